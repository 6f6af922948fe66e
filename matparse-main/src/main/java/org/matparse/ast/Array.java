package org.matparse.ast;

import org.matparse.ast.visitor.NodeVisitor;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A bare matrix ({@code [1 2; 3 4]}) or cell array ({@code {a, 'b'}}) literal.
 * {@code []} and <code>{}</code> have no rows.
 */
public final class Array extends Entity {

    private final List<List<Node>> rows;
    private final boolean cell;

    public Array(List<List<Node>> rows, boolean cell) {
        List<List<Node>> copy = new ArrayList<>(rows.size());
        for (List<Node> row : rows) {
            copy.add(List.copyOf(row));
        }
        this.rows = List.copyOf(copy);
        this.cell = cell;
    }

    public List<List<Node>> getRows() {
        return rows;
    }

    public boolean isCell() {
        return cell;
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    @Override
    public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Array)) {
            return false;
        }
        Array other = (Array) o;
        return cell == other.cell && rows.equals(other.rows);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rows, cell);
    }

    @Override
    public String toString() {
        return "Array(is_cell=" + (cell ? "True" : "False") + ", rows=" + rows + ")";
    }
}
