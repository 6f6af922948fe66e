package org.matparse.ast;

import org.matparse.ast.visitor.NodeVisitor;

import java.util.List;
import java.util.Objects;

/**
 * A reference known to index into an array: {@code a(i, :)}, {@code c{2}},
 * the target of an indexed assignment, or a call-shaped reference to a
 * known variable.
 */
public final class ArrayRef extends Reference {

    private final Node name;
    private final List<Node> args;
    private final boolean cell;

    public ArrayRef(Node name, List<? extends Node> args, boolean cell) {
        this.name = Objects.requireNonNull(name, "name");
        this.args = List.copyOf(args);
        this.cell = cell;
    }

    public Node getName() {
        return name;
    }

    public List<Node> getArgs() {
        return args;
    }

    public boolean isCell() {
        return cell;
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
        if (!(o instanceof ArrayRef)) {
            return false;
        }
        ArrayRef other = (ArrayRef) o;
        return cell == other.cell && name.equals(other.name) && args.equals(other.args);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ArrayRef.class, name, args, cell);
    }

    @Override
    public String toString() {
        return "ArrayRef(name=" + name + ", args=" + args + ", is_cell=" + (cell ? "True" : "False") + ")";
    }
}
