package org.matparse.ast;

import org.matparse.ast.visitor.NodeVisitor;

import java.util.Objects;

/**
 * {@code lhs = rhs}. The left side is an {@link Identifier}, an
 * {@link ArrayRef}, a {@link StructRef}, or an {@link Array} with a single
 * row for multiple outputs.
 */
public final class Assignment extends Definition {

    private final Node lhs;
    private final Node rhs;

    public Assignment(Node lhs, Node rhs) {
        this.lhs = Objects.requireNonNull(lhs, "lhs");
        this.rhs = Objects.requireNonNull(rhs, "rhs");
    }

    public Node getLhs() {
        return lhs;
    }

    public Node getRhs() {
        return rhs;
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
        if (!(o instanceof Assignment)) {
            return false;
        }
        Assignment other = (Assignment) o;
        return lhs.equals(other.lhs) && rhs.equals(other.rhs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Assignment.class, lhs, rhs);
    }

    @Override
    public String toString() {
        return "Assignment(lhs=" + lhs + ", rhs=" + rhs + ")";
    }
}
