package org.matparse.ast;

import org.matparse.ast.visitor.NodeVisitor;

import java.util.Objects;

/**
 * An infix operation. Chains of equal precedence nest to the left, so
 * {@code 1 + 2 + 3} is {@code BinaryOp(BinaryOp(1, +, 2), +, 3)}.
 */
public final class BinaryOp extends Operator {

    private final Node left;
    private final Node right;

    public BinaryOp(Node left, String op, Node right) {
        super(op);
        this.left = Objects.requireNonNull(left, "left");
        this.right = Objects.requireNonNull(right, "right");
    }

    public Node getLeft() {
        return left;
    }

    public Node getRight() {
        return right;
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
        if (!(o instanceof BinaryOp)) {
            return false;
        }
        BinaryOp other = (BinaryOp) o;
        return getOp().equals(other.getOp()) && left.equals(other.left) && right.equals(other.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(BinaryOp.class, left, getOp(), right);
    }

    @Override
    public String toString() {
        return "BinaryOp(left=" + left + ", op='" + getOp() + "', right=" + right + ")";
    }
}
