package org.matparse.ast;

import org.matparse.ast.visitor.NodeVisitor;

import java.util.Objects;

/**
 * Prefix {@code -}, {@code +} or {@code ~}.
 */
public final class UnaryOp extends Operator {

    private final Node operand;

    public UnaryOp(String op, Node operand) {
        super(op);
        this.operand = Objects.requireNonNull(operand, "operand");
    }

    public Node getOperand() {
        return operand;
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
        if (!(o instanceof UnaryOp)) {
            return false;
        }
        UnaryOp other = (UnaryOp) o;
        return getOp().equals(other.getOp()) && operand.equals(other.operand);
    }

    @Override
    public int hashCode() {
        return Objects.hash(UnaryOp.class, getOp(), operand);
    }

    @Override
    public String toString() {
        return "UnaryOp(op='" + getOp() + "', operand=" + operand + ")";
    }
}
