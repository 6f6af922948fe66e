package org.matparse.ast;

import org.matparse.ast.visitor.NodeVisitor;

import java.util.Objects;

/**
 * Postfix {@code '} (complex conjugate transpose) or {@code .'}.
 */
public final class Transpose extends Operator {

    private final Node operand;

    public Transpose(Node operand, String op) {
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
        if (!(o instanceof Transpose)) {
            return false;
        }
        Transpose other = (Transpose) o;
        return getOp().equals(other.getOp()) && operand.equals(other.operand);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Transpose.class, operand, getOp());
    }

    @Override
    public String toString() {
        return "Transpose(operand=" + operand + ", op=\"" + getOp() + "\")";
    }
}
