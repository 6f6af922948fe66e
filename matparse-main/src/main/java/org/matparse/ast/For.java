package org.matparse.ast;

import org.matparse.ast.visitor.NodeVisitor;

import java.util.Objects;

/**
 * {@code for var = expr} (and {@code parfor}).
 */
public final class For extends FlowControl {

    private final Identifier var;
    private final Node expr;

    public For(Identifier var, Node expr) {
        this.var = Objects.requireNonNull(var, "var");
        this.expr = Objects.requireNonNull(expr, "expr");
    }

    public Identifier getVar() {
        return var;
    }

    public Node getExpr() {
        return expr;
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
        if (!(o instanceof For)) {
            return false;
        }
        For other = (For) o;
        return var.equals(other.var) && expr.equals(other.expr);
    }

    @Override
    public int hashCode() {
        return Objects.hash(For.class, var, expr);
    }

    @Override
    public String toString() {
        return "For(var=" + var + ", expr=" + expr + ")";
    }
}
