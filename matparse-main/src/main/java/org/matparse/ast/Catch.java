package org.matparse.ast;

import org.matparse.ast.visitor.NodeVisitor;

import java.util.Objects;

/**
 * {@code catch} with an optional exception variable.
 */
public final class Catch extends FlowControl {

    private final Identifier var;

    public Catch(Identifier var) {
        this.var = var;
    }

    /**
     * @return the exception variable, or {@code null} for a bare {@code catch}
     */
    public Identifier getVar() {
        return var;
    }

    @Override
    public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Catch && Objects.equals(var, ((Catch) o).var));
    }

    @Override
    public int hashCode() {
        return Objects.hash(Catch.class, var);
    }

    @Override
    public String toString() {
        return "Catch(var=" + var + ")";
    }
}
