package org.matparse.ast;

import org.matparse.ast.visitor.NodeVisitor;

import java.util.List;
import java.util.Objects;

/**
 * A function definition header.
 * <p>
 * The body is not attached: the statements that follow in the node list
 * up to the matching {@link End} make up the function. {@link #getParameters()}
 * is {@code null} when the header has no parameter list at all, and
 * {@link #getOutput()} is {@code null} when there is no {@code ... =} part.
 */
public final class FunDef extends Definition {

    private final Identifier name;
    private final List<Node> parameters;
    private final List<Node> output;

    public FunDef(Identifier name, List<? extends Node> parameters, List<? extends Node> output) {
        this.name = Objects.requireNonNull(name, "name");
        this.parameters = parameters == null ? null : List.copyOf(parameters);
        this.output = output == null ? null : List.copyOf(output);
    }

    public Identifier getName() {
        return name;
    }

    public List<Node> getParameters() {
        return parameters;
    }

    public List<Node> getOutput() {
        return output;
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
        if (!(o instanceof FunDef)) {
            return false;
        }
        FunDef other = (FunDef) o;
        return name.equals(other.name)
                && Objects.equals(parameters, other.parameters)
                && Objects.equals(output, other.output);
    }

    @Override
    public int hashCode() {
        return Objects.hash(FunDef.class, name, parameters, output);
    }

    @Override
    public String toString() {
        return "FunDef(name=" + name + ", parameters=" + parameters + ", output=" + output + ")";
    }
}
