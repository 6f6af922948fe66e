package org.matparse.ast;

import org.matparse.ast.visitor.NodeVisitor;

import java.util.List;
import java.util.Objects;

/**
 * {@code name(args)} where syntax alone cannot tell an array access from a
 * function call.
 * <p>
 * The scope pass rewrites it to {@link ArrayRef} when {@code name} is known
 * to be a variable; otherwise it survives and callers have to decide.
 */
public final class ArrayOrFunCall extends Reference {

    private final Node name;
    private final List<Node> args;

    public ArrayOrFunCall(Node name, List<? extends Node> args) {
        this.name = Objects.requireNonNull(name, "name");
        this.args = List.copyOf(args);
    }

    public Node getName() {
        return name;
    }

    public List<Node> getArgs() {
        return args;
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
        if (!(o instanceof ArrayOrFunCall)) {
            return false;
        }
        ArrayOrFunCall other = (ArrayOrFunCall) o;
        return name.equals(other.name) && args.equals(other.args);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ArrayOrFunCall.class, name, args);
    }

    @Override
    public String toString() {
        return "ArrayOrFunCall(name=" + name + ", args=" + args + ")";
    }
}
