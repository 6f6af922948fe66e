package org.matparse.ast;

import org.matparse.ast.visitor.NodeVisitor;

import java.util.List;
import java.util.Objects;

/**
 * A reference known to be a function call.
 */
public final class FunCall extends Reference {

    private final Node name;
    private final List<Node> args;

    public FunCall(Node name, List<? extends Node> args) {
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
        if (!(o instanceof FunCall)) {
            return false;
        }
        FunCall other = (FunCall) o;
        return name.equals(other.name) && args.equals(other.args);
    }

    @Override
    public int hashCode() {
        return Objects.hash(FunCall.class, name, args);
    }

    @Override
    public String toString() {
        return "FunCall(name=" + name + ", args=" + args + ")";
    }
}
