package org.matparse.ast;

import org.matparse.ast.visitor.NodeVisitor;

import java.util.List;
import java.util.Objects;

/**
 * An anonymous function, {@code @(x, y) x + y}. Parameters are
 * {@link Identifier}s, or {@link Special} {@code ~} for ignored ones.
 */
public final class AnonFun extends Handle {

    private final List<Node> params;
    private final Node body;

    public AnonFun(List<? extends Node> params, Node body) {
        this.params = List.copyOf(params);
        this.body = Objects.requireNonNull(body, "body");
    }

    public List<Node> getParams() {
        return params;
    }

    public Node getBody() {
        return body;
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
        if (!(o instanceof AnonFun)) {
            return false;
        }
        AnonFun other = (AnonFun) o;
        return params.equals(other.params) && body.equals(other.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(params, body);
    }

    @Override
    public String toString() {
        return "AnonFun(params=" + params + ", body=" + body + ")";
    }
}
