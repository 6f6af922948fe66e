package org.matparse.ast;

import org.matparse.ast.visitor.NodeVisitor;

import java.util.Objects;

/**
 * A named function handle, {@code @name}.
 */
public final class FunHandle extends Handle {

    private final Identifier name;

    public FunHandle(Identifier name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public Identifier getName() {
        return name;
    }

    @Override
    public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof FunHandle && name.equals(((FunHandle) o).name));
    }

    @Override
    public int hashCode() {
        return Objects.hash(FunHandle.class, name);
    }

    @Override
    public String toString() {
        return "FunHandle(name=" + name + ")";
    }
}
