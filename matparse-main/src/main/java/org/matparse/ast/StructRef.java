package org.matparse.ast;

import org.matparse.ast.visitor.NodeVisitor;

import java.util.Objects;

/**
 * Field access {@code base.field}. The field is an {@link Identifier}, or an
 * {@link Expression} for dynamic field names {@code base.(expr)}.
 */
public final class StructRef extends Reference {

    private final Node base;
    private final Node field;

    public StructRef(Node base, Node field) {
        this.base = Objects.requireNonNull(base, "base");
        this.field = Objects.requireNonNull(field, "field");
    }

    public Node getBase() {
        return base;
    }

    public Node getField() {
        return field;
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
        if (!(o instanceof StructRef)) {
            return false;
        }
        StructRef other = (StructRef) o;
        return base.equals(other.base) && field.equals(other.field);
    }

    @Override
    public int hashCode() {
        return Objects.hash(StructRef.class, base, field);
    }

    @Override
    public String toString() {
        return "StructRef(base=" + base + ", field=" + field + ")";
    }
}
