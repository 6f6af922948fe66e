package org.matparse.ast;

import org.matparse.ast.visitor.NodeVisitor;

/**
 * {@code true} or {@code false}.
 */
public final class BooleanLiteral extends Primitive {

    public BooleanLiteral(String value) {
        super(value);
    }

    @Override
    public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
