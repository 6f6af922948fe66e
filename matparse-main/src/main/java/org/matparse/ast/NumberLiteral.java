package org.matparse.ast;

import org.matparse.ast.visitor.NodeVisitor;

/**
 * A numeric literal such as {@code 3}, {@code .5} or {@code 3.5D+2}.
 */
public final class NumberLiteral extends Primitive {

    public NumberLiteral(String value) {
        super(value);
    }

    @Override
    public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
