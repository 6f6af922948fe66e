package org.matparse.ast;

import org.matparse.ast.visitor.NodeVisitor;

/**
 * A single-quoted string literal; the value has the quotes removed and doubled quotes collapsed.
 */
public final class StringLiteral extends Primitive {

    public StringLiteral(String value) {
        super(value);
    }

    @Override
    public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
