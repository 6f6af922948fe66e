package org.matparse.ast;

import org.matparse.ast.visitor.NodeVisitor;

/**
 * Bare symbols with a special meaning in their position: {@code :} as a
 * subscript, {@code ~} as an ignored output or parameter, and {@code end}
 * as the last-index sentinel.
 */
public final class Special extends Primitive {

    public static final String COLON = ":";
    public static final String TILDE = "~";
    public static final String END = "end";

    public Special(String value) {
        super(value);
    }

    public static Special colon() {
        return new Special(COLON);
    }

    public static Special tilde() {
        return new Special(TILDE);
    }

    public static Special end() {
        return new Special(END);
    }

    public boolean isColon() {
        return COLON.equals(getValue());
    }

    @Override
    public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
