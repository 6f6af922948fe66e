package org.matparse.ast;

import org.matparse.ast.visitor.NodeVisitor;

public final class Try extends MarkerFlow {

    @Override
    public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
