package org.matparse.ast;

import org.matparse.ast.visitor.NodeVisitor;

public final class Else extends MarkerFlow {

    @Override
    public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
