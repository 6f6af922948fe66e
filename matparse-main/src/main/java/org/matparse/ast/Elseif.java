package org.matparse.ast;

import org.matparse.ast.visitor.NodeVisitor;

public final class Elseif extends ConditionalFlow {

    public Elseif(Node cond) {
        super(cond);
    }

    @Override
    public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
