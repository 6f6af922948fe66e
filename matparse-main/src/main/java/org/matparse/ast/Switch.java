package org.matparse.ast;

import org.matparse.ast.visitor.NodeVisitor;

public final class Switch extends ConditionalFlow {

    public Switch(Node cond) {
        super(cond);
    }

    @Override
    public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
