package org.matparse.ast;

import org.matparse.ast.visitor.NodeVisitor;

public final class Case extends ConditionalFlow {

    public Case(Node cond) {
        super(cond);
    }

    @Override
    public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
