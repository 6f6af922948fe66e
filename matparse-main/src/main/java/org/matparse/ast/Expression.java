package org.matparse.ast;

import org.matparse.ast.visitor.NodeVisitor;

import java.util.List;

/**
 * A parenthesised group whose content is not itself an operator, such as
 * {@code (x)} or the name in a dynamic field access {@code s.(name)}.
 * Operator nodes already carry their grouping and are never wrapped.
 */
public final class Expression extends Node {

    private final List<Node> content;

    public Expression(List<? extends Node> content) {
        this.content = List.copyOf(content);
    }

    public List<Node> getContent() {
        return content;
    }

    @Override
    public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Expression && content.equals(((Expression) o).content));
    }

    @Override
    public int hashCode() {
        return content.hashCode();
    }

    @Override
    public String toString() {
        return "Expression(content=" + content + ")";
    }
}
