package org.matparse.ast;

import org.matparse.ast.visitor.NodeVisitor;

import java.util.Objects;

/**
 * A line comment (text after {@code %}) or a block comment (text between
 * the {@code %&#123;} and {@code %&#125;} lines).
 */
public final class Comment extends Node {

    private final String content;

    public Comment(String content) {
        this.content = Objects.requireNonNull(content, "content");
    }

    public String getContent() {
        return content;
    }

    @Override
    public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Comment && content.equals(((Comment) o).content));
    }

    @Override
    public int hashCode() {
        return Objects.hash(Comment.class, content);
    }

    @Override
    public String toString() {
        return "Comment(content='" + content + "')";
    }
}
