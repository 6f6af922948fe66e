package org.matparse.ast;

import org.matparse.ast.visitor.NodeVisitor;

import java.util.Objects;

/**
 * {@code break}, {@code continue} or {@code return}.
 */
public final class Branch extends FlowControl {

    public enum Kind {
        BREAK("break"),
        CONTINUE("continue"),
        RETURN("return");

        private final String keyword;

        Kind(String keyword) {
            this.keyword = keyword;
        }

        public String keyword() {
            return keyword;
        }

        public static Kind fromKeyword(String keyword) {
            for (Kind kind : values()) {
                if (kind.keyword.equals(keyword)) {
                    return kind;
                }
            }
            throw new IllegalArgumentException("Not a branch keyword: " + keyword);
        }
    }

    private final Kind kind;

    public Branch(Kind kind) {
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public Kind getKind() {
        return kind;
    }

    @Override
    public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Branch && kind == ((Branch) o).kind);
    }

    @Override
    public int hashCode() {
        return kind.hashCode();
    }

    @Override
    public String toString() {
        return "Branch(kind='" + kind.keyword() + "')";
    }
}
