package org.matparse.parser;

import java.util.Objects;

/**
 * A lexical token with its position and the surrounding-whitespace facts the
 * grammar needs inside matrix literals.
 */
public final class Token {

    private final TokenKind kind;
    private final String text;
    private final int offset;
    private final int line;
    private final int column;
    private final boolean spaceBefore;
    private final boolean spaceAfter;
    private final boolean indexOpener;

    Token(TokenKind kind, String text, int offset, int line, int column,
          boolean spaceBefore, boolean spaceAfter, boolean indexOpener) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.text = text;
        this.offset = offset;
        this.line = line;
        this.column = column;
        this.spaceBefore = spaceBefore;
        this.spaceAfter = spaceAfter;
        this.indexOpener = indexOpener;
    }

    public TokenKind getKind() {
        return kind;
    }

    /**
     * The token text. For strings this is the unescaped content without
     * quotes; for comments the text after the comment marker.
     */
    public String getText() {
        return text;
    }

    public int getOffset() {
        return offset;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public boolean hasSpaceBefore() {
        return spaceBefore;
    }

    public boolean hasSpaceAfter() {
        return spaceAfter;
    }

    /**
     * For {@code (} and <code>{</code>: whether the bracket subscripts the
     * operand before it rather than opening a group or cell literal.
     */
    public boolean isIndexOpener() {
        return indexOpener;
    }

    public boolean is(TokenKind kind) {
        return this.kind == kind;
    }

    public boolean is(TokenKind kind, String text) {
        return this.kind == kind && Objects.equals(this.text, text);
    }

    public boolean isKeyword(String keyword) {
        return is(TokenKind.KEYWORD, keyword);
    }

    public boolean isOperator(String op) {
        return is(TokenKind.OPERATOR, op);
    }

    /**
     * Whether this token ends a statement: a comma, semicolon, newline,
     * comment or the end of input.
     */
    public boolean isStatementEnd() {
        switch (kind) {
            case COMMA:
            case SEMICOLON:
            case NEWLINE:
            case COMMENT:
            case EOF:
                return true;
            default:
                return false;
        }
    }

    public String describe() {
        switch (kind) {
            case EOF:
                return "end of input";
            case NEWLINE:
                return "end of line";
            case COMMENT:
                return "comment";
            case STRING:
                return "string '" + text + "'";
            default:
                return "'" + text + "'";
        }
    }

    @Override
    public String toString() {
        return kind + "(" + text + ")@" + line + ":" + column;
    }
}
