package org.matparse.parser;

import org.matparse.MatlabParseException;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Set;

/**
 * On-demand tokenizer for MATLAB source.
 * <p>
 * MATLAB tokenization depends on context, so the lexer keeps a stack of the
 * brackets it has opened:
 * <ul>
 *     <li>inside parentheses and index braces, newlines and comments are
 *     dropped;</li>
 *     <li>inside matrix and cell literals, newlines and comments are kept as
 *     row separators and a blank before {@code '} turns it into a string
 *     delimiter;</li>
 *     <li>elsewhere a {@code '} right after an operand is a transpose.</li>
 * </ul>
 * Command syntax and shell escapes are read as raw text through
 * {@link #commandArguments()} and {@link #restOfLine()}, which the grammar
 * calls before asking for the next token.
 */
public final class MatlabLexer {

    static final Set<String> KEYWORDS = Set.of(
            "break", "case", "catch", "classdef", "continue", "else", "elseif", "end",
            "for", "function", "global", "if", "otherwise", "parfor", "persistent",
            "return", "switch", "try", "while");

    private enum Bracket {
        PAREN,
        INDEX_BRACE,
        MATRIX,
        CELL
    }

    private final String source;
    private final String sourceName;
    private final int length;
    private final Deque<Bracket> brackets = new ArrayDeque<>();

    private int pos;
    private int line = 1;
    private int lineStart;
    private Token previous;

    public MatlabLexer(String source, String sourceName) {
        this.source = source;
        this.sourceName = sourceName;
        this.length = source.length();
    }

    public String getSource() {
        return source;
    }

    public String getSourceName() {
        return sourceName;
    }

    public Token next() {
        boolean space = false;
        while (true) {
            space |= skipBlanks();
            if (pos >= length) {
                return emit(TokenKind.EOF, "", pos, line, column(pos), space, false);
            }
            char c = source.charAt(pos);
            if (c == '.' && source.startsWith("...", pos)) {
                // continuation: the rest of the physical line is ignored
                pos = endOfLine(pos);
                if (pos < length) {
                    newline();
                }
                space = true;
                continue;
            }
            if (c == '\n') {
                if (insideParens()) {
                    newline();
                    space = true;
                    continue;
                }
                int startLine = line;
                int startColumn = column(pos);
                int start = pos;
                newline();
                return emit(TokenKind.NEWLINE, "\n", start, startLine, startColumn, space, false);
            }
            if (c == '%') {
                if (insideParens()) {
                    pos = endOfLine(pos);
                    space = true;
                    continue;
                }
                return comment(space);
            }
            return token(c, space);
        }
    }

    /**
     * Reads command-syntax arguments if the text right after the current
     * identifier has the command shape: blanks, then something other than
     * {@code =}, {@code (}, a delimiter, a comment or the end of the line.
     * The arguments run to the next {@code ;}, {@code ,} or {@code %} outside
     * quotes, or to the end of the line.
     *
     * @return the trimmed argument text, or {@code null} if this is not a command
     */
    public String commandArguments() {
        int p = pos;
        if (p >= length || !isBlank(source.charAt(p))) {
            return null;
        }
        while (p < length && isBlank(source.charAt(p))) {
            p++;
        }
        if (p >= length) {
            return null;
        }
        char c = source.charAt(p);
        if (c == '\n' || c == '=' || c == '(' || c == ';' || c == ',' || c == '%'
                || source.startsWith("...", p)) {
            return null;
        }
        int start = p;
        boolean quoted = false;
        while (p < length) {
            c = source.charAt(p);
            if (c == '\n') {
                break;
            }
            if (c == '\'') {
                // a quote only opens at the start of an argument, otherwise it is a transpose
                if (quoted) {
                    if (charAt(p + 1) == '\'') {
                        p++;
                    } else {
                        quoted = false;
                    }
                } else if (p == start || isBlank(source.charAt(p - 1))) {
                    quoted = true;
                }
            } else if (!quoted && (c == ';' || c == ',' || c == '%')) {
                break;
            }
            p++;
        }
        pos = p;
        return source.substring(start, p).strip();
    }

    /**
     * Consumes the raw text up to (not including) the end of the line.
     */
    public String restOfLine() {
        int end = endOfLine(pos);
        String text = source.substring(pos, end);
        pos = end;
        return text.strip();
    }

    // ── Tokens ────────────────────────────────────────────────────────────

    private Token token(char c, boolean space) {
        int start = pos;
        int startLine = line;
        int startColumn = column(pos);
        char next = charAt(pos + 1);
        switch (c) {
            case '(': {
                boolean index = isIndexPosition(space);
                brackets.push(Bracket.PAREN);
                pos++;
                return emit(TokenKind.LPAREN, "(", start, startLine, startColumn, space, index);
            }
            case ')':
                closeBracket();
                pos++;
                return emit(TokenKind.RPAREN, ")", start, startLine, startColumn, space, false);
            case '[':
                brackets.push(Bracket.MATRIX);
                pos++;
                return emit(TokenKind.LBRACKET, "[", start, startLine, startColumn, space, false);
            case ']':
                closeBracket();
                pos++;
                return emit(TokenKind.RBRACKET, "]", start, startLine, startColumn, space, false);
            case '{': {
                boolean index = isIndexPosition(space);
                brackets.push(index ? Bracket.INDEX_BRACE : Bracket.CELL);
                pos++;
                return emit(TokenKind.LBRACE, "{", start, startLine, startColumn, space, index);
            }
            case '}':
                closeBracket();
                pos++;
                return emit(TokenKind.RBRACE, "}", start, startLine, startColumn, space, false);
            case ',':
                pos++;
                return emit(TokenKind.COMMA, ",", start, startLine, startColumn, space, false);
            case ';':
                pos++;
                return emit(TokenKind.SEMICOLON, ";", start, startLine, startColumn, space, false);
            case ':':
                pos++;
                return emit(TokenKind.COLON, ":", start, startLine, startColumn, space, false);
            case '@':
                pos++;
                return emit(TokenKind.AT, "@", start, startLine, startColumn, space, false);
            case '!':
                pos++;
                return emit(TokenKind.BANG, "!", start, startLine, startColumn, space, false);
            case '=':
                if (next == '=') {
                    return operator("==", start, startLine, startColumn, space);
                }
                pos++;
                return emit(TokenKind.EQUALS, "=", start, startLine, startColumn, space, false);
            case '~':
            case '<':
            case '>':
                return operator(next == '=' ? c + "=" : String.valueOf(c), start, startLine, startColumn, space);
            case '&':
            case '|':
                return operator(next == c ? "" + c + c : String.valueOf(c), start, startLine, startColumn, space);
            case '+':
            case '-':
            case '*':
            case '/':
            case '\\':
            case '^':
                return operator(String.valueOf(c), start, startLine, startColumn, space);
            case '.':
                if (isDigit(next)) {
                    return number(space);
                }
                if (next == '*' || next == '/' || next == '\\' || next == '^') {
                    return operator("." + next, start, startLine, startColumn, space);
                }
                if (next == '\'') {
                    pos += 2;
                    return emit(TokenKind.TRANSPOSE, ".'", start, startLine, startColumn, space, false);
                }
                pos++;
                return emit(TokenKind.DOT, ".", start, startLine, startColumn, space, false);
            case '\'':
                if (isIndexPosition(space)) {
                    pos++;
                    return emit(TokenKind.TRANSPOSE, "'", start, startLine, startColumn, space, false);
                }
                return string('\'', space);
            case '"':
                return string('"', space);
            default:
                if (isDigit(c)) {
                    return number(space);
                }
                if (isLetter(c)) {
                    return identifier(space);
                }
                throw error("Unexpected character '" + c + "'", startLine, startColumn);
        }
    }

    private Token operator(String op, int start, int startLine, int startColumn, boolean space) {
        pos += op.length();
        return emit(TokenKind.OPERATOR, op, start, startLine, startColumn, space, false);
    }

    private Token number(boolean space) {
        int start = pos;
        int startColumn = column(pos);
        while (isDigit(charAt(pos))) {
            pos++;
        }
        if (charAt(pos) == '.' && !isElementwiseSuffix(charAt(pos + 1)) && charAt(pos + 1) != '.') {
            pos++;
            while (isDigit(charAt(pos))) {
                pos++;
            }
        }
        char e = charAt(pos);
        if (e == 'e' || e == 'E' || e == 'd' || e == 'D') {
            int p = pos + 1;
            if (charAt(p) == '+' || charAt(p) == '-') {
                p++;
            }
            if (isDigit(charAt(p))) {
                pos = p;
                while (isDigit(charAt(pos))) {
                    pos++;
                }
            }
        }
        return emit(TokenKind.NUMBER, source.substring(start, pos), start, line, startColumn, space, false);
    }

    private Token identifier(boolean space) {
        int start = pos;
        int startColumn = column(pos);
        while (isIdentifierPart(charAt(pos))) {
            pos++;
        }
        String text = source.substring(start, pos);
        TokenKind kind;
        if ("true".equals(text) || "false".equals(text)) {
            kind = TokenKind.BOOLEAN;
        } else if (KEYWORDS.contains(text)) {
            kind = TokenKind.KEYWORD;
        } else {
            kind = TokenKind.IDENTIFIER;
        }
        return emit(kind, text, start, line, startColumn, space, false);
    }

    private Token string(char quote, boolean space) {
        int start = pos;
        int startColumn = column(pos);
        StringBuilder text = new StringBuilder();
        pos++;
        while (true) {
            char c = charAt(pos);
            if (pos >= length || c == '\n') {
                throw error("Unterminated string literal", line, startColumn);
            }
            if (c == quote) {
                if (charAt(pos + 1) == quote) {
                    text.append(quote);
                    pos += 2;
                    continue;
                }
                pos++;
                break;
            }
            text.append(c);
            pos++;
        }
        return emit(TokenKind.STRING, text.toString(), start, line, startColumn, space, false);
    }

    private Token comment(boolean space) {
        int start = pos;
        int startLine = line;
        int startColumn = column(pos);
        if (source.startsWith("%{", pos) && isAloneOnLine(pos, pos + 2)) {
            return blockComment(start, startLine, startColumn, space);
        }
        int end = endOfLine(pos);
        String text = stripCarriageReturn(source.substring(pos + 1, end));
        pos = end;
        return emit(TokenKind.COMMENT, text, start, startLine, startColumn, space, false);
    }

    private Token blockComment(int start, int startLine, int startColumn, boolean space) {
        StringBuilder content = new StringBuilder();
        int depth = 1;
        boolean first = true;
        pos = endOfLine(pos);
        while (pos < length) {
            newline();
            int eol = endOfLine(pos);
            String text = stripCarriageReturn(source.substring(pos, eol));
            String marker = text.strip();
            if ("%{".equals(marker)) {
                depth++;
            } else if ("%}".equals(marker) && --depth == 0) {
                pos = eol;
                break;
            }
            if (!first) {
                content.append('\n');
            }
            content.append(text);
            first = false;
            pos = eol;
        }
        return emit(TokenKind.COMMENT, content.toString(), start, startLine, startColumn, space, false);
    }

    private Token emit(TokenKind kind, String text, int start, int startLine, int startColumn,
                       boolean space, boolean indexOpener) {
        boolean spaceAfter = pos < length && isBlank(source.charAt(pos));
        Token token = new Token(kind, text, start, startLine, startColumn, space, spaceAfter, indexOpener);
        previous = token;
        return token;
    }

    // ── Context ───────────────────────────────────────────────────────────

    /**
     * A {@code (}, <code>{</code> or {@code '} subscripts or transposes the
     * previous operand when it touches it, or when it follows it after blanks
     * outside a matrix or cell literal.
     */
    private boolean isIndexPosition(boolean space) {
        return endsOperand(previous) && (!space || !insideLiteral());
    }

    private boolean endsOperand(Token token) {
        if (token == null) {
            return false;
        }
        switch (token.getKind()) {
            case IDENTIFIER:
            case NUMBER:
            case STRING:
            case BOOLEAN:
            case RPAREN:
            case RBRACKET:
            case RBRACE:
            case TRANSPOSE:
                return true;
            case KEYWORD:
                return "end".equals(token.getText()) && !brackets.isEmpty();
            default:
                return false;
        }
    }

    private boolean insideParens() {
        Bracket top = brackets.peek();
        return top == Bracket.PAREN || top == Bracket.INDEX_BRACE;
    }

    private boolean insideLiteral() {
        Bracket top = brackets.peek();
        return top == Bracket.MATRIX || top == Bracket.CELL;
    }

    private void closeBracket() {
        if (!brackets.isEmpty()) {
            brackets.pop();
        }
    }

    // ── Characters ────────────────────────────────────────────────────────

    private boolean skipBlanks() {
        boolean skipped = false;
        while (pos < length && isBlank(source.charAt(pos))) {
            pos++;
            skipped = true;
        }
        return skipped;
    }

    private void newline() {
        pos++;
        line++;
        lineStart = pos;
    }

    private int endOfLine(int from) {
        int eol = source.indexOf('\n', from);
        return eol < 0 ? length : eol;
    }

    private boolean isAloneOnLine(int markerStart, int markerEnd) {
        for (int p = markerStart - 1; p >= 0 && source.charAt(p) != '\n'; p--) {
            if (!isBlank(source.charAt(p))) {
                return false;
            }
        }
        for (int p = markerEnd; p < length && source.charAt(p) != '\n'; p++) {
            if (!isBlank(source.charAt(p))) {
                return false;
            }
        }
        return true;
    }

    private int column(int offset) {
        return offset - lineStart + 1;
    }

    private char charAt(int p) {
        return p < length ? source.charAt(p) : '\0';
    }

    private MatlabParseException error(String message, int errorLine, int errorColumn) {
        return new MatlabParseException(message, sourceName, errorLine, errorColumn);
    }

    private static String stripCarriageReturn(String text) {
        return text.endsWith("\r") ? text.substring(0, text.length() - 1) : text;
    }

    private static boolean isElementwiseSuffix(char c) {
        return c == '*' || c == '/' || c == '\\' || c == '^' || c == '\'';
    }

    private static boolean isBlank(char c) {
        return c == ' ' || c == '\t' || c == '\r' || c == '\f';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isIdentifierPart(char c) {
        return isLetter(c) || isDigit(c) || c == '_';
    }
}
