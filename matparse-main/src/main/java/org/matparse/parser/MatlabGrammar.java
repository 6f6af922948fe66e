package org.matparse.parser;

import org.matparse.MatlabParseException;

import java.util.ArrayList;
import java.util.List;

/**
 * Predictive recursive-descent parser for MATLAB statements, with precedence
 * climbing for binary operators. Produces one {@link ParseTree} per statement.
 * <p>
 * The parser never backtracks: every decision is taken on the current token,
 * at most one token of lookahead, and the whitespace facts the lexer records.
 * Inside matrix and cell literals a {@code +} or {@code -} preceded by a blank
 * but directly followed by its operand starts a new element, so {@code [1 -2]}
 * has two elements and {@code [1 - 2]} one.
 */
public final class MatlabGrammar {

    private static final int OR_OR = 1;
    private static final int AND_AND = 2;
    private static final int OR = 3;
    private static final int AND = 4;
    private static final int RELATIONAL = 5;
    private static final int RANGE = 6;
    private static final int ADDITIVE = 7;
    private static final int MULTIPLICATIVE = 8;
    private static final int POWER = 9;

    private final MatlabLexer lexer;
    private final String sourceName;

    private Token current;
    private Token lookahead;
    private boolean inMatrix;
    private int indexDepth;

    public MatlabGrammar(String source, String sourceName) {
        this.lexer = new MatlabLexer(source, sourceName);
        this.sourceName = sourceName;
        this.current = lexer.next();
    }

    /**
     * Parses the whole input as a sequence of statements.
     */
    public List<ParseTree> parseProgram() {
        List<ParseTree> statements = new ArrayList<>();
        while (true) {
            while (current.is(TokenKind.COMMA) || current.is(TokenKind.SEMICOLON) || current.is(TokenKind.NEWLINE)) {
                advance();
            }
            if (current.is(TokenKind.EOF)) {
                return statements;
            }
            statements.add(parseStatement());
            endStatement();
        }
    }

    /**
     * Parses the whole input as one expression.
     */
    public ParseTree parseSingleExpression() {
        ParseTree expression = parseExpression();
        if (!current.is(TokenKind.EOF)) {
            throw unexpected("end of input");
        }
        return expression;
    }

    // ── Statements ───────────────────────────────────────────────────────

    private void endStatement() {
        switch (current.getKind()) {
            case COMMA:
            case SEMICOLON:
            case NEWLINE:
                advance();
                return;
            case COMMENT:
            case EOF:
                return;
            default:
                throw unexpected("end of statement");
        }
    }

    private ParseTree parseStatement() {
        Token start = current;
        switch (start.getKind()) {
            case COMMENT:
                advance();
                return ParseTree.builder(RuleKind.COMMENT, start).with(Field.TEXT, start.getText()).build();
            case BANG: {
                String command = lexer.restOfLine();
                advance();
                return ParseTree.builder(RuleKind.SHELL_COMMAND, start).with(Field.TEXT, command).build();
            }
            case KEYWORD:
                return parseKeywordStatement();
            case IDENTIFIER:
                if (lookahead == null) {
                    String arguments = lexer.commandArguments();
                    if (arguments != null) {
                        advance();
                        return command(start, arguments);
                    }
                }
                return parseExpressionStatement();
            default:
                return parseExpressionStatement();
        }
    }

    private ParseTree parseExpressionStatement() {
        ParseTree expression = parseExpression();
        if (!current.is(TokenKind.EQUALS)) {
            return expression;
        }
        checkAssignable(expression);
        advance();
        ParseTree value = parseExpression();
        return ParseTree.builder(RuleKind.ASSIGNMENT, expression)
                .with(Field.LHS, expression)
                .with(Field.RHS, value)
                .build();
    }

    private void checkAssignable(ParseTree target) {
        switch (target.getKind()) {
            case IDENTIFIER:
            case ARRAY_OR_FUNCTION:
            case ARRAY_ACCESS:
            case CELL_ACCESS:
            case STRUCT:
                return;
            case ARRAY: {
                List<List<ParseTree>> rows = target.rows(Field.ROWS);
                if (rows.size() != 1) {
                    break;
                }
                for (ParseTree element : rows.get(0)) {
                    if (element.is(RuleKind.ARRAY)) {
                        throw error("Invalid assignment target", element.getLine(), element.getColumn());
                    }
                    if (!element.is(RuleKind.TILDE)) {
                        checkAssignable(element);
                    }
                }
                return;
            }
            default:
                break;
        }
        throw error("Invalid assignment target", target.getLine(), target.getColumn());
    }

    private ParseTree parseKeywordStatement() {
        Token keyword = current;
        switch (keyword.getText()) {
            case "if":
                return conditional(RuleKind.IF);
            case "elseif":
                return conditional(RuleKind.ELSEIF);
            case "while":
                return conditional(RuleKind.WHILE);
            case "switch":
                return conditional(RuleKind.SWITCH);
            case "case":
                return conditional(RuleKind.CASE);
            case "else":
                return marker(RuleKind.ELSE);
            case "otherwise":
                return marker(RuleKind.OTHERWISE);
            case "try":
                return marker(RuleKind.TRY);
            case "end":
                return marker(RuleKind.END);
            case "break":
                return marker(RuleKind.BREAK);
            case "continue":
                return marker(RuleKind.CONTINUE);
            case "return":
                return marker(RuleKind.RETURN);
            case "catch": {
                advance();
                ParseTree.Builder builder = ParseTree.builder(RuleKind.CATCH, keyword);
                if (current.is(TokenKind.IDENTIFIER)) {
                    builder.with(Field.VARIABLE, identifier(advance()));
                }
                return builder.build();
            }
            case "for":
            case "parfor":
                return parseFor();
            case "function":
                return parseFunctionDefinition();
            case "global":
            case "persistent": {
                String arguments = lookahead == null ? lexer.commandArguments() : null;
                advance();
                return command(keyword, arguments == null ? "" : arguments);
            }
            case "classdef":
                throw error("classdef files are not supported", keyword.getLine(), keyword.getColumn());
            default:
                throw unexpected("a statement");
        }
    }

    private ParseTree conditional(RuleKind kind) {
        Token keyword = advance();
        ParseTree condition = parseExpression();
        return ParseTree.builder(kind, keyword).with(Field.CONDITION, condition).build();
    }

    private ParseTree marker(RuleKind kind) {
        return ParseTree.leaf(kind, advance());
    }

    private ParseTree parseFor() {
        Token keyword = advance();
        Token open = current.is(TokenKind.LPAREN) ? advance() : null;
        ParseTree variable = identifier(expect(TokenKind.IDENTIFIER, "loop variable"));
        expect(TokenKind.EQUALS, "'='");
        ParseTree range = parseExpression();
        if (open != null) {
            expectClose(TokenKind.RPAREN, open);
        }
        return ParseTree.builder(RuleKind.FOR, keyword)
                .with(Field.VARIABLE, variable)
                .with(Field.EXPRESSION, range)
                .build();
    }

    private ParseTree parseFunctionDefinition() {
        Token keyword = advance();
        List<ParseTree> outputs = null;
        Token name;
        if (current.is(TokenKind.LBRACKET)) {
            outputs = parseNameList(advance(), TokenKind.RBRACKET);
            expect(TokenKind.EQUALS, "'='");
            name = expect(TokenKind.IDENTIFIER, "function name");
        } else {
            Token first = expect(TokenKind.IDENTIFIER, "function name");
            if (current.is(TokenKind.EQUALS)) {
                advance();
                outputs = List.of(identifier(first));
                name = expect(TokenKind.IDENTIFIER, "function name");
            } else {
                name = first;
            }
        }
        List<ParseTree> parameters = null;
        if (current.is(TokenKind.LPAREN)) {
            parameters = parseNameList(advance(), TokenKind.RPAREN);
        }
        return ParseTree.builder(RuleKind.FUNCTION_DEFINITION, keyword)
                .with(Field.NAME, name.getText())
                .with(Field.PARAMETERS, parameters)
                .with(Field.OUTPUTS, outputs)
                .build();
    }

    /**
     * Names or {@code ~} separated by commas or blanks, up to the closing
     * bracket, which is consumed.
     */
    private List<ParseTree> parseNameList(Token open, TokenKind close) {
        List<ParseTree> names = new ArrayList<>();
        while (!current.is(close)) {
            if (current.is(TokenKind.COMMA)) {
                advance();
            } else if (current.is(TokenKind.EOF)) {
                throw unterminated(open);
            } else if (current.is(TokenKind.IDENTIFIER)) {
                names.add(identifier(advance()));
            } else if (current.isOperator("~")) {
                names.add(ParseTree.leaf(RuleKind.TILDE, advance()));
            } else {
                throw unexpected("a name");
            }
        }
        advance();
        return names;
    }

    private ParseTree command(Token name, String arguments) {
        return ParseTree.builder(RuleKind.COMMAND, name)
                .with(Field.NAME, name.getText())
                .with(Field.TEXT, arguments)
                .build();
    }

    // ── Expressions ──────────────────────────────────────────────────────

    private ParseTree parseExpression() {
        return parseBinary(OR_OR);
    }

    private ParseTree parseBinary(int minPrecedence) {
        ParseTree left = parseUnary();
        while (true) {
            Token op = current;
            int precedence = binaryPrecedence(op);
            if (precedence < minPrecedence) {
                return left;
            }
            advance();
            if (precedence == RANGE) {
                ParseTree second = parseBinary(RANGE + 1);
                ParseTree.Builder range = ParseTree.builder(RuleKind.RANGE, left).with(Field.START, left);
                if (current.is(TokenKind.COLON)) {
                    advance();
                    range.with(Field.STEP, second).with(Field.STOP, parseBinary(RANGE + 1));
                } else {
                    range.with(Field.STOP, second);
                }
                left = range.build();
            } else {
                ParseTree right = parseBinary(precedence + 1);
                left = ParseTree.builder(RuleKind.BINARY, left)
                        .with(Field.LEFT, left)
                        .with(Field.OPERATOR, op.getText())
                        .with(Field.RIGHT, right)
                        .build();
            }
        }
    }

    private int binaryPrecedence(Token token) {
        if (token.is(TokenKind.COLON)) {
            return RANGE;
        }
        if (!token.is(TokenKind.OPERATOR)) {
            return -1;
        }
        switch (token.getText()) {
            case "||":
                return OR_OR;
            case "&&":
                return AND_AND;
            case "|":
                return OR;
            case "&":
                return AND;
            case "<":
            case "<=":
            case ">":
            case ">=":
            case "==":
            case "~=":
                return RELATIONAL;
            case "+":
            case "-":
                return startsMatrixElement(token) ? -1 : ADDITIVE;
            case "*":
            case "/":
            case "\\":
            case ".*":
            case "./":
            case ".\\":
                return MULTIPLICATIVE;
            case "^":
            case ".^":
                return POWER;
            default:
                return -1;
        }
    }

    private boolean startsMatrixElement(Token sign) {
        return inMatrix && sign.hasSpaceBefore() && !sign.hasSpaceAfter();
    }

    private ParseTree parseUnary() {
        Token op = current;
        if (op.isOperator("-") || op.isOperator("+") || op.isOperator("~")) {
            if (op.isOperator("~") && isIgnoredValue()) {
                return ParseTree.leaf(RuleKind.TILDE, advance());
            }
            advance();
            ParseTree operand = parseUnary();
            return ParseTree.builder(RuleKind.UNARY, op)
                    .with(Field.OPERATOR, op.getText())
                    .with(Field.OPERAND, operand)
                    .build();
        }
        return parsePostfix(parsePrimary());
    }

    private boolean isIgnoredValue() {
        Token next = peek();
        return next.is(TokenKind.COMMA) || next.is(TokenKind.RBRACKET) || next.is(TokenKind.RPAREN);
    }

    private ParseTree parsePrimary() {
        Token token = current;
        switch (token.getKind()) {
            case IDENTIFIER:
                return identifier(advance());
            case NUMBER:
                return literal(RuleKind.NUMBER);
            case STRING:
                return literal(RuleKind.STRING);
            case BOOLEAN:
                return literal(RuleKind.BOOLEAN);
            case LPAREN:
                return parseGroup();
            case LBRACKET:
                return parseMatrix(RuleKind.ARRAY, TokenKind.RBRACKET);
            case LBRACE:
                return parseMatrix(RuleKind.CELL_ARRAY, TokenKind.RBRACE);
            case AT:
                return parseHandle();
            case KEYWORD:
                if (token.isKeyword("end") && indexDepth > 0) {
                    return ParseTree.leaf(RuleKind.END_INDEX, advance());
                }
                throw unexpected("an expression");
            default:
                throw unexpected("an expression");
        }
    }

    private ParseTree literal(RuleKind kind) {
        Token token = advance();
        return ParseTree.builder(kind, token).with(Field.TEXT, token.getText()).build();
    }

    private ParseTree identifier(Token token) {
        return ParseTree.builder(RuleKind.IDENTIFIER, token).with(Field.NAME, token.getText()).build();
    }

    private ParseTree parseGroup() {
        Token open = advance();
        boolean matrix = inMatrix;
        inMatrix = false;
        ParseTree content = parseExpression();
        expectClose(TokenKind.RPAREN, open);
        inMatrix = matrix;
        return ParseTree.builder(RuleKind.PAREN, open).with(Field.CONTENT, content).build();
    }

    private ParseTree parseMatrix(RuleKind kind, TokenKind close) {
        Token open = advance();
        boolean matrix = inMatrix;
        inMatrix = true;
        List<List<ParseTree>> rows = new ArrayList<>();
        List<ParseTree> row = new ArrayList<>();
        while (!current.is(close)) {
            switch (current.getKind()) {
                case EOF:
                    throw unterminated(open);
                case SEMICOLON:
                case NEWLINE:
                case COMMENT:
                    advance();
                    if (!row.isEmpty()) {
                        rows.add(row);
                        row = new ArrayList<>();
                    }
                    break;
                case COMMA:
                    advance();
                    break;
                default:
                    row.add(parseExpression());
            }
        }
        advance();
        if (!row.isEmpty()) {
            rows.add(row);
        }
        inMatrix = matrix;
        return ParseTree.builder(kind, open).withRows(Field.ROWS, rows).build();
    }

    private ParseTree parseHandle() {
        Token at = advance();
        if (current.is(TokenKind.LPAREN)) {
            List<ParseTree> parameters = parseNameList(advance(), TokenKind.RPAREN);
            ParseTree body = parseExpression();
            return ParseTree.builder(RuleKind.ANONYMOUS_FUNCTION, at)
                    .with(Field.PARAMETERS, parameters)
                    .with(Field.BODY, body)
                    .build();
        }
        if (current.is(TokenKind.IDENTIFIER)) {
            return ParseTree.builder(RuleKind.FUNCTION_HANDLE, at)
                    .with(Field.TARGET, identifier(advance()))
                    .build();
        }
        throw unexpected("a function name or parameter list after '@'");
    }

    private ParseTree parsePostfix(ParseTree base) {
        while (true) {
            Token token = current;
            if (token.is(TokenKind.LPAREN) && token.isIndexOpener() && isSubscriptable(base)) {
                List<ParseTree> arguments = parseArguments(TokenKind.RPAREN);
                RuleKind kind = RuleKind.ARRAY_OR_FUNCTION;
                for (ParseTree argument : arguments) {
                    if (argument.is(RuleKind.COLON)) {
                        kind = RuleKind.ARRAY_ACCESS;
                        break;
                    }
                }
                base = ParseTree.builder(kind, base)
                        .with(Field.TARGET, base)
                        .with(Field.ARGUMENTS, arguments)
                        .build();
            } else if (token.is(TokenKind.LBRACE) && token.isIndexOpener() && isSubscriptable(base)) {
                List<ParseTree> arguments = parseArguments(TokenKind.RBRACE);
                base = ParseTree.builder(RuleKind.CELL_ACCESS, base)
                        .with(Field.TARGET, base)
                        .with(Field.ARGUMENTS, arguments)
                        .build();
            } else if (token.is(TokenKind.DOT) && (isSubscriptable(base) || base.is(RuleKind.FUNCTION_HANDLE))) {
                base = parseField(base);
            } else if (token.is(TokenKind.TRANSPOSE)) {
                advance();
                base = ParseTree.builder(RuleKind.TRANSPOSE, base)
                        .with(Field.OPERAND, base)
                        .with(Field.OPERATOR, token.getText())
                        .build();
            } else {
                return base;
            }
        }
    }

    private static boolean isSubscriptable(ParseTree base) {
        switch (base.getKind()) {
            case IDENTIFIER:
            case ARRAY_OR_FUNCTION:
            case ARRAY_ACCESS:
            case CELL_ACCESS:
            case STRUCT:
                return true;
            default:
                return false;
        }
    }

    private ParseTree parseField(ParseTree base) {
        advance();
        ParseTree.Builder field = ParseTree.builder(RuleKind.STRUCT, base).with(Field.BASE, base);
        if (current.is(TokenKind.IDENTIFIER) || current.is(TokenKind.KEYWORD)) {
            return field.with(Field.MEMBER, identifier(advance())).build();
        }
        if (current.is(TokenKind.LPAREN)) {
            Token open = advance();
            boolean matrix = inMatrix;
            inMatrix = false;
            ParseTree name = parseExpression();
            expectClose(TokenKind.RPAREN, open);
            inMatrix = matrix;
            return field.with(Field.DYNAMIC_MEMBER, name).build();
        }
        throw unexpected("a field name");
    }

    /**
     * Subscript list after an index opener. A lone {@code :} is a whole-dimension
     * subscript; {@code end} is the last-index sentinel anywhere inside.
     */
    private List<ParseTree> parseArguments(TokenKind close) {
        Token open = advance();
        boolean matrix = inMatrix;
        inMatrix = false;
        indexDepth++;
        List<ParseTree> arguments = new ArrayList<>();
        if (current.is(close)) {
            advance();
        } else {
            while (true) {
                if (current.is(TokenKind.COLON) && (peek().is(TokenKind.COMMA) || peek().is(close))) {
                    arguments.add(ParseTree.leaf(RuleKind.COLON, advance()));
                } else {
                    arguments.add(parseExpression());
                }
                if (current.is(TokenKind.COMMA)) {
                    advance();
                } else if (current.is(close)) {
                    advance();
                    break;
                } else if (current.is(TokenKind.EOF)) {
                    throw unterminated(open);
                } else {
                    throw unexpected("',' or '" + (close == TokenKind.RPAREN ? ")" : "}") + "'");
                }
            }
        }
        indexDepth--;
        inMatrix = matrix;
        return arguments;
    }

    // ── Tokens ───────────────────────────────────────────────────────────

    private Token advance() {
        Token consumed = current;
        if (lookahead != null) {
            current = lookahead;
            lookahead = null;
        } else {
            current = lexer.next();
        }
        return consumed;
    }

    private Token peek() {
        if (lookahead == null) {
            lookahead = lexer.next();
        }
        return lookahead;
    }

    private Token expect(TokenKind kind, String what) {
        if (!current.is(kind)) {
            throw unexpected(what);
        }
        return advance();
    }

    private void expectClose(TokenKind close, Token open) {
        if (current.is(close)) {
            advance();
        } else if (current.is(TokenKind.EOF)) {
            throw unterminated(open);
        } else {
            throw unexpected("')'");
        }
    }

    private MatlabParseException unexpected(String expected) {
        return error("Expected " + expected + " but found " + current.describe(),
                current.getLine(), current.getColumn());
    }

    private MatlabParseException unterminated(Token open) {
        return error("Unterminated '" + open.getText() + "' opened at line " + open.getLine()
                + ", column " + open.getColumn(), open.getLine(), open.getColumn());
    }

    private MatlabParseException error(String message, int line, int column) {
        return new MatlabParseException(message, sourceName, line, column);
    }
}
