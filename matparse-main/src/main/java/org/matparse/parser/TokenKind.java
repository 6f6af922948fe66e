package org.matparse.parser;

public enum TokenKind {
    IDENTIFIER,
    KEYWORD,
    NUMBER,
    STRING,
    BOOLEAN,
    /** Arithmetic, relational and logical operators, including unary {@code ~}. */
    OPERATOR,
    /** {@code '} or {@code .'} in operator position. */
    TRANSPOSE,
    COLON,
    EQUALS,
    DOT,
    AT,
    BANG,
    LPAREN,
    RPAREN,
    LBRACKET,
    RBRACKET,
    LBRACE,
    RBRACE,
    COMMA,
    SEMICOLON,
    NEWLINE,
    COMMENT,
    EOF
}
