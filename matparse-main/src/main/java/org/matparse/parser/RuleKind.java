package org.matparse.parser;

/**
 * The tag the grammar attaches to every {@link ParseTree}. Each kind has one
 * rule in the canonical-node transform.
 */
public enum RuleKind {

    // ── Expressions ──────────────────────────────────────────────────────
    IDENTIFIER,
    NUMBER,
    STRING,
    BOOLEAN,
    /** {@code ~} standing for an ignored value. */
    TILDE,
    /** Bare {@code :} subscript. */
    COLON,
    /** {@code end} inside a subscript. */
    END_INDEX,
    UNARY,
    BINARY,
    RANGE,
    TRANSPOSE,
    PAREN,
    ARRAY,
    CELL_ARRAY,
    ARRAY_OR_FUNCTION,
    ARRAY_ACCESS,
    CELL_ACCESS,
    FUNCTION_HANDLE,
    ANONYMOUS_FUNCTION,
    STRUCT,

    // ── Statements ───────────────────────────────────────────────────────
    ASSIGNMENT,
    WHILE,
    IF,
    ELSEIF,
    ELSE,
    SWITCH,
    CASE,
    OTHERWISE,
    FOR,
    TRY,
    CATCH,
    END,
    BREAK,
    CONTINUE,
    RETURN,
    FUNCTION_DEFINITION,
    COMMAND,
    SHELL_COMMAND,
    COMMENT
}
