package org.matparse.parser;

/**
 * Named slots of a {@link ParseTree}.
 */
public enum Field {
    NAME,
    TEXT,
    OPERATOR,
    OPERAND,
    LEFT,
    RIGHT,
    START,
    STEP,
    STOP,
    CONTENT,
    ROWS,
    TARGET,
    ARGUMENTS,
    PARAMETERS,
    OUTPUTS,
    BODY,
    BASE,
    MEMBER,
    DYNAMIC_MEMBER,
    LHS,
    RHS,
    CONDITION,
    VARIABLE,
    EXPRESSION
}
