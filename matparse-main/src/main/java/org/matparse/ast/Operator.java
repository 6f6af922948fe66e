package org.matparse.ast;

import java.util.Objects;

/**
 * Operator applications. The operator is kept as its source spelling.
 */
public abstract class Operator extends Entity {

    private final String op;

    Operator(String op) {
        this.op = Objects.requireNonNull(op, "op");
    }

    public String getOp() {
        return op;
    }
}
