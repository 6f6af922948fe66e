package org.matparse.ast;

/**
 * Named things: variables, indexed arrays, calls and struct fields.
 */
public abstract class Reference extends Entity {

    Reference() {
    }
}
