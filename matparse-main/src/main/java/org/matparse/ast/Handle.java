package org.matparse.ast;

/**
 * Function handles. They behave like values but carry closure semantics.
 */
public abstract class Handle extends Entity {

    Handle() {
    }
}
