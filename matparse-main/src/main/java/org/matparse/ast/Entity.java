package org.matparse.ast;

/**
 * Things that can appear as operands of an expression or inside commands.
 */
public abstract class Entity extends Node {

    Entity() {
    }
}
