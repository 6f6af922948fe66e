package org.matparse.ast;

/**
 * Statements executed for effect with their own syntax rules.
 */
public abstract class Command extends Node {

    Command() {
    }
}
