package org.matparse.ast;

public abstract class Definition extends Node {

    Definition() {
    }
}
