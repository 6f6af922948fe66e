package org.matparse.context;

/**
 * What the scope tracker has learned about a name. Names without an entry
 * are unknown: they may denote a function or an array.
 */
public enum SymbolType {
    VARIABLE
}
