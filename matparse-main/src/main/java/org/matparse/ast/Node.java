package org.matparse.ast;

import org.matparse.ast.visitor.NodeVisitor;

/**
 * Root of the canonical MATLAB node hierarchy.
 * <p>
 * Nodes are immutable and own their children; no node refers back to its
 * container. Equality is structural.
 */
public abstract class Node {

    Node() {
    }

    public abstract <R, A> R accept(NodeVisitor<R, A> visitor, A arg);
}
