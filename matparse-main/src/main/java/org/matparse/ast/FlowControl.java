package org.matparse.ast;

/**
 * Control-flow markers. These are flat: a loop or conditional body is the
 * run of nodes that follows the marker in the same list, closed by an
 * {@link End}.
 */
public abstract class FlowControl extends Node {

    FlowControl() {
    }
}
