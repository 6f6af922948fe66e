package org.matparse;

import org.matparse.parser.RuleKind;

/**
 * Signals a defect in the conversion of grammar output to canonical nodes:
 * the grammar produced a shape that the transformer has no rule for.
 */
public class NodeTransformException extends MatparseException {

    private final RuleKind kind;

    public NodeTransformException(RuleKind kind, String message) {
        super(kind == null ? message : "Cannot transform " + kind + ": " + message);
        this.kind = kind;
    }

    public RuleKind getKind() {
        return kind;
    }
}
