package org.matparse.ast;

import org.matparse.ast.visitor.NodeVisitor;

import java.util.Objects;

/**
 * The colon range operator: {@code start:stop} or {@code start:step:stop}.
 * {@link #getStep()} is {@code null} in the two-operand form.
 */
public final class TernaryOp extends Operator {

    public static final String COLON = ":";

    private final Node start;
    private final Node step;
    private final Node stop;

    public TernaryOp(Node start, Node step, Node stop) {
        super(COLON);
        this.start = Objects.requireNonNull(start, "start");
        this.step = step;
        this.stop = Objects.requireNonNull(stop, "stop");
    }

    public Node getStart() {
        return start;
    }

    public Node getStep() {
        return step;
    }

    public Node getStop() {
        return stop;
    }

    public boolean hasStep() {
        return step != null;
    }

    @Override
    public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TernaryOp)) {
            return false;
        }
        TernaryOp other = (TernaryOp) o;
        return start.equals(other.start) && Objects.equals(step, other.step) && stop.equals(other.stop);
    }

    @Override
    public int hashCode() {
        return Objects.hash(TernaryOp.class, start, step, stop);
    }

    @Override
    public String toString() {
        return "TernaryOp(start=" + start + ", step=" + step + ", stop=" + stop + ")";
    }
}
