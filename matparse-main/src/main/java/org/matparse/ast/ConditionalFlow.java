package org.matparse.ast;

import java.util.Objects;

/**
 * Flow-control markers that carry a condition or switch value.
 */
public abstract class ConditionalFlow extends FlowControl {

    private final Node cond;

    ConditionalFlow(Node cond) {
        this.cond = Objects.requireNonNull(cond, "cond");
    }

    public Node getCond() {
        return cond;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return cond.equals(((ConditionalFlow) o).cond);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), cond);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(cond=" + cond + ")";
    }
}
