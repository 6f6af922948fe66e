package org.matparse.ast;

/**
 * Flow-control keywords that carry nothing but their position.
 */
public abstract class MarkerFlow extends FlowControl {

    MarkerFlow() {
    }

    @Override
    public boolean equals(Object o) {
        return o != null && getClass() == o.getClass();
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "()";
    }
}
