package org.matparse.ast;

import java.util.Objects;

/**
 * Literal leaf values. The source text is kept verbatim; no numeric
 * interpretation is attempted.
 */
public abstract class Primitive extends Entity {

    private final String value;

    Primitive(String value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return value.equals(((Primitive) o).value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), value);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(value='" + value + "')";
    }
}
