package org.matparse.parser;

import org.matparse.NodeTransformException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Grammar output: a node tagged with a {@link RuleKind} whose children are
 * reachable by {@link Field} name.
 * <p>
 * Field values are strings, nested trees, lists of trees, or lists of rows
 * of trees (matrix literals). The typed accessors fail with a
 * {@link NodeTransformException} when a field is missing or holds a value of
 * another shape, so a grammar defect surfaces where the tree is consumed.
 */
public final class ParseTree {

    private final RuleKind kind;
    private final Map<Field, Object> fields;
    private final int line;
    private final int column;

    private ParseTree(RuleKind kind, Map<Field, Object> fields, int line, int column) {
        this.kind = kind;
        this.fields = fields;
        this.line = line;
        this.column = column;
    }

    public static Builder builder(RuleKind kind, Token at) {
        return new Builder(kind, at.getLine(), at.getColumn());
    }

    public static Builder builder(RuleKind kind, ParseTree at) {
        return new Builder(kind, at.getLine(), at.getColumn());
    }

    public static ParseTree leaf(RuleKind kind, Token at) {
        return builder(kind, at).build();
    }

    public RuleKind getKind() {
        return kind;
    }

    public boolean is(RuleKind kind) {
        return this.kind == kind;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public boolean has(Field field) {
        return fields.containsKey(field);
    }

    public String text(Field field) {
        return require(field, String.class);
    }

    public ParseTree tree(Field field) {
        return require(field, ParseTree.class);
    }

    public ParseTree optionalTree(Field field) {
        return has(field) ? tree(field) : null;
    }

    @SuppressWarnings("unchecked")
    public List<ParseTree> trees(Field field) {
        return (List<ParseTree>) require(field, List.class);
    }

    public List<ParseTree> optionalTrees(Field field) {
        return has(field) ? trees(field) : null;
    }

    @SuppressWarnings("unchecked")
    public List<List<ParseTree>> rows(Field field) {
        return (List<List<ParseTree>>) require(field, List.class);
    }

    private <T> T require(Field field, Class<T> type) {
        Object value = fields.get(field);
        if (value == null) {
            throw new NodeTransformException(kind, "missing field " + field);
        }
        if (!type.isInstance(value)) {
            throw new NodeTransformException(kind, "field " + field + " holds "
                    + value.getClass().getSimpleName() + ", expected " + type.getSimpleName());
        }
        return type.cast(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ParseTree)) {
            return false;
        }
        ParseTree other = (ParseTree) o;
        return kind == other.kind && fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, fields);
    }

    @Override
    public String toString() {
        return fields.isEmpty() ? kind.name() : kind + fields.toString();
    }

    public static final class Builder {

        private final RuleKind kind;
        private final int line;
        private final int column;
        private final Map<Field, Object> fields = new EnumMap<>(Field.class);

        private Builder(RuleKind kind, int line, int column) {
            this.kind = Objects.requireNonNull(kind, "kind");
            this.line = line;
            this.column = column;
        }

        public Builder with(Field field, String value) {
            return put(field, value);
        }

        public Builder with(Field field, ParseTree value) {
            return put(field, value);
        }

        public Builder with(Field field, List<ParseTree> value) {
            return put(field, value == null ? null : Collections.unmodifiableList(new ArrayList<>(value)));
        }

        public Builder withRows(Field field, List<List<ParseTree>> rows) {
            List<List<ParseTree>> copy = new ArrayList<>(rows.size());
            for (List<ParseTree> row : rows) {
                copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
            }
            return put(field, Collections.unmodifiableList(copy));
        }

        private Builder put(Field field, Object value) {
            if (value != null) {
                fields.put(field, value);
            }
            return this;
        }

        public ParseTree build() {
            return new ParseTree(kind, Collections.unmodifiableMap(new EnumMap<>(fields)), line, column);
        }
    }
}
