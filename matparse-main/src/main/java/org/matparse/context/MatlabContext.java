package org.matparse.context;

import org.matparse.ast.Node;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A lexical scope: the file being parsed, or one function definition inside it.
 * <p>
 * All maps are keyed by {@link org.matparse.util.MatlabFormulas#makeKey canonical keys}
 * and keep insertion order. The root context also holds the complete list of
 * canonical nodes of the parse; function contexts share that flat list and
 * leave {@link #getNodes()} empty.
 * <p>
 * Contexts are filled in by a {@link ContextTracker} and are read-only to
 * everyone else.
 */
public final class MatlabContext {

    private final String name;
    private final MatlabContext parent;
    private final List<Node> parameters;
    private final List<Node> returns;
    private final Path file;

    private final Map<String, Node> assignments = new LinkedHashMap<>();
    private final Map<String, List<Node>> calls = new LinkedHashMap<>();
    private final Map<String, SymbolType> types = new LinkedHashMap<>();
    private final Map<String, MatlabContext> functions = new LinkedHashMap<>();
    private List<Node> nodes = List.of();

    MatlabContext(String name, MatlabContext parent, List<Node> parameters, List<Node> returns, Path file) {
        this.name = name;
        this.parent = parent;
        this.parameters = parameters;
        this.returns = returns;
        this.file = file;
    }

    public String getName() {
        return name;
    }

    /**
     * The enclosing scope, {@code null} for the root.
     */
    public MatlabContext getParent() {
        return parent;
    }

    public boolean isRoot() {
        return parent == null;
    }

    /**
     * Parameters of the function header, {@code null} for the root or when the
     * header has no parameter list.
     */
    public List<Node> getParameters() {
        return parameters;
    }

    public List<Node> getReturns() {
        return returns;
    }

    /**
     * The file this root context was parsed from, {@code null} for string input.
     */
    public Path getFile() {
        return file;
    }

    public Map<String, Node> getAssignments() {
        return Collections.unmodifiableMap(assignments);
    }

    /**
     * Names that may be function calls, mapped to the arguments of the last call seen.
     */
    public Map<String, List<Node>> getCalls() {
        return Collections.unmodifiableMap(calls);
    }

    public Map<String, SymbolType> getTypes() {
        return Collections.unmodifiableMap(types);
    }

    public Map<String, MatlabContext> getFunctions() {
        return Collections.unmodifiableMap(functions);
    }

    public List<Node> getNodes() {
        return nodes;
    }

    /**
     * The type recorded for {@code key} in this scope only.
     */
    public SymbolType getType(String key) {
        return types.get(key);
    }

    /**
     * The type recorded for {@code key} here or in the nearest enclosing scope.
     */
    public SymbolType lookupType(String key) {
        for (MatlabContext context = this; context != null; context = context.parent) {
            SymbolType type = context.types.get(key);
            if (type != null) {
                return type;
            }
        }
        return null;
    }

    public boolean isVariable(String key) {
        return lookupType(key) == SymbolType.VARIABLE;
    }

    void putAssignment(String key, Node value) {
        assignments.put(key, value);
    }

    void putCall(String key, List<Node> args) {
        calls.put(key, args);
    }

    void removeCall(String key) {
        calls.remove(key);
    }

    void putTypeIfAbsent(String key, SymbolType type) {
        types.putIfAbsent(key, type);
    }

    void putFunction(String functionName, MatlabContext context) {
        functions.put(functionName, context);
    }

    void setNodes(List<Node> nodes) {
        this.nodes = List.copyOf(nodes);
    }

    @Override
    public String toString() {
        return "MatlabContext(name='" + name + "', parent=" + (parent == null ? "None" : "'" + parent.name + "'")
                + ", functions=" + functions.keySet()
                + ", types=" + types
                + ", assignments=" + assignments.keySet()
                + ", calls=" + calls.keySet() + ")";
    }
}
