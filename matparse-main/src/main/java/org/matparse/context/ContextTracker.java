package org.matparse.context;

import org.matparse.ast.AnonFun;
import org.matparse.ast.Array;
import org.matparse.ast.ArrayOrFunCall;
import org.matparse.ast.ArrayRef;
import org.matparse.ast.Assignment;
import org.matparse.ast.BinaryOp;
import org.matparse.ast.BooleanLiteral;
import org.matparse.ast.Case;
import org.matparse.ast.Elseif;
import org.matparse.ast.End;
import org.matparse.ast.Expression;
import org.matparse.ast.For;
import org.matparse.ast.FunCall;
import org.matparse.ast.FunDef;
import org.matparse.ast.Identifier;
import org.matparse.ast.If;
import org.matparse.ast.Node;
import org.matparse.ast.NumberLiteral;
import org.matparse.ast.StringLiteral;
import org.matparse.ast.StructRef;
import org.matparse.ast.Switch;
import org.matparse.ast.TernaryOp;
import org.matparse.ast.Transpose;
import org.matparse.ast.UnaryOp;
import org.matparse.ast.While;
import org.matparse.ast.visitor.GenericVisitorWithDefaults;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.matparse.util.MatlabFormulas.makeKey;

/**
 * One parse session of the scope tracker.
 * <p>
 * Walks the canonical nodes of a file once, in source order. For each node it
 * records assignments, enters a function scope on {@link FunDef} and leaves it
 * on {@link End}, classifies names that are certainly variables,
 * records possible function calls, and finally rewrites every
 * {@link ArrayOrFunCall} whose name is a known variable into an
 * {@link ArrayRef}. Knowledge only flows forward: a use that precedes the
 * assignment proving a name is a variable stays ambiguous.
 * <p>
 * Every {@link End} leaves the current function scope, including the
 * {@code end} of a loop or conditional: statements are a flat list and this
 * pass does not pair block openers with their {@code end}. Consumers that
 * need exact function extents must pair them themselves. The root scope is
 * never left.
 * <p>
 * Not thread-safe; use one tracker per parse.
 */
public final class ContextTracker {

    private static final Logger LOG = LoggerFactory.getLogger(ContextTracker.class);

    public static final String ROOT_NAME = "(outermost context)";

    private final Path file;
    private final TypeConverter converter = new TypeConverter();

    private MatlabContext context;

    public ContextTracker() {
        this(null);
    }

    public ContextTracker(Path file) {
        this.file = file;
    }

    /**
     * Processes the nodes of one file and returns its root context, whose
     * node list holds the rewritten nodes.
     */
    public MatlabContext process(List<Node> nodes) {
        MatlabContext root = new MatlabContext(ROOT_NAME, null, null, null, file);
        context = root;
        List<Node> processed = new ArrayList<>(nodes.size());
        for (Node node : nodes) {
            processed.add(processNode(node));
        }
        root.setNodes(processed);
        return root;
    }

    /**
     * The scope the next node would be processed in.
     */
    public MatlabContext current() {
        return context;
    }

    private Node processNode(Node node) {
        if (node instanceof Assignment) {
            Assignment assignment = (Assignment) node;
            String key = makeKey(assignment.getLhs());
            if (key != null) {
                context.putAssignment(key, assignment.getRhs());
            }
        } else if (node instanceof FunDef) {
            pushFunction((FunDef) node);
        } else if (node instanceof End) {
            popFunction();
        }
        saveInferredTypes(node);
        saveCalls(node);
        return node.accept(converter, null);
    }

    // ── Scopes ───────────────────────────────────────────────────────────

    private void pushFunction(FunDef definition) {
        String functionName = definition.getName().getName();
        MatlabContext child = new MatlabContext(functionName, context,
                definition.getParameters(), definition.getOutput(), null);
        context.putFunction(functionName, child);
        context = child;
        LOG.trace("Entering scope of function {}", functionName);
    }

    private void popFunction() {
        if (context.isRoot()) {
            return;
        }
        LOG.trace("Leaving scope of function {}", context.getName());
        context = context.getParent();
    }

    // ── Type inference ───────────────────────────────────────────────────

    private void saveInferredTypes(Node node) {
        if (node instanceof Assignment) {
            Assignment assignment = (Assignment) node;
            Node lhs = assignment.getLhs();
            Node rhs = assignment.getRhs();
            if (lhs instanceof Identifier) {
                if (rhs instanceof Array || rhs instanceof NumberLiteral
                        || rhs instanceof BooleanLiteral || rhs instanceof StringLiteral) {
                    saveVariable(lhs);
                }
            } else if (lhs instanceof ArrayRef) {
                saveVariable(((ArrayRef) lhs).getName());
            } else if (lhs instanceof Array && !((Array) lhs).isEmpty()) {
                for (Node item : ((Array) lhs).getRows().get(0)) {
                    if (item instanceof Identifier) {
                        saveVariable(item);
                    }
                }
            }
        } else if (node instanceof FunDef) {
            FunDef definition = (FunDef) node;
            saveIdentifiers(definition.getOutput());
            saveIdentifiers(definition.getParameters());
        }
    }

    private void saveIdentifiers(List<Node> names) {
        if (names == null) {
            return;
        }
        for (Node name : names) {
            if (name instanceof Identifier) {
                saveVariable(name);
            }
        }
    }

    private void saveVariable(Node name) {
        String key = makeKey(name);
        if (key != null) {
            context.putTypeIfAbsent(key, SymbolType.VARIABLE);
        }
    }

    // ── Calls ────────────────────────────────────────────────────────────

    private void saveCalls(Node node) {
        if (node instanceof ArrayOrFunCall) {
            ArrayOrFunCall call = (ArrayOrFunCall) node;
            String key = makeKey(call.getName());
            String root = rootName(call.getName());
            if (key != null && !context.isVariable(key) && (root == null || !context.isVariable(root))) {
                context.putCall(key, call.getArgs());
            }
            if (!(call.getName() instanceof Identifier)) {
                saveCalls(call.getName());
            }
        } else if (node instanceof FunCall) {
            FunCall call = (FunCall) node;
            String key = makeKey(call.getName());
            if (key != null) {
                context.putCall(key, call.getArgs());
            }
        } else if (node instanceof Assignment) {
            saveCalls(((Assignment) node).getRhs());
        } else if (node instanceof ArrayRef) {
            saveCalls(((ArrayRef) node).getArgs());
        } else if (node instanceof Array) {
            for (List<Node> row : ((Array) node).getRows()) {
                saveCalls(row);
            }
        } else if (node instanceof AnonFun) {
            saveCalls(((AnonFun) node).getBody());
        } else if (node instanceof Expression) {
            saveCalls(((Expression) node).getContent());
        } else if (node instanceof Transpose) {
            saveCalls(((Transpose) node).getOperand());
        } else if (node instanceof UnaryOp) {
            saveCalls(((UnaryOp) node).getOperand());
        } else if (node instanceof BinaryOp) {
            BinaryOp op = (BinaryOp) node;
            saveCalls(op.getLeft());
            saveCalls(op.getRight());
        } else if (node instanceof TernaryOp) {
            TernaryOp range = (TernaryOp) node;
            saveCalls(range.getStart());
            if (range.hasStep()) {
                saveCalls(range.getStep());
            }
            saveCalls(range.getStop());
        }
    }

    /**
     * The identifier a reference chain such as {@code a(1).b{2}} starts from,
     * or {@code null} when it starts from something else.
     */
    private static String rootName(Node name) {
        Node base = name;
        while (true) {
            if (base instanceof Identifier) {
                return ((Identifier) base).getName();
            } else if (base instanceof StructRef) {
                base = ((StructRef) base).getBase();
            } else if (base instanceof ArrayRef) {
                base = ((ArrayRef) base).getName();
            } else if (base instanceof ArrayOrFunCall) {
                base = ((ArrayOrFunCall) base).getName();
            } else {
                return null;
            }
        }
    }

    private void saveCalls(List<Node> nodes) {
        for (Node node : nodes) {
            saveCalls(node);
        }
    }

    // ── Rewriting ────────────────────────────────────────────────────────

    /**
     * Rebuilds a node with every ambiguous reference to a known variable
     * turned into an {@link ArrayRef}. Nodes without such references come
     * back as they are.
     */
    private final class TypeConverter extends GenericVisitorWithDefaults<Node, Void> {

        @Override
        public Node defaultAction(Node n, Void arg) {
            return n;
        }

        private Node convert(Node node) {
            return node == null ? null : node.accept(this, null);
        }

        private List<Node> convert(List<Node> nodes) {
            if (nodes == null) {
                return null;
            }
            List<Node> converted = new ArrayList<>(nodes.size());
            for (Node node : nodes) {
                converted.add(convert(node));
            }
            return converted;
        }

        @Override
        public Node visit(ArrayOrFunCall n, Void arg) {
            if (!(n.getName() instanceof Identifier)) {
                return new ArrayOrFunCall(convert(n.getName()), convert(n.getArgs()));
            }
            String name = ((Identifier) n.getName()).getName();
            if (context.isVariable(name)) {
                context.removeCall(name);
                return new ArrayRef(n.getName(), convert(n.getArgs()), false);
            }
            return new ArrayOrFunCall(n.getName(), convert(n.getArgs()));
        }

        @Override
        public Node visit(FunCall n, Void arg) {
            return new FunCall(n.getName(), convert(n.getArgs()));
        }

        @Override
        public Node visit(ArrayRef n, Void arg) {
            return new ArrayRef(convert(n.getName()), convert(n.getArgs()), n.isCell());
        }

        @Override
        public Node visit(Array n, Void arg) {
            List<List<Node>> rows = new ArrayList<>(n.getRows().size());
            for (List<Node> row : n.getRows()) {
                rows.add(convert(row));
            }
            return new Array(rows, n.isCell());
        }

        @Override
        public Node visit(StructRef n, Void arg) {
            return new StructRef(convert(n.getBase()), convert(n.getField()));
        }

        @Override
        public Node visit(AnonFun n, Void arg) {
            return new AnonFun(convert(n.getParams()), convert(n.getBody()));
        }

        @Override
        public Node visit(Expression n, Void arg) {
            return new Expression(convert(n.getContent()));
        }

        @Override
        public Node visit(Assignment n, Void arg) {
            return new Assignment(convert(n.getLhs()), convert(n.getRhs()));
        }

        @Override
        public Node visit(While n, Void arg) {
            return new While(convert(n.getCond()));
        }

        @Override
        public Node visit(If n, Void arg) {
            return new If(convert(n.getCond()));
        }

        @Override
        public Node visit(Elseif n, Void arg) {
            return new Elseif(convert(n.getCond()));
        }

        @Override
        public Node visit(Switch n, Void arg) {
            return new Switch(convert(n.getCond()));
        }

        @Override
        public Node visit(Case n, Void arg) {
            return new Case(convert(n.getCond()));
        }

        @Override
        public Node visit(For n, Void arg) {
            return new For(n.getVar(), convert(n.getExpr()));
        }

        @Override
        public Node visit(Transpose n, Void arg) {
            return new Transpose(convert(n.getOperand()), n.getOp());
        }

        @Override
        public Node visit(UnaryOp n, Void arg) {
            return new UnaryOp(n.getOp(), convert(n.getOperand()));
        }

        @Override
        public Node visit(BinaryOp n, Void arg) {
            return new BinaryOp(convert(n.getLeft()), n.getOp(), convert(n.getRight()));
        }

        @Override
        public Node visit(TernaryOp n, Void arg) {
            return new TernaryOp(convert(n.getStart()), convert(n.getStep()), convert(n.getStop()));
        }
    }
}
