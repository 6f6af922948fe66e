package org.matparse.util;

import org.matparse.ast.AnonFun;
import org.matparse.ast.Array;
import org.matparse.ast.ArrayOrFunCall;
import org.matparse.ast.ArrayRef;
import org.matparse.ast.BinaryOp;
import org.matparse.ast.BooleanLiteral;
import org.matparse.ast.Comment;
import org.matparse.ast.Expression;
import org.matparse.ast.FunCall;
import org.matparse.ast.FunHandle;
import org.matparse.ast.Identifier;
import org.matparse.ast.Node;
import org.matparse.ast.NumberLiteral;
import org.matparse.ast.Special;
import org.matparse.ast.StringLiteral;
import org.matparse.ast.StructRef;
import org.matparse.ast.TernaryOp;
import org.matparse.ast.Transpose;
import org.matparse.ast.UnaryOp;
import org.matparse.ast.visitor.GenericVisitorWithDefaults;

import java.util.List;
import java.util.function.Function;

/**
 * Canonical text forms of nodes.
 * <p>
 * {@link #makeKey(Node)} is the symbol-table key used by the scope tracker:
 * {@code a(1,2)}, <code>c{3}</code>, {@code s.f}, {@code [1,2;3,4]},
 * {@code @(x)(x+1)}, with operator groups written without blanks.
 * {@link #makeFormula(Node, boolean, boolean, Function)} renders expressions
 * for downstream consumers, {@code (1 + 2)} by default. Both return
 * {@code null} for nodes that have no such form, such as commands or
 * function definitions, and never throw for them.
 */
public final class MatlabFormulas {

    private static final KeyVisitor KEYS = new KeyVisitor();

    private MatlabFormulas() {
    }

    public static String makeKey(Node node) {
        return node == null ? null : node.accept(KEYS, null);
    }

    public static String makeFormula(Node node) {
        return makeFormula(node, true, true, null);
    }

    public static String makeFormula(Node node, boolean spaces, boolean parens) {
        return makeFormula(node, spaces, parens, null);
    }

    /**
     * @param spaces        put blanks around binary operators and after unary ones
     * @param parens        whether the outermost operator group keeps its parentheses;
     *                      nested groups always keep theirs
     * @param arrayRenderer renders {@link ArrayRef} and {@link ArrayOrFunCall} nodes
     *                      in place of their key, may be {@code null}
     */
    public static String makeFormula(Node node, boolean spaces, boolean parens,
                                     Function<Node, String> arrayRenderer) {
        if (node == null) {
            return null;
        }
        return node.accept(new FormulaVisitor(spaces, parens, arrayRenderer), Boolean.TRUE);
    }

    private static String join(List<Node> nodes, String separator, Function<Node, String> render) {
        StringBuilder out = new StringBuilder();
        for (int i = 0; i < nodes.size(); i++) {
            String text = render.apply(nodes.get(i));
            if (text == null) {
                return null;
            }
            if (i > 0) {
                out.append(separator);
            }
            out.append(text);
        }
        return out.toString();
    }

    private static String concat(String... parts) {
        StringBuilder out = new StringBuilder();
        for (String part : parts) {
            if (part == null) {
                return null;
            }
            out.append(part);
        }
        return out.toString();
    }

    // ── Keys ─────────────────────────────────────────────────────────────

    private static final class KeyVisitor extends GenericVisitorWithDefaults<String, Void> {

        @Override
        public String visit(NumberLiteral n, Void arg) {
            return n.getValue();
        }

        @Override
        public String visit(StringLiteral n, Void arg) {
            return n.getValue();
        }

        @Override
        public String visit(BooleanLiteral n, Void arg) {
            return n.getValue();
        }

        @Override
        public String visit(Special n, Void arg) {
            return n.getValue();
        }

        @Override
        public String visit(Identifier n, Void arg) {
            return n.getName();
        }

        @Override
        public String visit(ArrayOrFunCall n, Void arg) {
            return concat(makeKey(n.getName()), "(", arguments(n.getArgs()), ")");
        }

        @Override
        public String visit(FunCall n, Void arg) {
            return concat(makeKey(n.getName()), "(", arguments(n.getArgs()), ")");
        }

        @Override
        public String visit(ArrayRef n, Void arg) {
            return n.isCell()
                    ? concat(makeKey(n.getName()), "{", arguments(n.getArgs()), "}")
                    : concat(makeKey(n.getName()), "(", arguments(n.getArgs()), ")");
        }

        @Override
        public String visit(StructRef n, Void arg) {
            return concat(makeKey(n.getBase()), ".", makeKey(n.getField()));
        }

        @Override
        public String visit(Array n, Void arg) {
            StringBuilder out = new StringBuilder("[");
            List<List<Node>> rows = n.getRows();
            for (int i = 0; i < rows.size(); i++) {
                String row = arguments(rows.get(i));
                if (row == null) {
                    return null;
                }
                if (i > 0) {
                    out.append(';');
                }
                out.append(row);
            }
            return out.append(']').toString();
        }

        @Override
        public String visit(Transpose n, Void arg) {
            return concat(makeKey(n.getOperand()), n.getOp());
        }

        @Override
        public String visit(FunHandle n, Void arg) {
            return "@" + n.getName().getName();
        }

        @Override
        public String visit(AnonFun n, Void arg) {
            return concat("@(", arguments(n.getParams()), ")", makeKey(n.getBody()));
        }

        @Override
        public String visit(UnaryOp n, Void arg) {
            return makeFormula(n, false, true);
        }

        @Override
        public String visit(BinaryOp n, Void arg) {
            return makeFormula(n, false, true);
        }

        @Override
        public String visit(TernaryOp n, Void arg) {
            return makeFormula(n, false, true);
        }

        @Override
        public String visit(Expression n, Void arg) {
            return concat("(", join(n.getContent(), "", term -> makeFormula(term, false, true)), ")");
        }

        private static String arguments(List<Node> args) {
            return join(args, ",", MatlabFormulas::makeKey);
        }
    }

    // ── Formulas ─────────────────────────────────────────────────────────

    /**
     * The argument tells whether the node is the outermost one.
     */
    private static final class FormulaVisitor extends GenericVisitorWithDefaults<String, Boolean> {

        private final String blank;
        private final boolean parens;
        private final Function<Node, String> arrayRenderer;

        FormulaVisitor(boolean spaces, boolean parens, Function<Node, String> arrayRenderer) {
            this.blank = spaces ? " " : "";
            this.parens = parens;
            this.arrayRenderer = arrayRenderer;
        }

        private String inner(Node node) {
            return node.accept(this, Boolean.FALSE);
        }

        private String group(String content, boolean outermost) {
            if (content == null) {
                return null;
            }
            return outermost && !parens ? content : "(" + content + ")";
        }

        @Override
        public String visit(NumberLiteral n, Boolean outermost) {
            return makeKey(n);
        }

        @Override
        public String visit(StringLiteral n, Boolean outermost) {
            return makeKey(n);
        }

        @Override
        public String visit(BooleanLiteral n, Boolean outermost) {
            return makeKey(n);
        }

        @Override
        public String visit(Special n, Boolean outermost) {
            return makeKey(n);
        }

        @Override
        public String visit(Identifier n, Boolean outermost) {
            return makeKey(n);
        }

        @Override
        public String visit(Transpose n, Boolean outermost) {
            return makeKey(n);
        }

        @Override
        public String visit(ArrayRef n, Boolean outermost) {
            return arrayRenderer != null ? arrayRenderer.apply(n) : makeKey(n);
        }

        @Override
        public String visit(ArrayOrFunCall n, Boolean outermost) {
            return arrayRenderer != null ? arrayRenderer.apply(n) : makeKey(n);
        }

        @Override
        public String visit(StructRef n, Boolean outermost) {
            return makeKey(n);
        }

        @Override
        public String visit(FunCall n, Boolean outermost) {
            return makeKey(n);
        }

        @Override
        public String visit(AnonFun n, Boolean outermost) {
            return makeKey(n);
        }

        @Override
        public String visit(FunHandle n, Boolean outermost) {
            return makeKey(n);
        }

        @Override
        public String visit(Array n, Boolean outermost) {
            return makeKey(n);
        }

        @Override
        public String visit(UnaryOp n, Boolean outermost) {
            return group(concat(n.getOp(), blank, inner(n.getOperand())), outermost);
        }

        @Override
        public String visit(BinaryOp n, Boolean outermost) {
            return group(concat(inner(n.getLeft()), blank, n.getOp(), blank, inner(n.getRight())), outermost);
        }

        @Override
        public String visit(TernaryOp n, Boolean outermost) {
            String separator = blank + ":" + blank;
            String content = n.hasStep()
                    ? concat(inner(n.getStart()), separator, inner(n.getStep()), separator, inner(n.getStop()))
                    : concat(inner(n.getStart()), separator, inner(n.getStop()));
            return group(content, outermost);
        }

        @Override
        public String visit(Expression n, Boolean outermost) {
            return group(join(n.getContent(), blank, this::inner), outermost);
        }

        @Override
        public String visit(Comment n, Boolean outermost) {
            return "";
        }
    }
}
