package org.matparse.printer;

import org.matparse.ast.AnonFun;
import org.matparse.ast.Array;
import org.matparse.ast.ArrayOrFunCall;
import org.matparse.ast.ArrayRef;
import org.matparse.ast.Assignment;
import org.matparse.ast.BinaryOp;
import org.matparse.ast.BooleanLiteral;
import org.matparse.ast.Branch;
import org.matparse.ast.Case;
import org.matparse.ast.Catch;
import org.matparse.ast.Comment;
import org.matparse.ast.Else;
import org.matparse.ast.Elseif;
import org.matparse.ast.End;
import org.matparse.ast.Expression;
import org.matparse.ast.For;
import org.matparse.ast.FunCall;
import org.matparse.ast.FunDef;
import org.matparse.ast.FunHandle;
import org.matparse.ast.Identifier;
import org.matparse.ast.If;
import org.matparse.ast.MatlabCommand;
import org.matparse.ast.Node;
import org.matparse.ast.NumberLiteral;
import org.matparse.ast.Otherwise;
import org.matparse.ast.ShellCommand;
import org.matparse.ast.Special;
import org.matparse.ast.StringLiteral;
import org.matparse.ast.StructRef;
import org.matparse.ast.Switch;
import org.matparse.ast.TernaryOp;
import org.matparse.ast.Transpose;
import org.matparse.ast.Try;
import org.matparse.ast.UnaryOp;
import org.matparse.ast.While;
import org.matparse.ast.visitor.NodeVisitor;
import org.matparse.context.MatlabContext;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Debug rendering of canonical nodes, one statement per line, for example
 * <pre>{@code {assign: {identifier: "a"} = {number: 1}}}</pre>
 * Statements inside function definitions and control blocks are indented.
 */
public class NodePrinter implements NodeVisitor<String, Void> {

    private static final String INDENT = "  ";

    public String print(Node node) {
        return node.accept(this, null);
    }

    public String print(MatlabContext context) {
        StringBuilder out = new StringBuilder();
        int depth = 0;
        for (Node node : context.getNodes()) {
            if (node instanceof End || node instanceof Else || node instanceof Elseif
                    || node instanceof Case || node instanceof Otherwise || node instanceof Catch) {
                depth = Math.max(0, depth - 1);
            }
            out.append(INDENT.repeat(depth)).append(print(node)).append('\n');
            if (opensBlock(node)) {
                depth++;
            }
        }
        return out.toString();
    }

    private static boolean opensBlock(Node node) {
        return node instanceof FunDef || node instanceof If || node instanceof Elseif || node instanceof Else
                || node instanceof While || node instanceof For || node instanceof Switch || node instanceof Case
                || node instanceof Otherwise || node instanceof Try || node instanceof Catch;
    }

    private String list(List<Node> nodes) {
        return nodes.stream().map(this::print).collect(Collectors.joining(", "));
    }

    private String rows(List<List<Node>> rows) {
        return rows.stream().map(this::list).collect(Collectors.joining(" ; "));
    }

    // ── Entities ─────────────────────────────────────────────────────────

    @Override
    public String visit(NumberLiteral n, Void arg) {
        return "{number: " + n.getValue() + "}";
    }

    @Override
    public String visit(StringLiteral n, Void arg) {
        return "{string: \"" + n.getValue() + "\"}";
    }

    @Override
    public String visit(BooleanLiteral n, Void arg) {
        return "{boolean: " + n.getValue() + "}";
    }

    @Override
    public String visit(Special n, Void arg) {
        switch (n.getValue()) {
            case Special.COLON:
                return "{colon}";
            case Special.TILDE:
                return "{tilde}";
            default:
                return "{" + n.getValue() + "}";
        }
    }

    @Override
    public String visit(Array n, Void arg) {
        String kind = n.isCell() ? "cell array" : "array";
        if (n.isEmpty()) {
            return "{" + kind + ": []}";
        }
        return "{" + kind + ": [ " + rows(n.getRows()) + " ]}";
    }

    @Override
    public String visit(FunHandle n, Void arg) {
        return "{function @ handle: " + print(n.getName()) + "}";
    }

    @Override
    public String visit(AnonFun n, Void arg) {
        return "{anon @ handle: args ( " + list(n.getParams()) + " ) body " + print(n.getBody()) + "}";
    }

    // ── References ───────────────────────────────────────────────────────

    @Override
    public String visit(Identifier n, Void arg) {
        return "{identifier: \"" + n.getName() + "\"}";
    }

    @Override
    public String visit(ArrayOrFunCall n, Void arg) {
        return "{function/array: " + print(n.getName()) + " ( " + list(n.getArgs()) + " )}";
    }

    @Override
    public String visit(FunCall n, Void arg) {
        return "{function call: " + print(n.getName()) + " ( " + list(n.getArgs()) + " )}";
    }

    @Override
    public String visit(ArrayRef n, Void arg) {
        if (n.isCell()) {
            return "{cell array " + print(n.getName()) + ": { " + list(n.getArgs()) + " }}";
        }
        return "{array " + print(n.getName()) + ": [ " + list(n.getArgs()) + " ]}";
    }

    @Override
    public String visit(StructRef n, Void arg) {
        return "{struct: " + print(n.getBase()) + "." + print(n.getField()) + "}";
    }

    // ── Operators ────────────────────────────────────────────────────────

    @Override
    public String visit(UnaryOp n, Void arg) {
        return "{unary op: " + n.getOp() + " " + print(n.getOperand()) + "}";
    }

    @Override
    public String visit(BinaryOp n, Void arg) {
        return "{binary op: " + print(n.getLeft()) + " " + n.getOp() + " " + print(n.getRight()) + "}";
    }

    @Override
    public String visit(TernaryOp n, Void arg) {
        String step = n.hasStep() ? print(n.getStep()) + " : " : "";
        return "{colon op: " + print(n.getStart()) + " : " + step + print(n.getStop()) + "}";
    }

    @Override
    public String visit(Transpose n, Void arg) {
        return "{transpose: " + print(n.getOperand()) + " operator " + n.getOp() + "}";
    }

    @Override
    public String visit(Expression n, Void arg) {
        return "{expression: ( " + list(n.getContent()) + " )}";
    }

    // ── Statements ───────────────────────────────────────────────────────

    @Override
    public String visit(Assignment n, Void arg) {
        return "{assign: " + print(n.getLhs()) + " = " + print(n.getRhs()) + "}";
    }

    @Override
    public String visit(FunDef n, Void arg) {
        String parameters = n.getParameters() == null ? "none" : "( " + list(n.getParameters()) + " )";
        String output = n.getOutput() == null ? "none" : "[ " + list(n.getOutput()) + " ]";
        return "{function definition: " + print(n.getName()) + " parameters " + parameters
                + " output " + output + "}";
    }

    @Override
    public String visit(While n, Void arg) {
        return "{while stmt: " + print(n.getCond()) + "}";
    }

    @Override
    public String visit(If n, Void arg) {
        return "{if stmt: " + print(n.getCond()) + "}";
    }

    @Override
    public String visit(Elseif n, Void arg) {
        return "{elseif stmt: " + print(n.getCond()) + "}";
    }

    @Override
    public String visit(Else n, Void arg) {
        return "{else}";
    }

    @Override
    public String visit(Switch n, Void arg) {
        return "{switch stmt: " + print(n.getCond()) + "}";
    }

    @Override
    public String visit(Case n, Void arg) {
        return "{case: " + print(n.getCond()) + "}";
    }

    @Override
    public String visit(Otherwise n, Void arg) {
        return "{otherwise}";
    }

    @Override
    public String visit(Try n, Void arg) {
        return "{try}";
    }

    @Override
    public String visit(Catch n, Void arg) {
        return n.getVar() == null ? "{catch}" : "{catch: var " + print(n.getVar()) + "}";
    }

    @Override
    public String visit(For n, Void arg) {
        return "{for stmt: var " + print(n.getVar()) + " in " + print(n.getExpr()) + "}";
    }

    @Override
    public String visit(End n, Void arg) {
        return "{end}";
    }

    @Override
    public String visit(Branch n, Void arg) {
        return "{" + n.getKind().keyword() + "}";
    }

    @Override
    public String visit(ShellCommand n, Void arg) {
        return "{shell command: " + n.getCommand() + "}";
    }

    @Override
    public String visit(MatlabCommand n, Void arg) {
        return "{command: name " + print(n.getCommand()) + " args '" + n.getArgs() + "'}";
    }

    @Override
    public String visit(Comment n, Void arg) {
        return "{comment: " + n.getContent() + "}";
    }
}
