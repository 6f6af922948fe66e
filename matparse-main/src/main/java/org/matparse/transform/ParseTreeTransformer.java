package org.matparse.transform;

import org.matparse.NodeTransformException;
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
import org.matparse.parser.Field;
import org.matparse.parser.ParseTree;
import org.matparse.parser.RuleKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts grammar output into canonical {@link Node}s.
 * <p>
 * There is exactly one rule per {@link RuleKind}; the {@code switch} below has
 * no default branch so that a new kind without a rule fails to compile. A tree
 * whose fields do not match its kind raises {@link NodeTransformException}.
 * The transform is stateless and may be shared.
 */
public class ParseTreeTransformer {

    public List<Node> transformAll(List<ParseTree> trees) {
        List<Node> nodes = new ArrayList<>(trees.size());
        for (ParseTree tree : trees) {
            nodes.add(transform(tree));
        }
        return nodes;
    }

    public Node transform(ParseTree tree) {
        return switch (tree.getKind()) {
            case IDENTIFIER -> new Identifier(tree.text(Field.NAME));
            case NUMBER -> new NumberLiteral(tree.text(Field.TEXT));
            case STRING -> new StringLiteral(tree.text(Field.TEXT));
            case BOOLEAN -> new BooleanLiteral(tree.text(Field.TEXT));
            case TILDE -> Special.tilde();
            case COLON -> Special.colon();
            case END_INDEX -> Special.end();
            case UNARY -> new UnaryOp(tree.text(Field.OPERATOR), transform(tree.tree(Field.OPERAND)));
            case BINARY -> new BinaryOp(transform(tree.tree(Field.LEFT)), tree.text(Field.OPERATOR),
                    transform(tree.tree(Field.RIGHT)));
            case RANGE -> new TernaryOp(transform(tree.tree(Field.START)),
                    optional(tree.optionalTree(Field.STEP)), transform(tree.tree(Field.STOP)));
            case TRANSPOSE -> new Transpose(transform(tree.tree(Field.OPERAND)), tree.text(Field.OPERATOR));
            case PAREN -> group(transform(tree.tree(Field.CONTENT)));
            case ARRAY -> new Array(rows(tree, false), false);
            case CELL_ARRAY -> new Array(rows(tree, false), true);
            case ARRAY_OR_FUNCTION -> new ArrayOrFunCall(transform(tree.tree(Field.TARGET)), arguments(tree));
            case ARRAY_ACCESS -> new ArrayRef(transform(tree.tree(Field.TARGET)), arguments(tree), false);
            case CELL_ACCESS -> new ArrayRef(transform(tree.tree(Field.TARGET)), arguments(tree), true);
            case FUNCTION_HANDLE -> new FunHandle(identifier(tree.tree(Field.TARGET)));
            case ANONYMOUS_FUNCTION -> new AnonFun(transformAll(tree.trees(Field.PARAMETERS)),
                    transform(tree.tree(Field.BODY)));
            case STRUCT -> new StructRef(transform(tree.tree(Field.BASE)), member(tree));
            case ASSIGNMENT -> new Assignment(assignmentTarget(tree.tree(Field.LHS)), transform(tree.tree(Field.RHS)));
            case WHILE -> new While(condition(tree));
            case IF -> new If(condition(tree));
            case ELSEIF -> new Elseif(condition(tree));
            case ELSE -> new Else();
            case SWITCH -> new Switch(condition(tree));
            case CASE -> new Case(condition(tree));
            case OTHERWISE -> new Otherwise();
            case FOR -> new For(identifier(tree.tree(Field.VARIABLE)), transform(tree.tree(Field.EXPRESSION)));
            case TRY -> new Try();
            case CATCH -> new Catch(tree.has(Field.VARIABLE) ? identifier(tree.tree(Field.VARIABLE)) : null);
            case END -> new End();
            case BREAK -> new Branch(Branch.Kind.BREAK);
            case CONTINUE -> new Branch(Branch.Kind.CONTINUE);
            case RETURN -> new Branch(Branch.Kind.RETURN);
            case FUNCTION_DEFINITION -> new FunDef(new Identifier(tree.text(Field.NAME)),
                    optionalList(tree.optionalTrees(Field.PARAMETERS)),
                    optionalList(tree.optionalTrees(Field.OUTPUTS)));
            case COMMAND -> new MatlabCommand(new Identifier(tree.text(Field.NAME)), tree.text(Field.TEXT));
            case SHELL_COMMAND -> new ShellCommand(tree.text(Field.TEXT));
            case COMMENT -> new Comment(tree.text(Field.TEXT));
        };
    }

    // ── Rules ────────────────────────────────────────────────────────────

    /**
     * Operators keep their own grouping; anything else in parentheses is kept
     * as a one-element {@link Expression}.
     */
    private static Node group(Node inner) {
        if (inner instanceof UnaryOp || inner instanceof BinaryOp || inner instanceof TernaryOp) {
            return inner;
        }
        return new Expression(List.of(inner));
    }

    /**
     * Indexed names on the left of {@code =} are arrays being written, never
     * calls, including inside a destructuring row.
     */
    private Node assignmentTarget(ParseTree lhs) {
        if (lhs.is(RuleKind.ARRAY_OR_FUNCTION)) {
            return new ArrayRef(transform(lhs.tree(Field.TARGET)), arguments(lhs), false);
        }
        if (lhs.is(RuleKind.ARRAY)) {
            return new Array(rows(lhs, true), false);
        }
        return transform(lhs);
    }

    private List<List<Node>> rows(ParseTree tree, boolean assignment) {
        List<List<Node>> rows = new ArrayList<>();
        for (List<ParseTree> row : tree.rows(Field.ROWS)) {
            List<Node> elements = new ArrayList<>(row.size());
            for (ParseTree element : row) {
                elements.add(assignment ? assignmentTarget(element) : transform(element));
            }
            rows.add(elements);
        }
        return rows;
    }

    private List<Node> arguments(ParseTree tree) {
        return transformAll(tree.trees(Field.ARGUMENTS));
    }

    private Node member(ParseTree tree) {
        if (tree.has(Field.MEMBER)) {
            return identifier(tree.tree(Field.MEMBER));
        }
        if (tree.has(Field.DYNAMIC_MEMBER)) {
            return new Expression(List.of(transform(tree.tree(Field.DYNAMIC_MEMBER))));
        }
        throw new NodeTransformException(tree.getKind(), "missing field name");
    }

    private Node condition(ParseTree tree) {
        return transform(tree.tree(Field.CONDITION));
    }

    private Identifier identifier(ParseTree tree) {
        if (!tree.is(RuleKind.IDENTIFIER)) {
            throw new NodeTransformException(tree.getKind(), "expected an identifier");
        }
        return new Identifier(tree.text(Field.NAME));
    }

    private Node optional(ParseTree tree) {
        return tree == null ? null : transform(tree);
    }

    private List<Node> optionalList(List<ParseTree> trees) {
        return trees == null ? null : transformAll(trees);
    }
}
