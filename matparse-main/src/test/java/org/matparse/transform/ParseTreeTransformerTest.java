package org.matparse.transform;

import org.junit.jupiter.api.Test;
import org.matparse.NodeTransformException;
import org.matparse.ast.AnonFun;
import org.matparse.ast.Array;
import org.matparse.ast.ArrayOrFunCall;
import org.matparse.ast.ArrayRef;
import org.matparse.ast.Assignment;
import org.matparse.ast.BinaryOp;
import org.matparse.ast.Branch;
import org.matparse.ast.Catch;
import org.matparse.ast.Expression;
import org.matparse.ast.FunDef;
import org.matparse.ast.FunHandle;
import org.matparse.ast.Identifier;
import org.matparse.ast.MatlabCommand;
import org.matparse.ast.Node;
import org.matparse.ast.NumberLiteral;
import org.matparse.ast.Special;
import org.matparse.ast.StringLiteral;
import org.matparse.ast.StructRef;
import org.matparse.ast.TernaryOp;
import org.matparse.ast.Transpose;
import org.matparse.ast.UnaryOp;
import org.matparse.parser.Field;
import org.matparse.parser.MatlabGrammar;
import org.matparse.parser.ParseTree;
import org.matparse.parser.RuleKind;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ParseTreeTransformerTest {

    private final ParseTreeTransformer transformer = new ParseTreeTransformer();

    private Node expression(String source) {
        return transformer.transform(new MatlabGrammar(source, null).parseSingleExpression());
    }

    private List<Node> program(String source) {
        return transformer.transformAll(new MatlabGrammar(source, null).parseProgram());
    }

    private static Identifier id(String name) {
        return new Identifier(name);
    }

    private static NumberLiteral num(String text) {
        return new NumberLiteral(text);
    }

    @Test
    void binaryOperationsAreTrees() {
        assertThat(expression("1 + 2 * x")).isEqualTo(
                new BinaryOp(num("1"), "+", new BinaryOp(num("2"), "*", id("x"))));
    }

    @Test
    void parenthesizedOperatorKeepsItsNode() {
        assertThat(expression("(a + b)")).isEqualTo(new BinaryOp(id("a"), "+", id("b")));
        assertThat(expression("(-a)")).isEqualTo(new UnaryOp("-", id("a")));
    }

    @Test
    void parenthesizedOperandBecomesExpression() {
        assertThat(expression("(a)")).isEqualTo(new Expression(List.of(id("a"))));
        assertThat(expression("(a')")).isEqualTo(new Expression(List.of(new Transpose(id("a"), "'"))));
    }

    @Test
    void ranges() {
        assertThat(expression("1:n")).isEqualTo(new TernaryOp(num("1"), null, id("n")));
        assertThat(expression("1:2:n")).isEqualTo(new TernaryOp(num("1"), num("2"), id("n")));
    }

    @Test
    void references() {
        assertThat(expression("f(1, x)")).isEqualTo(new ArrayOrFunCall(id("f"), List.of(num("1"), id("x"))));
        assertThat(expression("m(:, end)")).isEqualTo(
                new ArrayRef(id("m"), List.of(Special.colon(), Special.end()), false));
        assertThat(expression("c{2}")).isEqualTo(new ArrayRef(id("c"), List.of(num("2")), true));
        assertThat(expression("s.f")).isEqualTo(new StructRef(id("s"), id("f")));
        assertThat(expression("s.(k)")).isEqualTo(new StructRef(id("s"), new Expression(List.of(id("k")))));
    }

    @Test
    void literalsAndHandles() {
        assertThat(expression("'text'")).isEqualTo(new StringLiteral("text"));
        assertThat(expression("[1 2; 3 4]")).isEqualTo(new Array(
                List.of(List.of(num("1"), num("2")), List.of(num("3"), num("4"))), false));
        assertThat(expression("{}")).isEqualTo(new Array(List.of(), true));
        assertThat(expression("@sin")).isEqualTo(new FunHandle(id("sin")));
        assertThat(expression("@(x) x + 1")).isEqualTo(
                new AnonFun(List.of(id("x")), new BinaryOp(id("x"), "+", num("1"))));
    }

    @Test
    void fieldOfHandle() {
        Assignment assignment = (Assignment) program("x = @pkg.fn").get(0);
        assertThat(assignment.getRhs()).isEqualTo(new StructRef(new FunHandle(id("pkg")), id("fn")));
    }

    @Test
    void indexedAssignmentTargetIsArrayRef() {
        Assignment assignment = (Assignment) program("x(2) = 1").get(0);
        assertThat(assignment.getLhs()).isEqualTo(new ArrayRef(id("x"), List.of(num("2")), false));
        assertThat(assignment.getRhs()).isEqualTo(num("1"));
    }

    @Test
    void destructuringAssignment() {
        Assignment assignment = (Assignment) program("[a, ~, b(1)] = size(m)").get(0);
        assertThat(assignment.getLhs()).isEqualTo(new Array(List.of(List.of(
                id("a"), Special.tilde(), new ArrayRef(id("b"), List.of(num("1")), false))), false));
        assertThat(assignment.getRhs()).isInstanceOf(ArrayOrFunCall.class);
    }

    @Test
    void statements() {
        List<Node> nodes = program("function [r] = f(x)\ntry\ncatch e\nend\nreturn\nhold on");
        assertThat(nodes.get(0)).isEqualTo(new FunDef(id("f"), List.of(id("x")), List.of(id("r"))));
        assertThat(nodes.get(2)).isEqualTo(new Catch(id("e")));
        assertThat(nodes.get(4)).isEqualTo(new Branch(Branch.Kind.RETURN));
        assertThat(nodes.get(5)).isEqualTo(new MatlabCommand(id("hold"), "on"));
    }

    @Test
    void missingFieldIsReported() {
        ParseTree operand = new MatlabGrammar("a", null).parseSingleExpression();
        ParseTree broken = ParseTree.builder(RuleKind.BINARY, operand).with(Field.LEFT, operand).build();
        assertThatThrownBy(() -> transformer.transform(broken))
                .isInstanceOf(NodeTransformException.class)
                .hasMessageContaining("Cannot transform BINARY")
                .hasMessageContaining("OPERATOR")
                .satisfies(e -> assertThat(((NodeTransformException) e).getKind()).isEqualTo(RuleKind.BINARY));
    }

    @Test
    void wrongShapeIsReported() {
        ParseTree number = new MatlabGrammar("1", null).parseSingleExpression();
        ParseTree broken = ParseTree.builder(RuleKind.FOR, number)
                .with(Field.VARIABLE, number)
                .with(Field.EXPRESSION, number)
                .build();
        assertThatThrownBy(() -> transformer.transform(broken))
                .isInstanceOf(NodeTransformException.class)
                .hasMessageContaining("expected an identifier");
    }
}
