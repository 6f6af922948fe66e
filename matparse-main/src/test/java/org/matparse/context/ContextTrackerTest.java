package org.matparse.context;

import org.junit.jupiter.api.Test;
import org.matparse.MatlabParser;
import org.matparse.ast.ArrayOrFunCall;
import org.matparse.ast.ArrayRef;
import org.matparse.ast.Assignment;
import org.matparse.ast.BinaryOp;
import org.matparse.ast.Identifier;
import org.matparse.ast.If;
import org.matparse.ast.Node;
import org.matparse.ast.NumberLiteral;
import org.matparse.ast.StructRef;
import org.matparse.parser.MatlabGrammar;
import org.matparse.transform.ParseTreeTransformer;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ContextTrackerTest {

    private final MatlabParser parser = new MatlabParser();

    private static Node rhs(MatlabContext context, int index) {
        return ((Assignment) context.getNodes().get(index)).getRhs();
    }

    @Test
    void literalAssignmentMakesVariable() {
        MatlabContext context = parser.parseString("a = [1 2 3];\nb = a(2);");
        assertThat(context.getTypes()).containsEntry("a", SymbolType.VARIABLE).doesNotContainKey("b");
        assertThat(rhs(context, 1)).isEqualTo(
                new ArrayRef(new Identifier("a"), List.of(new NumberLiteral("2")), false));
        assertThat(context.getCalls()).isEmpty();
    }

    @Test
    void assignmentsAreKeyedByCanonicalForm() {
        MatlabContext context = parser.parseString("x(2) = 5;\ns.f = 'a';");
        assertThat(context.getAssignments()).containsOnlyKeys("x(2)", "s.f");
        assertThat(context.getAssignments().get("x(2)")).isEqualTo(new NumberLiteral("5"));
        assertThat(context.getTypes()).containsOnlyKeys("x");
    }

    @Test
    void unknownNameStaysAmbiguousAndIsRecordedAsCall() {
        MatlabContext context = parser.parseString("b = foo(2);");
        assertThat(rhs(context, 0)).isInstanceOf(ArrayOrFunCall.class);
        assertThat(context.getCalls()).containsOnlyKeys("foo");
        assertThat(context.getCalls().get("foo")).containsExactly(new NumberLiteral("2"));
    }

    @Test
    void inferenceOnlyFlowsForward() {
        MatlabContext context = parser.parseString("y = x(1);\nx = 3;\nz = x(2);");
        assertThat(rhs(context, 0)).isInstanceOf(ArrayOrFunCall.class);
        assertThat(rhs(context, 2)).isInstanceOf(ArrayRef.class);
        // the earlier call record is withdrawn once x is known to be a variable
        assertThat(context.getCalls()).doesNotContainKey("x");
    }

    @Test
    void callResultDoesNotClassify() {
        MatlabContext context = parser.parseString("x = f(1);\ny = x(2);");
        assertThat(context.getTypes()).doesNotContainKey("x");
        assertThat(rhs(context, 1)).isInstanceOf(ArrayOrFunCall.class);
        assertThat(context.getCalls()).containsOnlyKeys("f", "x");
    }

    @Test
    void destructuringClassifiesEveryName() {
        MatlabContext context = parser.parseString("[m, ~, n] = size(z);\nq = m(1) + n(2);");
        assertThat(context.getTypes()).containsOnlyKeys("m", "n");
        BinaryOp sum = (BinaryOp) rhs(context, 1);
        assertThat(sum.getLeft()).isInstanceOf(ArrayRef.class);
        assertThat(sum.getRight()).isInstanceOf(ArrayRef.class);
        assertThat(context.getCalls()).containsOnlyKeys("size");
    }

    @Test
    void functionDefinitionOpensScope() {
        MatlabContext root = parser.parseString("function r = f(a)\n  r = a(1);\nend\ny = g(2);");
        assertThat(root.getFunctions()).containsOnlyKeys("f");
        MatlabContext f = root.getFunctions().get("f");
        assertThat(f.getParent()).isSameAs(root);
        assertThat(f.getTypes()).containsOnlyKeys("r", "a");
        assertThat(f.getParameters()).containsExactly(new Identifier("a"));
        assertThat(f.getReturns()).containsExactly(new Identifier("r"));
        assertThat(f.getAssignments()).containsOnlyKeys("r");
        assertThat(f.getNodes()).isEmpty();

        assertThat(rhs(root, 1)).isInstanceOf(ArrayRef.class);
        assertThat(root.getTypes()).isEmpty();
        assertThat(root.getCalls()).containsOnlyKeys("g");
        assertThat(root.getNodes()).hasSize(4);
    }

    @Test
    void lookupFallsBackToEnclosingScope() {
        MatlabContext root = parser.parseString("a = 1;\nfunction f()\n  b = a(1);\nend");
        assertThat(rhs(root, 2)).isInstanceOf(ArrayRef.class);
        assertThat(root.getFunctions().get("f").lookupType("a")).isEqualTo(SymbolType.VARIABLE);
        assertThat(root.getFunctions().get("f").getType("a")).isNull();
    }

    @Test
    void everyEndLeavesTheFunctionScope() {
        MatlabContext root = parser.parseString(
                "function f(x)\nif x\n  y = 1;\nend\nz = x(1);\nend");
        // the if block's end already closed the scope of f
        assertThat(rhs(root, 4)).isInstanceOf(ArrayOrFunCall.class);
        assertThat(root.getAssignments()).containsOnlyKeys("z");
        assertThat(root.getFunctions().get("f").getAssignments()).containsOnlyKeys("y");
    }

    @Test
    void argumentsOfFieldCallsAreRewritten() {
        MatlabContext context = parser.parseString("k = [1 2];\nx = s.f(k(1));");
        ArrayOrFunCall call = (ArrayOrFunCall) rhs(context, 1);
        assertThat(call.getName()).isEqualTo(new StructRef(new Identifier("s"), new Identifier("f")));
        assertThat(call.getArgs()).containsExactly(
                new ArrayRef(new Identifier("k"), List.of(new NumberLiteral("1")), false));
        assertThat(context.getCalls()).containsOnlyKeys("s.f");
    }

    @Test
    void chainedIndexOfVariableIsNoCall() {
        MatlabContext context = parser.parseString("a = [1 2];\nx = a(1)(2);");
        ArrayOrFunCall outer = (ArrayOrFunCall) rhs(context, 1);
        assertThat(outer.getName()).isEqualTo(
                new ArrayRef(new Identifier("a"), List.of(new NumberLiteral("1")), false));
        assertThat(outer.getArgs()).containsExactly(new NumberLiteral("2"));
        assertThat(context.getCalls()).isEmpty();
    }

    @Test
    void strayEndKeepsRootScope() {
        MatlabContext root = parser.parseString("end\nend\nx = 1;");
        assertThat(root.getTypes()).containsOnlyKeys("x");
        assertThat(root.isRoot()).isTrue();
    }

    @Test
    void conditionsAreRewritten() {
        MatlabContext context = parser.parseString("v = [1 2];\nif v(1) > 0\nend");
        If condition = (If) context.getNodes().get(1);
        assertThat(((BinaryOp) condition.getCond()).getLeft()).isInstanceOf(ArrayRef.class);
    }

    @Test
    void nestedArgumentsAreRewritten() {
        MatlabContext context = parser.parseString("k = 2;\nw = g(k(1), {k(2)});");
        ArrayOrFunCall call = (ArrayOrFunCall) rhs(context, 1);
        assertThat(call.getArgs().get(0)).isInstanceOf(ArrayRef.class);
        assertThat(context.getCalls()).containsOnlyKeys("g");
    }

    @Test
    void trackerStartsFreshForEveryRun() {
        ContextTracker tracker = new ContextTracker();
        List<Node> nodes = new ParseTreeTransformer().transformAll(
                new MatlabGrammar("function f()\nx = 1;", null).parseProgram());
        MatlabContext first = tracker.process(nodes);
        assertThat(tracker.current().getName()).isEqualTo("f");

        MatlabContext second = tracker.process(List.of());
        assertThat(second).isNotSameAs(first);
        assertThat(second.getFunctions()).isEmpty();
        assertThat(tracker.current()).isSameAs(second);
        assertThat(second.getName()).isEqualTo(ContextTracker.ROOT_NAME);
    }
}
