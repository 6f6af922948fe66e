package org.matparse;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.matparse.ast.Array;
import org.matparse.ast.ArrayOrFunCall;
import org.matparse.ast.ArrayRef;
import org.matparse.ast.Assignment;
import org.matparse.ast.Identifier;
import org.matparse.ast.Node;
import org.matparse.ast.NumberLiteral;
import org.matparse.context.MatlabContext;
import org.matparse.context.SymbolType;
import org.matparse.parser.ParseTree;
import org.matparse.parser.RuleKind;
import org.matparse.transform.ParseTreeTransformer;
import org.matparse.util.MatlabFormulas;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MatlabParserTest {

    private final MatlabParser parser = new MatlabParser();

    private static Node rhs(MatlabContext context, int index) {
        return ((Assignment) context.getNodes().get(index)).getRhs();
    }

    @Test
    void numericLiteralForms() {
        MatlabContext context = parser.parseString("a = 1;\nb = 1.5;\nc = .5;\nd = 1e-3;\ne = 2.5E+10;\nf = 3.;");
        assertThat(context.getNodes()).hasSize(6);
        assertThat(rhs(context, 0)).isEqualTo(new NumberLiteral("1"));
        assertThat(rhs(context, 1)).isEqualTo(new NumberLiteral("1.5"));
        assertThat(rhs(context, 2)).isEqualTo(new NumberLiteral(".5"));
        assertThat(rhs(context, 3)).isEqualTo(new NumberLiteral("1e-3"));
        assertThat(rhs(context, 4)).isEqualTo(new NumberLiteral("2.5E+10"));
        assertThat(rhs(context, 5)).isEqualTo(new NumberLiteral("3."));
    }

    @Test
    void singleAssignment() {
        MatlabContext context = parser.parseString("a = 1");
        assertThat(context.getNodes()).containsExactly(
                new Assignment(new Identifier("a"), new NumberLiteral("1")));
        assertThat(context.getTypes()).containsEntry("a", SymbolType.VARIABLE);
    }

    @Test
    void rowVector() {
        MatlabContext context = parser.parseString("a = [1 2]");
        assertThat(rhs(context, 0)).isEqualTo(new Array(
                List.of(List.of(new NumberLiteral("1"), new NumberLiteral("2"))), false));
    }

    @Test
    void formulaOfParsedExpression() {
        MatlabContext context = parser.parseString("x = 1 + 2 + 3;");
        assertThat(MatlabFormulas.makeFormula(rhs(context, 0))).isEqualTo("((1 + 2) + 3)");
    }

    @Test
    void variableIndexResolvesToArrayRef() {
        MatlabContext context = parser.parseString("a = [1 2 3];\nb = a(2);\nc = foo(2);");
        assertThat(rhs(context, 1)).isEqualTo(
                new ArrayRef(new Identifier("a"), List.of(new NumberLiteral("2")), false));
        assertThat(rhs(context, 2)).isInstanceOf(ArrayOrFunCall.class);
        assertThat(context.getCalls()).containsOnlyKeys("foo");
    }

    @Test
    void functionScopesArePushedAndPopped() {
        MatlabContext root = parser.parseString("function y = g(x)\n  y = x * 2;\nend\nz = 1;");
        assertThat(root.isRoot()).isTrue();
        assertThat(root.getFunctions()).containsOnlyKeys("g");
        assertThat(root.getFunctions().get("g").getTypes()).containsOnlyKeys("x", "y");
        assertThat(root.getTypes()).containsOnlyKeys("z");
    }

    @Test
    void keysAreStableAcrossParses() {
        Node first = rhs(parser.parseString("v = 1;\nw = v(1, :);"), 1);
        Node second = rhs(parser.parseString("v = 1;\nw = v(1, :);"), 1);
        assertThat(MatlabFormulas.makeKey(first))
                .isEqualTo(MatlabFormulas.makeKey(second))
                .isEqualTo("v(1,:)");
    }

    @Test
    void softFailReportsExactlyOneDiagnostic() {
        List<MatlabParseException> errors = new ArrayList<>();
        ParseOptions options = ParseOptions.builder()
                .failSoft(true)
                .diagnosticListener(errors::add)
                .build();

        Optional<MatlabContext> result = parser.parseString("x = 1;\na = [1 2; 3 4", options);

        assertThat(result).isEmpty();
        assertThat(errors).hasSize(1);
        assertThat(errors.get(0).getDetail()).startsWith("Unterminated '['");
    }

    @Test
    void softFailWithoutErrorReturnsContext() {
        ParseOptions options = ParseOptions.builder().failSoft(true).build();
        assertThat(parser.parseString("a = 1;", options)).hasValueSatisfying(
                context -> assertThat(context.getNodes()).hasSize(1));
    }

    @Test
    void hardFailThrowsWithPosition() {
        assertThatThrownBy(() -> parser.parseString("a = 1;\nb = [1 2"))
                .isInstanceOf(MatlabParseException.class)
                .satisfies(e -> {
                    MatlabParseException pe = (MatlabParseException) e;
                    assertThat(pe.getLine()).isEqualTo(2);
                    assertThat(pe.getColumn()).isEqualTo(5);
                    assertThat(pe.getSourceName()).isNull();
                });
    }

    @Test
    void namedSourceAppearsInMessage() {
        ParseOptions options = ParseOptions.builder().sourceName("model.m").build();
        assertThatThrownBy(() -> parser.parseString("x = (1 + ;", options))
                .isInstanceOf(MatlabParseException.class)
                .hasMessageStartingWith("Parse error at model.m:1:");
    }

    @Test
    void parseFileRecordsPath(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("script.m");
        Files.writeString(file, "% setup\nk = 2;\nr = k(1) * f(3);\n", StandardCharsets.UTF_8);

        MatlabContext context = parser.parseFile(file);

        assertThat(context.getFile()).isEqualTo(file);
        assertThat(context.getNodes()).hasSize(3);
        assertThat(context.getCalls()).containsOnlyKeys("f");
    }

    @Test
    void parseFileNamesErrorsAfterTheFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("broken.m");
        Files.writeString(file, "x = 1;\ny = [2", StandardCharsets.UTF_8);

        assertThatThrownBy(() -> parser.parseFile(file))
                .isInstanceOf(MatlabParseException.class)
                .satisfies(e -> assertThat(((MatlabParseException) e).getSourceName()).isEqualTo(file.toString()));
    }

    @Test
    void missingFileIsAnIoError(@TempDir Path dir) {
        assertThatThrownBy(() -> parser.parseFile(dir.resolve("absent.m")))
                .isInstanceOf(NoSuchFileException.class);
    }

    @Test
    void softFailReportsUnreadableFile(@TempDir Path dir) throws IOException {
        List<MatparseException> failures = new ArrayList<>();
        ParseOptions options = ParseOptions.builder()
                .failSoft(true)
                .diagnosticListener(new ParseDiagnosticListener() {
                    @Override
                    public void syntaxError(MatlabParseException error) {
                        failures.add(error);
                    }

                    @Override
                    public void parseFailure(MatparseException error) {
                        failures.add(error);
                    }
                })
                .build();

        assertThat(parser.parseFile(dir.resolve("absent.m"), options)).isEmpty();
        assertThat(failures).hasSize(1);
        assertThat(failures.get(0)).isNotInstanceOf(MatlabParseException.class)
                .hasMessageStartingWith("Cannot read ")
                .hasCauseInstanceOf(NoSuchFileException.class);
    }

    @Test
    void transformFailureFollowsFailMode() {
        NodeTransformException defect = new NodeTransformException(RuleKind.BINARY, "missing field OPERATOR");
        MatlabParser broken = new MatlabParser(new ParseTreeTransformer() {
            @Override
            public List<Node> transformAll(List<ParseTree> trees) {
                throw defect;
            }
        });
        List<MatparseException> failures = new ArrayList<>();
        ParseOptions soft = ParseOptions.builder()
                .failSoft(true)
                .diagnosticListener(new ParseDiagnosticListener() {
                    @Override
                    public void syntaxError(MatlabParseException error) {
                        failures.add(error);
                    }

                    @Override
                    public void parseFailure(MatparseException error) {
                        failures.add(error);
                    }
                })
                .build();

        assertThat(broken.parseString("a = 1", soft)).isEmpty();
        assertThat(failures).containsExactly(defect);
        assertThatThrownBy(() -> broken.parseString("a = 1")).isSameAs(defect);
    }

    @Test
    void printParseResults() {
        MatlabContext context = parser.parseString("a = 1;\nb = a(1);");
        assertThat(parser.printParseResults(context)).isEqualTo(
                "{assign: {identifier: \"a\"} = {number: 1}}\n"
                        + "{assign: {identifier: \"b\"} = {array {identifier: \"a\"}: [ {number: 1} ]}}\n");
    }

    @Test
    void printRawResults() {
        MatlabContext context = parser.parseString("a = 1;\nhold on");
        String raw = parser.printRawResults(context);
        assertThat(raw).startsWith("[\n").endsWith("\n]");
        assertThat(raw.split("\n")).hasSize(4);
        assertThat(raw).contains(context.getNodes().get(0).toString());
    }

    @Test
    void printDebugStillReturnsResult() {
        ParseOptions options = ParseOptions.builder().printDebug(true).build();
        assertThat(parser.parseString("if x > 1\n  y = 2;\nend", options)).isPresent();
    }

    @Test
    void defaultsFollowSystemProperties() {
        String previous = System.getProperty(ParseOptions.FAIL_SOFT_PROPERTY);
        try {
            System.setProperty(ParseOptions.FAIL_SOFT_PROPERTY, "true");
            assertThat(ParseOptions.defaults().isFailSoft()).isTrue();
            System.clearProperty(ParseOptions.FAIL_SOFT_PROPERTY);
            assertThat(ParseOptions.defaults().isFailSoft()).isFalse();
            assertThat(ParseOptions.defaults().isPrintDebug()).isFalse();
        } finally {
            if (previous == null) {
                System.clearProperty(ParseOptions.FAIL_SOFT_PROPERTY);
            } else {
                System.setProperty(ParseOptions.FAIL_SOFT_PROPERTY, previous);
            }
        }
    }

    @Test
    void toBuilderKeepsSettings() {
        ParseDiagnosticListener listener = error -> { };
        ParseOptions options = ParseOptions.builder().failSoft(true).sourceName("m.m")
                .diagnosticListener(listener).build();
        ParseOptions copy = options.toBuilder().printDebug(true).build();
        assertThat(copy.isFailSoft()).isTrue();
        assertThat(copy.isPrintDebug()).isTrue();
        assertThat(copy.getSourceName()).isEqualTo("m.m");
        assertThat(copy.getDiagnosticListener()).isSameAs(listener);
    }
}
