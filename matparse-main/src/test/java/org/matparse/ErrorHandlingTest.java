package org.matparse;

import org.junit.jupiter.api.Test;
import org.matparse.parser.Field;
import org.matparse.parser.MatlabGrammar;
import org.matparse.parser.ParseTree;
import org.matparse.parser.RuleKind;
import org.matparse.transform.ParseTreeTransformer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ErrorHandlingTest {

    private final MatlabParser parser = new MatlabParser();

    // 1. MatlabParseException: position and detail
    @Test
    void parseError_carriesPosition() {
        assertThatThrownBy(() -> parser.parseString("y = 2 *"))
                .isInstanceOf(MatlabParseException.class)
                .satisfies(e -> {
                    MatlabParseException pe = (MatlabParseException) e;
                    assertThat(pe.getLine()).isEqualTo(1);
                    assertThat(pe.getColumn()).isEqualTo(8);
                    assertThat(pe.getMessage()).startsWith("Parse error at 1:8: ");
                    assertThat(pe.getMessage()).endsWith(pe.getDetail());
                });
    }

    // 2. Lexical errors surface as parse errors
    @Test
    void lexError_isParseError() {
        assertThatThrownBy(() -> parser.parseString("s = 'open"))
                .isInstanceOf(MatlabParseException.class)
                .hasMessageContaining("Unterminated string literal");
        assertThatThrownBy(() -> parser.parseString("a = 1 $ 2"))
                .isInstanceOf(MatlabParseException.class)
                .hasMessageContaining("Unexpected character '$'");
    }

    // 3. Invalid assignment targets
    @Test
    void assignmentTarget_isValidated() {
        assertThatThrownBy(() -> parser.parseString("1 = a"))
                .isInstanceOf(MatlabParseException.class)
                .hasMessageContaining("Invalid assignment target");
        assertThatThrownBy(() -> parser.parseString("[a; b] = deal(1, 2)"))
                .isInstanceOf(MatlabParseException.class)
                .hasMessageContaining("Invalid assignment target");
    }

    // 4. NodeTransformException: rule kind is reported
    @Test
    void transformError_reportsRuleKind() {
        ParseTree name = new MatlabGrammar("x", null).parseSingleExpression();
        ParseTree broken = ParseTree.builder(RuleKind.UNARY, name).with(Field.OPERAND, name).build();
        assertThatThrownBy(() -> new ParseTreeTransformer().transform(broken))
                .isInstanceOf(NodeTransformException.class)
                .satisfies(e -> {
                    NodeTransformException te = (NodeTransformException) e;
                    assertThat(te.getKind()).isEqualTo(RuleKind.UNARY);
                    assertThat(te.getMessage()).startsWith("Cannot transform UNARY: ");
                });
    }

    // 5. Hierarchy: all exceptions extend MatparseException
    @Test
    void exceptionHierarchy_allExtendRoot() {
        assertThat(MatparseException.class).isAssignableFrom(MatlabParseException.class);
        assertThat(MatparseException.class).isAssignableFrom(NodeTransformException.class);
        assertThat(RuntimeException.class).isAssignableFrom(MatparseException.class);
    }

    // 6. catch(MatparseException) catches all subtypes
    @Test
    void catchRoot_catchesAllSubtypes() {
        try {
            parser.parseString("function");
        } catch (MatparseException e) {
            assertThat(e).isInstanceOf(MatlabParseException.class);
            return;
        }
        throw new AssertionError("expected a MatparseException");
    }

    // 7. Soft fail hands the same exception to the listener
    @Test
    void softFail_deliversExceptionToListener() {
        MatlabParseException[] received = new MatlabParseException[1];
        ParseOptions options = ParseOptions.builder()
                .failSoft(true)
                .sourceName("calc.m")
                .diagnosticListener(error -> received[0] = error)
                .build();

        assertThat(parser.parseString("z = )", options)).isEmpty();
        assertThat(received[0]).isNotNull();
        assertThat(received[0].getSourceName()).isEqualTo("calc.m");
        assertThat(received[0].getMessage()).startsWith("Parse error at calc.m:1:5: ");
    }

    // 8. classdef is rejected
    @Test
    void classdef_isRejected() {
        assertThatThrownBy(() -> parser.parseString("classdef Foo\nend"))
                .isInstanceOf(MatlabParseException.class)
                .hasMessageContaining("classdef files are not supported");
    }
}
