package org.matparse.benchmark;

import java.util.List;
import java.util.concurrent.TimeUnit;

import org.matparse.MatlabParser;
import org.matparse.ast.Node;
import org.matparse.context.MatlabContext;
import org.matparse.parser.MatlabGrammar;
import org.matparse.parser.MatlabLexer;
import org.matparse.parser.Token;
import org.matparse.parser.TokenKind;
import org.matparse.transform.ParseTreeTransformer;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

/**
 * Parse cost of inputs that stress the grammar: deeply parenthesized
 * expressions, long matrix rows and a script mixing functions, control flow
 * and commands. Grammar-only variants leave out scope tracking.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Fork(2)
@Warmup(iterations = 5, time = 2)
@Measurement(iterations = 5, time = 2)
@State(Scope.Thread)
public class ParserBenchmark {

    @State(Scope.Benchmark)
    public static class Sources {

        @Param({"16", "128"})
        int depth;

        @Param({"100", "2000"})
        int width;

        String nested;
        String matrix;
        String script;

        @Setup(Level.Trial)
        public void generate() {
            StringBuilder expression = new StringBuilder("y = ");
            for (int i = 0; i < depth; i++) {
                expression.append("(x").append(i).append(" + ");
            }
            expression.append('1');
            for (int i = 0; i < depth; i++) {
                if (i % 2 == 0) {
                    expression.append(") * 2");
                } else {
                    expression.append(")' - v(").append(i).append(')');
                }
            }
            nested = expression.append(';').toString();

            StringBuilder row = new StringBuilder("m = [");
            for (int i = 0; i < width; i++) {
                row.append(i % 3 == 0 ? " -" : " ").append(i).append(i % 5 == 0 ? "e-3" : "");
            }
            matrix = row.append("; 1:").append(width).append("];").toString();

            StringBuilder lines = new StringBuilder();
            for (int i = 0; i < width / 10; i++) {
                lines.append("function [r, s] = f").append(i).append("(a, ~, c)\n")
                        .append("  % scale the inputs\n")
                        .append("  r = a(1, :) .* c{2}';\n")
                        .append("  if r(end) > 0 && ~isempty(c)\n")
                        .append("    s.total = sum(r(2:end)) / numel(r);\n")
                        .append("  else\n")
                        .append("    s = struct('total', 0);\n")
                        .append("  end\n")
                        .append("  for k = 1:2:numel(r)\n")
                        .append("    r(k) = r(k) ^ 2;\n")
                        .append("  end\n")
                        .append("end\n")
                        .append("hold on\n")
                        .append("h = @(t) t.^2 + f").append(i).append("(t, 1, 2);\n");
            }
            script = lines.toString();
        }
    }

    private final MatlabParser parser = new MatlabParser();

    @Benchmark
    public MatlabContext parseNestedExpression(Sources sources) {
        return parser.parseString(sources.nested);
    }

    @Benchmark
    public MatlabContext parseLongMatrixRow(Sources sources) {
        return parser.parseString(sources.matrix);
    }

    @Benchmark
    public MatlabContext parseScript(Sources sources) {
        return parser.parseString(sources.script);
    }

    @Benchmark
    public List<Node> parseScriptWithoutScopes(Sources sources) {
        return new ParseTreeTransformer().transformAll(new MatlabGrammar(sources.script, null).parseProgram());
    }

    @Benchmark
    public void tokenizeScript(Sources sources, Blackhole blackhole) {
        MatlabLexer lexer = new MatlabLexer(sources.script, null);
        Token token;
        do {
            token = lexer.next();
            blackhole.consume(token);
        } while (!token.is(TokenKind.EOF));
    }
}
