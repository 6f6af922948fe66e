package org.matparse;

import org.matparse.ast.Node;
import org.matparse.context.ContextTracker;
import org.matparse.context.MatlabContext;
import org.matparse.parser.MatlabGrammar;
import org.matparse.parser.ParseTree;
import org.matparse.printer.NodePrinter;
import org.matparse.transform.ParseTreeTransformer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Entry point: parses MATLAB source into canonical nodes and the scope
 * information gathered while reading them.
 * <p>
 * Each call is an independent parse with its own scope tracker, so one
 * parser instance may be shared between threads.
 * <pre>{@code
 * MatlabContext context = new MatlabParser().parseString("a = [1 2];\nb = a(2);");
 * context.getNodes();     // [Assignment(...), Assignment(lhs=b, rhs=ArrayRef(a, [2]))]
 * context.getTypes();     // {a=VARIABLE}
 * }</pre>
 */
public final class MatlabParser {

    private static final Logger LOG = LoggerFactory.getLogger(MatlabParser.class);

    private static final ParseOptions HARD_FAIL = ParseOptions.builder().failSoft(false).build();

    private final ParseTreeTransformer transformer;

    public MatlabParser() {
        this(new ParseTreeTransformer());
    }

    MatlabParser(ParseTreeTransformer transformer) {
        this.transformer = transformer;
    }

    /**
     * Parses {@code source}, throwing {@link MatlabParseException} on a syntax error.
     */
    public MatlabContext parseString(String source) {
        return parse(source, null, HARD_FAIL).orElseThrow();
    }

    /**
     * Parses {@code source}. The result is empty only in fail-soft mode after
     * a syntax error or a transform failure, which has then been reported to
     * the options' listener.
     */
    public Optional<MatlabContext> parseString(String source, ParseOptions options) {
        return parse(source, null, options);
    }

    /**
     * Parses a UTF-8 file, throwing {@link MatlabParseException} on a syntax
     * error. The root context records {@code path}.
     */
    public MatlabContext parseFile(Path path) throws IOException {
        return parseFile(path, HARD_FAIL).orElseThrow();
    }

    /**
     * Parses a UTF-8 file. In fail-soft mode a read failure is reported to the
     * options' listener as well and the result is empty.
     */
    public Optional<MatlabContext> parseFile(Path path, ParseOptions options) throws IOException {
        String source;
        try {
            source = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            if (!options.isFailSoft()) {
                throw e;
            }
            options.getDiagnosticListener().parseFailure(new MatparseException("Cannot read " + path, e));
            return Optional.empty();
        }
        if (options.getSourceName() == null) {
            options = options.toBuilder().sourceName(path.toString()).build();
        }
        return parse(source, path, options);
    }

    /**
     * One line per top-level node in a readable form, indented by block.
     */
    public String printParseResults(MatlabContext context) {
        return new NodePrinter().print(context);
    }

    /**
     * One line per top-level node in the {@code toString()} form of the node classes.
     */
    public String printRawResults(MatlabContext context) {
        return context.getNodes().stream()
                .map(Node::toString)
                .collect(Collectors.joining("\n", "[\n", "\n]"));
    }

    private Optional<MatlabContext> parse(String source, Path file, ParseOptions options) {
        String sourceName = options.getSourceName();
        try {
            List<ParseTree> statements = new MatlabGrammar(source, sourceName).parseProgram();
            List<Node> nodes = transformer.transformAll(statements);
            MatlabContext context = new ContextTracker(file).process(nodes);
            LOG.debug("Parsed {} statements from {}", nodes.size(), sourceName == null ? "<string>" : sourceName);
            if (options.isPrintDebug() && LOG.isDebugEnabled()) {
                LOG.debug("Parse results of {}:\n{}", sourceName == null ? "<string>" : sourceName,
                        printParseResults(context));
            }
            return Optional.of(context);
        } catch (MatlabParseException e) {
            if (!options.isFailSoft()) {
                throw e;
            }
            options.getDiagnosticListener().syntaxError(e);
            return Optional.empty();
        } catch (NodeTransformException e) {
            if (!options.isFailSoft()) {
                throw e;
            }
            options.getDiagnosticListener().parseFailure(e);
            return Optional.empty();
        }
    }
}
