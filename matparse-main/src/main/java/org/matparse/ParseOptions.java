package org.matparse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Settings of a single parse.
 * <p>
 * In fail-soft mode a failed parse is handed to the diagnostic listener and
 * returns no result; otherwise the exception propagates. The default listener
 * logs syntax errors at WARN level.
 */
public final class ParseOptions {

    /**
     * System property read by {@link #defaults()} to switch fail-soft mode on.
     */
    public static final String FAIL_SOFT_PROPERTY = "matparse.parser.failSoft";

    /**
     * System property read by {@link #defaults()} to log every parse result at DEBUG level.
     */
    public static final String PRINT_DEBUG_PROPERTY = "matparse.parser.printDebug";

    private static final Logger LOG = LoggerFactory.getLogger(ParseOptions.class);

    private static final ParseDiagnosticListener LOGGING_LISTENER =
            error -> LOG.warn("{}", error.getMessage());

    private final boolean failSoft;
    private final boolean printDebug;
    private final String sourceName;
    private final ParseDiagnosticListener diagnosticListener;

    private ParseOptions(Builder builder) {
        this.failSoft = builder.failSoft;
        this.printDebug = builder.printDebug;
        this.sourceName = builder.sourceName;
        this.diagnosticListener = builder.diagnosticListener;
    }

    public static ParseOptions defaults() {
        return builder()
                .failSoft(Boolean.getBoolean(FAIL_SOFT_PROPERTY))
                .printDebug(Boolean.getBoolean(PRINT_DEBUG_PROPERTY))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isFailSoft() {
        return failSoft;
    }

    public boolean isPrintDebug() {
        return printDebug;
    }

    /**
     * Name used in error messages, {@code null} when unnamed. File parses
     * fall back to the file name.
     */
    public String getSourceName() {
        return sourceName;
    }

    public ParseDiagnosticListener getDiagnosticListener() {
        return diagnosticListener;
    }

    public Builder toBuilder() {
        return new Builder()
                .failSoft(failSoft)
                .printDebug(printDebug)
                .sourceName(sourceName)
                .diagnosticListener(diagnosticListener);
    }

    @Override
    public String toString() {
        return "ParseOptions(failSoft=" + failSoft + ", printDebug=" + printDebug
                + ", sourceName=" + sourceName + ")";
    }

    public static final class Builder {

        private boolean failSoft;
        private boolean printDebug;
        private String sourceName;
        private ParseDiagnosticListener diagnosticListener = LOGGING_LISTENER;

        private Builder() {
        }

        public Builder failSoft(boolean failSoft) {
            this.failSoft = failSoft;
            return this;
        }

        public Builder printDebug(boolean printDebug) {
            this.printDebug = printDebug;
            return this;
        }

        public Builder sourceName(String sourceName) {
            this.sourceName = sourceName;
            return this;
        }

        public Builder diagnosticListener(ParseDiagnosticListener diagnosticListener) {
            this.diagnosticListener = Objects.requireNonNull(diagnosticListener, "diagnosticListener");
            return this;
        }

        public ParseOptions build() {
            return new ParseOptions(this);
        }
    }
}
