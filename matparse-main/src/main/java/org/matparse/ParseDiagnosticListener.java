package org.matparse;

import org.slf4j.LoggerFactory;

/**
 * Receives the failure of a parse that runs in fail-soft mode.
 */
@FunctionalInterface
public interface ParseDiagnosticListener {

    void syntaxError(MatlabParseException error);

    /**
     * Failures other than syntax errors: an unreadable file, or grammar output
     * the transformer has no rule for. Logged at ERROR level unless overridden.
     */
    default void parseFailure(MatparseException error) {
        LoggerFactory.getLogger(ParseDiagnosticListener.class).error(error.getMessage(), error);
    }
}
