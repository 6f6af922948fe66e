package org.matparse;

/**
 * Raised when MATLAB source text does not match the grammar.
 * <p>
 * Lines and columns are 1-based and point at the offending character, or at
 * the opening bracket when a bracket is never closed.
 */
public class MatlabParseException extends MatparseException {

    private final String sourceName;
    private final int line;
    private final int column;
    private final String detail;

    public MatlabParseException(String detail, String sourceName, int line, int column) {
        super(formatMessage(detail, sourceName, line, column));
        this.detail = detail;
        this.sourceName = sourceName;
        this.line = line;
        this.column = column;
    }

    private static String formatMessage(String detail, String sourceName, int line, int column) {
        String where = sourceName == null ? "" : sourceName + ":";
        return "Parse error at " + where + line + ":" + column + ": " + detail;
    }

    /**
     * The message without the position prefix.
     */
    public String getDetail() {
        return detail;
    }

    public String getSourceName() {
        return sourceName;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
