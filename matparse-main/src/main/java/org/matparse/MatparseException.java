package org.matparse;

/**
 * Base class of every exception raised by the MATLAB parser.
 */
public class MatparseException extends RuntimeException {

    public MatparseException(String message) {
        super(message);
    }

    public MatparseException(String message, Throwable cause) {
        super(message, cause);
    }

    public MatparseException(Throwable cause) {
        super(cause);
    }
}
