package org.qcircuit.circuit;

/**
 * Thrown when a circuit file cannot be opened, read or written.
 * <p>
 * Kept distinct from {@link CircuitParseException} so that command line front ends can report
 * file access problems with their own exit code.
 */
public class CircuitFileException extends CircuitException {

    /** Process exit code for file access failures. */
    public static final int EXIT_CODE = 3;

    public CircuitFileException(String message) {
        super(message);
    }

    public CircuitFileException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public int exitCode() {
        return EXIT_CODE;
    }
}
