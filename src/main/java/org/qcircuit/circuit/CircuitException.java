package org.qcircuit.circuit;

/**
 * Thrown when an import, export or functionality build cannot continue.
 * <p>
 * This covers semantic violations such as re-declaring a register, control counts that exceed
 * the circuit width, unresolvable qubit indices or non-unitary operations in a functionality
 * build. Grammar violations use {@link CircuitParseException}, file access failures use
 * {@link CircuitFileException}.
 */
public class CircuitException extends RuntimeException {

    /** Process exit code for parse and semantic failures. */
    public static final int EXIT_CODE = 1;

    /**
     * Creates a CircuitException with the specified message.
     *
     * @param message Description of the failure
     */
    public CircuitException(String message) {
        super(message);
    }

    /**
     * Creates a CircuitException with the specified message and cause.
     *
     * @param message Description of the failure
     * @param cause The underlying exception that caused the failure
     */
    public CircuitException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * @return The exit code a command line front end should terminate with.
     */
    public int exitCode() {
        return EXIT_CODE;
    }
}
