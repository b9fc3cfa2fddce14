package org.qcircuit.bridge;

/**
 * Signals that the foreign circuit model could not provide requested information, typically
 * the definition of a composite instruction.
 */
public class ForeignCircuitException extends Exception {

    public ForeignCircuitException(String message) {
        super(message);
    }

    public ForeignCircuitException(String message, Throwable cause) {
        super(message, cause);
    }
}
