package org.qcircuit.circuit;

/**
 * Thrown when a circuit description violates the grammar of its format.
 */
public class CircuitParseException extends CircuitException {

    private final String sourceName;
    private final int line;

    /**
     * Creates a parse exception that points at a source location.
     *
     * @param message Description of the violation
     * @param sourceName The file or logical name of the source, may be null
     * @param line The 1-based line number, or 0 if unknown
     */
    public CircuitParseException(String message, String sourceName, int line) {
        super(format(message, sourceName, line));
        this.sourceName = sourceName;
        this.line = line;
    }

    /**
     * Creates a parse exception without location information.
     *
     * @param message Description of the violation
     */
    public CircuitParseException(String message) {
        this(message, null, 0);
    }

    public String getSourceName() {
        return sourceName;
    }

    public int getLine() {
        return line;
    }

    private static String format(String message, String sourceName, int line) {
        if (line <= 0) {
            return message;
        }
        String where = sourceName != null ? sourceName + ":" + line : "line " + line;
        return where + ": " + message;
    }
}
