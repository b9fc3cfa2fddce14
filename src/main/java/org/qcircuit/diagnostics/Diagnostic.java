package org.qcircuit.diagnostics;

/**
 * A single message reported while importing or translating a circuit.
 *
 * @param severity   The severity of the message.
 * @param message    The human readable description.
 * @param sourceName The file, logical name or instruction the message refers to.
 * @param line       The 1-based line number, or 0 if not applicable.
 */
public record Diagnostic(Severity severity, String message, String sourceName, int line) {

    /**
     * Severity of a {@link Diagnostic}.
     */
    public enum Severity { WARNING, ERROR }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(severity.name());
        if (sourceName != null) {
            sb.append(" [").append(sourceName);
            if (line > 0) {
                sb.append(':').append(line);
            }
            sb.append(']');
        }
        return sb.append(": ").append(message).toString();
    }
}
