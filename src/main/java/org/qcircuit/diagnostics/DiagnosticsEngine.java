package org.qcircuit.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects recoverable problems found while importing or translating a circuit.
 * <p>
 * Fatal problems are thrown as {@link org.qcircuit.circuit.CircuitException}s. Everything
 * reported here was skipped so that processing of the remaining input could continue. Every
 * report is also logged at WARN level.
 */
public class DiagnosticsEngine {

    private static final Logger LOG = LoggerFactory.getLogger(DiagnosticsEngine.class);

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error that caused a unit of input to be skipped.
     * @param message The error message.
     * @param sourceName The source the error refers to.
     * @param line The line number, or 0 if not applicable.
     */
    public void reportError(String message, String sourceName, int line) {
        add(new Diagnostic(Diagnostic.Severity.ERROR, message, sourceName, line));
    }

    /**
     * Reports a warning about input that was accepted but ignored or approximated.
     * @param message The warning message.
     * @param sourceName The source the warning refers to.
     * @param line The line number, or 0 if not applicable.
     */
    public void reportWarning(String message, String sourceName, int line) {
        add(new Diagnostic(Diagnostic.Severity.WARNING, message, sourceName, line));
    }

    /**
     * @return true if at least one error has been reported.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.severity() == Diagnostic.Severity.ERROR);
    }

    /**
     * @return All reported diagnostics in reporting order.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * @return A multi-line summary of all diagnostics, or an empty string if there are none.
     */
    public String summary() {
        StringBuilder sb = new StringBuilder();
        for (Diagnostic d : diagnostics) {
            sb.append(d).append('\n');
        }
        return sb.toString();
    }

    private void add(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
        LOG.warn("{}", diagnostic);
    }
}
