package org.qcircuit.frontend;

import java.util.Optional;

/**
 * Textual circuit formats known to the importers and exporters.
 */
public enum Format {
    /** RevLib REAL format. */
    REAL,
    /** OpenQASM 2.0. */
    OPEN_QASM,
    /** Grid benchmark circuits (GRCS) as plain text. */
    GRCS,
    /** Python script for the Qiskit ecosystem. Export only. */
    QISKIT;

    /**
     * Maps an import file extension to its format.
     * @param extension The lower-case extension without dot.
     * @return The format, or empty if the extension is not an import format.
     */
    public static Optional<Format> forImportExtension(String extension) {
        return switch (extension) {
            case "real" -> Optional.of(REAL);
            case "qasm" -> Optional.of(OPEN_QASM);
            case "txt" -> Optional.of(GRCS);
            default -> Optional.empty();
        };
    }

    /**
     * Maps an export file extension to its format.
     * @param extension The lower-case extension without dot.
     * @return The format, or empty if the extension is unknown.
     */
    public static Optional<Format> forExportExtension(String extension) {
        if ("py".equals(extension)) {
            return Optional.of(QISKIT);
        }
        return forImportExtension(extension);
    }

    /**
     * Parses a format name as given on the command line, e.g. {@code qasm} or {@code QISKIT}.
     * @param name The name.
     * @return The format.
     * @throws IllegalArgumentException if the name is unknown.
     */
    public static Format parse(String name) {
        String normalized = name.trim().toUpperCase().replace('-', '_');
        return switch (normalized) {
            case "QASM", "OPENQASM", "OPEN_QASM" -> OPEN_QASM;
            case "REAL" -> REAL;
            case "GRCS", "TXT" -> GRCS;
            case "QISKIT", "PY" -> QISKIT;
            default -> throw new IllegalArgumentException("Unknown format: " + name);
        };
    }
}
