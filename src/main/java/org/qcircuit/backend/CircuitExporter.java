package org.qcircuit.backend;

import org.qcircuit.circuit.CircuitException;
import org.qcircuit.circuit.CircuitFileException;
import org.qcircuit.circuit.QuantumComputation;
import org.qcircuit.frontend.Format;
import org.qcircuit.frontend.io.SourceLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Entry point for writing circuits. Picks the emitter by file extension or explicit format.
 */
public class CircuitExporter {

    private static final Logger LOG = LoggerFactory.getLogger(CircuitExporter.class);

    private final ExportSettings settings;

    public CircuitExporter(ExportSettings settings) {
        this.settings = settings;
    }

    public CircuitExporter() {
        this(ExportSettings.defaults());
    }

    /**
     * Writes a circuit, choosing the format by the file extension.
     *
     * @param qc The circuit.
     * @param path The output file.
     * @return true if a file was written.
     * @throws CircuitException if the extension is not recognized.
     */
    public boolean dump(QuantumComputation qc, Path path) {
        String extension = SourceLoader.extension(path);
        Format format = Format.forExportExtension(extension)
                .orElseThrow(() -> new CircuitException("Extension " + extension + " not recognized."));
        return dump(qc, path, format);
    }

    /**
     * Writes a circuit in the given format. REAL and GRCS output is not supported; a Qiskit
     * script is refused for circuits wider than the configured maximum. Both cases are logged
     * and nothing is written.
     *
     * @param qc The circuit.
     * @param path The output file.
     * @param format The output format.
     * @return true if a file was written.
     * @throws CircuitFileException if the file cannot be written.
     */
    public boolean dump(QuantumComputation qc, Path path, Format format) {
        switch (format) {
            case OPEN_QASM:
                write(path, new OpenQasmEmitter(settings).emit(qc));
                return true;
            case QISKIT: {
                QiskitScriptEmitter emitter = new QiskitScriptEmitter(settings);
                if (!emitter.supports(qc)) {
                    LOG.error("No more than {} total qubits are currently supported, circuit '{}' needs {}",
                            settings.qiskitMaxQubits(), qc.getName(), QiskitScriptEmitter.totalQubits(qc));
                    return false;
                }
                write(path, emitter.emit(qc, basePath(path)));
                return true;
            }
            case REAL:
            case GRCS:
                LOG.warn("Dumping in {} format currently not supported", format);
                return false;
            default:
                throw new CircuitException("Format " + format + " not supported.");
        }
    }

    private static String basePath(Path path) {
        String full = path.toString();
        int dot = full.lastIndexOf('.');
        int separator = Math.max(full.lastIndexOf('/'), full.lastIndexOf('\\'));
        return dot > separator ? full.substring(0, dot) : full;
    }

    private static void write(Path path, String content) {
        try {
            Files.writeString(path, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new CircuitFileException("Error opening file: " + path, e);
        }
        LOG.debug("Wrote {}", path);
    }
}
