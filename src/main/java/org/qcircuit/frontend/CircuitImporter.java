package org.qcircuit.frontend;

import org.qcircuit.circuit.CircuitException;
import org.qcircuit.circuit.QuantumComputation;
import org.qcircuit.diagnostics.DiagnosticsEngine;
import org.qcircuit.frontend.grcs.GrcsImporter;
import org.qcircuit.frontend.io.SourceLoader;
import org.qcircuit.frontend.qasm.QasmImporter;
import org.qcircuit.frontend.real.RealImporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Entry point for reading circuit files. Picks the importer by file extension or explicit
 * format and names the circuit after the file.
 */
public class CircuitImporter {

    private static final Logger LOG = LoggerFactory.getLogger(CircuitImporter.class);

    private final DiagnosticsEngine diagnostics;

    public CircuitImporter(DiagnosticsEngine diagnostics) {
        this.diagnostics = diagnostics;
    }

    public CircuitImporter() {
        this(new DiagnosticsEngine());
    }

    /**
     * Imports a file, choosing the format by its extension.
     *
     * @param qc The circuit to populate.
     * @param path The file.
     * @throws CircuitException if the extension is not recognized or the import fails.
     */
    public void importFile(QuantumComputation qc, Path path) {
        String extension = SourceLoader.extension(path);
        Format format = Format.forImportExtension(extension)
                .orElseThrow(() -> new CircuitException("Extension " + extension + " not recognized."));
        importFile(qc, path, format);
    }

    /**
     * Imports a file in the given format.
     *
     * @param qc The circuit to populate.
     * @param path The file.
     * @param format The format of the file.
     * @throws org.qcircuit.circuit.CircuitFileException if the file cannot be read.
     * @throws CircuitException if the format cannot be imported or the content is malformed.
     */
    public void importFile(QuantumComputation qc, Path path, Format format) {
        qc.setName(SourceLoader.baseName(path));
        if (format == Format.QISKIT) {
            throw new CircuitException("Format " + format + " not yet supported.");
        }
        SourceLoader.LoadResult source = SourceLoader.loadFile(path);
        LOG.debug("Importing {} as {}", source.logicalName(), format);

        switch (format) {
            case REAL:
                new RealImporter(diagnostics).importSource(qc, source.content(), source.logicalName());
                break;
            case OPEN_QASM:
                // the standard library contains ccx
                qc.updateMaxControls(2);
                Path baseDir = path.toAbsolutePath().normalize().getParent();
                new QasmImporter(diagnostics).importSource(qc, source.content(), source.logicalName(), baseDir);
                break;
            case GRCS:
                new GrcsImporter().importSource(qc, source.content(), source.logicalName());
                break;
            default:
                throw new CircuitException("Format " + format + " not yet supported.");
        }
    }

    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }
}
