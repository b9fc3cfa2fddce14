package org.qcircuit.frontend.grcs;

import org.qcircuit.circuit.CircuitParseException;
import org.qcircuit.circuit.QuantumComputation;
import org.qcircuit.operations.Control;
import org.qcircuit.operations.OpType;
import org.qcircuit.operations.StandardOperation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Imports grid benchmark circuits.
 * <p>
 * The first line holds the qubit count, every further non-empty line reads
 * {@code <cycle> <gate> <qubits...>}. The cycle is not used.
 */
public class GrcsImporter {

    private static final Logger LOG = LoggerFactory.getLogger(GrcsImporter.class);

    /**
     * @param qc The circuit to populate, normally empty.
     * @param content The source text.
     * @param sourceName The name used in error messages.
     * @throws CircuitParseException on a malformed line or an unknown gate.
     */
    public void importSource(QuantumComputation qc, String content, String sourceName) {
        String[] lines = content.split("\n", -1);
        int lineIndex = 0;
        while (lineIndex < lines.length && lines[lineIndex].isBlank()) {
            lineIndex++;
        }
        if (lineIndex == lines.length) {
            throw new CircuitParseException("Missing qubit count", sourceName, 1);
        }
        String[] header = lines[lineIndex].trim().split("\\s+");
        int nqubits = parseInt(header[0], sourceName, lineIndex + 1);
        qc.setNqubits(nqubits);

        for (int i = lineIndex + 1; i < lines.length; i++) {
            String line = lines[i].trim();
            if (line.isEmpty()) {
                continue;
            }
            parseGate(qc, line.split("\\s+"), sourceName, i + 1);
        }

        qc.initializeIdentityPermutations();
        LOG.debug("Imported grid benchmark '{}' with {} qubits and {} operations", sourceName, nqubits, qc.size());
    }

    private static void parseGate(QuantumComputation qc, String[] fields, String sourceName, int line) {
        if (fields.length < 3) {
            throw new CircuitParseException("Expected '<cycle> <gate> <qubits>'", sourceName, line);
        }
        parseInt(fields[0], sourceName, line);
        String identifier = fields[1];
        int n = qc.getNqubits();

        if ("cz".equals(identifier)) {
            if (fields.length < 4) {
                throw new CircuitParseException("cz requires a control and a target", sourceName, line);
            }
            int control = qubit(fields[2], n, sourceName, line);
            int target = qubit(fields[3], n, sourceName, line);
            qc.emplaceBack(new StandardOperation(n, Control.pos(control), target, OpType.Z));
            return;
        }

        int target = qubit(fields[2], n, sourceName, line);
        switch (identifier) {
            case "h" -> qc.emplaceBack(new StandardOperation(n, target, OpType.H));
            case "t" -> qc.emplaceBack(new StandardOperation(n, target, OpType.T));
            case "x_1_2" -> qc.emplaceBack(new StandardOperation(n, target, OpType.RX, Math.PI / 2));
            case "y_1_2" -> qc.emplaceBack(new StandardOperation(n, target, OpType.RY, Math.PI / 2));
            default -> throw new CircuitParseException("Unknown gate '" + identifier + "'", sourceName, line);
        }
    }

    private static int qubit(String field, int nqubits, String sourceName, int line) {
        int qubit = parseInt(field, sourceName, line);
        if (qubit < 0 || qubit >= nqubits) {
            throw new CircuitParseException("Qubit " + qubit + " out of range [0, " + nqubits + ")", sourceName, line);
        }
        return qubit;
    }

    private static int parseInt(String field, String sourceName, int line) {
        try {
            return Integer.parseInt(field);
        } catch (NumberFormatException e) {
            throw new CircuitParseException("Invalid number '" + field + "'", sourceName, line);
        }
    }
}
