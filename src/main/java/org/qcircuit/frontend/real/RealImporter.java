package org.qcircuit.frontend.real;

import org.qcircuit.circuit.CircuitParseException;
import org.qcircuit.circuit.QuantumComputation;
import org.qcircuit.circuit.Register;
import org.qcircuit.diagnostics.DiagnosticsEngine;
import org.qcircuit.operations.Control;
import org.qcircuit.operations.OpType;
import org.qcircuit.operations.StandardOperation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Imports reversible circuits in the RevLib REAL format.
 * <p>
 * The header declares the variables (one qubit and one classical bit each) and ends at
 * {@code .BEGIN}. Each body line names a gate, an optional line count and an optional
 * parameter, followed by the control labels and the target label. The body ends at
 * {@code .END}.
 */
public class RealImporter {

    private static final Logger LOG = LoggerFactory.getLogger(RealImporter.class);

    /** Distance from an integer below which an RZ/U1 divisor is treated as exact. */
    static final double TOLERANCE = 1e-13;

    private static final Pattern GATE_PATTERN =
            Pattern.compile("(r[xyz]|q|[0a-z](?:[+i])?)(\\d+)?(?::([-+]?[0-9]+[.]?[0-9]*(?:[eE][-+]?[0-9]+)?))?");

    private static final Map<String, OpType> IDENTIFIERS = Map.ofEntries(
            Map.entry("0", OpType.I),
            Map.entry("id", OpType.I),
            Map.entry("h", OpType.H),
            Map.entry("n", OpType.X),
            Map.entry("c", OpType.X),
            Map.entry("x", OpType.X),
            Map.entry("y", OpType.Y),
            Map.entry("z", OpType.Z),
            Map.entry("s", OpType.S),
            Map.entry("si", OpType.SDAG),
            Map.entry("sp", OpType.SDAG),
            Map.entry("s+", OpType.SDAG),
            Map.entry("v", OpType.V),
            Map.entry("vi", OpType.VDAG),
            Map.entry("vp", OpType.VDAG),
            Map.entry("v+", OpType.VDAG),
            Map.entry("rx", OpType.RX),
            Map.entry("ry", OpType.RY),
            Map.entry("rz", OpType.RZ),
            Map.entry("f", OpType.SWAP),
            Map.entry("if", OpType.SWAP),
            Map.entry("p", OpType.P),
            Map.entry("pi", OpType.PDAG),
            Map.entry("p+", OpType.PDAG),
            Map.entry("q", OpType.RZ),
            Map.entry("ti", OpType.TDAG),
            Map.entry("t+", OpType.TDAG),
            Map.entry("u", OpType.U3));

    private final DiagnosticsEngine diagnostics;

    public RealImporter(DiagnosticsEngine diagnostics) {
        this.diagnostics = diagnostics;
    }

    /**
     * Parses a REAL source into the given circuit.
     *
     * @param qc The circuit to populate, normally empty.
     * @param content The source text.
     * @param sourceName The name used in error messages.
     * @throws CircuitParseException on any format violation.
     */
    public void importSource(QuantumComputation qc, String content, String sourceName) {
        TextCursor cursor = new TextCursor(content);
        readHeader(qc, cursor, sourceName);
        readGateDescriptions(qc, cursor, sourceName);
        LOG.debug("Imported REAL circuit '{}' with {} qubits and {} operations", sourceName, qc.getNqubits(), qc.size());
    }

    private void readHeader(QuantumComputation qc, TextCursor cursor, String sourceName) {
        while (true) {
            String word = cursor.nextWord();
            if (word == null) {
                throw new CircuitParseException("Unexpected end of file in header", sourceName, cursor.line());
            }
            String cmd = word.toUpperCase(Locale.ROOT);

            if (cmd.startsWith("#")) {
                cursor.restOfLine();
                continue;
            }
            if (!cmd.startsWith(".")) {
                throw new CircuitParseException("Invalid file header: " + word, sourceName, cursor.line());
            }

            switch (cmd) {
                case ".BEGIN":
                    return;
                case ".NUMVARS": {
                    int n = parseCount(cursor.nextWord(), sourceName, cursor.line());
                    qc.setNqubits(n);
                    qc.setNclassics(n);
                    break;
                }
                case ".VARIABLES":
                    for (int i = 0; i < qc.getNqubits(); i++) {
                        String variable = cursor.nextWord();
                        if (variable == null) {
                            throw new CircuitParseException("Too few variables declared", sourceName, cursor.line());
                        }
                        qc.getQubitRegisters().put(variable, new Register(i, 1));
                        qc.getClassicalRegisters().put("c_" + variable, new Register(i, 1));
                        qc.getInputPermutation().put(i, i);
                        qc.getOutputPermutation().put(i, i);
                    }
                    break;
                case ".CONSTANTS":
                case ".INPUTS":
                case ".OUTPUTS":
                case ".GARBAGE":
                case ".VERSION":
                case ".INPUTBUS":
                case ".OUTPUTBUS":
                    cursor.restOfLine();
                    break;
                case ".DEFINE":
                    diagnostics.reportWarning("File contains 'define' statement, which is not supported and thus skipped",
                            sourceName, cursor.line());
                    skipDefinition(cursor, sourceName);
                    break;
                default:
                    throw new CircuitParseException("Unknown command: " + word, sourceName, cursor.line());
            }
        }
    }

    private static void skipDefinition(TextCursor cursor, String sourceName) {
        String cmd = ".DEFINE";
        while (!".ENDDEFINE".equals(cmd)) {
            cursor.restOfLine();
            String word = cursor.nextWord();
            if (word == null) {
                throw new CircuitParseException("Missing .ENDDEFINE", sourceName, cursor.line());
            }
            cmd = word.toUpperCase(Locale.ROOT);
        }
    }

    private void readGateDescriptions(QuantumComputation qc, TextCursor cursor, String sourceName) {
        while (true) {
            String word = cursor.nextWord();
            if (word == null) {
                diagnostics.reportWarning("Missing .END at end of file", sourceName, cursor.line());
                return;
            }
            String cmd = word.toLowerCase(Locale.ROOT);
            int line = cursor.line();

            if (cmd.startsWith("#")) {
                cursor.restOfLine();
                continue;
            }
            if (".end".equals(cmd)) {
                return;
            }

            Matcher m = GATE_PATTERN.matcher(cmd);
            if (!m.matches()) {
                throw new CircuitParseException("Unsupported gate detected: " + cmd, sourceName, line);
            }
            String identifier = m.group(1);
            OpType gate = gateFor(identifier, sourceName, line);
            int ncontrols = 0;
            if (m.group(2) != null) {
                int lines = parseCount(m.group(2), sourceName, line);
                if (lines < 1) {
                    throw new CircuitParseException("Invalid line count " + lines + " for gate " + identifier,
                            sourceName, line);
                }
                ncontrols = lines - 1;
            }
            double lambda = m.group(3) == null ? 0.0 : Double.parseDouble(m.group(3));

            if (gate == OpType.V || gate == OpType.VDAG || "c".equals(identifier)) {
                ncontrols = 1;
            } else if (gate == OpType.P || gate == OpType.PDAG) {
                ncontrols = 2;
            }

            if (ncontrols >= qc.getNqubits()) {
                throw new CircuitParseException("Gate acts on " + (ncontrols + 1) + " qubits, but only "
                        + qc.getNqubits() + " qubits are available.", sourceName, line);
            }

            String rest = cursor.restOfLine().trim();
            String[] labels = rest.isEmpty() ? new String[0] : rest.split("\\s+");
            List<Control> controls = new ArrayList<>();
            for (int i = 0; i < ncontrols; i++) {
                if (i >= labels.length) {
                    throw new CircuitParseException("Too few variables for gate " + identifier, sourceName, line);
                }
                String label = labels[i];
                boolean negative = label.charAt(0) == '-';
                if (negative) {
                    label = label.substring(1);
                }
                int qubit = resolveLabel(qc, label, sourceName, line);
                controls.add(negative ? Control.neg(qubit) : Control.pos(qubit));
            }
            if (ncontrols >= labels.length) {
                throw new CircuitParseException("Too few variables (no target) for gate " + identifier, sourceName, line);
            }
            int target = resolveLabel(qc, labels[ncontrols], sourceName, line);

            qc.updateMaxControls(ncontrols);
            emit(qc, gate, controls, target, lambda, sourceName, line);
        }
    }

    private static void emit(QuantumComputation qc, OpType gate, List<Control> controls, int target,
                             double lambda, String sourceName, int line) {
        int n = qc.getNqubits();
        switch (gate) {
            case I:
            case H:
            case Y:
            case Z:
            case S:
            case SDAG:
            case T:
            case TDAG:
            case V:
            case VDAG:
            case U3:
            case U2:
                qc.emplaceBack(new StandardOperation(n, controls, target, gate, lambda));
                break;
            case X:
                qc.emplaceBack(new StandardOperation(n, controls, target));
                break;
            case RX:
            case RY:
                qc.emplaceBack(new StandardOperation(n, controls, target, gate, Math.PI / lambda));
                break;
            case RZ:
            case U1: {
                double x = Math.rint(lambda);
                if (Math.abs(lambda - x) < TOLERANCE) {
                    if (x == 1.0 || x == -1.0) {
                        qc.emplaceBack(new StandardOperation(n, controls, target, OpType.Z));
                    } else if (x == 2.0) {
                        qc.emplaceBack(new StandardOperation(n, controls, target, OpType.S));
                    } else if (x == -2.0) {
                        qc.emplaceBack(new StandardOperation(n, controls, target, OpType.SDAG));
                    } else if (x == 4.0) {
                        qc.emplaceBack(new StandardOperation(n, controls, target, OpType.T));
                    } else if (x == -4.0) {
                        qc.emplaceBack(new StandardOperation(n, controls, target, OpType.TDAG));
                    } else {
                        qc.emplaceBack(new StandardOperation(n, controls, target, gate, Math.PI / x));
                    }
                } else {
                    qc.emplaceBack(new StandardOperation(n, controls, target, gate, Math.PI / lambda));
                }
                break;
            }
            case SWAP:
            case P:
            case PDAG: {
                if (controls.isEmpty()) {
                    throw new CircuitParseException("Gate " + gate + " requires two targets", sourceName, line);
                }
                List<Control> remaining = new ArrayList<>(controls.subList(0, controls.size() - 1));
                int target1 = controls.get(controls.size() - 1).qubit();
                qc.emplaceBack(new StandardOperation(n, remaining, target, target1, gate, 0, 0, 0));
                break;
            }
            default:
                throw new CircuitParseException("'" + gate + "' operation detected", sourceName, line);
        }
    }

    private static OpType gateFor(String identifier, String sourceName, int line) {
        // 't' is the Toffoli family in this format
        if ("t".equals(identifier)) {
            return OpType.X;
        }
        OpType gate = IDENTIFIERS.get(identifier);
        if (gate == null) {
            throw new CircuitParseException("Unknown gate identifier: " + identifier, sourceName, line);
        }
        return gate;
    }

    private static int resolveLabel(QuantumComputation qc, String label, String sourceName, int line) {
        return qc.getQubitRegisters().get(label)
                .orElseThrow(() -> new CircuitParseException("Label " + label + " not found!", sourceName, line))
                .start();
    }

    private static int parseCount(String word, String sourceName, int line) {
        try {
            return Integer.parseInt(word);
        } catch (NumberFormatException e) {
            throw new CircuitParseException("Invalid number: " + word, sourceName, line);
        }
    }
}
