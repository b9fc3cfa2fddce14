package org.qcircuit.frontend.qasm;

import org.qcircuit.circuit.CircuitParseException;
import org.qcircuit.circuit.QuantumComputation;
import org.qcircuit.circuit.Register;
import org.qcircuit.diagnostics.DiagnosticsEngine;
import org.qcircuit.operations.ClassicControlledOperation;
import org.qcircuit.operations.NonUnitaryOperation;
import org.qcircuit.operations.Operation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Imports OpenQASM 2.0 sources.
 * <p>
 * Top-level statements are dispatched here: register declarations change the circuit's width,
 * everything that builds operations is delegated to the {@link QasmParser}. After the last
 * statement both permutations are reset to the identity.
 */
public class QasmImporter {

    private static final Logger LOG = LoggerFactory.getLogger(QasmImporter.class);

    /** The standard library include, whose gates are built in. */
    static final String STANDARD_LIBRARY = "qelib1.inc";

    private final DiagnosticsEngine diagnostics;

    public QasmImporter(DiagnosticsEngine diagnostics) {
        this.diagnostics = diagnostics;
    }

    /**
     * Parses an OpenQASM source into the given circuit.
     *
     * @param qc The circuit to populate, normally empty.
     * @param content The source text.
     * @param sourceName The logical name of the source.
     * @param baseDir The directory relative includes are resolved against, may be null.
     * @throws CircuitParseException on any grammar violation.
     */
    public void importSource(QuantumComputation qc, String content, String sourceName, Path baseDir) {
        QasmParser parser = new QasmParser(new Lexer(content, sourceName).scanTokens(), qc, sourceName, baseDir);

        parser.consume(TokenType.OPENQASM, "Expected 'OPENQASM' header");
        if (!parser.match(TokenType.REAL, TokenType.NNINTEGER)) {
            throw new CircuitParseException("Expected version after OPENQASM", sourceName, parser.peek().line());
        }
        parser.consume(TokenType.SEMICOLON, "Expected ';' after version");

        while (!parser.isAtEnd()) {
            statement(qc, parser);
        }

        qc.initializeIdentityPermutations();
        LOG.debug("Imported OpenQASM circuit '{}' with {} qubits and {} operations", sourceName, qc.getNqubits(), qc.size());
    }

    private void statement(QuantumComputation qc, QasmParser parser) {
        Token start = parser.peek();
        switch (start.type()) {
            case QREG: {
                parser.advance();
                Declaration declaration = declaration(parser);
                if (qc.getQubitRegisters().contains(declaration.name())) {
                    throw new CircuitParseException("Qubit register '" + declaration.name() + "' already declared",
                            start.fileName(), start.line());
                }
                int width = qc.getNqubits();
                qc.getQubitRegisters().put(declaration.name(), new Register(width, declaration.size()));
                qc.setNqubits(width + declaration.size());
                break;
            }
            case CREG: {
                parser.advance();
                Declaration declaration = declaration(parser);
                if (qc.getClassicalRegisters().contains(declaration.name())) {
                    throw new CircuitParseException("Classical register '" + declaration.name() + "' already declared",
                            start.fileName(), start.line());
                }
                int width = qc.getNclassics();
                qc.getClassicalRegisters().put(declaration.name(), new Register(width, declaration.size()));
                qc.setNclassics(width + declaration.size());
                break;
            }
            case UGATE:
            case CXGATE:
            case IDENTIFIER:
            case MEASURE:
            case RESET:
                parser.qop().ifPresent(qc::emplaceBack);
                break;
            case GATE:
                parser.gateDecl();
                break;
            case OPAQUE:
                parser.opaqueGateDecl();
                break;
            case INCLUDE: {
                parser.advance();
                Token path = parser.consume(TokenType.STRING, "Expected file name after include");
                parser.consume(TokenType.SEMICOLON, "Expected ';' after include");
                if (STANDARD_LIBRARY.equals(path.value())) {
                    LOG.debug("Standard library include is built in");
                } else {
                    parser.includeFile((String) path.value(), path);
                }
                break;
            }
            case BARRIER: {
                parser.advance();
                List<QasmParser.Argument> arguments = parser.argList();
                parser.consume(TokenType.SEMICOLON, "Expected ';' after barrier");
                qc.emplaceBack(NonUnitaryOperation.barrier(qc.getNqubits(), allQubits(arguments)));
                break;
            }
            case IF:
                classicControlled(qc, parser);
                break;
            case SNAPSHOT: {
                parser.advance();
                parser.consume(TokenType.LPAREN, "Expected '(' after snapshot");
                Token id = parser.consume(TokenType.NNINTEGER, "Expected snapshot number");
                parser.consume(TokenType.RPAREN, "Expected ')' after snapshot number");
                List<QasmParser.Argument> arguments = parser.argList();
                parser.consume(TokenType.SEMICOLON, "Expected ';' after snapshot");
                for (QasmParser.Argument argument : arguments) {
                    if (argument.size() != 1) {
                        diagnostics.reportError("Snapshot arguments must be qubits", start.fileName(), start.line());
                    }
                }
                qc.emplaceBack(NonUnitaryOperation.snapshot(qc.getNqubits(), firstQubits(arguments), (Integer) id.value()));
                break;
            }
            case PROBABILITIES:
                parser.advance();
                parser.consume(TokenType.SEMICOLON, "Expected ';' after " + start.text());
                qc.emplaceBack(NonUnitaryOperation.showProbabilities(qc.getNqubits()));
                break;
            default:
                throw new CircuitParseException("Unexpected statement: started with '" + start.text() + "'",
                        start.fileName(), start.line());
        }
    }

    /**
     * {@code if (creg == n) qop}. The condition refers to bit {@code creg.start + n}.
     */
    private void classicControlled(QuantumComputation qc, QasmParser parser) {
        Token start = parser.advance();
        parser.consume(TokenType.LPAREN, "Expected '(' after if");
        Token register = parser.consume(TokenType.IDENTIFIER, "Expected classical register in if");
        parser.consume(TokenType.EQUALS, "Expected '==' in if");
        Token value = parser.consume(TokenType.NNINTEGER, "Expected integer in if");
        parser.consume(TokenType.RPAREN, "Expected ')' after if condition");

        if (!parser.atQop()) {
            diagnostics.reportError("Unsupported statement '" + parser.peek().text() + "' in if",
                    start.fileName(), start.line());
            parser.skipStatement();
            return;
        }

        Optional<Register> creg = qc.getClassicalRegisters().get(register.text());
        Optional<Operation> operation = parser.qop();
        if (creg.isEmpty()) {
            diagnostics.reportError("Error in if statement: " + register.text() + " is not a creg",
                    start.fileName(), start.line());
            return;
        }
        operation.ifPresent(op -> qc.emplaceBack(
                new ClassicControlledOperation(op, register.text(), creg.get().start(), (Integer) value.value())));
    }

    private static Declaration declaration(QasmParser parser) {
        Token name = parser.consume(TokenType.IDENTIFIER, "Expected register name");
        parser.consume(TokenType.LBRACKET, "Expected '[' after register name");
        Token size = parser.consume(TokenType.NNINTEGER, "Expected register size");
        parser.consume(TokenType.RBRACKET, "Expected ']' after register size");
        parser.consume(TokenType.SEMICOLON, "Expected ';' after register declaration");
        return new Declaration(name.text(), (Integer) size.value());
    }

    private static List<Integer> firstQubits(List<QasmParser.Argument> arguments) {
        List<Integer> qubits = new ArrayList<>(arguments.size());
        for (QasmParser.Argument argument : arguments) {
            qubits.add(argument.start());
        }
        return qubits;
    }

    private static List<Integer> allQubits(List<QasmParser.Argument> arguments) {
        List<Integer> qubits = new ArrayList<>();
        for (QasmParser.Argument argument : arguments) {
            for (int i = 0; i < argument.size(); i++) {
                qubits.add(argument.start() + i);
            }
        }
        return qubits;
    }

    private record Declaration(String name, int size) {}
}
