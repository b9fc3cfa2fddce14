package org.qcircuit.frontend.qasm;

import org.qcircuit.circuit.CircuitException;
import org.qcircuit.circuit.CircuitParseException;
import org.qcircuit.circuit.QuantumComputation;
import org.qcircuit.circuit.Register;
import org.qcircuit.circuit.RegisterMap;
import org.qcircuit.frontend.io.SourceLoader;
import org.qcircuit.operations.CompoundOperation;
import org.qcircuit.operations.Control;
import org.qcircuit.operations.NonUnitaryOperation;
import org.qcircuit.operations.Operation;
import org.qcircuit.operations.StandardOperation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Statement-level parser for OpenQASM 2.0.
 * <p>
 * The parser owns the token stream and the gate definitions; the register tables are read
 * from the {@link QuantumComputation} being populated, so declarations made by the importer are
 * visible immediately. {@link #qop()} builds the operation of one gate application, measurement
 * or reset statement for the circuit's current width.
 */
public class QasmParser {

    private static final Logger LOG = LoggerFactory.getLogger(QasmParser.class);

    /**
     * A resolved register argument.
     *
     * @param start The global index of the first bit.
     * @param size  1 for an indexed bit, the register size for a whole register.
     */
    public record Argument(int start, int size) {}

    private final List<Token> tokens;
    private final QuantumComputation qc;
    private final Path baseDir;
    private final Map<String, GateDefinition> gates = new HashMap<>();
    private final Set<String> includedFiles = new HashSet<>();
    private int current = 0;

    /**
     * @param tokens The tokens of the main source, ending with END_OF_FILE.
     * @param qc The circuit whose registers arguments are resolved against.
     * @param sourceName The logical name of the main source.
     * @param baseDir The directory includes are resolved against, may be null.
     */
    public QasmParser(List<Token> tokens, QuantumComputation qc, String sourceName, Path baseDir) {
        this.tokens = new ArrayList<>(tokens);
        this.qc = qc;
        this.baseDir = baseDir;
        this.includedFiles.add(sourceName);
    }

    // --- Statements ---

    /**
     * @return true if the current token starts a statement {@link #qop()} can build.
     */
    public boolean atQop() {
        return check(TokenType.UGATE) || check(TokenType.CXGATE) || check(TokenType.IDENTIFIER)
                || check(TokenType.MEASURE) || check(TokenType.RESET);
    }

    /**
     * Parses a gate application, measurement or reset statement including its semicolon.
     *
     * @return The operation, or empty if a gate with an empty body was applied.
     * @throws CircuitParseException on any grammar or semantic violation.
     */
    public Optional<Operation> qop() {
        Token start = peek();
        switch (start.type()) {
            case UGATE: {
                advance();
                consume(TokenType.LPAREN, "Expected '(' after U");
                List<Double> parameters = evaluateAll(expressionList(Set.of()), start);
                consume(TokenType.RPAREN, "Expected ')' after U parameters");
                List<Argument> arguments = List.of(argument());
                consume(TokenType.SEMICOLON, "Expected ';' after U statement");
                return applyStandard(StandardGates.lookup("u3").orElseThrow(), parameters, arguments, start);
            }
            case CXGATE: {
                advance();
                List<Argument> arguments = argList();
                consume(TokenType.SEMICOLON, "Expected ';' after CX statement");
                return applyStandard(StandardGates.lookup("cx").orElseThrow(), List.of(), arguments, start);
            }
            case IDENTIFIER: {
                advance();
                List<Double> parameters = List.of();
                if (match(TokenType.LPAREN)) {
                    if (!check(TokenType.RPAREN)) {
                        parameters = evaluateAll(expressionList(Set.of()), start);
                    }
                    consume(TokenType.RPAREN, "Expected ')' after gate parameters");
                }
                List<Argument> arguments = argList();
                consume(TokenType.SEMICOLON, "Expected ';' after gate statement");
                return applyGate(start.text(), parameters, arguments, start);
            }
            case MEASURE: {
                advance();
                Argument qubits = argument();
                consume(TokenType.ARROW, "Expected '->' in measure statement");
                Argument bits = classicalArgument();
                consume(TokenType.SEMICOLON, "Expected ';' after measure statement");
                if (qubits.size() != bits.size()) {
                    throw error(start, "Mismatch of qubit and classical bit register sizes in measurement");
                }
                return Optional.of(NonUnitaryOperation.measure(qc.getNqubits(), range(qubits), range(bits)));
            }
            case RESET: {
                advance();
                Argument qubits = argument();
                consume(TokenType.SEMICOLON, "Expected ';' after reset statement");
                return Optional.of(NonUnitaryOperation.reset(qc.getNqubits(), range(qubits)));
            }
            default:
                throw error(start, "Expected a gate, measure or reset statement but found '" + start.text() + "'");
        }
    }

    /**
     * Parses {@code gate name[(params)] args { body }} and registers the definition.
     */
    public void gateDecl() {
        consume(TokenType.GATE, "Expected 'gate'");
        Token name = consume(TokenType.IDENTIFIER, "Expected gate name");
        List<String> parameters = List.of();
        if (match(TokenType.LPAREN)) {
            if (!check(TokenType.RPAREN)) {
                parameters = idList();
            }
            consume(TokenType.RPAREN, "Expected ')' after gate parameters");
        }
        List<String> arguments = idList();
        consume(TokenType.LBRACE, "Expected '{' to open gate body");

        Set<String> parameterScope = Set.copyOf(parameters);
        Set<String> argumentScope = Set.copyOf(arguments);
        List<GateDefinition.GateCall> body = new ArrayList<>();
        while (!check(TokenType.RBRACE)) {
            if (isAtEnd()) {
                throw error(peek(), "Unterminated body of gate '" + name.text() + "'");
            }
            Token start = peek();
            if (match(TokenType.BARRIER)) {
                checkArguments(idList(), argumentScope, start);
                consume(TokenType.SEMICOLON, "Expected ';' after barrier");
                continue;
            }
            GateDefinition.GateCall call = gateCall(parameterScope);
            checkArguments(call.arguments(), argumentScope, start);
            checkCallee(call, start);
            body.add(call);
        }
        consume(TokenType.RBRACE, "Expected '}' to close gate body");
        define(new GateDefinition(name.text(), parameters, arguments, List.copyOf(body), false));
    }

    /**
     * Parses {@code opaque name[(params)] args;} and registers the gate as not expandable.
     */
    public void opaqueGateDecl() {
        consume(TokenType.OPAQUE, "Expected 'opaque'");
        Token name = consume(TokenType.IDENTIFIER, "Expected gate name");
        List<String> parameters = List.of();
        if (match(TokenType.LPAREN)) {
            if (!check(TokenType.RPAREN)) {
                parameters = idList();
            }
            consume(TokenType.RPAREN, "Expected ')' after gate parameters");
        }
        List<String> arguments = idList();
        consume(TokenType.SEMICOLON, "Expected ';' after opaque declaration");
        define(new GateDefinition(name.text(), parameters, arguments, List.of(), true));
    }

    /**
     * Loads an included file and splices its tokens at the current position. Files already
     * part of the stream are skipped.
     *
     * @param pathValue The path as written in the include statement.
     * @param at The include token, for resolving relative paths.
     * @throws org.qcircuit.circuit.CircuitFileException if the file cannot be read.
     */
    public void includeFile(String pathValue, Token at) {
        Path path = SourceLoader.resolveInclude(pathValue, at.fileName(), baseDir);
        SourceLoader.LoadResult loaded = SourceLoader.loadFile(path);
        if (includedFiles.contains(loaded.logicalName())) {
            LOG.debug("Skipping repeated include of {}", loaded.logicalName());
            return;
        }
        includedFiles.add(loaded.logicalName());
        injectTokens(new Lexer(loaded.content(), loaded.logicalName()).scanTokens());
    }

    /**
     * Skips tokens up to and including the next semicolon.
     */
    public void skipStatement() {
        while (!isAtEnd() && !check(TokenType.SEMICOLON)) {
            advance();
        }
        match(TokenType.SEMICOLON);
    }

    public Map<String, GateDefinition> getGateDefinitions() {
        return Map.copyOf(gates);
    }

    // --- Arguments ---

    /**
     * Parses a comma separated list of qubit arguments.
     * @return The resolved arguments in order.
     */
    public List<Argument> argList() {
        List<Argument> arguments = new ArrayList<>();
        arguments.add(argument());
        while (match(TokenType.COMMA)) {
            arguments.add(argument());
        }
        return arguments;
    }

    /**
     * Parses {@code reg} or {@code reg[i]} against the qubit registers.
     */
    public Argument argument() {
        return resolve(qc.getQubitRegisters(), "qubit");
    }

    /**
     * Parses {@code reg} or {@code reg[i]} against the classical registers.
     */
    public Argument classicalArgument() {
        return resolve(qc.getClassicalRegisters(), "classical");
    }

    private Argument resolve(RegisterMap registers, String kind) {
        Token name = consume(TokenType.IDENTIFIER, "Expected " + kind + " register name");
        Register register = registers.get(name.text())
                .orElseThrow(() -> error(name, "Unknown " + kind + " register '" + name.text() + "'"));
        if (match(TokenType.LBRACKET)) {
            Token index = consume(TokenType.NNINTEGER, "Expected index");
            consume(TokenType.RBRACKET, "Expected ']' after index");
            int offset = (Integer) index.value();
            if (offset >= register.size()) {
                throw error(index, "Index " + offset + " out of range for " + kind + " register "
                        + name.text() + "[" + register.size() + "]");
            }
            return new Argument(register.start() + offset, 1);
        }
        return new Argument(register.start(), register.size());
    }

    private List<String> idList() {
        List<String> ids = new ArrayList<>();
        ids.add(consume(TokenType.IDENTIFIER, "Expected identifier").text());
        while (match(TokenType.COMMA)) {
            ids.add(consume(TokenType.IDENTIFIER, "Expected identifier").text());
        }
        return ids;
    }

    private static List<Integer> range(Argument argument) {
        List<Integer> indices = new ArrayList<>(argument.size());
        for (int i = 0; i < argument.size(); i++) {
            indices.add(argument.start() + i);
        }
        return indices;
    }

    // --- Expressions ---

    /**
     * Parses a comma separated list of expressions.
     * @param parameters The gate parameters that may be referenced.
     */
    public List<Expression> expressionList(Set<String> parameters) {
        List<Expression> expressions = new ArrayList<>();
        expressions.add(expression(parameters));
        while (match(TokenType.COMMA)) {
            expressions.add(expression(parameters));
        }
        return expressions;
    }

    /**
     * Parses an expression with the usual precedence; {@code ^} binds tightest and is right
     * associative.
     * @param parameters The gate parameters that may be referenced.
     */
    public Expression expression(Set<String> parameters) {
        Expression left = term(parameters);
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            TokenType operator = previous().type();
            left = new Expression.Binary(operator, left, term(parameters));
        }
        return left;
    }

    private Expression term(Set<String> parameters) {
        Expression left = power(parameters);
        while (match(TokenType.TIMES, TokenType.DIVIDE)) {
            TokenType operator = previous().type();
            left = new Expression.Binary(operator, left, power(parameters));
        }
        return left;
    }

    private Expression power(Set<String> parameters) {
        Expression base = unary(parameters);
        if (match(TokenType.POWER)) {
            return new Expression.Binary(TokenType.POWER, base, power(parameters));
        }
        return base;
    }

    private Expression unary(Set<String> parameters) {
        if (match(TokenType.MINUS)) {
            return new Expression.Negation(unary(parameters));
        }
        if (match(TokenType.PLUS)) {
            return unary(parameters);
        }
        return primary(parameters);
    }

    private Expression primary(Set<String> parameters) {
        Token token = advance();
        switch (token.type()) {
            case REAL:
                return new Expression.Constant((Double) token.value());
            case NNINTEGER:
                return new Expression.Constant((Integer) token.value());
            case PI:
                return new Expression.Constant(Math.PI);
            case IDENTIFIER:
                if (!parameters.contains(token.text())) {
                    throw error(token, "Unknown parameter '" + token.text() + "'");
                }
                return new Expression.Parameter(token.text());
            case SIN:
            case COS:
            case TAN:
            case EXP:
            case LN:
            case SQRT: {
                consume(TokenType.LPAREN, "Expected '(' after " + token.text());
                Expression argument = expression(parameters);
                consume(TokenType.RPAREN, "Expected ')' after argument of " + token.text());
                return new Expression.Function(token.type(), argument);
            }
            case LPAREN: {
                Expression inner = expression(parameters);
                consume(TokenType.RPAREN, "Expected ')'");
                return inner;
            }
            default:
                throw error(token, "Expected expression but found '" + token.text() + "'");
        }
    }

    private List<Double> evaluateAll(List<Expression> expressions, Token at) {
        return evaluateAll(expressions, Map.of(), at.fileName(), at.line());
    }

    private static List<Double> evaluateAll(List<Expression> expressions, Map<String, Double> scope,
                                            String sourceName, int line) {
        List<Double> values = new ArrayList<>(expressions.size());
        for (Expression expression : expressions) {
            try {
                values.add(expression.evaluate(scope));
            } catch (CircuitException e) {
                throw new CircuitParseException(e.getMessage(), sourceName, line);
            }
        }
        return values;
    }

    // --- Gate definitions and expansion ---

    private GateDefinition.GateCall gateCall(Set<String> parameterScope) {
        Token start = peek();
        if (match(TokenType.UGATE)) {
            consume(TokenType.LPAREN, "Expected '(' after U");
            List<Expression> parameters = expressionList(parameterScope);
            consume(TokenType.RPAREN, "Expected ')' after U parameters");
            List<String> arguments = idList();
            consume(TokenType.SEMICOLON, "Expected ';' after U statement");
            return new GateDefinition.GateCall("U", parameters, arguments, start.line());
        }
        if (match(TokenType.CXGATE)) {
            List<String> arguments = idList();
            consume(TokenType.SEMICOLON, "Expected ';' after CX statement");
            return new GateDefinition.GateCall("CX", List.of(), arguments, start.line());
        }
        Token name = consume(TokenType.IDENTIFIER, "Expected gate statement in gate body");
        List<Expression> parameters = List.of();
        if (match(TokenType.LPAREN)) {
            if (!check(TokenType.RPAREN)) {
                parameters = expressionList(parameterScope);
            }
            consume(TokenType.RPAREN, "Expected ')' after gate parameters");
        }
        List<String> arguments = idList();
        consume(TokenType.SEMICOLON, "Expected ';' after gate statement");
        return new GateDefinition.GateCall(name.text(), parameters, arguments, start.line());
    }

    private void checkArguments(List<String> used, Set<String> scope, Token at) {
        for (String argument : used) {
            if (!scope.contains(argument)) {
                throw error(at, "Unknown gate argument '" + argument + "'");
            }
        }
    }

    private void checkCallee(GateDefinition.GateCall call, Token at) {
        int parameters;
        int arity;
        GateDefinition definition = gates.get(call.name());
        if ("U".equals(call.name())) {
            parameters = 3;
            arity = 1;
        } else if ("CX".equals(call.name())) {
            parameters = 0;
            arity = 2;
        } else if (definition != null) {
            parameters = definition.parameters().size();
            arity = definition.arguments().size();
        } else {
            StandardGates.Signature signature = StandardGates.lookup(call.name())
                    .orElseThrow(() -> error(at, "Undefined gate '" + call.name() + "'"));
            parameters = signature.parameters();
            arity = signature.arity();
        }
        if (call.parameters().size() != parameters) {
            throw error(at, "Gate '" + call.name() + "' expects " + parameters + " parameters but got "
                    + call.parameters().size());
        }
        if (call.arguments().size() != arity) {
            throw error(at, "Gate '" + call.name() + "' expects " + arity + " arguments but got "
                    + call.arguments().size());
        }
    }

    private void define(GateDefinition definition) {
        if (gates.put(definition.name(), definition) != null) {
            LOG.debug("Gate '{}' redefined", definition.name());
        }
    }

    private Optional<Operation> applyGate(String name, List<Double> parameters, List<Argument> arguments, Token at) {
        GateDefinition definition = gates.get(name);
        if (definition == null) {
            StandardGates.Signature signature = StandardGates.lookup(name)
                    .orElseThrow(() -> error(at, "Undefined gate '" + name + "'"));
            return applyStandard(signature, parameters, arguments, at);
        }
        if (definition.opaque()) {
            throw error(at, "Opaque gate '" + name + "' cannot be applied");
        }
        checkCounts(name, definition.parameters().size(), definition.arguments().size(), parameters, arguments, at);
        return broadcast(arguments, at, qubits -> expand(definition, parameters, qubits, at.fileName()));
    }

    private Optional<Operation> applyStandard(StandardGates.Signature signature, List<Double> parameters,
                                              List<Argument> arguments, Token at) {
        checkCounts(signature.type().shortName(), signature.parameters(), signature.arity(), parameters, arguments, at);
        return broadcast(arguments, at, qubits -> List.of(standardOperation(signature, parameters, qubits)));
    }

    private void checkCounts(String name, int expectedParameters, int expectedArguments,
                             List<Double> parameters, List<Argument> arguments, Token at) {
        if (parameters.size() != expectedParameters) {
            throw error(at, "Gate '" + name + "' expects " + expectedParameters + " parameters but got " + parameters.size());
        }
        if (arguments.size() != expectedArguments) {
            throw error(at, "Gate '" + name + "' expects " + expectedArguments + " arguments but got " + arguments.size());
        }
    }

    /**
     * Applies a gate to every index of the register arguments. Single bit arguments take part in
     * every application; all register arguments must have the same size.
     */
    private Optional<Operation> broadcast(List<Argument> arguments, Token at,
                                          Function<List<Integer>, List<Operation>> application) {
        int width = 1;
        for (Argument argument : arguments) {
            if (argument.size() > 1) {
                if (width > 1 && width != argument.size()) {
                    throw error(at, "Registers of different sizes in gate arguments");
                }
                width = argument.size();
            }
        }
        List<Operation> operations = new ArrayList<>();
        for (int i = 0; i < width; i++) {
            List<Integer> qubits = new ArrayList<>(arguments.size());
            for (Argument argument : arguments) {
                int qubit = argument.size() == 1 ? argument.start() : argument.start() + i;
                if (qubits.contains(qubit)) {
                    throw error(at, "Qubit " + qubit + " used twice in one gate application");
                }
                qubits.add(qubit);
            }
            operations.addAll(application.apply(qubits));
        }
        if (operations.isEmpty()) {
            return Optional.empty();
        }
        if (operations.size() == 1) {
            return Optional.of(operations.get(0));
        }
        return Optional.of(new CompoundOperation(qc.getNqubits(), operations));
    }

    private List<Operation> expand(GateDefinition definition, List<Double> parameters, List<Integer> qubits,
                                   String sourceName) {
        Map<String, Double> parameterScope = new HashMap<>();
        for (int i = 0; i < parameters.size(); i++) {
            parameterScope.put(definition.parameters().get(i), parameters.get(i));
        }
        Map<String, Integer> argumentScope = new HashMap<>();
        for (int i = 0; i < qubits.size(); i++) {
            argumentScope.put(definition.arguments().get(i), qubits.get(i));
        }

        List<Operation> operations = new ArrayList<>();
        for (GateDefinition.GateCall call : definition.body()) {
            List<Double> values = evaluateAll(call.parameters(), parameterScope, sourceName, call.line());
            List<Integer> callQubits = new ArrayList<>(call.arguments().size());
            for (String argument : call.arguments()) {
                callQubits.add(argumentScope.get(argument));
            }
            if (Set.copyOf(callQubits).size() != callQubits.size()) {
                throw new CircuitParseException("Qubit used twice in call of '" + call.name() + "' inside gate '"
                        + definition.name() + "'", sourceName, call.line());
            }
            operations.addAll(expandCall(call, values, callQubits, sourceName));
        }
        return operations;
    }

    private List<Operation> expandCall(GateDefinition.GateCall call, List<Double> parameters, List<Integer> qubits,
                                       String sourceName) {
        String name = call.name();
        if ("U".equals(name)) {
            return List.of(standardOperation(StandardGates.lookup("u3").orElseThrow(), parameters, qubits));
        }
        if ("CX".equals(name)) {
            return List.of(standardOperation(StandardGates.lookup("cx").orElseThrow(), parameters, qubits));
        }
        GateDefinition definition = gates.get(name);
        if (definition != null) {
            if (definition.opaque()) {
                throw new CircuitParseException("Opaque gate '" + name + "' cannot be applied", sourceName, call.line());
            }
            if (definition.parameters().size() != parameters.size() || definition.arguments().size() != qubits.size()) {
                throw new CircuitParseException("Gate '" + name + "' was redefined with a different signature",
                        sourceName, call.line());
            }
            return expand(definition, parameters, qubits, sourceName);
        }
        StandardGates.Signature signature = StandardGates.lookup(name)
                .orElseThrow(() -> new CircuitParseException("Undefined gate '" + name + "'", sourceName, call.line()));
        return List.of(standardOperation(signature, parameters, qubits));
    }

    private Operation standardOperation(StandardGates.Signature signature, List<Double> parameters, List<Integer> qubits) {
        double lambda = 0;
        double phi = 0;
        double theta = 0;
        switch (parameters.size()) {
            case 1:
                lambda = parameters.get(0);
                break;
            case 2:
                phi = parameters.get(0);
                lambda = parameters.get(1);
                break;
            case 3:
                theta = parameters.get(0);
                phi = parameters.get(1);
                lambda = parameters.get(2);
                break;
            default:
                break;
        }
        List<Control> controls = new ArrayList<>(signature.controls());
        for (int i = 0; i < signature.controls(); i++) {
            controls.add(Control.pos(qubits.get(i)));
        }
        int target = qubits.get(signature.controls());
        if (signature.targets() == 2) {
            return new StandardOperation(qc.getNqubits(), controls, target, qubits.get(signature.controls() + 1),
                    signature.type(), lambda, phi, theta);
        }
        return new StandardOperation(qc.getNqubits(), controls, target, signature.type(), lambda, phi, theta);
    }

    // --- Token stream navigation ---

    /**
     * Checks if the current token matches any of the given types. If so, consumes it.
     * @param types The token types to match.
     * @return true if the current token matches one of the types, false otherwise.
     */
    public boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    /**
     * Checks if the current token is of the given type without consuming it.
     */
    public boolean check(TokenType type) {
        if (isAtEnd()) {
            return type == TokenType.END_OF_FILE;
        }
        return peek().type() == type;
    }

    /**
     * Consumes the current token and returns it.
     */
    public Token advance() {
        if (!isAtEnd()) {
            current++;
        }
        return previous();
    }

    public Token peek() {
        return tokens.get(current);
    }

    /**
     * @return The previously consumed token, or null at the start of the stream.
     */
    public Token previous() {
        if (current == 0) {
            return null;
        }
        return tokens.get(current - 1);
    }

    /**
     * Consumes the current token if it is of the expected type.
     * @param type The expected token type.
     * @param errorMessage The message of the exception if the type does not match.
     * @return The consumed token.
     * @throws CircuitParseException if the current token does not match the expected type.
     */
    public Token consume(TokenType type, String errorMessage) {
        if (check(type)) {
            return advance();
        }
        Token unexpected = peek();
        throw error(unexpected, errorMessage + " but found '" + unexpected.text() + "'");
    }

    public boolean isAtEnd() {
        return current >= tokens.size() || tokens.get(current).type() == TokenType.END_OF_FILE;
    }

    /**
     * Injects tokens into the stream at the current position. A trailing END_OF_FILE token of
     * the injected list is dropped.
     * @param newTokens The tokens to inject.
     */
    public void injectTokens(List<Token> newTokens) {
        List<Token> injected = new ArrayList<>(newTokens);
        if (!injected.isEmpty() && injected.get(injected.size() - 1).type() == TokenType.END_OF_FILE) {
            injected.remove(injected.size() - 1);
        }
        tokens.addAll(current, injected);
    }

    private static CircuitParseException error(Token token, String message) {
        return new CircuitParseException(message, token.fileName(), token.line());
    }
}
