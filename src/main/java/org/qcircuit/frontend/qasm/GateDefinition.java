package org.qcircuit.frontend.qasm;

import java.util.List;

/**
 * A gate declared with {@code gate} or {@code opaque}.
 *
 * @param name       The gate name.
 * @param parameters The formal parameter names.
 * @param arguments  The formal qubit argument names.
 * @param body       The body statements in order; empty for opaque gates.
 * @param opaque     true if the gate was declared {@code opaque} and cannot be expanded.
 */
public record GateDefinition(String name, List<String> parameters, List<String> arguments,
                             List<GateCall> body, boolean opaque) {

    /**
     * A gate application inside a gate body.
     *
     * @param name       The called gate, {@code U} and {@code CX} for the built-ins.
     * @param parameters The actual parameter expressions.
     * @param arguments  The formal qubit arguments of the enclosing gate it is applied to.
     * @param line       The source line, for error messages.
     */
    public record GateCall(String name, List<Expression> parameters, List<String> arguments, int line) {}
}
