package org.qcircuit.frontend.qasm;

import org.qcircuit.circuit.CircuitException;

import java.util.Map;

/**
 * A parameter expression of an OpenQASM gate call. Expressions inside gate bodies may refer to
 * the gate's formal parameters; they are evaluated once per expansion.
 */
public sealed interface Expression {

    /**
     * @param parameters Values of the formal parameters in scope.
     * @return The value of the expression.
     * @throws CircuitException if a referenced parameter is not bound.
     */
    double evaluate(Map<String, Double> parameters);

    record Constant(double value) implements Expression {
        @Override
        public double evaluate(Map<String, Double> parameters) {
            return value;
        }
    }

    record Parameter(String name) implements Expression {
        @Override
        public double evaluate(Map<String, Double> parameters) {
            Double value = parameters.get(name);
            if (value == null) {
                throw new CircuitException("Unbound parameter '" + name + "'");
            }
            return value;
        }
    }

    record Negation(Expression operand) implements Expression {
        @Override
        public double evaluate(Map<String, Double> parameters) {
            return -operand.evaluate(parameters);
        }
    }

    record Binary(TokenType operator, Expression left, Expression right) implements Expression {
        @Override
        public double evaluate(Map<String, Double> parameters) {
            double l = left.evaluate(parameters);
            double r = right.evaluate(parameters);
            switch (operator) {
                case PLUS:
                    return l + r;
                case MINUS:
                    return l - r;
                case TIMES:
                    return l * r;
                case DIVIDE:
                    return l / r;
                case POWER:
                    return Math.pow(l, r);
                default:
                    throw new IllegalStateException("Not a binary operator: " + operator);
            }
        }
    }

    record Function(TokenType function, Expression argument) implements Expression {
        @Override
        public double evaluate(Map<String, Double> parameters) {
            double x = argument.evaluate(parameters);
            switch (function) {
                case SIN:
                    return Math.sin(x);
                case COS:
                    return Math.cos(x);
                case TAN:
                    return Math.tan(x);
                case EXP:
                    return Math.exp(x);
                case LN:
                    return Math.log(x);
                case SQRT:
                    return Math.sqrt(x);
                default:
                    throw new IllegalStateException("Not a unary function: " + function);
            }
        }
    }
}
