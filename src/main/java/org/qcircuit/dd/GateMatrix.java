package org.qcircuit.dd;

import org.qcircuit.operations.OpType;

/**
 * The 2x2 matrix of a single-qubit gate, row major.
 */
public record GateMatrix(Complex a00, Complex a01, Complex a10, Complex a11) {

    private static final double SQRT_2_INV = 1.0 / Math.sqrt(2.0);

    public static final GateMatrix IDENTITY = new GateMatrix(Complex.ONE, Complex.ZERO, Complex.ZERO, Complex.ONE);
    public static final GateMatrix HADAMARD = new GateMatrix(
            new Complex(SQRT_2_INV, 0), new Complex(SQRT_2_INV, 0),
            new Complex(SQRT_2_INV, 0), new Complex(-SQRT_2_INV, 0));
    public static final GateMatrix PAULI_X = new GateMatrix(Complex.ZERO, Complex.ONE, Complex.ONE, Complex.ZERO);
    public static final GateMatrix PAULI_Y = new GateMatrix(Complex.ZERO, new Complex(0, -1), Complex.I, Complex.ZERO);
    public static final GateMatrix PAULI_Z = diagonal(Math.PI);

    /**
     * Returns the matrix of a single-target gate.
     *
     * @param type The gate kind. Two-target and non-unitary kinds have no 2x2 matrix.
     * @param lambda The lambda parameter (the angle of rotations and phase gates).
     * @param phi The phi parameter.
     * @param theta The theta parameter.
     * @return The gate matrix.
     * @throws IllegalArgumentException if {@code type} has no single-target matrix.
     */
    public static GateMatrix of(OpType type, double lambda, double phi, double theta) {
        switch (type) {
            case I: return IDENTITY;
            case H: return HADAMARD;
            case X: return PAULI_X;
            case Y: return PAULI_Y;
            case Z: return PAULI_Z;
            case S: return diagonal(Math.PI / 2);
            case SDAG: return diagonal(-Math.PI / 2);
            case T: return diagonal(Math.PI / 4);
            case TDAG: return diagonal(-Math.PI / 4);
            case V: return new GateMatrix(
                    new Complex(SQRT_2_INV, 0), new Complex(0, -SQRT_2_INV),
                    new Complex(0, -SQRT_2_INV), new Complex(SQRT_2_INV, 0));
            case VDAG: return new GateMatrix(
                    new Complex(SQRT_2_INV, 0), new Complex(0, SQRT_2_INV),
                    new Complex(0, SQRT_2_INV), new Complex(SQRT_2_INV, 0));
            case SX: return new GateMatrix(
                    new Complex(0.5, 0.5), new Complex(0.5, -0.5),
                    new Complex(0.5, -0.5), new Complex(0.5, 0.5));
            case SXDAG: return new GateMatrix(
                    new Complex(0.5, -0.5), new Complex(0.5, 0.5),
                    new Complex(0.5, 0.5), new Complex(0.5, -0.5));
            case U1:
            case PHASE: return diagonal(lambda);
            case U2: return new GateMatrix(
                    new Complex(SQRT_2_INV, 0), Complex.expI(lambda).scale(-SQRT_2_INV),
                    Complex.expI(phi).scale(SQRT_2_INV), Complex.expI(phi + lambda).scale(SQRT_2_INV));
            case U3: {
                double c = Math.cos(theta / 2);
                double s = Math.sin(theta / 2);
                return new GateMatrix(
                        new Complex(c, 0), Complex.expI(lambda).scale(-s),
                        Complex.expI(phi).scale(s), Complex.expI(phi + lambda).scale(c));
            }
            case RX: {
                double c = Math.cos(lambda / 2);
                double s = Math.sin(lambda / 2);
                return new GateMatrix(new Complex(c, 0), new Complex(0, -s), new Complex(0, -s), new Complex(c, 0));
            }
            case RY: {
                double c = Math.cos(lambda / 2);
                double s = Math.sin(lambda / 2);
                return new GateMatrix(new Complex(c, 0), new Complex(-s, 0), new Complex(s, 0), new Complex(c, 0));
            }
            case RZ: return new GateMatrix(Complex.expI(-lambda / 2), Complex.ZERO, Complex.ZERO, Complex.expI(lambda / 2));
            default:
                throw new IllegalArgumentException("No single-target matrix for gate " + type);
        }
    }

    private static GateMatrix diagonal(double phase) {
        return new GateMatrix(Complex.ONE, Complex.ZERO, Complex.ZERO, Complex.expI(phase));
    }

    /**
     * @param row 0 or 1.
     * @param col 0 or 1.
     * @return The entry at the given position.
     */
    public Complex get(int row, int col) {
        if (row == 0) {
            return col == 0 ? a00 : a01;
        }
        return col == 0 ? a10 : a11;
    }
}
