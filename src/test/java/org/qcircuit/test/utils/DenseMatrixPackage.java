package org.qcircuit.test.utils;

import org.qcircuit.dd.Complex;
import org.qcircuit.dd.DecisionDiagramPackage;
import org.qcircuit.dd.Edge;
import org.qcircuit.dd.GateMatrix;
import org.qcircuit.dd.LineBuffer;

import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Reference backend representing every edge by its dense matrix (a state as a single column).
 * Tracks reference counts and garbage collection calls so that tests can check the retain and
 * release protocol of the functionality builder. Only practical for a handful of qubits.
 */
public class DenseMatrixPackage implements DecisionDiagramPackage {

    private static final double TOLERANCE = 1e-9;

    private final Map<Edge, Integer> references = new IdentityHashMap<>();
    private final DenseEdge one = new DenseEdge(new Complex[][]{{Complex.ONE}});
    private int garbageCollections;
    private int normalizationSwitches;
    private boolean normalization;

    /**
     * An edge holding its matrix.
     */
    public static final class DenseEdge implements Edge {
        private final Complex[][] matrix;

        DenseEdge(Complex[][] matrix) {
            this.matrix = matrix;
        }

        public int rows() {
            return matrix.length;
        }

        public int columns() {
            return matrix[0].length;
        }

        public Complex get(int row, int column) {
            return matrix[row][column];
        }
    }

    @Override
    public Edge one() {
        return one;
    }

    @Override
    public Edge makeIdent(int nqubits) {
        int dim = 1 << nqubits;
        Complex[][] m = zeros(dim, dim);
        for (int i = 0; i < dim; i++) {
            m[i][i] = Complex.ONE;
        }
        return new DenseEdge(m);
    }

    @Override
    public Edge makeGateDD(GateMatrix matrix, int nqubits, LineBuffer line) {
        int dim = 1 << nqubits;
        int target = -1;
        for (int w = 0; w < nqubits; w++) {
            if (line.get(w) == LineBuffer.TARGET) {
                target = w;
            }
        }
        if (target < 0) {
            throw new IllegalStateException("No target wire set");
        }
        for (int w = nqubits; w < line.capacity(); w++) {
            if (line.get(w) != LineBuffer.UNUSED) {
                throw new IllegalStateException("Wire " + w + " beyond width " + nqubits + " carries a role");
            }
        }
        Complex[][] m = zeros(dim, dim);
        for (int column = 0; column < dim; column++) {
            if (!controlsSatisfied(column, nqubits, line)) {
                m[column][column] = Complex.ONE;
                continue;
            }
            int bit = (column >> target) & 1;
            for (int newBit = 0; newBit < 2; newBit++) {
                int row = (column & ~(1 << target)) | (newBit << target);
                m[row][column] = m[row][column].add(matrix.get(newBit, bit));
            }
        }
        return new DenseEdge(m);
    }

    private static boolean controlsSatisfied(int basis, int nqubits, LineBuffer line) {
        for (int w = 0; w < nqubits; w++) {
            int bit = (basis >> w) & 1;
            if (line.get(w) == LineBuffer.POSITIVE_CONTROL && bit != 1) {
                return false;
            }
            if (line.get(w) == LineBuffer.NEGATIVE_CONTROL && bit != 0) {
                return false;
            }
        }
        return true;
    }

    @Override
    public Edge multiply(Edge left, Edge right) {
        DenseEdge l = (DenseEdge) left;
        DenseEdge r = (DenseEdge) right;
        if (l.columns() != r.rows()) {
            throw new IllegalArgumentException("Dimension mismatch " + l.columns() + " vs " + r.rows());
        }
        Complex[][] m = zeros(l.rows(), r.columns());
        for (int i = 0; i < l.rows(); i++) {
            for (int j = 0; j < r.columns(); j++) {
                Complex sum = Complex.ZERO;
                for (int k = 0; k < l.columns(); k++) {
                    sum = sum.add(l.get(i, k).multiply(r.get(k, j)));
                }
                m[i][j] = sum;
            }
        }
        return new DenseEdge(m);
    }

    @Override
    public void incRef(Edge edge) {
        references.merge(edge, 1, Integer::sum);
    }

    @Override
    public void decRef(Edge edge) {
        Integer count = references.get(edge);
        if (count == null || count == 0) {
            throw new IllegalStateException("Releasing an edge that is not retained");
        }
        if (count == 1) {
            references.remove(edge);
        } else {
            references.put(edge, count - 1);
        }
    }

    @Override
    public void garbageCollect() {
        garbageCollections++;
    }

    @Override
    public void useMatrixNormalization(boolean enabled) {
        normalization = enabled;
        normalizationSwitches++;
    }

    @Override
    public boolean isTerminal(Edge edge) {
        return ((DenseEdge) edge).rows() == 1;
    }

    // --- Test inspection ---

    /**
     * @return The sum of all reference counts.
     */
    public int outstandingRefs() {
        int sum = 0;
        for (int count : references.values()) {
            sum += count;
        }
        return sum;
    }

    public int referencesOf(Edge edge) {
        return references.getOrDefault(edge, 0);
    }

    public int garbageCollections() {
        return garbageCollections;
    }

    public boolean isNormalizationEnabled() {
        return normalization;
    }

    public int normalizationSwitches() {
        return normalizationSwitches;
    }

    /**
     * @return The computational basis state {@code |basis>} over {@code nqubits} qubits.
     */
    public Edge basisState(int nqubits, int basis) {
        Complex[][] m = zeros(1 << nqubits, 1);
        m[basis][0] = Complex.ONE;
        return new DenseEdge(m);
    }

    /**
     * @return true if both edges hold the same matrix up to a small tolerance.
     */
    public static boolean approximatelyEqual(Edge a, Edge b) {
        DenseEdge x = (DenseEdge) a;
        DenseEdge y = (DenseEdge) b;
        if (x.rows() != y.rows() || x.columns() != y.columns()) {
            return false;
        }
        for (int i = 0; i < x.rows(); i++) {
            for (int j = 0; j < x.columns(); j++) {
                if (!x.get(i, j).approximatelyEquals(y.get(i, j), TOLERANCE)) {
                    return false;
                }
            }
        }
        return true;
    }

    private static Complex[][] zeros(int rows, int columns) {
        Complex[][] m = new Complex[rows][columns];
        for (Complex[] row : m) {
            java.util.Arrays.fill(row, Complex.ZERO);
        }
        return m;
    }
}
