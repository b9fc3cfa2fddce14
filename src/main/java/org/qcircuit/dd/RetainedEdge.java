package org.qcircuit.dd;

/**
 * Scoped ownership of one reference on a decision-diagram edge.
 * <p>
 * {@link #retain(DecisionDiagramPackage, Edge)} increments the reference count,
 * {@link #close()} decrements it exactly once. {@link #detach()} hands the reference over to
 * the caller, after which closing is a no-op. Used with try/finally this guarantees release on
 * every exit path.
 */
public final class RetainedEdge implements AutoCloseable {

    private final DecisionDiagramPackage dd;
    private final Edge edge;
    private boolean owned = true;

    private RetainedEdge(DecisionDiagramPackage dd, Edge edge) {
        this.dd = dd;
        this.edge = edge;
    }

    /**
     * Retains an edge.
     * @param dd The package owning the edge.
     * @param edge The edge to retain.
     * @return The handle owning the new reference.
     */
    public static RetainedEdge retain(DecisionDiagramPackage dd, Edge edge) {
        dd.incRef(edge);
        return new RetainedEdge(dd, edge);
    }

    public Edge edge() {
        return edge;
    }

    /**
     * Transfers the reference to the caller.
     * @return The still retained edge.
     * @throws IllegalStateException if the reference was already released or detached.
     */
    public Edge detach() {
        if (!owned) {
            throw new IllegalStateException("Edge reference already released");
        }
        owned = false;
        return edge;
    }

    @Override
    public void close() {
        if (owned) {
            owned = false;
            dd.decRef(edge);
        }
    }
}
