package org.qcircuit.dd;

/**
 * Opaque handle to a decision-diagram edge owned by a {@link DecisionDiagramPackage}.
 * <p>
 * Edges are reference counted by their package. Code that keeps an edge alive across a
 * garbage collection must retain it, see {@link RetainedEdge}.
 */
public interface Edge {
}
