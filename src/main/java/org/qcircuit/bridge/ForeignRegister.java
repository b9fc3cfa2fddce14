package org.qcircuit.bridge;

/**
 * A register declared by a foreign circuit.
 *
 * @param name The register name.
 * @param size The number of bits.
 */
public record ForeignRegister(String name, int size) {}
