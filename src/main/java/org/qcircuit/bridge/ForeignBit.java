package org.qcircuit.bridge;

/**
 * A qubit or classical bit of a foreign circuit, addressed by its register and offset.
 *
 * @param registerName The name of the register the bit belongs to.
 * @param index        The offset of the bit inside the register.
 */
public record ForeignBit(String registerName, int index) {}
