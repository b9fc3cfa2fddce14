package org.qcircuit.operations;

/**
 * Kinds of operations a circuit can contain.
 */
public enum OpType {
    NONE("none", false),
    I("id", true),
    H("h", true),
    X("x", true),
    Y("y", true),
    Z("z", true),
    S("s", true),
    SDAG("sdg", true),
    T("t", true),
    TDAG("tdg", true),
    V("v", true),
    VDAG("vdg", true),
    SX("sx", true),
    SXDAG("sxdg", true),
    U3("u3", true),
    U2("u2", true),
    U1("u1", true),
    PHASE("p", true),
    RX("rx", true),
    RY("ry", true),
    RZ("rz", true),
    SWAP("swap", true),
    ISWAP("iswap", true),
    P("peres", true),
    PDAG("peresdg", true),
    MEASURE("measure", false),
    RESET("reset", false),
    BARRIER("barrier", false),
    SNAPSHOT("snapshot", false),
    SHOW_PROBABILITIES("show_probabilities", false);

    private final String shortName;
    private final boolean unitary;

    OpType(String shortName, boolean unitary) {
        this.shortName = shortName;
        this.unitary = unitary;
    }

    /**
     * @return The lower-case name used in OpenQASM and in circuit listings.
     */
    public String shortName() {
        return shortName;
    }

    public boolean isUnitary() {
        return unitary;
    }

    /**
     * @return true for the gate kinds acting on two targets.
     */
    public boolean isTwoTarget() {
        return this == SWAP || this == ISWAP || this == P || this == PDAG;
    }
}
