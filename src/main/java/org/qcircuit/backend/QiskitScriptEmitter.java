package org.qcircuit.backend;

import org.qcircuit.circuit.QuantumComputation;
import org.qcircuit.operations.Operation;

/**
 * Renders a circuit as a Python script for Qiskit.
 * <p>
 * All registers are fused into one qubit register and one classical register. Multi-controlled
 * gates with more than two controls need {@code maxControls - 2} ancillas, which are declared
 * as an extra register. The script decomposes the circuit and maps it onto a mock device chosen
 * by total qubit count, and writes {@code <base>_decomposed.qasm} and
 * {@code <base>_transpiled.qasm} when run.
 */
public class QiskitScriptEmitter {

    private final ExportSettings settings;

    public QiskitScriptEmitter(ExportSettings settings) {
        this.settings = settings;
    }

    /**
     * @param qc The circuit.
     * @return The number of qubits the script needs, ancillas included.
     */
    public static int totalQubits(QuantumComputation qc) {
        return qc.getNqubits() + Math.max(0, qc.getMaxControls() - 2);
    }

    /**
     * @param qc The circuit.
     * @return true if the circuit fits the configured maximum.
     */
    public boolean supports(QuantumComputation qc) {
        return totalQubits(qc) <= settings.qiskitMaxQubits();
    }

    /**
     * @param qc The circuit.
     * @param basePath The path the auxiliary output files are named after, without extension.
     * @return The script.
     * @throws IllegalArgumentException if the circuit exceeds the supported width.
     */
    public String emit(QuantumComputation qc, String basePath) {
        if (!supports(qc)) {
            throw new IllegalArgumentException("No more than " + settings.qiskitMaxQubits()
                    + " total qubits are currently supported");
        }
        String q = settings.qubitRegister();
        String c = settings.classicalRegister();
        String anc = settings.ancillaRegister();
        boolean ancillas = qc.getMaxControls() > 2;
        String device = settings.deviceFor(totalQubits(qc)).device();

        StringBuilder out = new StringBuilder();
        out.append("from qiskit import *\n");
        out.append("from qiskit.test.mock import ").append(device).append('\n');
        out.append("from qiskit.transpiler import PassManager, CouplingMap\n");
        out.append("from qiskit.converters import circuit_to_dag, dag_to_circuit\n");
        out.append("from qiskit.transpiler.passes import *\n");
        out.append("from math import pi\n\n");

        out.append(q).append(" = QuantumRegister(").append(qc.getNqubits()).append(", '").append(q).append("')\n");
        out.append(c).append(" = ClassicalRegister(").append(qc.getNclassics()).append(", '").append(c).append("')\n");
        if (ancillas) {
            out.append(anc).append(" = QuantumRegister(").append(qc.getMaxControls() - 2)
                    .append(", '").append(anc).append("')\n");
        }
        out.append("qc = QuantumCircuit(").append(q).append(", ").append(c);
        if (ancillas) {
            out.append(", ").append(anc);
        }
        out.append(")\n\n");

        RegisterNames qregs = RegisterNames.create(qc.getQubitRegisters(), qc.getNqubits(), q, true);
        RegisterNames cregs = RegisterNames.create(qc.getClassicalRegisters(), qc.getNclassics(), c, true);
        for (Operation op : qc.getOps()) {
            op.dumpQiskit(out, qregs, cregs, anc);
        }

        out.append("dag = circuit_to_dag(qc)\n\n");
        out.append("qc_decomposed = dag_to_circuit(Unroller(['id', 'u1', 'u2', 'u3', 'cx']).run(dag))\n\n");

        out.append("f = open(\"").append(basePath).append("_decomposed.qasm\", \"w\")\n");
        out.append("f.write(qc_decomposed.qasm())\n");
        out.append("f.close()\n\n");

        out.append("coupling_map = CouplingMap(").append(device).append("().configuration().coupling_map)\n");
        out.append("layout_pass = TrivialLayout(coupling_map)\n");
        out.append("layout_pass.run(dag)\n");
        out.append("pm = PassManager()\n");
        out.append("pm.append([TrivialLayout(coupling_map), FullAncillaAllocation(coupling_map), EnlargeWithAncilla(), "
                + "ApplyLayout(), StochasticSwap(coupling_map, trials=100, seed=420)])\n\n");
        out.append("qc_transpiled = pm.run(dag_to_circuit(dag))\n\n");
        out.append("layout = pm.property_set['layout']\n");

        out.append("f = open(\"").append(basePath).append("_transpiled.qasm\", \"w\")\n");
        out.append("f.write(\"// layout: physical qubit <- logical qubit\\n\")\n");
        if (ancillas) {
            out.append("for i in range(0, ").append(q).append(".size + ").append(anc).append(".size):\n");
        } else {
            out.append("for i in range(0, ").append(q).append(".size):\n");
        }
        out.append("\tf.write(\"// \" + str(i) + \" \")\n");
        if (ancillas) {
            out.append("\tif layout[i].register.name == '").append(q).append("':\n");
            out.append("\t\tf.write(str(layout[i].index))\n");
            out.append("\telse:\n");
            out.append("\t\tf.write(str(layout[i].index + layout[0].register.size))\n");
        } else {
            out.append("\tf.write(str(layout[i].index))\n");
        }
        out.append("\tf.write(\"\\n\")\n");
        out.append("f.write(\"\\n\")\n");
        out.append("f.write(qc_transpiled.qasm())\n");
        out.append("f.close()\n");
        return out.toString();
    }
}
