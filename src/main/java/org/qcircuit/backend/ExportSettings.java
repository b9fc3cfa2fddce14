package org.qcircuit.backend;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Settings of the exporters.
 *
 * @param qubitRegister     Name of the qubit register emitted when none is declared.
 * @param classicalRegister Name of the classical register emitted when none is declared.
 * @param ancillaRegister   Name of the ancilla register of Qiskit scripts.
 * @param qiskitMaxQubits   Largest total qubit count (including ancillas) a Qiskit script is emitted for.
 * @param deviceTiers       Mock devices of the Qiskit pipeline, ascending by size.
 */
public record ExportSettings(String qubitRegister, String classicalRegister, String ancillaRegister,
                             int qiskitMaxQubits, List<DeviceTier> deviceTiers) {

    /**
     * A mock device used for circuits of up to {@code maxQubits} qubits.
     *
     * @param maxQubits The largest circuit the device is chosen for.
     * @param device    The name of the mock backend class.
     */
    public record DeviceTier(int maxQubits, String device) {}

    public ExportSettings {
        if (deviceTiers.isEmpty()) {
            throw new IllegalArgumentException("At least one device tier is required");
        }
        List<DeviceTier> sorted = new ArrayList<>(deviceTiers);
        sorted.sort(Comparator.comparingInt(DeviceTier::maxQubits));
        deviceTiers = List.copyOf(sorted);
    }

    /**
     * @return The settings of the bundled {@code reference.conf}.
     */
    public static ExportSettings defaults() {
        return fromConfig(ConfigFactory.defaultReference());
    }

    /**
     * Reads the settings from the {@code qcircuit.export} section.
     *
     * @param config The resolved application config.
     * @return The settings.
     * @throws com.typesafe.config.ConfigException if a key is missing or has the wrong type.
     */
    public static ExportSettings fromConfig(Config config) {
        Config export = config.getConfig("qcircuit.export");
        List<DeviceTier> tiers = new ArrayList<>();
        for (Config tier : export.getConfigList("qiskit.device-tiers")) {
            tiers.add(new DeviceTier(tier.getInt("max-qubits"), tier.getString("device")));
        }
        return new ExportSettings(
                export.getString("default-qreg"),
                export.getString("default-creg"),
                export.getString("ancilla-reg"),
                export.getInt("qiskit.max-qubits"),
                tiers);
    }

    /**
     * @param totalQubits The total qubit count of a circuit.
     * @return The smallest device tier that fits.
     * @throws IllegalArgumentException if no tier fits.
     */
    public DeviceTier deviceFor(int totalQubits) {
        for (DeviceTier tier : deviceTiers) {
            if (totalQubits <= tier.maxQubits()) {
                return tier;
            }
        }
        throw new IllegalArgumentException("No device for " + totalQubits + " qubits");
    }
}
