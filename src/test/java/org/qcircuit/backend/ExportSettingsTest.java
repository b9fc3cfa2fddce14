package org.qcircuit.backend;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ExportSettingsTest {

    @Test
    void defaultsComeFromReferenceConfig() {
        ExportSettings settings = ExportSettings.defaults();

        assertThat(settings.qubitRegister()).isEqualTo("q");
        assertThat(settings.classicalRegister()).isEqualTo("c");
        assertThat(settings.ancillaRegister()).isEqualTo("anc");
        assertThat(settings.qiskitMaxQubits()).isEqualTo(53);
        assertThat(settings.deviceFor(5).device()).isEqualTo("FakeBurlington");
        assertThat(settings.deviceFor(6).device()).isEqualTo("FakeBoeblingen");
        assertThat(settings.deviceFor(53).device()).isEqualTo("FakeRochester");
        assertThatThrownBy(() -> settings.deviceFor(54)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void overridesApplyOnTopOfDefaults() {
        Config config = ConfigFactory.parseString(
                "qcircuit.export { default-qreg = r, qiskit.max-qubits = 10, "
                        + "qiskit.device-tiers = [{max-qubits = 10, device = Big}, {max-qubits = 2, device = Small}] }")
                .withFallback(ConfigFactory.defaultReference());

        ExportSettings settings = ExportSettings.fromConfig(config);

        assertThat(settings.qubitRegister()).isEqualTo("r");
        assertThat(settings.classicalRegister()).isEqualTo("c");
        assertThat(settings.deviceTiers()).extracting(ExportSettings.DeviceTier::device).containsExactly("Small", "Big");
    }

    @Test
    void missingKeysAreConfigErrors() {
        assertThatThrownBy(() -> ExportSettings.fromConfig(ConfigFactory.parseString("qcircuit.export {}")))
                .isInstanceOf(ConfigException.class);
    }

    @Test
    void requiresADeviceTier() {
        assertThatThrownBy(() -> new ExportSettings("q", "c", "anc", 53, List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
