package org.qcircuit.frontend;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class FormatTest {

    @Test
    void mapsExtensions() {
        assertThat(Format.forImportExtension("qasm")).contains(Format.OPEN_QASM);
        assertThat(Format.forImportExtension("txt")).contains(Format.GRCS);
        assertThat(Format.forImportExtension("py")).isEmpty();
        assertThat(Format.forExportExtension("py")).contains(Format.QISKIT);
    }

    @Test
    void parsesNames() {
        assertThat(Format.parse("OpenQASM")).isEqualTo(Format.OPEN_QASM);
        assertThat(Format.parse("real")).isEqualTo(Format.REAL);
        assertThat(Format.parse("py")).isEqualTo(Format.QISKIT);
        assertThatThrownBy(() -> Format.parse("quil")).isInstanceOf(IllegalArgumentException.class);
    }
}
