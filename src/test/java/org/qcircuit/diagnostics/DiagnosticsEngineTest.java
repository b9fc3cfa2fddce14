package org.qcircuit.diagnostics;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class DiagnosticsEngineTest {

    @Test
    void collectsDiagnosticsInOrder() {
        DiagnosticsEngine engine = new DiagnosticsEngine();
        engine.reportWarning("define skipped", "a.real", 3);
        assertThat(engine.hasErrors()).isFalse();

        engine.reportError("no definition", "circuit", 0);

        assertThat(engine.hasErrors()).isTrue();
        assertThat(engine.getDiagnostics()).extracting(Diagnostic::severity)
                .containsExactly(Diagnostic.Severity.WARNING, Diagnostic.Severity.ERROR);
        assertThat(engine.summary()).isEqualTo("WARNING [a.real:3]: define skipped\nERROR [circuit]: no definition\n");
    }

    @Test
    void emptyEngineHasEmptySummary() {
        assertThat(new DiagnosticsEngine().summary()).isEmpty();
    }
}
