package org.begend.compiler.diagnostics;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class DiagnosticsEngineTest {

    @Test
    void warningsAloneAreNotErrors() {
        DiagnosticsEngine engine = new DiagnosticsEngine();

        engine.reportWarning("unused", "a.bgd", 3, 4);

        assertThat(engine.hasErrors()).isFalse();
        assertThat(engine.summary()).isEqualTo("[WARNING] a.bgd:3:4: unused");
    }

    @Test
    void summaryListsDiagnosticsInReportOrder() {
        DiagnosticsEngine engine = new DiagnosticsEngine();

        engine.reportError("first", "a.bgd", 1, 2);
        engine.reportWarning("second", "a.bgd", 5, 1);

        assertThat(engine.hasErrors()).isTrue();
        assertThat(engine.summary()).isEqualTo("[ERROR] a.bgd:1:2: first\n[WARNING] a.bgd:5:1: second");
    }

    @Test
    void clearRemovesEverything() {
        DiagnosticsEngine engine = new DiagnosticsEngine();
        engine.reportError("oops", "a.bgd", 1, 1);

        engine.clear();

        assertThat(engine.hasErrors()).isFalse();
        assertThat(engine.getDiagnostics()).isEmpty();
    }
}
