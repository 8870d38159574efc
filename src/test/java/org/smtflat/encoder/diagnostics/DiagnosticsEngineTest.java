package org.smtflat.encoder.diagnostics;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.smtflat.encoder.api.EncodingErrorCode;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class DiagnosticsEngineTest {

    @Test
    void warningsAloneAreNotErrors() {
        DiagnosticsEngine engine = new DiagnosticsEngine();
        engine.reportWarning(null, "check", "solver returned unknown");

        assertThat(engine.hasErrors()).isFalse();
        assertThat(engine.getDiagnostics()).hasSize(1);
        assertThat(engine.summary()).isEqualTo("[WARNING] check: solver returned unknown");
    }

    @Test
    void errorsCarryTheirCode() {
        DiagnosticsEngine engine = new DiagnosticsEngine();
        engine.reportWarning(null, "check", "inconclusive");
        engine.reportError(EncodingErrorCode.BROADCAST_TOO_WIDE, "ArrayOf", "broadcast over a 32-bit domain");

        assertThat(engine.hasErrors()).isTrue();
        assertThat(engine.getDiagnostics().get(1).code()).isEqualTo(EncodingErrorCode.BROADCAST_TOO_WIDE);
        assertThat(engine.summary().lines())
                .containsExactly("[WARNING] check: inconclusive",
                        "[ERROR] BROADCAST_TOO_WIDE ArrayOf: broadcast over a 32-bit domain");
    }
}
