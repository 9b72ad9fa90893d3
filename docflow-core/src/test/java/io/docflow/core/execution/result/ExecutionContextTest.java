package io.docflow.core.execution.result;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;
import org.junit.jupiter.api.Test;

class ExecutionContextTest {

    @Test
    void shouldRejectSecondOutcomeForSameNode() {
        var context = new ExecutionContext();
        context.record("a", NodeOutcome.success("ocr-processor", Map.of()));

        assertThatThrownBy(() -> context.record("a", NodeOutcome.failure("ocr-processor", "x")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Outcome already recorded for node: a");
        assertThat(context.get("a")).get().extracting(NodeOutcome::isSuccess).isEqualTo(true);
    }

    @Test
    void shouldKeepRecordingOrderInSnapshot() {
        var context = new ExecutionContext();
        context.record("b", NodeOutcome.success("ocr-processor", Map.of()));
        context.record("a", NodeOutcome.success("ai-extractor", Map.of()));

        assertThat(context.snapshot().keySet()).containsExactly("b", "a");
        assertThat(context.contains("a")).isTrue();
        assertThat(context.get("c")).isEmpty();
    }

    @Test
    void shouldNotExposeLaterRecordsThroughEarlierSnapshot() {
        var context = new ExecutionContext();
        Map<String, NodeOutcome> snapshot = context.snapshot();

        context.record("a", NodeOutcome.success("ocr-processor", Map.of()));

        assertThat(snapshot).isEmpty();
    }
}
