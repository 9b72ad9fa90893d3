package io.docflow.core.execution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.docflow.core.exception.CyclicWorkflowException;
import io.docflow.core.exception.EmptyWorkflowException;
import io.docflow.core.exception.NodeExecutionException;
import io.docflow.core.execution.executor.DefaultNodeExecutorRegistry;
import io.docflow.core.execution.executor.NodeExecutor;
import io.docflow.core.execution.result.ExecutionContext;
import io.docflow.core.execution.result.ExecutionResult;
import io.docflow.core.execution.result.NodeOutcome;
import io.docflow.core.execution.result.OutcomeStatus;
import io.docflow.core.execution.result.RunStatus;
import io.docflow.core.extraction.EntityExtractor;
import io.docflow.core.extraction.ExtractedFields;
import io.docflow.core.extraction.TextExtraction;
import io.docflow.core.extraction.TextExtractionException;
import io.docflow.core.extraction.TextExtractor;
import io.docflow.core.workflow.WorkflowDefinition;
import io.docflow.core.workflow.node.Node;
import io.docflow.core.workflow.node.OcrProcessorNode;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class WorkflowExecutorTest {

    @Mock private TextExtractor textExtractor;
    @Mock private EntityExtractor entityExtractor;

    private DefaultNodeExecutorRegistry registry;
    private WorkflowExecutor executor;

    @BeforeEach
    void setUp() {
        registry = new DefaultNodeExecutorRegistry(textExtractor, entityExtractor);
        executor = new WorkflowExecutor(registry);
    }

    private static Map<String, Object> document(String id, String filename, String text) {
        return Map.of(
                "id",
                id,
                "filename",
                filename,
                "content",
                text.getBytes(StandardCharsets.UTF_8),
                "content_type",
                "application/pdf");
    }

    private static WorkflowDefinition inputToOcr() {
        return WorkflowDefinition.builder()
                .node("in", "document-input")
                .node("ocr", "ocr-processor")
                .edge("in", "ocr")
                .build();
    }

    @Nested
    class Scenarios {

        @Test
        void shouldRunInputAndOcr() throws Exception {
            when(textExtractor.extractText(any(), eq("a.pdf")))
                    .thenReturn(new TextExtraction("Invoice 42", 0.4, 1));

            ExecutionResult result =
                    executor.execute(
                            inputToOcr(),
                            Map.of("documents", List.of(document("d1", "a.pdf", "..."))));

            assertThat(result.status()).isEqualTo(RunStatus.COMPLETED);
            assertThat(result.status().getWireName()).isEqualTo("completed");
            assertThat(result.results().get("ocr").getData())
                    .containsEntry("successful_count", 1)
                    .containsEntry("failed_count", 0)
                    .containsEntry("stage", "ocr_complete");
            assertThat(result.executionId()).isNotBlank();
            assertThat(result.completedAt()).isAfterOrEqualTo(result.startedAt());
        }

        @Test
        void shouldHaltOnFirstNodeError() throws Exception {
            registry.register(
                    new NodeExecutor<OcrProcessorNode>() {
                        @Override
                        public Class<OcrProcessorNode> getNodeType() {
                            return OcrProcessorNode.class;
                        }

                        @Override
                        public Map<String, Object> execute(
                                OcrProcessorNode node, Map<String, Object> inputs)
                                throws NodeExecutionException {
                            throw new NodeExecutionException("OCR backend exploded");
                        }
                    });
            var definition =
                    WorkflowDefinition.builder()
                            .node("A", "document-input")
                            .node("B", "ocr-processor")
                            .node("C", "ai-extractor")
                            .edge("A", "B")
                            .edge("B", "C")
                            .build();

            ExecutionResult result =
                    executor.execute(
                            definition, Map.of("documents", List.of(document("d1", "a.pdf", "x"))));

            assertThat(result.status()).isEqualTo(RunStatus.FAILED);
            assertThat(result.results()).containsOnlyKeys(ExecutionContext.INPUT_KEY, "A", "B");
            NodeOutcome failed = result.results().get("B");
            assertThat(failed.getStatus()).isEqualTo(OutcomeStatus.ERROR);
            assertThat(failed.getError()).isEqualTo("OCR backend exploded");
            assertThat(failed.getNodeType()).isEqualTo("ocr-processor");
            assertThat(failed.getData()).isNull();
            assertThat(result.summary().failedNodes()).isEqualTo(1);
            assertThat(result.summary().successfulNodes()).isEqualTo(1);
            assertThat(result.summary().totalNodes()).isEqualTo(2);
            verifyNoInteractions(entityExtractor);
        }

        @Test
        void shouldPropagateOnlySuccessfulDocumentsPastPartialOcrFailure() throws Exception {
            when(textExtractor.extractText(any(), eq("good.pdf")))
                    .thenReturn(new TextExtraction("Invoice INV-1 total 10", 0.2, 1));
            when(textExtractor.extractText(any(), eq("bad.pdf")))
                    .thenThrow(new TextExtractionException(500, "Mistral OCR failed: boom"));
            when(entityExtractor.extractFields(
                            eq("Invoice INV-1 total 10"), anyList(), anyString(), anyString()))
                    .thenReturn(
                            new ExtractedFields(
                                    Map.of("invoice_number", "INV-1"),
                                    Map.of("invoice_number", 0.9)));
            var definition =
                    WorkflowDefinition.builder()
                            .node("in", "document-input")
                            .node("ocr", "ocr-processor")
                            .node("extract", "ai-extractor")
                            .edge("in", "ocr")
                            .edge("ocr", "extract")
                            .build();

            ExecutionResult result =
                    executor.execute(
                            definition,
                            Map.of(
                                    "documents",
                                    List.of(
                                            document("d1", "good.pdf", "1"),
                                            document("d2", "bad.pdf", "2"))));

            assertThat(result.status()).isEqualTo(RunStatus.COMPLETED);
            assertThat(result.results().get("ocr").getData())
                    .containsEntry("successful_count", 1)
                    .containsEntry("failed_count", 1);
            Map<String, Object> extraction = result.results().get("extract").getData();
            assertThat(extraction)
                    .containsEntry("successful_count", 1)
                    .containsEntry("failed_count", 1);
            verify(entityExtractor, times(1))
                    .extractFields(anyString(), anyList(), anyString(), anyString());
        }

        @Test
        void shouldProduceSameStatusAndSummaryOnRerun() throws Exception {
            when(textExtractor.extractText(any(), any()))
                    .thenReturn(new TextExtraction("text", 0.1, 1));
            var input = Map.<String, Object>of("documents", List.of(document("d1", "a.pdf", "x")));

            ExecutionResult first = executor.execute(inputToOcr(), input);
            ExecutionResult second = executor.execute(inputToOcr(), input);

            assertThat(second.status()).isEqualTo(first.status());
            assertThat(second.summary()).isEqualTo(first.summary());
            assertThat(second.executionId()).isNotEqualTo(first.executionId());
        }

        @Test
        void shouldFailNodeWhenInputHasWrongShape() throws Exception {
            ExecutionResult result =
                    executor.execute(
                            WorkflowDefinition.builder().node("in", "document-input").build(),
                            Map.of("documents", "not-a-list"));

            assertThat(result.status()).isEqualTo(RunStatus.FAILED);
            assertThat(result.results().get("in").getError())
                    .isEqualTo("Input 'documents' must be a list");
        }
    }

    @Nested
    class InputData {

        @Test
        void shouldRecordInputEntryButLeaveItOutOfSummary() throws Exception {
            ExecutionResult result =
                    executor.execute(
                            WorkflowDefinition.builder().node("in", "document-input").build(),
                            Map.of("documents", List.of()));

            NodeOutcome input = result.results().get(ExecutionContext.INPUT_KEY);
            assertThat(input.isSuccess()).isTrue();
            assertThat(input.getNodeType()).isEqualTo("input");
            assertThat(result.summary().totalNodes()).isEqualTo(1);
            assertThat(result.summary().successfulNodes()).isEqualTo(1);
            assertThat(result.summary().successRate()).isEqualTo(1.0);
        }

        @Test
        void shouldSkipInputEntryForNullOrEmptyInput() throws Exception {
            var definition = WorkflowDefinition.builder().node("in", "document-input").build();

            assertThat(executor.execute(definition, null).results())
                    .containsOnlyKeys("in");
            assertThat(executor.execute(definition, Map.of()).results())
                    .containsOnlyKeys("in");
        }
    }

    @Nested
    class BuildFailures {

        @Test
        void shouldPropagateEmptyWorkflowWithoutRunningNodes() {
            var listener = new RecordingListener();

            assertThatThrownBy(
                            () ->
                                    executor.execute(
                                            WorkflowDefinition.builder().build(), null, listener))
                    .isInstanceOf(EmptyWorkflowException.class);
            assertThat(listener.events).containsExactly("state:BUILDING");
        }

        @Test
        void shouldPropagateCycle() {
            var definition =
                    WorkflowDefinition.builder()
                            .node("a", "ocr-processor")
                            .node("b", "ocr-processor")
                            .edge("a", "b")
                            .edge("b", "a")
                            .build();

            assertThatThrownBy(() -> executor.execute(definition, null))
                    .isInstanceOf(CyclicWorkflowException.class);
            verifyNoInteractions(textExtractor);
        }
    }

    @Test
    void shouldNotifyListenerInLifecycleOrder() throws Exception {
        var listener = new RecordingListener();

        executor.execute(
                WorkflowDefinition.builder()
                        .node("in", "document-input")
                        .node("val", "data-validator")
                        .edge("in", "val")
                        .build(),
                null,
                listener);

        assertThat(listener.events)
                .containsExactly(
                        "state:BUILDING",
                        "state:READY",
                        "state:RUNNING",
                        "start:in",
                        "complete:in:SUCCESS",
                        "start:val",
                        "complete:val:SUCCESS",
                        "state:COMPLETED");
    }

    private static final class RecordingListener implements ExecutionListener {
        private final List<String> events = new ArrayList<>();

        @Override
        public void onStateChange(String executionId, RunState state) {
            events.add("state:" + state);
        }

        @Override
        public void onNodeStart(Node node) {
            events.add("start:" + node.getId());
        }

        @Override
        public void onNodeComplete(Node node, NodeOutcome outcome) {
            events.add("complete:" + node.getId() + ":" + outcome.getStatus());
        }
    }
}
