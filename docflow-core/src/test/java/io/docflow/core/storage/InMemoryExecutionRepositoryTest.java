package io.docflow.core.storage;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryExecutionRepositoryTest {

    private InMemoryExecutionRepository repository;

    @BeforeEach
    void setUp() {
        repository = new InMemoryExecutionRepository();
    }

    @Test
    void shouldListExecutionsOfOneWorkflowNewestFirst() {
        repository.save(ExecutionRecord.running("e1", "wf", 1, Instant.ofEpochSecond(10)));
        repository.save(ExecutionRecord.running("e2", "wf", 1, Instant.ofEpochSecond(30)));
        repository.save(ExecutionRecord.running("e3", "other", 1, Instant.ofEpochSecond(20)));

        assertThat(repository.findByWorkflowId("wf"))
                .extracting(ExecutionRecord::id)
                .containsExactly("e2", "e1");
        assertThat(repository.findByWorkflowId("none")).isEmpty();
        assertThat(repository.count()).isEqualTo(3);
    }

    @Test
    void shouldReplaceRunningRecordWithFinalOne() {
        ExecutionRecord running = ExecutionRecord.running("e1", "wf", 2, Instant.ofEpochSecond(10));
        repository.save(running);
        repository.save(running.fail("boom", null, Instant.ofEpochSecond(11)));

        ExecutionRecord stored = repository.findById("e1").orElseThrow();
        assertThat(stored.status()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(stored.errorMessage()).isEqualTo("boom");
        assertThat(stored.inputFileCount()).isEqualTo(2);
        assertThat(stored.completedAt()).isEqualTo(Instant.ofEpochSecond(11));
        assertThat(repository.count()).isEqualTo(1);

        repository.clear();
        assertThat(repository.findById("e1")).isEmpty();
    }

    @Test
    void shouldRenderStatusInLowerCase() {
        assertThat(ExecutionStatus.RUNNING.getWireName()).isEqualTo("running");
        assertThat(ExecutionStatus.COMPLETED.getWireName()).isEqualTo("completed");
    }
}
