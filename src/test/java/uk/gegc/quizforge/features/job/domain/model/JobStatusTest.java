package uk.gegc.quizforge.features.job.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import uk.gegc.quizforge.shared.exception.JobException;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("JobStatus")
class JobStatusTest {

    @Test
    @DisplayName("pending jobs start running or get cancelled, running jobs finish")
    void allowedTransitions() {
        assertThat(JobStatus.PENDING.canTransitionTo(JobStatus.RUNNING)).isTrue();
        assertThat(JobStatus.PENDING.canTransitionTo(JobStatus.CANCELLED)).isTrue();
        assertThat(JobStatus.PENDING.canTransitionTo(JobStatus.COMPLETED)).isFalse();
        assertThat(JobStatus.RUNNING.canTransitionTo(JobStatus.COMPLETED)).isTrue();
        assertThat(JobStatus.RUNNING.canTransitionTo(JobStatus.FAILED)).isTrue();
        assertThat(JobStatus.RUNNING.canTransitionTo(JobStatus.CANCELLED)).isFalse();
        assertThat(JobStatus.RUNNING.canTransitionTo(JobStatus.PENDING)).isFalse();
    }

    @ParameterizedTest
    @EnumSource(value = JobStatus.class, names = {"COMPLETED", "FAILED", "CANCELLED"})
    @DisplayName("terminal states never change")
    void terminalStates(JobStatus status) {
        assertThat(status.isTerminal()).isTrue();
        for (JobStatus next : JobStatus.values()) {
            assertThat(status.canTransitionTo(next)).isFalse();
        }
    }

    @Test
    @DisplayName("parse accepts any case and rejects unknown values")
    void parse() {
        assertThat(JobStatus.parse("Running")).contains(JobStatus.RUNNING);
        assertThat(JobStatus.parse(" completed ")).contains(JobStatus.COMPLETED);
        assertThat(JobStatus.parse("paused")).isEmpty();
        assertThat(JobStatus.parse(null)).isEmpty();
        assertThat(JobStatus.CANCELLED.getValue()).isEqualTo("cancelled");
    }

    @Test
    @DisplayName("an illegal transition on a job is rejected and leaves the status unchanged")
    void jobRejectsIllegalTransition() {
        GenerationJob job = new GenerationJob();
        job.setId(UUID.randomUUID());
        job.setStatus(JobStatus.COMPLETED);

        assertThatThrownBy(() -> job.transitionTo(JobStatus.RUNNING))
                .isInstanceOf(JobException.class)
                .hasMessageContaining("cannot move from completed to running");
        assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
    }
}
