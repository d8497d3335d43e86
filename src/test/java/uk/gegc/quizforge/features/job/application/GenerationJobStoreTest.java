package uk.gegc.quizforge.features.job.application;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import uk.gegc.quizforge.features.generation.domain.model.Difficulty;
import uk.gegc.quizforge.features.generation.domain.model.GenerationOptions;
import uk.gegc.quizforge.features.generation.domain.model.QuestionSet;
import uk.gegc.quizforge.features.job.domain.model.GenerationJob;
import uk.gegc.quizforge.features.job.domain.model.JobParams;
import uk.gegc.quizforge.features.job.domain.model.JobStatus;
import uk.gegc.quizforge.features.job.domain.repository.GenerationJobRepository;
import uk.gegc.quizforge.shared.exception.JobException;
import uk.gegc.quizforge.shared.exception.JobNotFoundException;
import uk.gegc.quizforge.testsupport.MutableClock;
import uk.gegc.quizforge.testsupport.TestQuestions;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@DisplayName("GenerationJobStore")
class GenerationJobStoreTest {

    private static final String TEXT = "Tectonic plates move slowly over the mantle and cause earthquakes at their edges.";
    private static final Instant START = Instant.parse("2026-04-10T12:00:00Z");

    @Autowired
    private GenerationJobRepository repository;

    @Autowired
    private TestEntityManager entityManager;

    private MutableClock clock;
    private GenerationJobStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        store = new GenerationJobStore(repository, new ObjectMapper(), clock);
    }

    private GenerationJob createJob() {
        GenerationJob job = store.create(TEXT, GenerationOptions.builder().numQuestions(4).build());
        clock.advance(Duration.ofSeconds(1));
        return job;
    }

    @Nested
    @DisplayName("lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("a new job is pending with its parameters stored")
        void createStoresParams() {
            // When
            GenerationJob job = createJob();

            // Then
            GenerationJob stored = store.get(job.getId());
            assertThat(stored.getStatus()).isEqualTo(JobStatus.PENDING);
            assertThat(stored.getProgress()).isZero();
            assertThat(stored.getCreatedAt()).isEqualTo(START);
            JobParams params = store.readParams(stored);
            assertThat(params.text()).isEqualTo(TEXT);
            assertThat(params.options().getNumQuestions()).isEqualTo(4);
        }

        @Test
        @DisplayName("a completed job carries its result and full progress")
        void completeStoresResult() {
            // Given
            GenerationJob job = createJob();
            store.markRunning(job.getId());
            QuestionSet result = TestQuestions.questionSet(TestQuestions.questions(0, 2, Difficulty.EASY), "gemini");

            // When
            store.complete(job.getId(), result);

            // Then
            GenerationJob stored = store.get(job.getId());
            assertThat(stored.getStatus()).isEqualTo(JobStatus.COMPLETED);
            assertThat(stored.getProgress()).isEqualTo(100);
            assertThat(stored.getStartedAt()).isEqualTo(START.plusSeconds(1));
            assertThat(stored.getCompletedAt()).isNotNull();
            assertThat(store.readResult(stored).getQuestions()).containsExactlyElementsOf(result.getQuestions());
        }

        @Test
        @DisplayName("a failed job keeps the error message")
        void failStoresError() {
            GenerationJob job = createJob();
            store.markRunning(job.getId());

            store.fail(job.getId(), "All providers failed");

            GenerationJob stored = store.get(job.getId());
            assertThat(stored.getStatus()).isEqualTo(JobStatus.FAILED);
            assertThat(stored.getError()).isEqualTo("All providers failed");
            assertThat(store.readResult(stored)).isNull();
        }

        @Test
        @DisplayName("terminal jobs cannot be started again")
        void terminalJobsStayTerminal() {
            GenerationJob job = createJob();
            store.markRunning(job.getId());
            store.fail(job.getId(), "boom");

            assertThatThrownBy(() -> store.markRunning(job.getId())).isInstanceOf(JobException.class);
            assertThatThrownBy(() -> store.complete(job.getId(), new QuestionSet())).isInstanceOf(JobException.class);
        }

        @Test
        @DisplayName("only pending jobs can be cancelled")
        void cancel() {
            GenerationJob pending = createJob();
            GenerationJob running = createJob();
            store.markRunning(running.getId());

            GenerationJob cancelled = store.cancel(pending.getId());

            assertThat(cancelled.getStatus()).isEqualTo(JobStatus.CANCELLED);
            assertThat(cancelled.getCompletedAt()).isNotNull();
            assertThatThrownBy(() -> store.cancel(running.getId()))
                    .isInstanceOf(JobException.class)
                    .hasMessageContaining("Only pending jobs can be cancelled");
        }

        @Test
        @DisplayName("unknown ids are reported as not found")
        void unknownJob() {
            UUID id = UUID.randomUUID();

            assertThatThrownBy(() -> store.get(id))
                    .isInstanceOf(JobNotFoundException.class)
                    .hasMessage("Generation job " + id + " not found");
        }
    }

    @Nested
    @DisplayName("progress")
    class Progress {

        @Test
        @DisplayName("progress only grows and only while running")
        void monotonic() {
            // Given
            GenerationJob job = createJob();

            // When / Then
            assertThat(store.updateProgress(job.getId(), 20)).isFalse();
            store.markRunning(job.getId());
            assertThat(store.updateProgress(job.getId(), 40)).isTrue();
            assertThat(store.updateProgress(job.getId(), 30)).isFalse();
            assertThat(store.updateProgress(job.getId(), 40)).isFalse();
            assertThat(store.updateProgress(job.getId(), 250)).isTrue();
            assertThat(store.get(job.getId()).getProgress()).isEqualTo(100);
        }
    }

    @Nested
    @DisplayName("recovery and cleanup")
    class RecoveryAndCleanup {

        @Test
        @DisplayName("running jobs return to pending and every pending id is listed in creation order")
        void recoverInterrupted() {
            // Given
            GenerationJob first = createJob();
            GenerationJob second = createJob();
            GenerationJob third = createJob();
            store.markRunning(second.getId());
            store.updateProgress(second.getId(), 45);
            store.markRunning(third.getId());
            store.complete(third.getId(), new QuestionSet());

            // When
            List<UUID> ids = store.recoverInterrupted();

            // Then
            assertThat(ids).containsExactly(first.getId(), second.getId());
            GenerationJob recovered = store.get(second.getId());
            assertThat(recovered.getStatus()).isEqualTo(JobStatus.PENDING);
            assertThat(recovered.getProgress()).isZero();
            assertThat(recovered.getStartedAt()).isNull();
            assertThat(store.get(third.getId()).getStatus()).isEqualTo(JobStatus.COMPLETED);
        }

        @Test
        @DisplayName("finished jobs past the retention window are removed")
        void clearFinished() {
            // Given
            GenerationJob old = createJob();
            store.cancel(old.getId());
            GenerationJob waiting = createJob();
            clock.advance(Duration.ofHours(25));
            GenerationJob recent = createJob();
            store.cancel(recent.getId());

            // When
            int removed = store.clearFinished(Duration.ofHours(24));
            entityManager.clear();

            // Then
            assertThat(removed).isEqualTo(1);
            assertThat(repository.findById(old.getId())).isEmpty();
            assertThat(repository.findById(waiting.getId())).isPresent();
            assertThat(repository.findById(recent.getId())).isPresent();
        }

        @Test
        @DisplayName("stats count jobs per status")
        void stats() {
            createJob();
            GenerationJob running = createJob();
            store.markRunning(running.getId());
            GenerationJob cancelled = createJob();
            store.cancel(cancelled.getId());

            JobStats stats = store.stats();

            assertThat(stats).isEqualTo(new JobStats(3, 1, 1, 0, 0, 1));
            assertThat(store.findByStatus(JobStatus.PENDING)).hasSize(1);
            assertThat(store.findByStatus(null)).hasSize(3);
        }
    }
}
