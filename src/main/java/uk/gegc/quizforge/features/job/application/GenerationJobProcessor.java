package uk.gegc.quizforge.features.job.application;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.quizforge.features.generation.application.GenerationProgress;
import uk.gegc.quizforge.features.generation.application.QuestionGenerationService;
import uk.gegc.quizforge.features.generation.domain.model.QuestionSet;
import uk.gegc.quizforge.features.job.domain.model.GenerationJob;
import uk.gegc.quizforge.features.job.domain.model.JobParams;
import uk.gegc.quizforge.shared.exception.JobException;

import java.util.UUID;

/**
 * Runs one job through the generation pipeline and records its terminal state.
 *
 * <p>Progress: 5 once running, 10 once the parameters are read, fan-out progress mapped onto
 * 10..90, 90 after post-processing, 100 on completion. Stored in steps of 5.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class GenerationJobProcessor {

    static final String JOBS_METRIC = "quizforge.jobs";
    static final int PROGRESS_STEP = 5;

    private final GenerationJobStore jobStore;
    private final QuestionGenerationService generationService;
    private final MeterRegistry meterRegistry;

    public void process(UUID id) {
        try {
            jobStore.markRunning(id);
        } catch (JobException e) {
            log.warn("Skipping job {}: {}", id, e.getMessage());
            return;
        }

        ProgressTracker tracker = new ProgressTracker(id);
        try {
            tracker.report(5);
            GenerationJob job = jobStore.get(id);
            JobParams params = jobStore.readParams(job);
            tracker.report(10);

            QuestionSet result = generationService.generate(params.text(), params.options(),
                    progress -> tracker.report(mapFanOutProgress(progress)));
            tracker.report(90);

            jobStore.complete(id, result);
            meterRegistry.counter(JOBS_METRIC, "status", "completed").increment();
        } catch (Exception e) {
            log.error("Generation job {} failed", id, e);
            meterRegistry.counter(JOBS_METRIC, "status", "failed").increment();
            try {
                jobStore.fail(id, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            } catch (RuntimeException storeError) {
                log.error("Could not record failure of job {}", id, storeError);
            }
        }
    }

    static int mapFanOutProgress(GenerationProgress progress) {
        return 10 + progress.percent() * 80 / 100;
    }

    /**
     * Persists progress rounded down to the step, only when it grows.
     */
    private final class ProgressTracker {

        private final UUID id;
        private int stored;

        private ProgressTracker(UUID id) {
            this.id = id;
        }

        synchronized void report(int progress) {
            int stepped = progress / PROGRESS_STEP * PROGRESS_STEP;
            if (stepped <= stored) {
                return;
            }
            try {
                jobStore.updateProgress(id, stepped);
                stored = stepped;
            } catch (RuntimeException e) {
                log.warn("Could not store progress {} for job {}: {}", stepped, id, e.getMessage());
            }
        }
    }
}
