package uk.gegc.quizforge.features.job.application;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.quizforge.features.generation.domain.model.GenerationOptions;
import uk.gegc.quizforge.features.generation.domain.model.QuestionSet;
import uk.gegc.quizforge.features.job.domain.model.GenerationJob;
import uk.gegc.quizforge.features.job.domain.model.JobParams;
import uk.gegc.quizforge.features.job.domain.model.JobStatus;
import uk.gegc.quizforge.features.job.domain.repository.GenerationJobRepository;
import uk.gegc.quizforge.shared.exception.JobException;
import uk.gegc.quizforge.shared.exception.JobNotFoundException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Durable record of generation jobs. Status changes go through {@link JobStatus#canTransitionTo};
 * the only exception is {@link #recoverInterrupted()}, which puts jobs left running by a
 * previous process back in the pending state.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class GenerationJobStore {

    private static final List<JobStatus> FINISHED = List.of(JobStatus.COMPLETED, JobStatus.FAILED, JobStatus.CANCELLED);

    private final GenerationJobRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Transactional
    public GenerationJob create(String text, GenerationOptions options) {
        GenerationJob job = new GenerationJob();
        job.setId(UUID.randomUUID());
        job.setStatus(JobStatus.PENDING);
        job.setProgress(0);
        job.setParams(write(new JobParams(text, options)));
        job.setCreatedAt(clock.instant());
        GenerationJob saved = repository.save(job);
        log.info("Created generation job {}", saved.getId());
        return saved;
    }

    @Transactional(readOnly = true)
    public GenerationJob get(UUID id) {
        return repository.findById(id).orElseThrow(() -> new JobNotFoundException(id));
    }

    @Transactional(readOnly = true)
    public List<GenerationJob> findByStatus(JobStatus status) {
        return status == null
                ? repository.findAllByOrderByCreatedAtAsc()
                : repository.findByStatusOrderByCreatedAtAsc(status);
    }

    @Transactional
    public GenerationJob markRunning(UUID id) {
        GenerationJob job = get(id);
        job.transitionTo(JobStatus.RUNNING);
        job.setStartedAt(clock.instant());
        return repository.save(job);
    }

    /**
     * Raises the progress of a running job; lower values and jobs in other states are ignored.
     *
     * @return whether the stored progress changed
     */
    @Transactional
    public boolean updateProgress(UUID id, int progress) {
        int clamped = Math.max(0, Math.min(100, progress));
        return repository.raiseProgress(id, clamped, JobStatus.RUNNING) > 0;
    }

    @Transactional
    public GenerationJob complete(UUID id, QuestionSet result) {
        GenerationJob job = get(id);
        job.transitionTo(JobStatus.COMPLETED);
        job.setResult(write(result));
        job.setProgress(100);
        job.setCompletedAt(clock.instant());
        log.info("Generation job {} completed with {} questions", id, result.size());
        return repository.save(job);
    }

    @Transactional
    public GenerationJob fail(UUID id, String error) {
        GenerationJob job = get(id);
        job.transitionTo(JobStatus.FAILED);
        job.setError(error);
        job.setCompletedAt(clock.instant());
        log.warn("Generation job {} failed: {}", id, error);
        return repository.save(job);
    }

    /**
     * @throws JobException if the job is not pending
     */
    @Transactional
    public GenerationJob cancel(UUID id) {
        GenerationJob job = get(id);
        if (job.getStatus() != JobStatus.PENDING) {
            throw new JobException("Only pending jobs can be cancelled; job " + id + " is " + job.getStatus().getValue());
        }
        job.transitionTo(JobStatus.CANCELLED);
        job.setCompletedAt(clock.instant());
        log.info("Generation job {} cancelled", id);
        return repository.save(job);
    }

    /**
     * Puts running jobs back to pending.
     *
     * @return ids of all pending jobs in creation order
     */
    @Transactional
    public List<UUID> recoverInterrupted() {
        int reset = repository.resetStatus(JobStatus.RUNNING, JobStatus.PENDING);
        if (reset > 0) {
            log.warn("Recovered {} interrupted generation jobs", reset);
        }
        return repository.findIdsByStatus(JobStatus.PENDING);
    }

    @Transactional
    public int clearFinished(Duration olderThan) {
        Instant cutoff = clock.instant().minus(olderThan);
        int removed = repository.deleteFinishedBefore(FINISHED, cutoff);
        if (removed > 0) {
            log.info("Removed {} finished generation jobs older than {}", removed, olderThan);
        }
        return removed;
    }

    @Transactional(readOnly = true)
    public JobStats stats() {
        long pending = repository.countByStatus(JobStatus.PENDING);
        long running = repository.countByStatus(JobStatus.RUNNING);
        long completed = repository.countByStatus(JobStatus.COMPLETED);
        long failed = repository.countByStatus(JobStatus.FAILED);
        long cancelled = repository.countByStatus(JobStatus.CANCELLED);
        return new JobStats(pending + running + completed + failed + cancelled,
                pending, running, completed, failed, cancelled);
    }

    public JobParams readParams(GenerationJob job) {
        try {
            return objectMapper.readValue(job.getParams(), JobParams.class);
        } catch (JsonProcessingException e) {
            throw new JobException("Stored parameters of job " + job.getId() + " are unreadable", e);
        }
    }

    public QuestionSet readResult(GenerationJob job) {
        if (job.getResult() == null) {
            return null;
        }
        try {
            return objectMapper.readValue(job.getResult(), QuestionSet.class);
        } catch (JsonProcessingException e) {
            throw new JobException("Stored result of job " + job.getId() + " is unreadable", e);
        }
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new JobException("Could not serialize job data", e);
        }
    }
}
