package uk.gegc.quizforge.features.job.application;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import uk.gegc.quizforge.features.generation.application.QuestionGenerationService;
import uk.gegc.quizforge.features.generation.domain.model.GenerationOptions;
import uk.gegc.quizforge.features.job.config.JobQueueProperties;
import uk.gegc.quizforge.features.job.domain.model.GenerationJob;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * FIFO of pending job ids drained by at most {@code maxConcurrent} workers.
 *
 * <p>The queue only holds ids; the job store stays the source of truth. On startup every
 * job left pending or running by a previous process is queued again.
 */
@Service
@Slf4j
public class GenerationJobQueue {

    private final GenerationJobStore jobStore;
    private final GenerationJobProcessor processor;
    private final QuestionGenerationService generationService;
    private final JobQueueProperties properties;
    private final Executor executor;

    private final Deque<UUID> pending = new ArrayDeque<>();
    private final Set<UUID> inFlight = new HashSet<>();

    public GenerationJobQueue(GenerationJobStore jobStore,
                              GenerationJobProcessor processor,
                              QuestionGenerationService generationService,
                              JobQueueProperties properties,
                              @Qualifier("jobTaskExecutor") Executor executor) {
        this.jobStore = jobStore;
        this.processor = processor;
        this.generationService = generationService;
        this.properties = properties;
        this.executor = executor;
    }

    /**
     * Validates the text, records a pending job and schedules it.
     */
    public GenerationJob submit(String text, GenerationOptions options) {
        generationService.validateInput(text);
        GenerationJob job = jobStore.create(text, options);
        synchronized (this) {
            pending.addLast(job.getId());
        }
        dispatch();
        return job;
    }

    /**
     * @throws uk.gegc.quizforge.shared.exception.JobException if the job is no longer pending
     */
    public GenerationJob cancel(UUID id) {
        GenerationJob cancelled = jobStore.cancel(id);
        synchronized (this) {
            pending.remove(id);
        }
        return cancelled;
    }

    public synchronized QueueStats getStats() {
        return new QueueStats(pending.size(), inFlight.size(), maxConcurrent(), jobStore.stats());
    }

    @EventListener(ApplicationReadyEvent.class)
    public void restore() {
        List<UUID> ids = jobStore.recoverInterrupted();
        int restored = 0;
        synchronized (this) {
            for (UUID id : ids) {
                if (!pending.contains(id) && !inFlight.contains(id)) {
                    pending.addLast(id);
                    restored++;
                }
            }
        }
        if (restored > 0) {
            log.info("Restored {} pending generation jobs", restored);
        }
        dispatch();
    }

    private void dispatch() {
        synchronized (this) {
            while (inFlight.size() < maxConcurrent() && !pending.isEmpty()) {
                UUID id = pending.pollFirst();
                inFlight.add(id);
                try {
                    executor.execute(() -> run(id));
                } catch (RejectedExecutionException e) {
                    log.warn("Job executor rejected job {}, leaving it queued: {}", id, e.getMessage());
                    inFlight.remove(id);
                    pending.addFirst(id);
                    break;
                }
            }
        }
    }

    private void run(UUID id) {
        try {
            processor.process(id);
        } finally {
            synchronized (this) {
                inFlight.remove(id);
            }
            dispatch();
        }
    }

    private int maxConcurrent() {
        return Math.max(1, properties.getMaxConcurrent());
    }
}
