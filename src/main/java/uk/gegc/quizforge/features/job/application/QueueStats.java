package uk.gegc.quizforge.features.job.application;

/**
 * @param queued   pending jobs waiting for a worker
 * @param inFlight jobs currently held by a worker
 */
public record QueueStats(int queued, int inFlight, int maxConcurrent, JobStats jobs) {
}
