package uk.gegc.quizforge.features.ai.domain.model;

import java.time.Instant;

/**
 * Mutable per-provider request counters kept by the router.
 */
public class ProviderHealth {

    private long requests;
    private long successes;
    private long failures;
    private long totalLatencyMs;
    private double estimatedCost;
    private Instant lastSuccess;
    private Instant lastFailure;
    private String lastError;

    public synchronized void recordSuccess(long latencyMs, double cost, Instant at) {
        requests++;
        successes++;
        totalLatencyMs += latencyMs;
        estimatedCost += cost;
        lastSuccess = at;
    }

    public synchronized void recordFailure(long latencyMs, String error, Instant at) {
        requests++;
        failures++;
        totalLatencyMs += latencyMs;
        lastFailure = at;
        lastError = error;
    }

    /**
     * Optimistic until the first request has been observed
     */
    public synchronized double successRate() {
        return requests == 0 ? 1.0 : (double) successes / requests;
    }

    public synchronized Snapshot snapshot() {
        double meanLatency = requests == 0 ? 0.0 : (double) totalLatencyMs / requests;
        return new Snapshot(requests, successes, failures, successRate(), meanLatency,
                estimatedCost, lastSuccess, lastFailure, lastError);
    }

    public record Snapshot(
            long requests,
            long successes,
            long failures,
            double successRate,
            double meanLatencyMs,
            double estimatedCost,
            Instant lastSuccess,
            Instant lastFailure,
            String lastError
    ) {
    }
}
