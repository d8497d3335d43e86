package uk.gegc.quizforge.features.generation.application;

/**
 * Rough wall-clock comparison of sequential and fanned-out generation, in seconds.
 */
public record TimeSavingsEstimate(
        int chunks,
        double sequentialSeconds,
        double parallelSeconds,
        double savedSeconds,
        double speedup
) {
}
