package uk.gegc.quizforge.features.generation.application.quality;

public enum ScoreDecision {
    ACCEPT,
    /** Kept as is, but flagged */
    NEEDS_REVISION,
    REJECT
}
