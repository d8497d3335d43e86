package uk.gegc.quizforge.features.generation.application;

/**
 * Progress event emitted while a generation runs.
 *
 * @param stage           start, chunk_complete, chunk_error or complete
 * @param completedChunks chunks finished so far
 * @param totalChunks     chunks in this generation (1 for a non-parallel call)
 * @param percent         0-100
 * @param questions       questions produced so far
 */
public record GenerationProgress(
        String stage,
        int completedChunks,
        int totalChunks,
        int percent,
        int questions
) {

    public static final String START = "start";
    public static final String CHUNK_COMPLETE = "chunk_complete";
    public static final String CHUNK_ERROR = "chunk_error";
    public static final String COMPLETE = "complete";
}
