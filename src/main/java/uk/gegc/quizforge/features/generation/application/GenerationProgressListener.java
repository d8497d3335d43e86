package uk.gegc.quizforge.features.generation.application;

@FunctionalInterface
public interface GenerationProgressListener {

    GenerationProgressListener NONE = progress -> {
    };

    void onProgress(GenerationProgress progress);
}
