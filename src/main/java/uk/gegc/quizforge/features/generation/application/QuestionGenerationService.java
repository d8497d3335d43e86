package uk.gegc.quizforge.features.generation.application;

import uk.gegc.quizforge.features.ai.domain.model.ConnectionTestResult;
import uk.gegc.quizforge.features.cache.application.CacheStats;
import uk.gegc.quizforge.features.generation.domain.model.GenerationOptions;
import uk.gegc.quizforge.features.generation.domain.model.QuestionSet;

import java.util.List;
import java.util.Map;

/**
 * Entry point of the generation pipeline: cache, provider call (fanned out when large),
 * quality scoring, deduplication and difficulty balancing.
 */
public interface QuestionGenerationService {

    QuestionSet generate(String text, GenerationOptions options);

    /**
     * Same as {@link #generate(String, GenerationOptions)}, reporting fan-out progress to the listener
     */
    QuestionSet generate(String text, GenerationOptions options, GenerationProgressListener listener);

    /**
     * Generates for each text in turn with a pause between texts. A failing text does not stop the batch.
     */
    List<BatchGenerationResult> batchGenerate(List<String> texts, GenerationOptions options);

    /**
     * @throws uk.gegc.quizforge.shared.exception.QuestionValidationException if the text is unusable
     */
    void validateInput(String text);

    Map<String, ConnectionTestResult> testConnections();

    GenerationStatus getStatus();

    int clearCache();

    CacheStats getCacheStats();
}
