package uk.gegc.quizforge.features.ai.application;

import uk.gegc.quizforge.features.ai.domain.model.ConnectionTestResult;
import uk.gegc.quizforge.features.generation.domain.model.GenerationOptions;
import uk.gegc.quizforge.features.generation.domain.model.QuestionSet;

import java.util.List;

/**
 * A vendor adapter. Implementations must tolerate concurrent calls: the parallel
 * generator fans several chunks out to the same provider instance.
 */
public interface QuestionProvider {

    String getName();

    String getDescription();

    /**
     * Whether the provider has what it needs to be called (credentials, or an enabled local endpoint)
     */
    boolean isConfigured();

    List<String> getSupportedModels();

    String getCurrentModel();

    int getCurrentModelIndex();

    /**
     * Generate questions for the text. Retries, model fallback and response recovery
     * happen inside; the returned set carries provider, model and generation time.
     */
    QuestionSet generate(String text, GenerationOptions options);

    /**
     * Plain completion with the same retry policy, used for scoring prompts
     */
    String complete(String prompt);

    ConnectionTestResult testConnection();
}
