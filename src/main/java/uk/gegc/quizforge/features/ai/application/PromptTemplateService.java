package uk.gegc.quizforge.features.ai.application;

import uk.gegc.quizforge.features.generation.domain.model.GenerationOptions;
import uk.gegc.quizforge.features.generation.domain.model.Question;

import java.util.List;

/**
 * Builds the prompts sent to providers from the templates under {@code classpath:prompts/}.
 */
public interface PromptTemplateService {

    /**
     * Generation prompt for the given text. Uses the distribution plan template when the
     * options carry a plan with more than one (difficulty, bloom level) cell.
     */
    String buildGenerationPrompt(String content, GenerationOptions options);

    String buildSystemPrompt();

    String buildScoringPrompt(Question question);

    String buildQuickScoringPrompt(Question question);

    String buildBatchScoringPrompt(List<Question> questions);

    /**
     * Load a template file by path relative to the prompts directory
     */
    String loadPromptTemplate(String templateName);
}
