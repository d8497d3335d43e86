package uk.gegc.quizforge.features.ai.infra.parser;

import com.fasterxml.jackson.databind.JsonNode;
import uk.gegc.quizforge.features.generation.domain.model.GenerationOptions;
import uk.gegc.quizforge.features.generation.domain.model.QuestionSet;
import uk.gegc.quizforge.shared.exception.AIResponseParseException;
import uk.gegc.quizforge.shared.exception.QuestionValidationException;

/**
 * Parser for provider completions
 */
public interface QuestionResponseParser {

    /**
     * Recover the JSON of a generation response and normalize its questions.
     * Invalid questions are dropped; the result is trimmed to the requested count.
     *
     * @throws AIResponseParseException     if no JSON can be recovered
     * @throws QuestionValidationException if no valid question remains
     */
    QuestionSet parseQuestionSet(String rawResponse, GenerationOptions options);

    /**
     * Recover a JSON tree from any completion, e.g. a scoring response
     */
    JsonNode parseJson(String rawResponse);
}
