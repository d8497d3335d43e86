package uk.gegc.quizforge.features.generation.application;

import com.fasterxml.jackson.annotation.JsonInclude;
import uk.gegc.quizforge.features.generation.domain.model.QuestionSet;

/**
 * Outcome of one text of a batch generation. Exactly one of {@code result} and {@code error} is set.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BatchGenerationResult(int index, boolean success, QuestionSet result, String error) {

    public static BatchGenerationResult success(int index, QuestionSet result) {
        return new BatchGenerationResult(index, true, result, null);
    }

    public static BatchGenerationResult failure(int index, String error) {
        return new BatchGenerationResult(index, false, null, error);
    }
}
