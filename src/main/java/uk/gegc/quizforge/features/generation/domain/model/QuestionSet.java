package uk.gegc.quizforge.features.generation.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of a generation: ordered questions, the model's analysis and free-form metadata.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QuestionSet {

    public static final String META_PROVIDER = "provider";
    public static final String META_MODEL = "model";
    public static final String META_GENERATED_AT = "generatedAt";
    public static final String META_NUM_QUESTIONS = "numQuestions";
    public static final String META_SOURCE_FINGERPRINT = "sourceFingerprint";
    public static final String META_CACHED = "cached";
    public static final String META_QUALITY_SCORING = "qualityScoring";
    public static final String META_DEDUPLICATION = "deduplication";
    public static final String META_DIFFICULTY_BALANCING = "difficultyBalancing";
    public static final String META_DISTRIBUTION_PLAN = "distributionPlan";

    @Builder.Default
    private List<Question> questions = new ArrayList<>();

    private String analysis;

    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    /**
     * Copy with the given questions and a copy of this set's metadata.
     */
    public QuestionSet withQuestions(List<Question> replacement) {
        return new QuestionSet(new ArrayList<>(replacement), analysis, new LinkedHashMap<>(metadata));
    }

    public QuestionSet putMetadata(String key, Object value) {
        if (metadata == null) {
            metadata = new LinkedHashMap<>();
        }
        metadata.put(key, value);
        return this;
    }

    public int size() {
        return questions == null ? 0 : questions.size();
    }
}
