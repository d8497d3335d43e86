package uk.gegc.quizforge.features.generation.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Options of a generation request. Unset values mean "use the default"; the
 * {@code ...OrDefault} and flag accessors resolve them.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GenerationOptions {

    public static final int DEFAULT_NUM_QUESTIONS = 10;
    public static final int MIN_NUM_QUESTIONS = 1;
    public static final int MAX_NUM_QUESTIONS = 50;
    public static final CognitiveLevel DEFAULT_BLOOM_LEVEL = CognitiveLevel.APPLY;
    public static final Difficulty DEFAULT_DIFFICULTY = Difficulty.MIXED;

    @Min(MIN_NUM_QUESTIONS)
    @Max(MAX_NUM_QUESTIONS)
    private Integer numQuestions;

    private CognitiveLevel bloomLevel;

    private Difficulty difficulty;

    /**
     * Difficulty label to count, summing to numQuestions
     */
    private Map<String, Integer> difficultyDistribution;

    /**
     * Bloom level label to count, summing to numQuestions
     */
    private Map<String, Integer> bloomDistribution;

    private Boolean parallel;

    private Boolean noCache;

    private Boolean qualityCheck;

    private Boolean deduplicate;

    private Boolean balanceDifficulty;

    private String provider;

    private List<SourceImage> images;

    /**
     * Set by the pipeline once the distributions have been turned into a plan
     */
    private DistributionPlan distributionPlan;

    public static GenerationOptions defaults() {
        return new GenerationOptions();
    }

    public int numQuestionsOrDefault() {
        return numQuestions != null ? numQuestions : DEFAULT_NUM_QUESTIONS;
    }

    public CognitiveLevel bloomLevelOrDefault() {
        return bloomLevel != null ? bloomLevel : DEFAULT_BLOOM_LEVEL;
    }

    public Difficulty difficultyOrDefault() {
        return difficulty != null ? difficulty : DEFAULT_DIFFICULTY;
    }

    public boolean parallelAllowed() {
        return !Boolean.FALSE.equals(parallel);
    }

    public boolean cacheDisabled() {
        return Boolean.TRUE.equals(noCache);
    }

    public boolean qualityCheckEnabled() {
        return !Boolean.FALSE.equals(qualityCheck);
    }

    public boolean deduplicateEnabled() {
        return !Boolean.FALSE.equals(deduplicate);
    }

    public boolean balanceDifficultyEnabled() {
        return !Boolean.FALSE.equals(balanceDifficulty);
    }

    public boolean hasDistributions() {
        return (difficultyDistribution != null && !difficultyDistribution.isEmpty())
                || (bloomDistribution != null && !bloomDistribution.isEmpty());
    }

    public boolean hasImages() {
        return images != null && !images.isEmpty();
    }

    public GenerationOptions withNumQuestions(int count) {
        return toBuilder().numQuestions(count).build();
    }
}
