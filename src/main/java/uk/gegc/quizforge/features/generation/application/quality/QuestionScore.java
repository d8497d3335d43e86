package uk.gegc.quizforge.features.generation.application.quality;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Rubric score of one question (0-10). A skipped score stands in for a scoring failure.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QuestionScore(
        double score,
        Integer clarity,
        Integer distractors,
        Integer relevance,
        Integer correctness,
        List<String> issues,
        List<String> strengths,
        String recommendation,
        boolean skipped,
        String error
) {

    static final double ACCEPT_SCORE = 7.0;
    static final double REVISE_SCORE = 5.0;

    public QuestionScore {
        issues = issues == null ? List.of() : List.copyOf(issues);
        strengths = strengths == null ? List.of() : List.copyOf(strengths);
    }

    public static QuestionScore skipped(double score, String error) {
        return new QuestionScore(score, null, null, null, null, List.of(), List.of(), "accept", true, error);
    }

    @JsonIgnore
    public ScoreDecision decision() {
        if (skipped || "accept".equals(recommendation) || score >= ACCEPT_SCORE) {
            return ScoreDecision.ACCEPT;
        }
        if ("revise".equals(recommendation) || score >= REVISE_SCORE) {
            return ScoreDecision.NEEDS_REVISION;
        }
        return ScoreDecision.REJECT;
    }
}
