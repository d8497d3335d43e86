package uk.gegc.quizforge.features.generation.application.quality;

import uk.gegc.quizforge.features.generation.domain.model.Question;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of {@link QualityScorer#scoreAndImprove}: the kept questions in order
 * (accepted, needs revision, improved) and what happened on the way.
 *
 * @param scores score of every kept question, keyed by question
 */
public record ScoringResult(
        List<Question> questions,
        Map<Question, Double> scores,
        int accepted,
        int needsRevision,
        int rejected,
        int improved,
        int regenerationAttempts,
        ScoreStatistics statistics,
        String regenerationError
) {

    public Map<String, Object> toMetadata() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("accepted", accepted);
        metadata.put("needsRevision", needsRevision);
        metadata.put("rejected", rejected);
        metadata.put("improved", improved);
        metadata.put("regenerationAttempts", regenerationAttempts);
        metadata.put("statistics", statistics);
        if (regenerationError != null) {
            metadata.put("regenerationError", regenerationError);
        }
        return metadata;
    }
}
