package uk.gegc.quizforge.features.generation.application.quality;

import java.util.List;

/**
 * Aggregate over the scores of one scoring run. A score passes at or above the minimum score.
 */
public record ScoreStatistics(
        int count,
        double average,
        double min,
        double max,
        int passed,
        int failed,
        int skipped
) {

    public static ScoreStatistics of(List<QuestionScore> scores, double minScore) {
        if (scores.isEmpty()) {
            return new ScoreStatistics(0, 0, 0, 0, 0, 0, 0);
        }
        double sum = 0;
        double min = Double.MAX_VALUE;
        double max = -Double.MAX_VALUE;
        int passed = 0;
        int skipped = 0;
        for (QuestionScore score : scores) {
            sum += score.score();
            min = Math.min(min, score.score());
            max = Math.max(max, score.score());
            if (score.skipped()) {
                skipped++;
            }
            if (score.skipped() || score.score() >= minScore) {
                passed++;
            }
        }
        double average = Math.round(sum / scores.size() * 100) / 100.0;
        return new ScoreStatistics(scores.size(), average, min, max, passed, scores.size() - passed, skipped);
    }
}
