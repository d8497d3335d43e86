package uk.gegc.quizforge.features.generation.application.balance;

import uk.gegc.quizforge.features.generation.domain.model.Difficulty;

import java.util.Map;

/**
 * Counts and shares (0-1) per concrete difficulty.
 */
public record DifficultyDistribution(int total, Map<Difficulty, Integer> counts, Map<Difficulty, Double> percentages) {

    public int count(Difficulty difficulty) {
        return counts.getOrDefault(difficulty, 0);
    }

    public double share(Difficulty difficulty) {
        return percentages.getOrDefault(difficulty, 0.0);
    }
}
