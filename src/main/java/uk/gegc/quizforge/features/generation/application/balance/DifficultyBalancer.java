package uk.gegc.quizforge.features.generation.application.balance;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.quizforge.features.generation.config.GenerationProperties;
import uk.gegc.quizforge.features.generation.domain.model.Difficulty;
import uk.gegc.quizforge.features.generation.domain.model.Question;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;

/**
 * Steers a question set towards the target easy/medium/hard split.
 *
 * <p>A set is balanced when no bucket's share deviates from its target by more than the
 * tolerance, or when its counts already equal the rounded targets. Deficits are filled through
 * the caller's regeneration function. Surplus buckets are trimmed in arrival order only once no
 * bucket is short, so an unbalanced result never holds fewer questions than it was given.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DifficultyBalancer {

    private final GenerationProperties properties;

    public boolean isEnabled() {
        return properties.getBalance().isEnabled();
    }

    public DifficultyDistribution calculateDistribution(List<Question> questions) {
        Map<Difficulty, Integer> counts = new EnumMap<>(Difficulty.class);
        for (Difficulty difficulty : Difficulty.CONCRETE) {
            counts.put(difficulty, 0);
        }
        for (Question question : questions) {
            Difficulty difficulty = question.difficulty() != null && question.difficulty().isConcrete()
                    ? question.difficulty()
                    : Difficulty.MEDIUM;
            counts.merge(difficulty, 1, Integer::sum);
        }
        Map<Difficulty, Double> percentages = new EnumMap<>(Difficulty.class);
        int total = questions.size();
        counts.forEach((difficulty, count) ->
                percentages.put(difficulty, total == 0 ? 0.0 : (double) count / total));
        return new DifficultyDistribution(total, counts, percentages);
    }

    public boolean isBalanced(DifficultyDistribution distribution) {
        if (distribution.total() == 0) {
            return true;
        }
        Map<Difficulty, Double> target = getTargetDistribution(Difficulty.MIXED);
        double tolerance = properties.getBalance().getTolerance();
        for (Difficulty difficulty : Difficulty.CONCRETE) {
            if (Math.abs(distribution.share(difficulty) - target.get(difficulty)) > tolerance + 1e-9) {
                return false;
            }
        }
        return true;
    }

    /**
     * Target count per bucket for the given total; rounding remainder goes to medium.
     */
    public Map<Difficulty, Integer> calculateNeeded(int total) {
        Map<Difficulty, Double> target = getTargetDistribution(Difficulty.MIXED);
        Map<Difficulty, Integer> needed = new EnumMap<>(Difficulty.class);
        int easy = (int) Math.round(total * target.get(Difficulty.EASY));
        int hard = (int) Math.round(total * target.get(Difficulty.HARD));
        int medium = (int) Math.round(total * target.get(Difficulty.MEDIUM));
        medium += total - (easy + medium + hard);
        needed.put(Difficulty.EASY, easy);
        needed.put(Difficulty.MEDIUM, medium);
        needed.put(Difficulty.HARD, hard);
        return needed;
    }

    /**
     * Target shares for a requested difficulty: the configured split for mixed,
     * everything in one bucket otherwise.
     */
    public Map<Difficulty, Double> getTargetDistribution(Difficulty requested) {
        Map<Difficulty, Double> target = new EnumMap<>(Difficulty.class);
        if (requested == null || requested == Difficulty.MIXED) {
            GenerationProperties.Balance balance = properties.getBalance();
            target.put(Difficulty.EASY, balance.getEasy());
            target.put(Difficulty.MEDIUM, balance.getMedium());
            target.put(Difficulty.HARD, balance.getHard());
            return target;
        }
        for (Difficulty difficulty : Difficulty.CONCRETE) {
            target.put(difficulty, difficulty == requested ? 1.0 : 0.0);
        }
        return target;
    }

    public Map<String, Object> getStatistics(List<Question> questions) {
        DifficultyDistribution distribution = calculateDistribution(questions);
        Map<Difficulty, Double> target = getTargetDistribution(Difficulty.MIXED);
        double maxDeviation = 0;
        for (Difficulty difficulty : Difficulty.CONCRETE) {
            maxDeviation = Math.max(maxDeviation, Math.abs(distribution.share(difficulty) - target.get(difficulty)));
        }
        Map<String, Object> statistics = new LinkedHashMap<>();
        statistics.put("distribution", distribution);
        statistics.put("target", target);
        statistics.put("maxDeviation", Math.round(maxDeviation * 1000) / 1000.0);
        statistics.put("tolerance", properties.getBalance().getTolerance());
        statistics.put("balanced", isBalanced(distribution));
        return statistics;
    }

    public BalanceResult balance(List<Question> questions,
                                 BiFunction<Integer, Difficulty, List<Question>> regenerateFn) {
        return balance(questions, questions.size(), regenerateFn);
    }

    /**
     * Balances the set towards the target split of {@code targetTotal} questions. A set larger
     * than the target with no bucket short is balanced by removal alone.
     *
     * @param regenerateFn produces {@code count} questions of the given difficulty, may be null
     */
    public BalanceResult balance(List<Question> questions,
                                 int targetTotal,
                                 BiFunction<Integer, Difficulty, List<Question>> regenerateFn) {
        Map<Difficulty, Integer> needed = calculateNeeded(targetTotal);
        int maxRetries = properties.getBalance().getMaxRetries();
        List<Question> current = questions;
        int attempts = 0;
        int removed = 0;
        int added = 0;

        while (true) {
            DifficultyDistribution distribution = calculateDistribution(current);
            if ((isBalanced(distribution) && current.size() <= targetTotal) || matches(distribution, needed)) {
                return new BalanceResult(current, true, attempts, distribution, removed, added,
                        attempts == 0 ? "already balanced" : "balanced after regeneration");
            }

            Map<Difficulty, Integer> deficits = deficits(distribution, needed);
            int totalDeficit = deficits.values().stream().mapToInt(Integer::intValue).sum();
            if (totalDeficit == 0) {
                List<Question> trimmed = keepPerBucket(current, needed);
                removed += current.size() - trimmed.size();
                DifficultyDistribution after = calculateDistribution(trimmed);
                log.info("Balanced difficulty by removing {} surplus questions", current.size() - trimmed.size());
                return new BalanceResult(trimmed, isBalanced(after) || matches(after, needed), attempts, after,
                        removed, added, added > 0 ? "balanced after regeneration" : "balanced by removal");
            }

            if (regenerateFn == null || attempts >= maxRetries) {
                return new BalanceResult(current, false, attempts, distribution, removed, added,
                        regenerateFn == null ? "no regeneration available" : "max attempts reached");
            }
            attempts++;

            List<Question> next = new ArrayList<>(current);
            Map<Difficulty, Integer> room = new EnumMap<>(deficits);
            for (Map.Entry<Difficulty, Integer> deficit : deficits.entrySet()) {
                if (deficit.getValue() <= 0) {
                    continue;
                }
                log.info("Regenerating {} {} questions to balance difficulty (attempt {}/{})",
                        deficit.getValue(), deficit.getKey().getValue(), attempts, maxRetries);
                List<Question> fresh;
                try {
                    fresh = regenerateFn.apply(deficit.getValue(), deficit.getKey());
                } catch (RuntimeException e) {
                    log.warn("Regeneration of {} questions failed: {}", deficit.getKey().getValue(), e.getMessage());
                    return new BalanceResult(next, false, attempts, calculateDistribution(next), removed, added,
                            "regeneration failed: " + e.getMessage());
                }
                for (Question question : fresh) {
                    Difficulty bucket = question.difficulty() != null && question.difficulty().isConcrete()
                            ? question.difficulty()
                            : Difficulty.MEDIUM;
                    if (room.getOrDefault(bucket, 0) > 0) {
                        next.add(question);
                        room.merge(bucket, -1, Integer::sum);
                        added++;
                    }
                }
            }
            current = next;
        }
    }

    private static boolean matches(DifficultyDistribution distribution, Map<Difficulty, Integer> needed) {
        for (Difficulty difficulty : Difficulty.CONCRETE) {
            if (distribution.count(difficulty) != needed.get(difficulty)) {
                return false;
            }
        }
        return true;
    }

    private static Map<Difficulty, Integer> deficits(DifficultyDistribution distribution, Map<Difficulty, Integer> needed) {
        Map<Difficulty, Integer> deficits = new EnumMap<>(Difficulty.class);
        for (Difficulty difficulty : Difficulty.CONCRETE) {
            deficits.put(difficulty, Math.max(0, needed.get(difficulty) - distribution.count(difficulty)));
        }
        return deficits;
    }

    /**
     * Keeps at most the needed number per bucket, in arrival order.
     */
    private static List<Question> keepPerBucket(List<Question> questions, Map<Difficulty, Integer> needed) {
        Map<Difficulty, Integer> remaining = new EnumMap<>(needed);
        List<Question> kept = new ArrayList<>();
        for (Question question : questions) {
            Difficulty bucket = question.difficulty() != null && question.difficulty().isConcrete()
                    ? question.difficulty()
                    : Difficulty.MEDIUM;
            if (remaining.getOrDefault(bucket, 0) > 0) {
                kept.add(question);
                remaining.merge(bucket, -1, Integer::sum);
            }
        }
        return kept;
    }
}
