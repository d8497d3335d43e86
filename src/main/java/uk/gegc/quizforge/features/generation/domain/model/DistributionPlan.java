package uk.gegc.quizforge.features.generation.domain.model;

import uk.gegc.quizforge.shared.exception.QuestionValidationException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Explicit per (difficulty, bloom level) question counts. Built once from the
 * requested distributions and then passed along unchanged.
 */
public record DistributionPlan(List<Entry> entries) {

    public record Entry(Difficulty difficulty, CognitiveLevel bloomLevel, int count) {
    }

    public DistributionPlan {
        entries = List.copyOf(entries);
    }

    public int total() {
        return entries.stream().mapToInt(Entry::count).sum();
    }

    /**
     * The part of this plan covering questions {@code [offset, offset + count)} when the
     * entries are laid out in order. Used to give each fan-out chunk its share of the plan.
     */
    public DistributionPlan slice(int offset, int count) {
        List<Entry> sliced = new ArrayList<>();
        int position = 0;
        int end = offset + count;
        for (Entry entry : entries) {
            int from = Math.max(position, offset);
            int to = Math.min(position + entry.count(), end);
            if (to > from) {
                sliced.add(new Entry(entry.difficulty(), entry.bloomLevel(), to - from));
            }
            position += entry.count();
        }
        return new DistributionPlan(sliced);
    }

    /**
     * Builds the plan for the given options. The two marginal distributions are paired in
     * order (north-west corner allocation); a missing dimension is filled from the single
     * requested bloom level or difficulty, with "mixed" split 30/40/30.
     *
     * @throws QuestionValidationException if a label is unknown or counts do not sum to numQuestions
     */
    public static DistributionPlan from(GenerationOptions options) {
        int total = options.numQuestionsOrDefault();

        Map<Difficulty, Integer> difficulties = options.getDifficultyDistribution() != null
                && !options.getDifficultyDistribution().isEmpty()
                ? parseDifficulties(options.getDifficultyDistribution(), total)
                : defaultDifficulties(options.difficultyOrDefault(), total);

        Map<CognitiveLevel, Integer> blooms = options.getBloomDistribution() != null
                && !options.getBloomDistribution().isEmpty()
                ? parseBlooms(options.getBloomDistribution(), total)
                : Map.of(options.bloomLevelOrDefault(), total);

        List<Map.Entry<Difficulty, Integer>> rows = new ArrayList<>(difficulties.entrySet());
        List<Map.Entry<CognitiveLevel, Integer>> cols = new ArrayList<>(blooms.entrySet());
        int[] rowLeft = rows.stream().mapToInt(Map.Entry::getValue).toArray();
        int[] colLeft = cols.stream().mapToInt(Map.Entry::getValue).toArray();

        List<Entry> entries = new ArrayList<>();
        int r = 0;
        int c = 0;
        while (r < rows.size() && c < cols.size()) {
            int take = Math.min(rowLeft[r], colLeft[c]);
            if (take > 0) {
                entries.add(new Entry(rows.get(r).getKey(), cols.get(c).getKey(), take));
            }
            rowLeft[r] -= take;
            colLeft[c] -= take;
            if (rowLeft[r] == 0) {
                r++;
            }
            if (c < cols.size() && colLeft[c] == 0) {
                c++;
            }
        }
        return new DistributionPlan(entries);
    }

    /**
     * Splits a count 30/40/30 over easy/medium/hard, rounding remainder into medium.
     */
    public static Map<Difficulty, Integer> mixedSplit(int total) {
        int easy = (int) Math.round(total * 0.30);
        int hard = (int) Math.round(total * 0.30);
        int medium = total - easy - hard;
        Map<Difficulty, Integer> split = new LinkedHashMap<>();
        split.put(Difficulty.EASY, easy);
        split.put(Difficulty.MEDIUM, medium);
        split.put(Difficulty.HARD, hard);
        return split;
    }

    private static Map<Difficulty, Integer> defaultDifficulties(Difficulty difficulty, int total) {
        if (difficulty == Difficulty.MIXED) {
            return mixedSplit(total);
        }
        return Map.of(difficulty, total);
    }

    private static Map<Difficulty, Integer> parseDifficulties(Map<String, Integer> raw, int total) {
        Map<Difficulty, Integer> parsed = new LinkedHashMap<>();
        for (Difficulty difficulty : Difficulty.CONCRETE) {
            parsed.put(difficulty, 0);
        }
        raw.forEach((label, count) -> {
            Difficulty difficulty = Difficulty.parse(label)
                    .filter(Difficulty::isConcrete)
                    .orElseThrow(() -> new QuestionValidationException("Unknown difficulty in distribution: " + label));
            parsed.merge(difficulty, requireCount(label, count), Integer::sum);
        });
        requireTotal("difficultyDistribution", parsed.values(), total);
        return parsed;
    }

    private static Map<CognitiveLevel, Integer> parseBlooms(Map<String, Integer> raw, int total) {
        Map<CognitiveLevel, Integer> parsed = new LinkedHashMap<>();
        for (CognitiveLevel level : CognitiveLevel.values()) {
            parsed.put(level, 0);
        }
        raw.forEach((label, count) -> {
            CognitiveLevel level = CognitiveLevel.parse(label)
                    .orElseThrow(() -> new QuestionValidationException("Unknown bloom level in distribution: " + label));
            parsed.merge(level, requireCount(label, count), Integer::sum);
        });
        requireTotal("bloomDistribution", parsed.values(), total);
        return parsed;
    }

    private static int requireCount(String label, Integer count) {
        if (count == null || count < 0) {
            throw new QuestionValidationException("Invalid count for '" + label + "': " + count);
        }
        return count;
    }

    private static void requireTotal(String name, Iterable<Integer> counts, int total) {
        int sum = 0;
        for (Integer count : counts) {
            sum += count;
        }
        if (sum != total) {
            throw new QuestionValidationException(
                    name + " sums to " + sum + " but numQuestions is " + total);
        }
    }
}
