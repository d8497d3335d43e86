package uk.gegc.quizforge.features.generation.application.dedup;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.quizforge.features.generation.config.GenerationProperties;
import uk.gegc.quizforge.features.generation.domain.model.Question;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Greedy clustering of near-duplicate questions.
 *
 * <p>Questions are visited in order; each unclustered question opens a cluster and pulls in
 * every later unclustered question whose similarity reaches the threshold. One representative
 * per cluster is kept, at the position of the cluster's first member.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class Deduplicator {

    /**
     * Options only count once the stems are at least this similar
     */
    static final double OPTION_COMPARISON_FLOOR = 50.0;
    static final double STEM_WEIGHT = 0.7;
    static final double OPTIONS_WEIGHT = 0.3;

    private final GenerationProperties properties;

    public boolean isEnabled() {
        return properties.getDedup().isEnabled();
    }

    public DeduplicationResult deduplicate(List<Question> questions) {
        return deduplicate(questions, Map.of());
    }

    /**
     * @param scores quality scores by question; when present the best-scored member of a
     *               cluster is kept, otherwise the first seen
     */
    public DeduplicationResult deduplicate(List<Question> questions, Map<Question, Double> scores) {
        double threshold = properties.getDedup().getThreshold();
        int n = questions.size();
        boolean[] clustered = new boolean[n];
        List<Question> kept = new ArrayList<>();
        List<DuplicateGroup> groups = new ArrayList<>();
        int removed = 0;

        for (int i = 0; i < n; i++) {
            if (clustered[i]) {
                continue;
            }
            clustered[i] = true;
            List<Integer> members = new ArrayList<>();
            List<Double> similarities = new ArrayList<>();
            members.add(i);
            similarities.add(100.0);
            for (int j = i + 1; j < n; j++) {
                if (clustered[j]) {
                    continue;
                }
                double similarity = similarity(questions.get(i), questions.get(j));
                if (similarity >= threshold) {
                    clustered[j] = true;
                    members.add(j);
                    similarities.add(similarity);
                }
            }

            int representative = pickRepresentative(members, questions, scores);
            kept.add(questions.get(representative));
            if (members.size() > 1) {
                List<DuplicateGroup.Removal> removals = new ArrayList<>();
                for (int m = 0; m < members.size(); m++) {
                    int index = members.get(m);
                    if (index != representative) {
                        removals.add(new DuplicateGroup.Removal(index, questions.get(index).stem(),
                                Math.round(similarities.get(m) * 10) / 10.0));
                    }
                }
                removed += removals.size();
                groups.add(new DuplicateGroup(representative, questions.get(representative).stem(), removals));
            }
        }

        if (removed > 0) {
            log.info("Deduplication removed {} of {} questions in {} groups", removed, n, groups.size());
        }
        return new DeduplicationResult(kept, removed, removed, kept.size(), groups);
    }

    /**
     * Similarity of two questions, 0-100.
     */
    public double similarity(Question first, Question second) {
        double stem = TextSimilarity.similarity(first.stem(), second.stem());
        if (!properties.getDedup().isCompareOptions() || stem < OPTION_COMPARISON_FLOOR) {
            return stem;
        }
        double options = TextSimilarity.similarity(String.join(" ", first.options()), String.join(" ", second.options()));
        return STEM_WEIGHT * stem + OPTIONS_WEIGHT * options;
    }

    private static int pickRepresentative(List<Integer> members, List<Question> questions, Map<Question, Double> scores) {
        if (scores == null || scores.isEmpty()) {
            return members.get(0);
        }
        int best = members.get(0);
        double bestScore = scores.getOrDefault(questions.get(best), Double.NEGATIVE_INFINITY);
        for (int index : members) {
            double score = scores.getOrDefault(questions.get(index), Double.NEGATIVE_INFINITY);
            if (score > bestScore) {
                best = index;
                bestScore = score;
            }
        }
        return best;
    }
}
