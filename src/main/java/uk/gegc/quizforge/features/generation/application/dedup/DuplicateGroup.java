package uk.gegc.quizforge.features.generation.application.dedup;

import java.util.List;

/**
 * A cluster of near-duplicates. Indexes refer to the deduplicated input.
 *
 * @param representative index of the kept question
 * @param duplicates     indexes of the removed questions, with their similarity to the representative
 */
public record DuplicateGroup(int representative, String representativeStem, List<Removal> duplicates) {

    public record Removal(int index, String stem, double similarity) {
    }
}
