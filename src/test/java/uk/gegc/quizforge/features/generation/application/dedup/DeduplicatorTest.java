package uk.gegc.quizforge.features.generation.application.dedup;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.quizforge.features.generation.config.GenerationProperties;
import uk.gegc.quizforge.features.generation.domain.model.Difficulty;
import uk.gegc.quizforge.features.generation.domain.model.Question;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static uk.gegc.quizforge.testsupport.TestQuestions.question;
import static uk.gegc.quizforge.testsupport.TestQuestions.questions;

@DisplayName("Deduplicator")
class DeduplicatorTest {

    private GenerationProperties properties;
    private Deduplicator deduplicator;

    @BeforeEach
    void setUp() {
        properties = new GenerationProperties();
        deduplicator = new Deduplicator(properties);
    }

    private static Question reworded(Question original, String stem) {
        return original.toBuilder().stem(stem).build();
    }

    @Test
    @DisplayName("a whitespace-only variant with the same options is removed, keeping the first")
    void removesWhitespaceVariant() {
        // Given
        List<Question> input = new ArrayList<>(questions(0, 5, Difficulty.MEDIUM));
        Question variant = reworded(input.get(0), "  Which organelle   produces most cellular energy? ");
        input.add(1, variant);

        // When
        DeduplicationResult result = deduplicator.deduplicate(input);

        // Then
        assertThat(result.questions()).containsExactlyElementsOf(questions(0, 5, Difficulty.MEDIUM));
        assertThat(result.duplicatesRemoved()).isEqualTo(1);
        assertThat(result.kept()).isEqualTo(5);
        assertThat(result.groups()).singleElement().satisfies(group -> {
            assertThat(group.representative()).isZero();
            assertThat(group.duplicates()).singleElement().satisfies(removal -> {
                assertThat(removal.index()).isEqualTo(1);
                assertThat(removal.similarity()).isEqualTo(100.0);
            });
        });
    }

    @Test
    @DisplayName("distinct questions pass through untouched")
    void keepsDistinct() {
        List<Question> input = questions(0, 20, Difficulty.MEDIUM);

        DeduplicationResult result = deduplicator.deduplicate(input);

        assertThat(result.questions()).containsExactlyElementsOf(input);
        assertThat(result.duplicatesFound()).isZero();
        assertThat(result.groups()).isEmpty();
    }

    @Test
    @DisplayName("running it twice changes nothing the second time")
    void idempotent() {
        // Given
        List<Question> input = new ArrayList<>(questions(0, 6, Difficulty.MEDIUM));
        input.add(reworded(input.get(2), input.get(2).stem().toUpperCase()));
        input.add(reworded(input.get(4), input.get(4).stem() + "  "));

        // When
        DeduplicationResult once = deduplicator.deduplicate(input);
        DeduplicationResult twice = deduplicator.deduplicate(once.questions());

        // Then
        assertThat(once.duplicatesRemoved()).isEqualTo(2);
        assertThat(twice.questions()).containsExactlyElementsOf(once.questions());
        assertThat(twice.duplicatesRemoved()).isZero();
    }

    @Test
    @DisplayName("with scores the best-scored cluster member is kept")
    void keepsBestScored() {
        // Given
        Question first = question(0);
        Question better = reworded(first, "which organelle produces most cellular energy");
        List<Question> input = List.of(first, question(1), better);

        // When
        DeduplicationResult result = deduplicator.deduplicate(input, Map.of(first, 6.0, better, 9.0));

        // Then
        assertThat(result.questions()).containsExactly(better, question(1));
        assertThat(result.groups().get(0).representative()).isEqualTo(2);
    }

    @Test
    @DisplayName("identical stems with unrelated options are kept apart when options are compared")
    void optionsDistinguishSameStem() {
        // Given
        Question first = question(0);
        Question sameStemOtherOptions = question(1).toBuilder().stem(first.stem()).build();

        // When & Then
        assertThat(deduplicator.similarity(first, sameStemOtherOptions)).isLessThan(85.0);
        assertThat(deduplicator.deduplicate(List.of(first, sameStemOtherOptions)).duplicatesRemoved()).isZero();

        properties.getDedup().setCompareOptions(false);
        assertThat(deduplicator.similarity(first, sameStemOtherOptions)).isEqualTo(100.0);
    }
}
