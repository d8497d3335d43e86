package uk.gegc.quizforge.features.generation.application.balance;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import uk.gegc.quizforge.features.generation.config.GenerationProperties;
import uk.gegc.quizforge.features.generation.domain.model.Difficulty;
import uk.gegc.quizforge.features.generation.domain.model.Question;
import uk.gegc.quizforge.shared.exception.ProviderException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static uk.gegc.quizforge.testsupport.TestQuestions.questions;

@DisplayName("DifficultyBalancer")
class DifficultyBalancerTest {

    private GenerationProperties properties;
    private DifficultyBalancer balancer;

    @BeforeEach
    void setUp() {
        properties = new GenerationProperties();
        balancer = new DifficultyBalancer(properties);
    }

    private static List<Question> mix(int easy, int medium, int hard) {
        List<Question> mixed = new ArrayList<>();
        mixed.addAll(questions(0, easy, Difficulty.EASY));
        mixed.addAll(questions(easy, medium, Difficulty.MEDIUM));
        mixed.addAll(questions(easy + medium, hard, Difficulty.HARD));
        return mixed;
    }

    @Nested
    @DisplayName("targets")
    class Targets {

        @Test
        @DisplayName("needed counts round each bucket and give the remainder to medium")
        void calculateNeeded() {
            assertThat(balancer.calculateNeeded(10))
                    .containsEntry(Difficulty.EASY, 3).containsEntry(Difficulty.MEDIUM, 4).containsEntry(Difficulty.HARD, 3);
            assertThat(balancer.calculateNeeded(2))
                    .containsEntry(Difficulty.EASY, 1).containsEntry(Difficulty.MEDIUM, 0).containsEntry(Difficulty.HARD, 1);
        }

        @Test
        @DisplayName("a single requested difficulty targets one bucket")
        void singleDifficultyTarget() {
            assertThat(balancer.getTargetDistribution(Difficulty.HARD))
                    .containsEntry(Difficulty.HARD, 1.0).containsEntry(Difficulty.EASY, 0.0);
        }

        @Test
        @DisplayName("shares within the tolerance count as balanced")
        void isBalanced() {
            assertThat(balancer.isBalanced(balancer.calculateDistribution(mix(3, 4, 3)))).isTrue();
            assertThat(balancer.isBalanced(balancer.calculateDistribution(mix(2, 5, 3)))).isTrue();
            assertThat(balancer.isBalanced(balancer.calculateDistribution(mix(0, 10, 0)))).isFalse();
        }

        @Test
        @DisplayName("statistics report the distribution against the target")
        void statistics() {
            Map<String, Object> statistics = balancer.getStatistics(mix(0, 10, 0));

            assertThat(statistics).containsEntry("balanced", false).containsEntry("maxDeviation", 0.6);
        }
    }

    @Nested
    @DisplayName("balance")
    class Balance {

        @Test
        @DisplayName("a balanced set is returned unchanged and balancing it again is a no-op")
        void fixedPoint() {
            // Given
            List<Question> input = mix(3, 4, 3);

            // When
            BalanceResult first = balancer.balance(input, (count, difficulty) -> {
                throw new AssertionError("should not regenerate");
            });
            BalanceResult second = balancer.balance(first.questions(), null);

            // Then
            assertThat(first.balanced()).isTrue();
            assertThat(first.attempts()).isZero();
            assertThat(first.questions()).containsExactlyElementsOf(input);
            assertThat(second.questions()).containsExactlyElementsOf(first.questions());
            assertThat(second.reason()).isEqualTo("already balanced");
        }

        @Test
        @DisplayName("an all-medium set is trimmed and topped up with easy and hard questions")
        void regeneratesMissingBuckets() {
            // Given
            List<Question> input = questions(0, 10, Difficulty.MEDIUM);
            List<String> requests = new ArrayList<>();

            // When
            BalanceResult result = balancer.balance(input, (count, difficulty) -> {
                requests.add(count + " " + difficulty.getValue());
                int seed = difficulty == Difficulty.EASY ? 20 : 25;
                return questions(seed, count, difficulty);
            });

            // Then
            assertThat(requests).containsExactly("3 easy", "3 hard");
            assertThat(result.balanced()).isTrue();
            assertThat(result.attempts()).isEqualTo(1);
            assertThat(result.removedCount()).isEqualTo(6);
            assertThat(result.addedCount()).isEqualTo(6);
            assertThat(result.distribution().counts())
                    .containsEntry(Difficulty.EASY, 3).containsEntry(Difficulty.MEDIUM, 4).containsEntry(Difficulty.HARD, 3);
            assertThat(result.questions().subList(0, 4)).containsExactlyElementsOf(input.subList(0, 4));
        }

        @Test
        @DisplayName("a surplus with no bucket short is balanced by removal alone")
        void removalOnly() {
            BalanceResult result = balancer.balance(mix(4, 4, 4), 10, null);

            assertThat(result.reason()).isEqualTo("balanced by removal");
            assertThat(result.questions()).hasSize(10);
            assertThat(result.removedCount()).isEqualTo(2);
            assertThat(result.balanced()).isTrue();
        }

        @Test
        @DisplayName("regenerated questions of the wrong difficulty are not added and nothing is trimmed")
        void ignoresWrongDifficulty() {
            properties.getBalance().setMaxRetries(1);
            List<Question> input = questions(0, 10, Difficulty.MEDIUM);

            BalanceResult result = balancer.balance(input,
                    (count, difficulty) -> questions(20, count, Difficulty.MEDIUM));

            assertThat(result.balanced()).isFalse();
            assertThat(result.reason()).isEqualTo("max attempts reached");
            assertThat(result.addedCount()).isZero();
            assertThat(result.removedCount()).isZero();
            assertThat(result.questions()).containsExactlyElementsOf(input);
        }

        @Test
        @DisplayName("a regeneration failure keeps every question it was given")
        void regenerationFailure() {
            List<Question> input = questions(0, 10, Difficulty.MEDIUM);

            BalanceResult result = balancer.balance(input, 10, (count, difficulty) -> {
                throw new ProviderException("gemini", "offline");
            });

            assertThat(result.balanced()).isFalse();
            assertThat(result.reason()).isEqualTo("regeneration failed: offline");
            assertThat(result.questions()).containsExactlyElementsOf(input);
            assertThat(result.removedCount()).isZero();
            assertThat(result.toMetadata()).containsEntry("balanced", false);
        }

        @Test
        @DisplayName("a failure after one bucket was filled keeps the originals plus the new questions")
        void partialRegenerationFailure() {
            List<Question> input = questions(0, 10, Difficulty.MEDIUM);

            BalanceResult result = balancer.balance(input, (count, difficulty) -> {
                if (difficulty == Difficulty.HARD) {
                    throw new ProviderException("gemini", "offline");
                }
                return questions(20, count, difficulty);
            });

            assertThat(result.balanced()).isFalse();
            assertThat(result.questions()).hasSize(13);
            assertThat(result.questions().subList(0, 10)).containsExactlyElementsOf(input);
            assertThat(result.addedCount()).isEqualTo(3);
        }

        @Test
        @DisplayName("without a regeneration function an unbalanced set is reported as is")
        void noRegeneration() {
            BalanceResult result = balancer.balance(questions(0, 10, Difficulty.MEDIUM), null);

            assertThat(result.balanced()).isFalse();
            assertThat(result.reason()).isEqualTo("no regeneration available");
            assertThat(result.questions()).hasSize(10);
        }
    }
}
