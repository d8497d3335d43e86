package uk.gegc.quizforge.features.generation.application.dedup;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("TextSimilarity")
class TextSimilarityTest {

    @Test
    @DisplayName("normalize lower-cases, strips punctuation and articles, collapses whitespace")
    void normalize() {
        assertThat(TextSimilarity.normalize("  What is THE capital   of a country?! "))
                .isEqualTo("what is capital of country");
        assertThat(TextSimilarity.normalize(null)).isEmpty();
    }

    @Test
    @DisplayName("texts equal after normalization score 100")
    void equalAfterNormalization() {
        assertThat(TextSimilarity.similarity("What is the capital of France?", "what is capital of  France"))
                .isEqualTo(100.0);
    }

    @Test
    @DisplayName("an empty side scores 0")
    void emptySide() {
        assertThat(TextSimilarity.similarity("", "anything")).isZero();
    }

    @Test
    @DisplayName("unrelated questions score low and near-paraphrases score high")
    void ordering() {
        double unrelated = TextSimilarity.similarity(
                "Which organelle produces most cellular energy?", "Who painted the Mona Lisa?");
        double paraphrase = TextSimilarity.similarity(
                "Which organelle produces most cellular energy?", "Which organelle produces the most cellular energy");
        double reworded = TextSimilarity.similarity(
                "Which organelle produces most cellular energy?", "Which organelle generates most cellular energy?");

        assertThat(unrelated).isLessThan(30.0);
        assertThat(paraphrase).isEqualTo(100.0);
        assertThat(reworded).isBetween(60.0, 99.0);
    }

    @Test
    @DisplayName("component measures match their textbook values")
    void components() {
        assertThat(TextSimilarity.levenshtein("kitten", "sitting")).isEqualTo(3);
        assertThat(TextSimilarity.levenshteinSimilarity("kitten", "sitting")).isCloseTo(1 - 3 / 7.0, within(1e-9));
        assertThat(TextSimilarity.jaccard(List.of("a", "b", "c"), List.of("b", "c", "d"))).isEqualTo(0.5);
        assertThat(TextSimilarity.cosine(List.of("x", "y"), List.of("x", "y"))).isCloseTo(1.0, within(1e-9));
        assertThat(TextSimilarity.cosine(List.of("x"), List.of("y"))).isZero();
    }
}
