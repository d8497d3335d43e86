package uk.gegc.quizforge.shared.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.quizforge.features.generation.domain.model.Difficulty;
import uk.gegc.quizforge.features.generation.domain.model.GenerationOptions;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Fingerprints")
class FingerprintsTest {

    @Test
    @DisplayName("hashText ignores surrounding whitespace and case")
    void hashTextNormalizesWhitespaceAndCase() {
        assertThat(Fingerprints.hashText("  Photosynthesis Basics \n"))
                .isEqualTo(Fingerprints.hashText("photosynthesis basics"));
        assertThat(Fingerprints.hashText("photosynthesis basics"))
                .isNotEqualTo(Fingerprints.hashText("photosynthesis  basics"));
    }

    @Test
    @DisplayName("hashOptions treats unset values and their defaults as equal")
    void hashOptionsMaterializesDefaults() {
        GenerationOptions implicit = GenerationOptions.defaults();
        GenerationOptions explicit = GenerationOptions.builder()
                .numQuestions(GenerationOptions.DEFAULT_NUM_QUESTIONS)
                .bloomLevel(GenerationOptions.DEFAULT_BLOOM_LEVEL)
                .difficulty(Difficulty.MIXED)
                .qualityCheck(true)
                .build();

        assertThat(Fingerprints.hashOptions(implicit, null))
                .isEqualTo(Fingerprints.hashOptions(explicit, "default"));
    }

    @Test
    @DisplayName("hashOptions ignores distribution key order and label case")
    void hashOptionsIsOrderIndependent() {
        Map<String, Integer> first = new LinkedHashMap<>();
        first.put("easy", 3);
        first.put("hard", 2);
        Map<String, Integer> second = new LinkedHashMap<>();
        second.put("HARD", 2);
        second.put("Easy", 3);

        GenerationOptions a = GenerationOptions.builder().numQuestions(5).difficultyDistribution(first).build();
        GenerationOptions b = GenerationOptions.builder().numQuestions(5).difficultyDistribution(second).build();

        assertThat(Fingerprints.hashOptions(a, "gemini")).isEqualTo(Fingerprints.hashOptions(b, "gemini"));
    }

    @Test
    @DisplayName("hashOptions differs by provider and by question count")
    void hashOptionsSeparatesProvidersAndCounts() {
        GenerationOptions five = GenerationOptions.builder().numQuestions(5).build();

        assertThat(Fingerprints.hashOptions(five, "gemini")).isNotEqualTo(Fingerprints.hashOptions(five, "openai"));
        assertThat(Fingerprints.hashOptions(five, "gemini"))
                .isNotEqualTo(Fingerprints.hashOptions(five.withNumQuestions(6), "gemini"));
    }

    @Test
    @DisplayName("fingerprint joins text and options hashes")
    void fingerprintComposesBothHashes() {
        GenerationOptions options = GenerationOptions.defaults();

        String fingerprint = Fingerprints.fingerprint("Some text", options, "gemini");

        assertThat(fingerprint).isEqualTo(
                Fingerprints.hashText("Some text") + "-" + Fingerprints.hashOptions(options, "gemini"));
        assertThat(fingerprint).matches("[0-9a-f]{64}-[0-9a-f]{64}");
    }
}
