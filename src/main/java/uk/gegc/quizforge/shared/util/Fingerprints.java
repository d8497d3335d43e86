package uk.gegc.quizforge.shared.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import uk.gegc.quizforge.features.generation.domain.model.GenerationOptions;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Content-addressed keys for (text, options) pairs.
 *
 * <p>Text is hashed after trimming and lower-casing, so whitespace-only and case-only edits
 * collide. Options are hashed over a normalized record: recognized keys only, defaults
 * materialized, keys sorted, provider included.
 */
public final class Fingerprints {

    public static final String DEFAULT_PROVIDER_KEY = "default";

    private static final ObjectMapper CANONICAL_MAPPER = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private Fingerprints() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static String hashText(String text) {
        String normalized = text == null ? "" : text.trim().toLowerCase(Locale.ROOT);
        return sha256(normalized);
    }

    public static String hashOptions(GenerationOptions options, String provider) {
        try {
            return sha256(CANONICAL_MAPPER.writeValueAsString(normalize(options, provider)));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize options for hashing", e);
        }
    }

    public static String fingerprint(String text, GenerationOptions options, String provider) {
        return hashText(text) + "-" + hashOptions(options, provider);
    }

    /**
     * The normalized options record that is hashed. Exposed for diagnostics and tests.
     */
    public static Map<String, Object> normalize(GenerationOptions options, String provider) {
        GenerationOptions source = options != null ? options : GenerationOptions.defaults();
        Map<String, Object> normalized = new TreeMap<>();
        normalized.put("numQuestions", source.numQuestionsOrDefault());
        normalized.put("bloomLevel", source.bloomLevelOrDefault().getValue());
        normalized.put("difficulty", source.difficultyOrDefault().getValue());
        normalized.put("parallel", source.parallelAllowed());
        normalized.put("noCache", source.cacheDisabled());
        normalized.put("qualityCheck", source.qualityCheckEnabled());
        normalized.put("deduplicate", source.deduplicateEnabled());
        normalized.put("balanceDifficulty", source.balanceDifficultyEnabled());
        normalized.put("provider", provider == null || provider.isBlank()
                ? DEFAULT_PROVIDER_KEY
                : provider.trim().toLowerCase(Locale.ROOT));
        if (source.getDifficultyDistribution() != null && !source.getDifficultyDistribution().isEmpty()) {
            normalized.put("difficultyDistribution", normalizeDistribution(source.getDifficultyDistribution()));
        }
        if (source.getBloomDistribution() != null && !source.getBloomDistribution().isEmpty()) {
            normalized.put("bloomDistribution", normalizeDistribution(source.getBloomDistribution()));
        }
        return normalized;
    }

    public static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static Map<String, Integer> normalizeDistribution(Map<String, Integer> distribution) {
        Map<String, Integer> sorted = new TreeMap<>();
        distribution.forEach((label, count) ->
                sorted.put(label.trim().toLowerCase(Locale.ROOT), count));
        return sorted;
    }
}
