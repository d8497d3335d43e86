package uk.gegc.quizforge.features.generation.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * The six levels of Bloom's taxonomy, lowest cognitive demand first.
 */
public enum CognitiveLevel {
    REMEMBER("remember", "recall facts, terms and basic concepts"),
    UNDERSTAND("understand", "explain ideas or concepts in one's own words"),
    APPLY("apply", "use the information in a new, concrete situation"),
    ANALYZE("analyze", "draw connections, compare and break ideas into parts"),
    EVALUATE("evaluate", "justify a decision or judge the merit of an approach"),
    CREATE("create", "combine elements into a new pattern, plan or product");

    private final String value;
    private final String guidance;

    CognitiveLevel(String value, String guidance) {
        this.value = value;
        this.guidance = guidance;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getGuidance() {
        return guidance;
    }

    @JsonCreator
    public static CognitiveLevel fromValue(String value) {
        return parse(value).orElseThrow(() ->
                new IllegalArgumentException("Unknown cognitive level: " + value));
    }

    public static Optional<CognitiveLevel> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if ("analyse".equals(normalized)) {
            normalized = "analyze";
        }
        for (CognitiveLevel level : values()) {
            if (level.value.equals(normalized)) {
                return Optional.of(level);
            }
        }
        return Optional.empty();
    }
}
