package uk.gegc.quizforge.features.generation.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Requested or actual difficulty. {@link #MIXED} is only valid on a request,
 * never on an individual question.
 */
public enum Difficulty {
    EASY("easy"),
    MEDIUM("medium"),
    HARD("hard"),
    MIXED("mixed");

    /**
     * The difficulties a question can carry, in bucket order
     */
    public static final List<Difficulty> CONCRETE = List.of(EASY, MEDIUM, HARD);

    private final String value;

    Difficulty(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isConcrete() {
        return this != MIXED;
    }

    @JsonCreator
    public static Difficulty fromValue(String value) {
        return parse(value).orElseThrow(() ->
                new IllegalArgumentException("Unknown difficulty: " + value));
    }

    public static Optional<Difficulty> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Difficulty difficulty : values()) {
            if (difficulty.value.equals(normalized)) {
                return Optional.of(difficulty);
            }
        }
        return Optional.empty();
    }
}
