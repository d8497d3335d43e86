package uk.gegc.quizforge.features.ai.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * How the router picks a provider when the request does not name one.
 */
public enum RoutingStrategy {
    /** The current provider, falling back to the static priority order */
    PREFERRED("preferred"),
    CHEAPEST("cheapest"),
    ROUND_ROBIN("round-robin"),
    FASTEST("fastest"),
    QUALITY("quality"),
    /** Weighted cost, speed, quality and observed health */
    BALANCED("balanced");

    private final String value;

    RoutingStrategy(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static Optional<RoutingStrategy> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (RoutingStrategy strategy : values()) {
            if (strategy.value.equals(normalized)) {
                return Optional.of(strategy);
            }
        }
        return Optional.empty();
    }
}
