package uk.gegc.quizforge.features.ai.domain.model;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Static routing facts about a provider. Costs are USD per 1K tokens.
 */
public record ProviderCharacteristics(
        String name,
        int priority,
        String costTier,
        String speedTier,
        String qualityTier,
        String reliability,
        int rateLimitPerMinute,
        List<String> bestFor,
        double inputCostPer1k,
        double outputCostPer1k
) {

    static final int OUTPUT_TOKENS_PER_QUESTION = 200;

    private static final Map<String, ProviderCharacteristics> TABLE = Map.of(
            "gemini", new ProviderCharacteristics("gemini", 90, "very_low", "fast", "good", "high", 60,
                    List.of("general", "bulk", "cost-sensitive"), 0.00015, 0.0006),
            "deepseek", new ProviderCharacteristics("deepseek", 85, "very_low", "medium", "good", "medium", 30,
                    List.of("technical", "bulk", "cost-sensitive"), 0.00014, 0.00028),
            "kimi", new ProviderCharacteristics("kimi", 80, "low", "fast", "good", "high", 60,
                    List.of("long-context", "general"), 0.0002, 0.0006),
            "openai", new ProviderCharacteristics("openai", 70, "medium", "fast", "good", "very_high", 60,
                    List.of("general", "reliable"), 0.0005, 0.0015),
            "anthropic", new ProviderCharacteristics("anthropic", 60, "high", "fast", "excellent", "very_high", 50,
                    List.of("quality", "complex-reasoning"), 0.0008, 0.0024),
            "local", new ProviderCharacteristics("local", 50, "free", "slow", "fair", "medium", 0,
                    List.of("offline", "privacy"), 0.0, 0.0)
    );

    public static Optional<ProviderCharacteristics> lookup(String provider) {
        if (provider == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(TABLE.get(provider.toLowerCase(Locale.ROOT)));
    }

    /**
     * Rough token estimate: one token per four characters
     */
    public static long estimateTokens(String text) {
        return text == null ? 0 : (long) Math.ceil(text.length() / 4.0);
    }

    public double estimateCost(String inputText, int numQuestions) {
        long inputTokens = estimateTokens(inputText);
        long outputTokens = (long) numQuestions * OUTPUT_TOKENS_PER_QUESTION;
        return inputTokens / 1000.0 * inputCostPer1k + outputTokens / 1000.0 * outputCostPer1k;
    }

    public int speedScore() {
        return switch (speedTier) {
            case "fast" -> 100;
            case "medium" -> 60;
            case "slow" -> 30;
            default -> 50;
        };
    }

    public int qualityScore() {
        return switch (qualityTier) {
            case "excellent" -> 100;
            case "good" -> 75;
            case "fair" -> 50;
            default -> 50;
        };
    }
}
