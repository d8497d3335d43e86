package uk.gegc.quizforge.features.ai.infra.http;

import java.util.List;

/**
 * Resolved per-provider settings: configured values with the dialect defaults filled in.
 */
public record ProviderSettings(
        boolean enabled,
        String apiKey,
        String baseUrl,
        List<String> models,
        double temperature,
        int maxTokens
) {

    public ProviderSettings {
        models = List.copyOf(models);
        if (models.isEmpty()) {
            throw new IllegalArgumentException("At least one model is required");
        }
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }
}
