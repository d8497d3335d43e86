package uk.gegc.quizforge.features.ai.domain.model;

import java.util.Map;

public record RoutingStats(
        RoutingStrategy strategy,
        String currentProvider,
        String defaultProvider,
        Map<String, ProviderHealth.Snapshot> providers
) {
}
