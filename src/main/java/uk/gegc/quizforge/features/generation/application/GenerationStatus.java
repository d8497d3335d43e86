package uk.gegc.quizforge.features.generation.application;

import uk.gegc.quizforge.features.ai.domain.model.ProviderInfo;
import uk.gegc.quizforge.features.ai.domain.model.RoutingStats;
import uk.gegc.quizforge.features.cache.application.CacheStats;
import uk.gegc.quizforge.features.generation.config.GenerationProperties;

import java.util.List;

public record GenerationStatus(
        String currentProvider,
        List<ProviderInfo> providers,
        CacheStats cache,
        GenerationProperties.Parallel parallel,
        RoutingStats routing
) {
}
