package uk.gegc.quizforge.features.ai.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Availability report for one known provider, including providers that failed to load.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProviderInfo(
        String name,
        String description,
        boolean available,
        boolean configured,
        boolean current,
        List<String> supportedModels,
        String currentModel,
        String loadError
) {
}
