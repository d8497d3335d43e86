package uk.gegc.quizforge.features.ai.infra.dialect;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Optional;

/**
 * Wire format of one vendor. Everything else (retries, model fallback, parsing)
 * is shared by {@link uk.gegc.quizforge.features.ai.infra.http.HttpQuestionProvider}.
 */
public interface ProviderDialect {

    String getName();

    String getDescription();

    String getDefaultBaseUrl();

    /**
     * Models in fallback order
     */
    List<String> getDefaultModels();

    DialectRequest buildRequest(String model, String apiKey, CompletionRequest request);

    /**
     * Extract the completion text from the vendor envelope, or null when there is none
     */
    String extractText(JsonNode response);

    default boolean requiresApiKey() {
        return true;
    }

    /**
     * Cheap GET used by the connection test instead of a sample generation
     */
    default Optional<String> getHealthCheckPath() {
        return Optional.empty();
    }

    /**
     * Remediation hint when the endpoint cannot be reached, or null to treat it as transient
     */
    default String getConnectionFailureHint() {
        return null;
    }
}
