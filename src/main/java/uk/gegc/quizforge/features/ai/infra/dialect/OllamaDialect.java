package uk.gegc.quizforge.features.ai.infra.dialect;

import com.fasterxml.jackson.databind.JsonNode;
import uk.gegc.quizforge.features.generation.domain.model.SourceImage;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Local models served by Ollama. No credentials; reachability is the configuration.
 */
public class OllamaDialect implements ProviderDialect {

    @Override
    public String getName() {
        return "local";
    }

    @Override
    public String getDescription() {
        return "Local models via Ollama";
    }

    @Override
    public String getDefaultBaseUrl() {
        return "http://localhost:11434";
    }

    @Override
    public List<String> getDefaultModels() {
        return List.of("llama3", "mistral", "gemma", "phi3");
    }

    @Override
    public boolean requiresApiKey() {
        return false;
    }

    @Override
    public Optional<String> getHealthCheckPath() {
        return Optional.of("/api/tags");
    }

    @Override
    public String getConnectionFailureHint() {
        return "Cannot reach the local model server. Is Ollama running? Start it with 'ollama serve'.";
    }

    @Override
    public DialectRequest buildRequest(String model, String apiKey, CompletionRequest request) {
        String prompt = request.systemPrompt() != null
                ? request.systemPrompt() + "\n\n" + request.prompt()
                : request.prompt();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("prompt", prompt);
        body.put("stream", false);
        if (request.jsonOutput()) {
            body.put("format", "json");
        }
        body.put("options", Map.of("temperature", request.temperature(), "num_predict", request.maxTokens()));
        if (request.hasImages()) {
            body.put("images", request.images().stream().map(SourceImage::data).toList());
        }
        return new DialectRequest("/api/generate", Map.of(), body);
    }

    @Override
    public String extractText(JsonNode response) {
        JsonNode text = response.path("response");
        return text.isTextual() ? text.asText() : null;
    }
}
