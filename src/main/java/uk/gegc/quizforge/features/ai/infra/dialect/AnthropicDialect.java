package uk.gegc.quizforge.features.ai.infra.dialect;

import com.fasterxml.jackson.databind.JsonNode;
import uk.gegc.quizforge.features.generation.domain.model.SourceImage;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class AnthropicDialect implements ProviderDialect {

    static final String API_VERSION = "2023-06-01";

    @Override
    public String getName() {
        return "anthropic";
    }

    @Override
    public String getDescription() {
        return "Anthropic Claude models";
    }

    @Override
    public String getDefaultBaseUrl() {
        return "https://api.anthropic.com/v1";
    }

    @Override
    public List<String> getDefaultModels() {
        return List.of("claude-3-5-haiku-latest", "claude-3-5-sonnet-latest", "claude-3-haiku-20240307");
    }

    @Override
    public DialectRequest buildRequest(String model, String apiKey, CompletionRequest request) {
        List<Map<String, Object>> content = new ArrayList<>();
        for (SourceImage image : request.images()) {
            content.add(Map.of("type", "image",
                    "source", Map.of("type", "base64", "media_type", image.mediaType(), "data", image.data())));
        }
        content.add(Map.of("type", "text", "text", request.prompt()));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("max_tokens", request.maxTokens());
        body.put("temperature", request.temperature());
        if (request.systemPrompt() != null) {
            body.put("system", request.systemPrompt());
        }
        body.put("messages", List.of(Map.of("role", "user", "content", content)));

        return new DialectRequest("/messages",
                Map.of("x-api-key", apiKey, "anthropic-version", API_VERSION), body);
    }

    @Override
    public String extractText(JsonNode response) {
        StringBuilder text = new StringBuilder();
        for (JsonNode block : response.path("content")) {
            if ("text".equals(block.path("type").asText())) {
                text.append(block.path("text").asText());
            }
        }
        return text.length() == 0 ? null : text.toString();
    }
}
