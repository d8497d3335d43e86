package uk.gegc.quizforge.features.ai.infra.dialect;

import com.fasterxml.jackson.databind.JsonNode;
import uk.gegc.quizforge.features.generation.domain.model.SourceImage;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class GeminiDialect implements ProviderDialect {

    @Override
    public String getName() {
        return "gemini";
    }

    @Override
    public String getDescription() {
        return "Google Gemini models";
    }

    @Override
    public String getDefaultBaseUrl() {
        return "https://generativelanguage.googleapis.com/v1beta";
    }

    @Override
    public List<String> getDefaultModels() {
        return List.of("gemini-2.5-flash", "gemini-1.5-flash", "gemini-1.5-pro", "gemini-pro");
    }

    @Override
    public DialectRequest buildRequest(String model, String apiKey, CompletionRequest request) {
        List<Map<String, Object>> parts = new ArrayList<>();
        parts.add(Map.of("text", request.prompt()));
        for (SourceImage image : request.images()) {
            parts.add(Map.of("inlineData", Map.of("mimeType", image.mediaType(), "data", image.data())));
        }

        Map<String, Object> generationConfig = new LinkedHashMap<>();
        generationConfig.put("temperature", request.temperature());
        generationConfig.put("maxOutputTokens", request.maxTokens());
        if (request.jsonOutput()) {
            generationConfig.put("responseMimeType", "application/json");
        }

        Map<String, Object> body = new LinkedHashMap<>();
        if (request.systemPrompt() != null) {
            body.put("systemInstruction", Map.of("parts", List.of(Map.of("text", request.systemPrompt()))));
        }
        body.put("contents", List.of(Map.of("role", "user", "parts", parts)));
        body.put("generationConfig", generationConfig);

        String modelId = model.startsWith("models/") ? model.substring("models/".length()) : model;
        return new DialectRequest("/models/" + modelId + ":generateContent",
                Map.of("x-goog-api-key", apiKey), body);
    }

    @Override
    public String extractText(JsonNode response) {
        StringBuilder text = new StringBuilder();
        for (JsonNode part : response.path("candidates").path(0).path("content").path("parts")) {
            if (part.hasNonNull("text")) {
                text.append(part.get("text").asText());
            }
        }
        return text.length() == 0 ? null : text.toString();
    }
}
