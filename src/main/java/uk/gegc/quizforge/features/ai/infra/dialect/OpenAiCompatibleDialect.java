package uk.gegc.quizforge.features.ai.infra.dialect;

import com.fasterxml.jackson.databind.JsonNode;
import uk.gegc.quizforge.features.generation.domain.model.SourceImage;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Chat completions format shared by OpenAI, DeepSeek and Kimi (via OpenRouter).
 */
public class OpenAiCompatibleDialect implements ProviderDialect {

    private final String name;
    private final String description;
    private final String defaultBaseUrl;
    private final List<String> defaultModels;
    private final Double topP;

    public OpenAiCompatibleDialect(String name, String description, String defaultBaseUrl,
                                   List<String> defaultModels, Double topP) {
        this.name = name;
        this.description = description;
        this.defaultBaseUrl = defaultBaseUrl;
        this.defaultModels = List.copyOf(defaultModels);
        this.topP = topP;
    }

    public static OpenAiCompatibleDialect openAi() {
        return new OpenAiCompatibleDialect("openai", "OpenAI GPT models", "https://api.openai.com/v1",
                List.of("gpt-4o-mini", "gpt-4o", "gpt-4-turbo", "gpt-3.5-turbo"), null);
    }

    public static OpenAiCompatibleDialect deepSeek() {
        return new OpenAiCompatibleDialect("deepseek", "DeepSeek chat models", "https://api.deepseek.com/v1",
                List.of("deepseek-chat", "deepseek-reasoner"), 0.9);
    }

    public static OpenAiCompatibleDialect kimi() {
        return new OpenAiCompatibleDialect("kimi", "Moonshot Kimi via OpenRouter", "https://openrouter.ai/api/v1",
                List.of("moonshotai/kimi-k2:free", "moonshotai/kimi-k2"), null);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getDescription() {
        return description;
    }

    @Override
    public String getDefaultBaseUrl() {
        return defaultBaseUrl;
    }

    @Override
    public List<String> getDefaultModels() {
        return defaultModels;
    }

    @Override
    public DialectRequest buildRequest(String model, String apiKey, CompletionRequest request) {
        List<Map<String, Object>> messages = new ArrayList<>();
        if (request.systemPrompt() != null) {
            messages.add(Map.of("role", "system", "content", request.systemPrompt()));
        }
        messages.add(Map.of("role", "user", "content", userContent(request)));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("messages", messages);
        body.put("temperature", request.temperature());
        body.put("max_tokens", request.maxTokens());
        if (topP != null) {
            body.put("top_p", topP);
        }
        return new DialectRequest("/chat/completions", Map.of("Authorization", "Bearer " + apiKey), body);
    }

    @Override
    public String extractText(JsonNode response) {
        JsonNode content = response.path("choices").path(0).path("message").path("content");
        return content.isTextual() ? content.asText() : null;
    }

    private Object userContent(CompletionRequest request) {
        if (!request.hasImages()) {
            return request.prompt();
        }
        List<Map<String, Object>> parts = new ArrayList<>();
        parts.add(Map.of("type", "text", "text", request.prompt()));
        for (SourceImage image : request.images()) {
            parts.add(Map.of("type", "image_url",
                    "image_url", Map.of("url", "data:" + image.mediaType() + ";base64," + image.data())));
        }
        return parts;
    }
}
