package uk.gegc.quizforge.features.ai.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the provider adapters and routing
 */
@Component
@ConfigurationProperties(prefix = "quizforge.providers")
@Data
public class ProvidersProperties {

    /**
     * Provider used when the request does not name one
     */
    private String defaultProvider = "gemini";

    /**
     * Initial routing strategy (preferred, cheapest, round-robin, fastest, quality, balanced)
     */
    private String routingStrategy = "preferred";

    private int connectTimeoutMs = 10_000;

    private int readTimeoutMs = 120_000;

    /**
     * Per-provider settings keyed by provider name
     */
    private Map<String, Entry> entries = new LinkedHashMap<>();

    public Entry entry(String name) {
        return entries.getOrDefault(name, new Entry());
    }

    @Data
    public static class Entry {

        private boolean enabled = true;

        private String apiKey;

        /**
         * Overrides the vendor's default endpoint
         */
        private String baseUrl;

        /**
         * Models in fallback order; empty means the vendor defaults
         */
        private List<String> models = new ArrayList<>();

        private double temperature = 0.7;

        private int maxTokens = 2000;
    }
}
