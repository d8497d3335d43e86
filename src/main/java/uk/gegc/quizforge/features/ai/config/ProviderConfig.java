package uk.gegc.quizforge.features.ai.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;
import uk.gegc.quizforge.features.ai.application.PromptTemplateService;
import uk.gegc.quizforge.features.ai.application.ProviderRegistry;
import uk.gegc.quizforge.features.ai.infra.dialect.AnthropicDialect;
import uk.gegc.quizforge.features.ai.infra.dialect.GeminiDialect;
import uk.gegc.quizforge.features.ai.infra.dialect.OllamaDialect;
import uk.gegc.quizforge.features.ai.infra.dialect.OpenAiCompatibleDialect;
import uk.gegc.quizforge.features.ai.infra.dialect.ProviderDialect;
import uk.gegc.quizforge.features.ai.infra.http.BackoffPolicy;
import uk.gegc.quizforge.features.ai.infra.http.HttpQuestionProvider;
import uk.gegc.quizforge.features.ai.infra.http.ProviderSettings;
import uk.gegc.quizforge.features.ai.infra.parser.QuestionResponseParser;
import uk.gegc.quizforge.shared.config.ProviderRetryConfig;

import java.time.Clock;
import java.util.List;

@Configuration
@Slf4j
public class ProviderConfig {

    /**
     * Supported vendors, in the order they are listed to clients
     */
    static List<ProviderDialect> dialects() {
        return List.of(
                new GeminiDialect(),
                OpenAiCompatibleDialect.openAi(),
                new AnthropicDialect(),
                OpenAiCompatibleDialect.deepSeek(),
                OpenAiCompatibleDialect.kimi(),
                new OllamaDialect()
        );
    }

    /**
     * Builds one adapter per vendor. A vendor whose adapter cannot be built is recorded
     * with its error and stays listed as unavailable; the others are unaffected.
     */
    @Bean
    public ProviderRegistry providerRegistry(ProvidersProperties properties,
                                             RestClient.Builder restClientBuilder,
                                             PromptTemplateService promptTemplateService,
                                             QuestionResponseParser responseParser,
                                             ObjectMapper objectMapper,
                                             ProviderRetryConfig retryConfig,
                                             BackoffPolicy backoffPolicy,
                                             Clock clock) {
        ProviderRegistry registry = new ProviderRegistry();
        for (ProviderDialect dialect : dialects()) {
            try {
                ProviderSettings settings = resolveSettings(dialect, properties.entry(dialect.getName()));
                RestClient restClient = restClientBuilder.clone()
                        .baseUrl(settings.baseUrl())
                        .requestFactory(requestFactory(properties))
                        .build();
                HttpQuestionProvider provider = new HttpQuestionProvider(dialect, settings, restClient,
                        promptTemplateService, responseParser, objectMapper, retryConfig, backoffPolicy, clock);
                registry.register(provider);
                log.info("Provider {} loaded - configured: {}, models: {}",
                        dialect.getName(), provider.isConfigured(), settings.models());
            } catch (RuntimeException e) {
                log.error("Failed to load provider {}: {}", dialect.getName(), e.getMessage(), e);
                registry.recordLoadFailure(dialect.getName(), e.getMessage());
            }
        }
        return registry;
    }

    static ProviderSettings resolveSettings(ProviderDialect dialect, ProvidersProperties.Entry entry) {
        List<String> models = entry.getModels() == null || entry.getModels().isEmpty()
                ? dialect.getDefaultModels()
                : entry.getModels().stream().map(String::trim).filter(m -> !m.isEmpty()).distinct().toList();
        String baseUrl = entry.getBaseUrl() == null || entry.getBaseUrl().isBlank()
                ? dialect.getDefaultBaseUrl()
                : entry.getBaseUrl().trim();
        return new ProviderSettings(entry.isEnabled(), entry.getApiKey(), baseUrl, models,
                entry.getTemperature(), entry.getMaxTokens());
    }

    private static SimpleClientHttpRequestFactory requestFactory(ProvidersProperties properties) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(properties.getConnectTimeoutMs());
        factory.setReadTimeout(properties.getReadTimeoutMs());
        return factory;
    }
}
