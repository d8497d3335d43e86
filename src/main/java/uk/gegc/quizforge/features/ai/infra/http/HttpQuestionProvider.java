package uk.gegc.quizforge.features.ai.infra.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;
import uk.gegc.quizforge.features.ai.application.PromptTemplateService;
import uk.gegc.quizforge.features.ai.application.QuestionProvider;
import uk.gegc.quizforge.features.ai.domain.model.ConnectionTestResult;
import uk.gegc.quizforge.features.ai.infra.dialect.CompletionRequest;
import uk.gegc.quizforge.features.ai.infra.dialect.DialectRequest;
import uk.gegc.quizforge.features.ai.infra.dialect.ProviderDialect;
import uk.gegc.quizforge.features.ai.infra.parser.QuestionResponseParser;
import uk.gegc.quizforge.features.generation.domain.model.GenerationOptions;
import uk.gegc.quizforge.features.generation.domain.model.QuestionSet;
import uk.gegc.quizforge.shared.config.ProviderRetryConfig;
import uk.gegc.quizforge.shared.exception.AIResponseParseException;
import uk.gegc.quizforge.shared.exception.ConfigurationException;
import uk.gegc.quizforge.shared.exception.ModelUnavailableException;
import uk.gegc.quizforge.shared.exception.ProviderException;
import uk.gegc.quizforge.shared.exception.QuestionValidationException;
import uk.gegc.quizforge.shared.exception.TransientProviderException;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Provider adapter over a vendor HTTP API.
 *
 * <p>Each call walks the configured models in order. A 404 moves permanently to the next
 * model; rate limits and overloads back off exponentially; authentication failures stop
 * immediately. Attempts per model are capped by {@code maxRetries}, attempts across all
 * models by {@code maxTotalAttempts}.
 */
@Slf4j
public class HttpQuestionProvider implements QuestionProvider {

    static final String CONNECTION_TEST_TEXT =
            "Photosynthesis is the process by which green plants use sunlight, water and carbon dioxide "
                    + "to produce glucose and oxygen. It takes place mainly in the chloroplasts of leaf cells.";

    private final ProviderDialect dialect;
    private final ProviderSettings settings;
    private final RestClient restClient;
    private final PromptTemplateService promptTemplateService;
    private final QuestionResponseParser responseParser;
    private final ObjectMapper objectMapper;
    private final ProviderRetryConfig retryConfig;
    private final BackoffPolicy backoffPolicy;
    private final Clock clock;

    // Only ever moves forward, so concurrent chunks agree on the fallback
    private final AtomicInteger modelIndex = new AtomicInteger();

    public HttpQuestionProvider(ProviderDialect dialect,
                                ProviderSettings settings,
                                RestClient restClient,
                                PromptTemplateService promptTemplateService,
                                QuestionResponseParser responseParser,
                                ObjectMapper objectMapper,
                                ProviderRetryConfig retryConfig,
                                BackoffPolicy backoffPolicy,
                                Clock clock) {
        this.dialect = dialect;
        this.settings = settings;
        this.restClient = restClient;
        this.promptTemplateService = promptTemplateService;
        this.responseParser = responseParser;
        this.objectMapper = objectMapper;
        this.retryConfig = retryConfig;
        this.backoffPolicy = backoffPolicy;
        this.clock = clock;
    }

    @Override
    public String getName() {
        return dialect.getName();
    }

    @Override
    public String getDescription() {
        return dialect.getDescription();
    }

    @Override
    public boolean isConfigured() {
        return settings.enabled() && (!dialect.requiresApiKey() || settings.hasApiKey());
    }

    @Override
    public List<String> getSupportedModels() {
        return settings.models();
    }

    @Override
    public String getCurrentModel() {
        return settings.models().get(getCurrentModelIndex());
    }

    @Override
    public int getCurrentModelIndex() {
        return Math.min(modelIndex.get(), settings.models().size() - 1);
    }

    @Override
    public QuestionSet generate(String text, GenerationOptions options) {
        requireConfigured();
        GenerationOptions resolved = options != null ? options : GenerationOptions.defaults();
        CompletionRequest request = new CompletionRequest(
                promptTemplateService.buildSystemPrompt(),
                promptTemplateService.buildGenerationPrompt(text, resolved),
                resolved.getImages(),
                settings.temperature(),
                settings.maxTokens(),
                true);

        return executeWithRetry(model -> {
            String completion = call(model, request);
            QuestionSet questionSet = responseParser.parseQuestionSet(completion, resolved);
            questionSet.putMetadata(QuestionSet.META_PROVIDER, getName());
            questionSet.putMetadata(QuestionSet.META_MODEL, model);
            questionSet.putMetadata(QuestionSet.META_GENERATED_AT, clock.instant().toString());
            questionSet.putMetadata(QuestionSet.META_NUM_QUESTIONS, questionSet.size());
            log.info("{} ({}) generated {} questions", getName(), model, questionSet.size());
            return questionSet;
        });
    }

    @Override
    public String complete(String prompt) {
        requireConfigured();
        CompletionRequest request = new CompletionRequest(
                null, prompt, List.of(), settings.temperature(), settings.maxTokens(), true);
        return executeWithRetry(model -> call(model, request));
    }

    @Override
    public ConnectionTestResult testConnection() {
        if (!isConfigured()) {
            return ConnectionTestResult.failure(getName(), null, getName() + " is not configured. "
                    + (dialect.requiresApiKey()
                    ? "Set " + getName().toUpperCase(Locale.ROOT) + "_API_KEY."
                    : "Enable it in the configuration."));
        }
        try {
            if (dialect.getHealthCheckPath().isPresent()) {
                restClient.get()
                        .uri(dialect.getHealthCheckPath().get())
                        .retrieve()
                        .toBodilessEntity();
                return ConnectionTestResult.success(getName(), getCurrentModel(),
                        getName() + " endpoint is reachable");
            }
            QuestionSet sample = generate(CONNECTION_TEST_TEXT, GenerationOptions.builder()
                    .numQuestions(1)
                    .build());
            return ConnectionTestResult.success(getName(), String.valueOf(sample.getMetadata().get(QuestionSet.META_MODEL)),
                    getName() + " connection successful");
        } catch (ResourceAccessException e) {
            String hint = dialect.getConnectionFailureHint();
            return ConnectionTestResult.failure(getName(), getCurrentModel(),
                    hint != null ? hint : getName() + " is unreachable: " + e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Connection test for {} failed: {}", getName(), e.getMessage());
            return ConnectionTestResult.failure(getName(), getCurrentModel(),
                    getName() + " connection failed: " + e.getMessage());
        }
    }

    /**
     * Runs one logical call against the current model with back-off and model fallback.
     */
    <T> T executeWithRetry(Function<String, T> attempt) {
        int maxRetries = Math.max(1, retryConfig.getMaxRetries());
        int totalCap = Math.max(maxRetries, retryConfig.getMaxTotalAttempts());
        int attemptOnModel = 0;
        int totalAttempts = 0;

        while (true) {
            attemptOnModel++;
            totalAttempts++;
            int observedIndex = getCurrentModelIndex();
            String model = settings.models().get(observedIndex);
            try {
                return attempt.apply(model);
            } catch (ModelUnavailableException e) {
                log.warn("{} model {} is not available: {}", getName(), model, e.getMessage());
                if (totalAttempts >= totalCap) {
                    throw new ProviderException(getName(),
                            getName() + " gave up after " + totalAttempts + " attempts across models", e);
                }
                if (!advanceModel(observedIndex)) {
                    throw new ConfigurationException("No available " + getName() + " model (tried "
                            + String.join(", ", settings.models())
                            + "). Please check your API key and model access.", e);
                }
                log.info("Falling back to {} model {}", getName(), getCurrentModel());
                attemptOnModel = 0;
            } catch (ConfigurationException e) {
                throw e;
            } catch (TransientProviderException e) {
                if (attemptOnModel >= maxRetries || totalAttempts >= totalCap) {
                    throw new ProviderException(getName(), exhaustedMessage(e, model), e);
                }
                long delayMs = backoffPolicy.delayFor(attemptOnModel);
                log.warn("{} returned {} for model {} (attempt {}/{}). Waiting {} ms before retry.",
                        getName(), e.getStatusCode(), model, attemptOnModel, maxRetries, delayMs);
                backoffPolicy.sleep(getName(), delayMs);
            } catch (AIResponseParseException | QuestionValidationException | ProviderException e) {
                if (attemptOnModel >= maxRetries || totalAttempts >= totalCap) {
                    throw e;
                }
                long delayMs = backoffPolicy.delayFor(attemptOnModel);
                log.warn("{} attempt {}/{} with model {} failed: {}. Retrying in {} ms.",
                        getName(), attemptOnModel, maxRetries, model, e.getMessage(), delayMs);
                backoffPolicy.sleep(getName(), delayMs);
            }
        }
    }

    private boolean advanceModel(int observedIndex) {
        if (modelIndex.get() > observedIndex) {
            return true;
        }
        if (observedIndex + 1 >= settings.models().size()) {
            return false;
        }
        modelIndex.compareAndSet(observedIndex, observedIndex + 1);
        return true;
    }

    private String call(String model, CompletionRequest request) {
        DialectRequest dialectRequest = dialect.buildRequest(model, settings.apiKey(), request);
        String body;
        try {
            body = restClient.post()
                    .uri(dialectRequest.path())
                    .contentType(MediaType.APPLICATION_JSON)
                    .headers(headers -> dialectRequest.headers().forEach(headers::set))
                    .body(dialectRequest.body())
                    .retrieve()
                    .body(String.class);
        } catch (RestClientResponseException e) {
            throw classify(e, model);
        } catch (ResourceAccessException e) {
            String hint = dialect.getConnectionFailureHint();
            if (hint != null) {
                throw new ConfigurationException(hint, e);
            }
            throw new TransientProviderException(getName() + " network error: " + e.getMessage(), 0, e);
        }

        if (body == null || body.isBlank()) {
            throw new AIResponseParseException("Empty response body from " + getName());
        }
        JsonNode envelope;
        try {
            envelope = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new AIResponseParseException("Malformed response envelope from " + getName(), e);
        }
        String text = dialect.extractText(envelope);
        if (text == null || text.isBlank()) {
            throw new AIResponseParseException("No completion text in response from " + getName() + " (" + model + ")");
        }
        return text;
    }

    private RuntimeException classify(RestClientResponseException e, String model) {
        int status = e.getStatusCode().value();
        return switch (status) {
            case 404 -> new ModelUnavailableException(model,
                    getName() + " model " + model + " not found (404)", e);
            case 401, 403 -> new ConfigurationException(
                    getName() + " rejected the credentials (" + status + "). Please check your API key.", e);
            case 429, 503, 529 -> new TransientProviderException(
                    getName() + " returned " + status + " for model " + model, status, e);
            default -> new ProviderException(getName(),
                    getName() + " request failed with status " + status + ": " + abbreviate(e.getResponseBodyAsString()), e);
        };
    }

    private String exhaustedMessage(TransientProviderException e, String model) {
        if (e.isRateLimited()) {
            return getName() + " rate limit exceeded for model " + model
                    + ". Please try again later or upgrade your plan.";
        }
        if (e.getStatusCode() == 0) {
            return getName() + " could not be reached after retries. Please check your network connection.";
        }
        return getName() + " model " + model + " is overloaded (" + e.getStatusCode()
                + "). Please try again in a few moments.";
    }

    private void requireConfigured() {
        if (!isConfigured()) {
            throw new ConfigurationException(getName() + " is not configured"
                    + (dialect.requiresApiKey() ? ". Please set " + getName().toUpperCase(Locale.ROOT) + "_API_KEY." : "."));
        }
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > 200 ? body.substring(0, 200) + "..." : body;
    }
}
