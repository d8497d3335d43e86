package uk.gegc.quizforge.features.ai.application;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import uk.gegc.quizforge.features.ai.config.ProvidersProperties;
import uk.gegc.quizforge.features.ai.domain.model.ConnectionTestResult;
import uk.gegc.quizforge.features.ai.domain.model.ProviderCharacteristics;
import uk.gegc.quizforge.features.ai.domain.model.ProviderHealth;
import uk.gegc.quizforge.features.ai.domain.model.ProviderInfo;
import uk.gegc.quizforge.features.ai.domain.model.RoutingStats;
import uk.gegc.quizforge.features.ai.domain.model.RoutingStrategy;
import uk.gegc.quizforge.features.generation.domain.model.GenerationOptions;
import uk.gegc.quizforge.features.generation.domain.model.QuestionSet;
import uk.gegc.quizforge.shared.exception.ConfigurationException;
import uk.gegc.quizforge.shared.exception.NoProviderConfiguredException;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Selects the provider for each request and records per-provider health.
 *
 * <p>An explicit, configured {@code options.provider} always wins. Otherwise the routing
 * strategy decides; {@link RoutingStrategy#PREFERRED} keeps the current provider. Providers
 * whose observed success rate is below {@value #UNHEALTHY_SUCCESS_RATE} are skipped while a
 * healthier one is available.
 */
@Service
@Slf4j
public class ProviderRouter {

    static final double UNHEALTHY_SUCCESS_RATE = 0.5;
    static final String REQUESTS_METRIC = "quizforge.provider.requests";
    static final String LATENCY_METRIC = "quizforge.provider.latency";

    private final ProviderRegistry registry;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final Executor executor;
    private final String defaultProvider;

    private final Map<String, ProviderHealth> health = new ConcurrentHashMap<>();
    private final AtomicInteger roundRobinCursor = new AtomicInteger();
    private volatile String currentProvider;
    private volatile RoutingStrategy strategy;

    public ProviderRouter(ProviderRegistry registry,
                          ProvidersProperties properties,
                          MeterRegistry meterRegistry,
                          Clock clock,
                          @Qualifier("generalTaskExecutor") Executor executor) {
        this.registry = registry;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.executor = executor;
        this.defaultProvider = normalize(properties.getDefaultProvider());
        this.strategy = RoutingStrategy.parse(properties.getRoutingStrategy()).orElseGet(() -> {
            log.warn("Unknown routing strategy '{}', using preferred", properties.getRoutingStrategy());
            return RoutingStrategy.PREFERRED;
        });
        this.currentProvider = initialProvider();
        log.info("Provider router ready - current: {}, strategy: {}, configured: {}",
                currentProvider, strategy.getValue(), configuredNames());
    }

    /**
     * Picks the provider for a request without calling it.
     *
     * @throws NoProviderConfiguredException if no provider is configured at all
     */
    public QuestionProvider selectProvider(GenerationOptions options, String text) {
        String requested = options != null ? normalize(options.getProvider()) : null;
        if (requested != null) {
            QuestionProvider explicit = registry.find(requested).filter(QuestionProvider::isConfigured).orElse(null);
            if (explicit != null) {
                return explicit;
            }
            log.warn("Requested provider '{}' is not available, routing with strategy {}", requested, strategy.getValue());
        }

        List<QuestionProvider> candidates = healthyCandidates();
        if (candidates.isEmpty()) {
            throw new NoProviderConfiguredException("No AI provider is configured. Set one of GEMINI_API_KEY, "
                    + "OPENAI_API_KEY, ANTHROPIC_API_KEY, DEEPSEEK_API_KEY, KIMI_API_KEY or enable the local provider.");
        }
        int numQuestions = options != null ? options.numQuestionsOrDefault() : GenerationOptions.DEFAULT_NUM_QUESTIONS;
        return choose(candidates, text, numQuestions);
    }

    /**
     * Calls the provider and records the outcome in the routing stats and metrics.
     */
    public QuestionSet generateWith(QuestionProvider provider, String text, GenerationOptions options) {
        long started = System.nanoTime();
        try {
            QuestionSet result = provider.generate(text, options);
            double cost = ProviderCharacteristics.lookup(provider.getName())
                    .map(c -> c.estimateCost(text, result.size()))
                    .orElse(0.0);
            recordSuccess(provider.getName(), elapsedMs(started), cost);
            return result;
        } catch (RuntimeException e) {
            recordFailure(provider.getName(), elapsedMs(started), e);
            throw e;
        }
    }

    public QuestionSet generate(String text, GenerationOptions options) {
        return generateWith(selectProvider(options, text), text, options);
    }

    /**
     * Raw completion on the named provider, falling back to the current one when the
     * named provider is not configured.
     */
    public String complete(String providerName, String prompt) {
        QuestionProvider provider = resolveForCompletion(providerName);
        long started = System.nanoTime();
        try {
            String completion = provider.complete(prompt);
            recordSuccess(provider.getName(), elapsedMs(started), 0.0);
            return completion;
        } catch (RuntimeException e) {
            recordFailure(provider.getName(), elapsedMs(started), e);
            throw e;
        }
    }

    public QuestionProvider resolveForCompletion(String providerName) {
        String name = normalize(providerName);
        if (name != null) {
            QuestionProvider named = registry.find(name).filter(QuestionProvider::isConfigured).orElse(null);
            if (named != null) {
                return named;
            }
            log.info("Provider '{}' is not configured for completions, using current provider {}", name, currentProvider);
        }
        return getCurrentProvider();
    }

    public QuestionProvider getCurrentProvider() {
        QuestionProvider current = registry.find(currentProvider).filter(QuestionProvider::isConfigured).orElse(null);
        if (current != null) {
            return current;
        }
        return healthyCandidates().stream().findFirst().orElseThrow(() ->
                new NoProviderConfiguredException("No AI provider is configured"));
    }

    public String getCurrentProviderName() {
        return currentProvider;
    }

    /**
     * Makes the named provider current.
     *
     * @throws ConfigurationException if the provider is unknown or not configured
     */
    public ProviderInfo switchProvider(String name) {
        String normalized = normalize(name);
        QuestionProvider provider = registry.find(normalized).orElseThrow(() ->
                new ConfigurationException("Unknown provider '" + name + "'. Available: " + knownNames()));
        if (!provider.isConfigured()) {
            throw new ConfigurationException("Provider '" + normalized + "' is not configured. Please set "
                    + normalized.toUpperCase(Locale.ROOT) + "_API_KEY.");
        }
        String previous = currentProvider;
        currentProvider = normalized;
        log.info("Switched provider from {} to {}", previous, normalized);
        return toInfo(provider);
    }

    public List<ProviderInfo> listProviders() {
        List<ProviderInfo> infos = new ArrayList<>();
        for (QuestionProvider provider : registry.all()) {
            infos.add(toInfo(provider));
        }
        registry.loadFailures().forEach((name, error) ->
                infos.add(new ProviderInfo(name, null, false, false, false, List.of(), null, error)));
        return infos;
    }

    /**
     * Tests every loaded provider concurrently. A failing provider never affects the others.
     */
    public Map<String, ConnectionTestResult> testAllProviders() {
        Map<String, CompletableFuture<ConnectionTestResult>> futures = new LinkedHashMap<>();
        for (QuestionProvider provider : registry.all()) {
            futures.put(provider.getName(), CompletableFuture
                    .supplyAsync(provider::testConnection, executor)
                    .exceptionally(ex -> ConnectionTestResult.failure(provider.getName(), null,
                            "Connection test failed: " + ex.getMessage())));
        }
        Map<String, ConnectionTestResult> results = new LinkedHashMap<>();
        futures.forEach((name, future) -> results.put(name, future.join()));
        return results;
    }

    public ConnectionTestResult testProvider(String name) {
        String normalized = normalize(name);
        return registry.find(normalized)
                .map(QuestionProvider::testConnection)
                .orElseGet(() -> ConnectionTestResult.failure(normalized, null,
                        registry.loadFailures().getOrDefault(normalized, "Unknown provider")));
    }

    public RoutingStats getRoutingStats() {
        Map<String, ProviderHealth.Snapshot> snapshots = new LinkedHashMap<>();
        for (QuestionProvider provider : registry.all()) {
            snapshots.put(provider.getName(), healthOf(provider.getName()).snapshot());
        }
        return new RoutingStats(strategy, currentProvider, defaultProvider, snapshots);
    }

    public void resetRoutingStats() {
        health.clear();
        roundRobinCursor.set(0);
        log.info("Routing statistics reset");
    }

    public RoutingStrategy getRoutingStrategy() {
        return strategy;
    }

    /**
     * @return false, leaving the strategy unchanged, when the value is not a known strategy
     */
    public boolean setRoutingStrategy(String value) {
        return RoutingStrategy.parse(value).map(parsed -> {
            strategy = parsed;
            log.info("Routing strategy set to {}", parsed.getValue());
            return true;
        }).orElseGet(() -> {
            log.warn("Ignoring invalid routing strategy '{}'", value);
            return false;
        });
    }

    public List<String> configuredNames() {
        return registry.all().stream()
                .filter(QuestionProvider::isConfigured)
                .map(QuestionProvider::getName)
                .toList();
    }

    private QuestionProvider choose(List<QuestionProvider> candidates, String text, int numQuestions) {
        return switch (strategy) {
            case PREFERRED -> candidates.stream()
                    .filter(p -> p.getName().equals(currentProvider))
                    .findFirst()
                    .orElse(candidates.get(0));
            case ROUND_ROBIN -> candidates.get(Math.floorMod(roundRobinCursor.getAndIncrement(), candidates.size()));
            case CHEAPEST -> candidates.stream()
                    .min(Comparator.comparingDouble(p -> estimatedCost(p, text, numQuestions)))
                    .orElseThrow();
            case FASTEST -> candidates.stream()
                    .max(Comparator.<QuestionProvider>comparingInt(p -> characteristics(p).map(ProviderCharacteristics::speedScore).orElse(0))
                            .thenComparing(p -> -healthOf(p.getName()).snapshot().meanLatencyMs()))
                    .orElseThrow();
            case QUALITY -> candidates.stream()
                    .max(Comparator.comparingInt(p -> characteristics(p).map(ProviderCharacteristics::qualityScore).orElse(0)))
                    .orElseThrow();
            case BALANCED -> candidates.stream()
                    .max(Comparator.comparingDouble(p -> balancedScore(p, text, numQuestions)))
                    .orElseThrow();
        };
    }

    /**
     * Configured providers by descending priority, without unhealthy ones unless nothing else is left.
     */
    private List<QuestionProvider> healthyCandidates() {
        List<QuestionProvider> configured = registry.all().stream()
                .filter(QuestionProvider::isConfigured)
                .sorted(Comparator.comparingInt((QuestionProvider p) ->
                        characteristics(p).map(ProviderCharacteristics::priority).orElse(0)).reversed())
                .toList();
        List<QuestionProvider> healthy = configured.stream()
                .filter(p -> healthOf(p.getName()).successRate() >= UNHEALTHY_SUCCESS_RATE)
                .toList();
        return healthy.isEmpty() ? configured : healthy;
    }

    private double balancedScore(QuestionProvider provider, String text, int numQuestions) {
        double cost = estimatedCost(provider, text, numQuestions);
        double costScore = Math.max(0.0, 1.0 - cost / 0.01) * 100;
        double speedScore = characteristics(provider).map(ProviderCharacteristics::speedScore).orElse(50);
        double qualityScore = characteristics(provider).map(ProviderCharacteristics::qualityScore).orElse(50);
        double healthScore = healthOf(provider.getName()).successRate() * 100;
        return 0.30 * costScore + 0.25 * speedScore + 0.25 * qualityScore + 0.20 * healthScore;
    }

    private double estimatedCost(QuestionProvider provider, String text, int numQuestions) {
        return characteristics(provider)
                .map(c -> c.estimateCost(text, numQuestions))
                .orElse(Double.MAX_VALUE);
    }

    private static Optional<ProviderCharacteristics> characteristics(QuestionProvider provider) {
        return ProviderCharacteristics.lookup(provider.getName());
    }

    private void recordSuccess(String provider, long latencyMs, double cost) {
        healthOf(provider).recordSuccess(latencyMs, cost, clock.instant());
        meterRegistry.counter(REQUESTS_METRIC, "provider", provider, "outcome", "success").increment();
        Timer.builder(LATENCY_METRIC).tag("provider", provider).register(meterRegistry)
                .record(Duration.ofMillis(latencyMs));
    }

    private void recordFailure(String provider, long latencyMs, RuntimeException error) {
        healthOf(provider).recordFailure(latencyMs, error.getMessage(), clock.instant());
        meterRegistry.counter(REQUESTS_METRIC, "provider", provider, "outcome", "failure").increment();
        Timer.builder(LATENCY_METRIC).tag("provider", provider).register(meterRegistry)
                .record(Duration.ofMillis(latencyMs));
    }

    private ProviderHealth healthOf(String provider) {
        return health.computeIfAbsent(provider, name -> new ProviderHealth());
    }

    private ProviderInfo toInfo(QuestionProvider provider) {
        return new ProviderInfo(
                provider.getName(),
                provider.getDescription(),
                true,
                provider.isConfigured(),
                provider.getName().equals(currentProvider),
                provider.getSupportedModels(),
                provider.getCurrentModel(),
                null);
    }

    private String initialProvider() {
        if (registry.find(defaultProvider).map(QuestionProvider::isConfigured).orElse(false)) {
            return defaultProvider;
        }
        List<QuestionProvider> configured = healthyCandidates();
        if (!configured.isEmpty()) {
            log.warn("Default provider '{}' is not configured, using {}", defaultProvider, configured.get(0).getName());
            return configured.get(0).getName();
        }
        log.warn("No AI provider is configured; generation requests will fail until one is");
        return defaultProvider;
    }

    private List<String> knownNames() {
        return registry.all().stream().map(QuestionProvider::getName).toList();
    }

    private static long elapsedMs(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000;
    }

    private static String normalize(String name) {
        return name == null || name.isBlank() ? null : name.trim().toLowerCase(Locale.ROOT);
    }
}
