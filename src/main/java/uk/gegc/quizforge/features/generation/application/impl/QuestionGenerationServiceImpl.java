package uk.gegc.quizforge.features.generation.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.quizforge.features.ai.application.ProviderRouter;
import uk.gegc.quizforge.features.ai.application.QuestionProvider;
import uk.gegc.quizforge.features.ai.domain.model.ConnectionTestResult;
import uk.gegc.quizforge.features.cache.application.CacheStats;
import uk.gegc.quizforge.features.cache.application.QuestionCacheService;
import uk.gegc.quizforge.features.generation.application.BatchGenerationResult;
import uk.gegc.quizforge.features.generation.application.GenerationProgressListener;
import uk.gegc.quizforge.features.generation.application.GenerationStatus;
import uk.gegc.quizforge.features.generation.application.ParallelQuestionGenerator;
import uk.gegc.quizforge.features.generation.application.QuestionGenerationService;
import uk.gegc.quizforge.features.generation.application.balance.BalanceResult;
import uk.gegc.quizforge.features.generation.application.balance.DifficultyBalancer;
import uk.gegc.quizforge.features.generation.application.dedup.DeduplicationResult;
import uk.gegc.quizforge.features.generation.application.dedup.Deduplicator;
import uk.gegc.quizforge.features.generation.application.quality.QualityScorer;
import uk.gegc.quizforge.features.generation.application.quality.ScoringResult;
import uk.gegc.quizforge.features.generation.config.GenerationProperties;
import uk.gegc.quizforge.features.generation.domain.model.Difficulty;
import uk.gegc.quizforge.features.generation.domain.model.DistributionPlan;
import uk.gegc.quizforge.features.generation.domain.model.GenerationOptions;
import uk.gegc.quizforge.features.generation.domain.model.Question;
import uk.gegc.quizforge.features.generation.domain.model.QuestionSet;
import uk.gegc.quizforge.shared.exception.PipelineException;
import uk.gegc.quizforge.shared.exception.QuestionValidationException;
import uk.gegc.quizforge.shared.util.Fingerprints;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
@Slf4j
@RequiredArgsConstructor
public class QuestionGenerationServiceImpl implements QuestionGenerationService {

    static final String STAGE_QUALITY = "qualityScoring";
    static final String STAGE_DEDUP = "deduplication";
    static final String STAGE_BALANCE = "difficultyBalancing";
    static final String META_TIMESTAMP = "timestamp";
    static final double REPLENISH_FACTOR = 1.5;

    private final GenerationProperties properties;
    private final ProviderRouter providerRouter;
    private final QuestionCacheService cacheService;
    private final ParallelQuestionGenerator parallelGenerator;
    private final QualityScorer qualityScorer;
    private final Deduplicator deduplicator;
    private final DifficultyBalancer difficultyBalancer;
    private final Clock clock;

    @Override
    public QuestionSet generate(String text, GenerationOptions options) {
        return generate(text, options, GenerationProgressListener.NONE);
    }

    @Override
    public QuestionSet generate(String text, GenerationOptions options, GenerationProgressListener listener) {
        validateInput(text);
        String source = truncate(text);
        GenerationOptions requested = withPlan(options != null ? options : GenerationOptions.defaults());
        int numQuestions = requested.numQuestionsOrDefault();
        String cacheProvider = requested.getProvider();

        boolean fanOut = parallelGenerator.shouldUseParallel(numQuestions, requested);
        if (!requested.cacheDisabled() && !fanOut) {
            Optional<QuestionSet> cached = cacheService.get(source, requested, cacheProvider);
            if (cached.isPresent()) {
                return cached.get();
            }
        }

        QuestionProvider provider = providerRouter.selectProvider(requested, source);
        log.info("Generating {} questions with provider {}{}", numQuestions, provider.getName(),
                fanOut ? " (fan-out)" : "");
        QuestionSet generated = fanOut
                ? parallelGenerator.generate(source, requested,
                (chunkText, chunkOptions) -> providerRouter.generateWith(provider, chunkText, chunkOptions), listener)
                : providerRouter.generateWith(provider, source, requested);

        QuestionSet result = postProcess(source, requested, provider, generated);

        if (result.size() > numQuestions) {
            result = result.withQuestions(result.getQuestions().subList(0, numQuestions));
        }
        result.putMetadata(QuestionSet.META_NUM_QUESTIONS, result.size());
        result.putMetadata(QuestionSet.META_SOURCE_FINGERPRINT, Fingerprints.hashText(source));
        result.putMetadata(META_TIMESTAMP, clock.instant().toString());
        if (requested.getDistributionPlan() != null) {
            result.putMetadata(QuestionSet.META_DISTRIBUTION_PLAN, requested.getDistributionPlan().entries());
        }

        if (!requested.cacheDisabled()) {
            cacheService.putAsync(source, requested, cacheProvider, result);
        }
        log.info("Generated {} of {} requested questions with {}", result.size(), numQuestions, provider.getName());
        return result;
    }

    @Override
    public List<BatchGenerationResult> batchGenerate(List<String> texts, GenerationOptions options) {
        List<BatchGenerationResult> results = new ArrayList<>(texts.size());
        for (int i = 0; i < texts.size(); i++) {
            if (i > 0) {
                pauseBetweenBatchItems(properties.getBatchDelayMs());
            }
            try {
                results.add(BatchGenerationResult.success(i, generate(texts.get(i), options)));
            } catch (RuntimeException e) {
                log.warn("Batch item {} of {} failed: {}", i + 1, texts.size(), e.getMessage());
                results.add(BatchGenerationResult.failure(i, e.getMessage()));
            }
        }
        long succeeded = results.stream().filter(BatchGenerationResult::success).count();
        log.info("Batch generation finished: {}/{} succeeded", succeeded, texts.size());
        return results;
    }

    @Override
    public void validateInput(String text) {
        if (text == null || text.isBlank()) {
            throw new QuestionValidationException("Text is required");
        }
        int length = text.trim().length();
        if (length < properties.getMinTextChars()) {
            throw new QuestionValidationException("Text is too short: " + length
                    + " characters, at least " + properties.getMinTextChars() + " required");
        }
    }

    @Override
    public Map<String, ConnectionTestResult> testConnections() {
        return providerRouter.testAllProviders();
    }

    @Override
    public GenerationStatus getStatus() {
        String current;
        try {
            current = providerRouter.getCurrentProviderName();
        } catch (RuntimeException e) {
            log.debug("No current provider for status: {}", e.getMessage());
            current = null;
        }
        return new GenerationStatus(current, providerRouter.listProviders(), cacheService.stats(),
                properties.getParallel(), providerRouter.getRoutingStats());
    }

    @Override
    public int clearCache() {
        return cacheService.clear();
    }

    @Override
    public CacheStats getCacheStats() {
        return cacheService.stats();
    }

    /**
     * Pause between batch items; overridden in tests.
     */
    protected void pauseBetweenBatchItems(long delayMs) {
        if (delayMs <= 0) {
            return;
        }
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PipelineException("batch", "Interrupted between batch items", e);
        }
    }

    private QuestionSet postProcess(String text, GenerationOptions options, QuestionProvider provider,
                                    QuestionSet generated) {
        int numQuestions = options.numQuestionsOrDefault();
        QuestionSet current = generated;
        Map<Question, Double> scores = Map.of();

        if (options.qualityCheckEnabled() && qualityScorer.isEnabled()) {
            try {
                ScoringResult scoring = qualityScorer.scoreAndImprove(current.getQuestions(),
                        count -> regenerate(provider, text, options, count, null));
                current = current.withQuestions(scoring.questions());
                current.putMetadata(STAGE_QUALITY, scoring.toMetadata());
                scores = scoring.scores();
            } catch (RuntimeException e) {
                annotateFailure(current, STAGE_QUALITY, e);
            }
        }

        if (options.deduplicateEnabled() && deduplicator.isEnabled()) {
            try {
                current = deduplicateAndReplenish(text, options, provider, current, scores);
            } catch (RuntimeException e) {
                annotateFailure(current, STAGE_DEDUP, e);
            }
        }

        if (shouldBalance(options)) {
            try {
                BalanceResult balance = difficultyBalancer.balance(current.getQuestions(), numQuestions,
                        (count, difficulty) -> regenerate(provider, text, options, count, difficulty));
                current = current.withQuestions(balance.questions());
                current.putMetadata(STAGE_BALANCE, balance.toMetadata());
            } catch (RuntimeException e) {
                annotateFailure(current, STAGE_BALANCE, e);
            }
        }
        return current;
    }

    private QuestionSet deduplicateAndReplenish(String text, GenerationOptions options, QuestionProvider provider,
                                                QuestionSet current, Map<Question, Double> scores) {
        int numQuestions = options.numQuestionsOrDefault();
        DeduplicationResult dedup = deduplicator.deduplicate(current.getQuestions(), scores);
        List<Question> kept = dedup.questions();
        int duplicatesFound = dedup.duplicatesFound();
        int duplicatesRemoved = dedup.duplicatesRemoved();

        int rounds = 0;
        String replenishError = null;
        int maxRounds = properties.getDedup().getMaxReplenishAttempts();
        while (kept.size() < numQuestions && rounds < maxRounds) {
            rounds++;
            int deficit = numQuestions - kept.size();
            int request = (int) Math.ceil(deficit * REPLENISH_FACTOR);
            log.info("Replenishing {} questions after deduplication (round {}/{}, requesting {})",
                    deficit, rounds, maxRounds, request);
            List<Question> fresh;
            try {
                fresh = regenerate(provider, text, options, request, null);
            } catch (RuntimeException e) {
                log.warn("Replenishment round {} failed: {}", rounds, e.getMessage());
                replenishError = e.getMessage();
                break;
            }
            List<Question> merged = new ArrayList<>(kept);
            merged.addAll(fresh);
            DeduplicationResult again = deduplicator.deduplicate(merged, scores);
            duplicatesFound += again.duplicatesFound();
            duplicatesRemoved += again.duplicatesRemoved();
            kept = again.questions();
        }
        if (kept.size() > numQuestions) {
            kept = new ArrayList<>(kept.subList(0, numQuestions));
        }

        Map<String, Object> metadata = new LinkedHashMap<>(dedup.toMetadata());
        metadata.put("duplicatesFound", duplicatesFound);
        metadata.put("duplicatesRemoved", duplicatesRemoved);
        metadata.put("kept", kept.size());
        metadata.put("replenished", rounds > 0);
        metadata.put("replenishRounds", rounds);
        if (replenishError != null) {
            metadata.put("replenishError", replenishError);
        }
        if (kept.size() < numQuestions) {
            log.warn("Delivering {} of {} requested questions after deduplication", kept.size(), numQuestions);
        }
        QuestionSet result = current.withQuestions(kept);
        result.putMetadata(STAGE_DEDUP, metadata);
        return result;
    }

    /**
     * Direct call for {@code count} extra questions, with every post-processing stage off.
     */
    private List<Question> regenerate(QuestionProvider provider, String text, GenerationOptions options,
                                      int count, Difficulty difficulty) {
        GenerationOptions.GenerationOptionsBuilder builder = options.toBuilder()
                .numQuestions(count)
                .qualityCheck(false)
                .deduplicate(false)
                .balanceDifficulty(false)
                .noCache(true)
                .parallel(false)
                .difficultyDistribution(null)
                .bloomDistribution(null)
                .distributionPlan(null);
        if (difficulty != null) {
            builder.difficulty(difficulty);
        }
        return providerRouter.generateWith(provider, text, builder.build()).getQuestions();
    }

    private boolean shouldBalance(GenerationOptions options) {
        boolean explicitSplit = options.getDifficultyDistribution() != null
                && !options.getDifficultyDistribution().isEmpty();
        return options.balanceDifficultyEnabled()
                && difficultyBalancer.isEnabled()
                && options.difficultyOrDefault() == Difficulty.MIXED
                && !explicitSplit;
    }

    private GenerationOptions withPlan(GenerationOptions options) {
        if (!options.hasDistributions() || options.getDistributionPlan() != null) {
            return options;
        }
        DistributionPlan plan = DistributionPlan.from(options);
        log.debug("Built distribution plan with {} entries for {} questions", plan.entries().size(), plan.total());
        return options.toBuilder().distributionPlan(plan).build();
    }

    private String truncate(String text) {
        int max = properties.getMaxTextChars();
        if (text.length() <= max) {
            return text;
        }
        log.warn("Input text of {} characters truncated to {}", text.length(), max);
        return text.substring(0, max);
    }

    private static void annotateFailure(QuestionSet set, String stage, RuntimeException e) {
        log.warn("Stage {} failed, keeping {} questions: {}", stage, set.size(), e.getMessage());
        Map<String, Object> failure = new LinkedHashMap<>();
        failure.put("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        set.putMetadata(stage, failure);
    }
}
