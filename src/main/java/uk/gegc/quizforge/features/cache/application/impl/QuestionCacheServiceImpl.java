package uk.gegc.quizforge.features.cache.application.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;
import uk.gegc.quizforge.features.cache.application.CacheStats;
import uk.gegc.quizforge.features.cache.application.QuestionCacheService;
import uk.gegc.quizforge.features.cache.config.CacheProperties;
import uk.gegc.quizforge.features.cache.domain.model.QuestionCacheEntry;
import uk.gegc.quizforge.features.cache.domain.repository.QuestionCacheRepository;
import uk.gegc.quizforge.features.generation.domain.model.GenerationOptions;
import uk.gegc.quizforge.features.generation.domain.model.Question;
import uk.gegc.quizforge.features.generation.domain.model.QuestionSet;
import uk.gegc.quizforge.shared.util.Fingerprints;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;

@Service
@Slf4j
public class QuestionCacheServiceImpl implements QuestionCacheService {

    static final String META_CACHE_AGE_MINUTES = "cacheAgeMinutes";
    static final String META_ACCESS_COUNT = "accessCount";
    static final String ERRORS_METRIC = "quizforge.cache.errors";

    private static final TypeReference<List<Question>> QUESTION_LIST = new TypeReference<>() {
    };
    private static final TypeReference<LinkedHashMap<String, Object>> METADATA_MAP = new TypeReference<>() {
    };

    private final QuestionCacheRepository repository;
    private final CacheProperties properties;
    private final ObjectMapper objectMapper;
    private final TransactionTemplate transactionTemplate;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final Executor executor;

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    public QuestionCacheServiceImpl(QuestionCacheRepository repository,
                                    CacheProperties properties,
                                    ObjectMapper objectMapper,
                                    TransactionTemplate transactionTemplate,
                                    MeterRegistry meterRegistry,
                                    Clock clock,
                                    @Qualifier("generalTaskExecutor") Executor executor) {
        this.repository = repository;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.transactionTemplate = transactionTemplate;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.executor = executor;
    }

    @Override
    public boolean isEnabled() {
        return properties.isEnabled();
    }

    @Override
    public Optional<QuestionSet> get(String text, GenerationOptions options, String provider) {
        if (!properties.isEnabled() || (options != null && options.hasImages())) {
            return Optional.empty();
        }
        String key = Fingerprints.fingerprint(text, options, provider);
        try {
            Optional<QuestionCacheEntry> found = repository.findByCacheKey(key);
            if (found.isEmpty()) {
                misses.incrementAndGet();
                return Optional.empty();
            }
            QuestionCacheEntry entry = found.get();
            long now = clock.millis();
            if (entry.isExpired(now, ttlMillis())) {
                repository.deleteById(entry.getId());
                misses.incrementAndGet();
                log.debug("Cache entry {} expired", key);
                return Optional.empty();
            }
            repository.touch(entry.getId(), now);

            QuestionSet cached = new QuestionSet(
                    objectMapper.readValue(entry.getQuestions(), QUESTION_LIST),
                    entry.getAnalysis(),
                    entry.getMetadata() != null
                            ? objectMapper.readValue(entry.getMetadata(), METADATA_MAP)
                            : new LinkedHashMap<>());
            cached.putMetadata(QuestionSet.META_CACHED, true);
            cached.putMetadata(META_CACHE_AGE_MINUTES, Duration.ofMillis(now - entry.getCreatedAt()).toMinutes());
            cached.putMetadata(META_ACCESS_COUNT, entry.getAccessCount() + 1);
            hits.incrementAndGet();
            log.info("Cache hit for {} ({} questions)", abbreviate(key), cached.size());
            return Optional.of(cached);
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("Cache lookup failed, treating as miss: {}", e.getMessage());
            meterRegistry.counter(ERRORS_METRIC, "operation", "get").increment();
            misses.incrementAndGet();
            return Optional.empty();
        }
    }

    @Override
    public void put(String text, GenerationOptions options, String provider, QuestionSet questionSet) {
        if (!properties.isEnabled() || (options != null && options.hasImages())) {
            return;
        }
        String textHash = Fingerprints.hashText(text);
        String optionsHash = Fingerprints.hashOptions(options, provider);
        String key = textHash + "-" + optionsHash;

        Map<String, Object> metadata = new LinkedHashMap<>(questionSet.getMetadata());
        metadata.remove(QuestionSet.META_CACHED);
        metadata.remove(META_CACHE_AGE_MINUTES);
        metadata.remove(META_ACCESS_COUNT);
        String questionsJson;
        String metadataJson;
        try {
            questionsJson = objectMapper.writeValueAsString(questionSet.getQuestions());
            metadataJson = objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize question set for caching", e);
        }

        transactionTemplate.executeWithoutResult(status -> {
            long now = clock.millis();
            QuestionCacheEntry entry = repository.findByCacheKey(key).orElseGet(QuestionCacheEntry::new);
            entry.setCacheKey(key);
            entry.setTextHash(textHash);
            entry.setOptionsHash(optionsHash);
            entry.setQuestions(questionsJson);
            entry.setAnalysis(questionSet.getAnalysis());
            entry.setMetadata(metadataJson);
            entry.setCreatedAt(now);
            entry.setAccessedAt(now);
            entry.setAccessCount(1);
            repository.save(entry);
            evictOverflow();
        });
        log.debug("Cached {} questions under {}", questionSet.size(), abbreviate(key));
    }

    @Override
    public void putAsync(String text, GenerationOptions options, String provider, QuestionSet questionSet) {
        if (!properties.isEnabled() || (options != null && options.hasImages())) {
            return;
        }
        QuestionSet snapshot = questionSet.withQuestions(questionSet.getQuestions());
        executor.execute(() -> {
            try {
                put(text, options, provider, snapshot);
            } catch (RuntimeException e) {
                log.warn("Background cache write failed: {}", e.getMessage());
                meterRegistry.counter(ERRORS_METRIC, "operation", "put").increment();
            }
        });
    }

    @Override
    public int clear() {
        long count = repository.count();
        repository.deleteAllInBatch();
        hits.set(0);
        misses.set(0);
        log.info("Cache cleared ({} entries)", count);
        return (int) count;
    }

    @Override
    public int purgeExpired() {
        int removed = repository.deleteCreatedAtOrBefore(clock.millis() - ttlMillis());
        if (removed > 0) {
            log.info("Purged {} expired cache entries", removed);
        }
        return removed;
    }

    @Override
    public CacheStats stats() {
        long total = repository.count();
        long accesses = repository.sumAccessCount();
        double average = total == 0 ? 0.0 : Math.round((double) accesses / total * 100) / 100.0;
        return new CacheStats(
                total,
                accesses,
                average,
                repository.findLastAccess().map(Instant::ofEpochMilli).orElse(null),
                repository.findOldestCreation().map(Instant::ofEpochMilli).orElse(null),
                properties.getMaxEntries(),
                properties.getTtlDays(),
                properties.isEnabled(),
                hits.get(),
                misses.get());
    }

    private void evictOverflow() {
        long overflow = repository.count() - properties.getMaxEntries();
        if (overflow <= 0) {
            return;
        }
        List<Long> oldest = repository.findIdsByAccessOrder(PageRequest.of(0, (int) overflow));
        int removed = repository.deleteByIds(oldest);
        log.info("Evicted {} least recently used cache entries", removed);
    }

    private long ttlMillis() {
        return Duration.ofDays(properties.getTtlDays()).toMillis();
    }

    private static String abbreviate(String key) {
        return key.length() > 16 ? key.substring(0, 16) + "..." : key;
    }
}
