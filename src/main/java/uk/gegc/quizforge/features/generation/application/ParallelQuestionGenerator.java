package uk.gegc.quizforge.features.generation.application;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import uk.gegc.quizforge.features.generation.config.GenerationProperties;
import uk.gegc.quizforge.features.generation.domain.model.DistributionPlan;
import uk.gegc.quizforge.features.generation.domain.model.GenerationOptions;
import uk.gegc.quizforge.features.generation.domain.model.Question;
import uk.gegc.quizforge.features.generation.domain.model.QuestionSet;
import uk.gegc.quizforge.shared.exception.PipelineException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BiFunction;

/**
 * Splits a large generation into chunks and runs them concurrently on the fan-out pool.
 *
 * <p>Chunks never touch the cache; the merged set is cached by the caller. Questions are
 * merged in submission order regardless of completion order, and the first chunk failure
 * fails the whole generation.
 */
@Service
@Slf4j
public class ParallelQuestionGenerator {

    static final String STAGE = "fan-out";
    static final String META_PARALLEL = "parallel";
    static final String META_CHUNKS = "chunks";
    static final String META_DURATION_SECONDS = "durationSeconds";
    static final double SECONDS_PER_QUESTION = 3.0;

    private final GenerationProperties properties;
    private final Executor executor;

    public ParallelQuestionGenerator(GenerationProperties properties,
                                     @Qualifier("fanOutTaskExecutor") Executor executor) {
        this.properties = properties;
        this.executor = executor;
    }

    public boolean shouldUseParallel(int numQuestions, GenerationOptions options) {
        GenerationProperties.Parallel parallel = properties.getParallel();
        return parallel.isEnabled()
                && (options == null || options.parallelAllowed())
                && numQuestions >= parallel.getThreshold();
    }

    /**
     * Chunk sizes for the given total: full chunks first, remainder last.
     */
    public List<Integer> calculateChunks(int numQuestions) {
        int chunkSize = Math.max(1, properties.getParallel().getChunkSize());
        List<Integer> chunks = new ArrayList<>();
        int remaining = numQuestions;
        while (remaining > 0) {
            int size = Math.min(chunkSize, remaining);
            chunks.add(size);
            remaining -= size;
        }
        return chunks;
    }

    public QuestionSet generate(String text,
                                GenerationOptions options,
                                BiFunction<String, GenerationOptions, QuestionSet> generator,
                                GenerationProgressListener listener) {
        GenerationProgressListener progress = listener != null ? listener : GenerationProgressListener.NONE;
        int numQuestions = options.numQuestionsOrDefault();
        List<Integer> chunks = calculateChunks(numQuestions);
        int totalChunks = chunks.size();
        int maxWorkers = Math.max(1, properties.getParallel().getMaxWorkers());
        long started = System.nanoTime();

        log.info("Fanning out {} questions into {} chunks (max {} concurrent)", numQuestions, totalChunks, maxWorkers);
        progress.onProgress(new GenerationProgress(GenerationProgress.START, 0, totalChunks, 0, 0));

        Semaphore permits = new Semaphore(maxWorkers);
        AtomicInteger completed = new AtomicInteger();
        AtomicInteger produced = new AtomicInteger();
        AtomicReference<RuntimeException> firstFailure = new AtomicReference<>();
        CompletableFuture<Void> failFast = new CompletableFuture<>();
        List<CompletableFuture<QuestionSet>> futures = new ArrayList<>(totalChunks);

        int offset = 0;
        for (int i = 0; i < totalChunks && firstFailure.get() == null; i++) {
            int chunkIndex = i;
            GenerationOptions chunkOptions = chunkOptions(options, offset, chunks.get(i));
            offset += chunks.get(i);

            acquire(permits);
            if (firstFailure.get() != null) {
                permits.release();
                break;
            }
            CompletableFuture<QuestionSet> future = CompletableFuture.supplyAsync(() -> {
                try {
                    QuestionSet result = generator.apply(text, chunkOptions);
                    int done = completed.incrementAndGet();
                    int questions = produced.addAndGet(result.size());
                    log.debug("Chunk {}/{} complete with {} questions", chunkIndex + 1, totalChunks, result.size());
                    progress.onProgress(new GenerationProgress(GenerationProgress.CHUNK_COMPLETE,
                            done, totalChunks, done * 100 / totalChunks, questions));
                    return result;
                } catch (RuntimeException e) {
                    log.error("Chunk {}/{} failed: {}", chunkIndex + 1, totalChunks, e.getMessage());
                    progress.onProgress(new GenerationProgress(GenerationProgress.CHUNK_ERROR,
                            completed.get(), totalChunks, completed.get() * 100 / totalChunks, produced.get()));
                    if (firstFailure.compareAndSet(null, e)) {
                        failFast.completeExceptionally(e);
                    }
                    throw e;
                } finally {
                    permits.release();
                }
            }, executor);
            futures.add(future);
        }

        CompletableFuture<Void> all = CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]));
        try {
            CompletableFuture.anyOf(all, failFast).join();
        } catch (CompletionException e) {
            futures.forEach(future -> future.cancel(true));
        }
        if (firstFailure.get() != null) {
            throw firstFailure.get();
        }

        List<QuestionSet> results = futures.stream().map(CompletableFuture::join).toList();
        QuestionSet merged = merge(results, numQuestions);
        double durationSeconds = (System.nanoTime() - started) / 1_000_000_000.0;
        merged.putMetadata(META_PARALLEL, true);
        merged.putMetadata(META_CHUNKS, totalChunks);
        merged.putMetadata(META_DURATION_SECONDS, Math.round(durationSeconds * 100) / 100.0);

        log.info("Fan-out complete: {} questions from {} chunks in {}s",
                merged.size(), totalChunks, String.format("%.2f", durationSeconds));
        progress.onProgress(new GenerationProgress(GenerationProgress.COMPLETE,
                totalChunks, totalChunks, 100, merged.size()));
        return merged;
    }

    public TimeSavingsEstimate estimateTimeSavings(int numQuestions) {
        double sequential = numQuestions * SECONDS_PER_QUESTION;
        if (!shouldUseParallel(numQuestions, null)) {
            return new TimeSavingsEstimate(1, sequential, sequential, 0, 1.0);
        }
        int chunks = calculateChunks(numQuestions).size();
        int waves = (int) Math.ceil(chunks / (double) Math.max(1, properties.getParallel().getMaxWorkers()));
        double parallel = waves * properties.getParallel().getChunkSize() * SECONDS_PER_QUESTION;
        double speedup = Math.round(sequential / parallel * 100) / 100.0;
        return new TimeSavingsEstimate(chunks, sequential, parallel, sequential - parallel, speedup);
    }

    private GenerationOptions chunkOptions(GenerationOptions options, int offset, int size) {
        DistributionPlan plan = options.getDistributionPlan();
        return options.toBuilder()
                .numQuestions(size)
                .noCache(true)
                .parallel(false)
                .distributionPlan(plan != null ? plan.slice(offset, size) : null)
                .build();
    }

    private QuestionSet merge(List<QuestionSet> results, int numQuestions) {
        List<Question> questions = new ArrayList<>();
        String analysis = null;
        for (QuestionSet result : results) {
            questions.addAll(result.getQuestions());
            if (analysis == null) {
                analysis = result.getAnalysis();
            }
        }
        if (questions.size() > numQuestions) {
            questions = new ArrayList<>(questions.subList(0, numQuestions));
        }
        LinkedHashMap<String, Object> metadata = results.isEmpty()
                ? new LinkedHashMap<>()
                : new LinkedHashMap<>(results.get(0).getMetadata());
        metadata.put(QuestionSet.META_NUM_QUESTIONS, questions.size());
        return new QuestionSet(questions, analysis, metadata);
    }

    private static void acquire(Semaphore permits) {
        try {
            permits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PipelineException(STAGE, "Interrupted while waiting for a fan-out worker", e);
        }
    }
}
