package uk.gegc.quizforge.features.generation.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the generation pipeline stages
 */
@Component
@ConfigurationProperties(prefix = "quizforge.generation")
@Data
public class GenerationProperties {

    /**
     * Input text beyond this length is truncated before generation
     */
    private int maxTextChars = 1_000_000;

    private int minTextChars = 50;

    /**
     * Pause between the items of a batch generation
     */
    private long batchDelayMs = 1000;

    private Parallel parallel = new Parallel();
    private Quality quality = new Quality();
    private Dedup dedup = new Dedup();
    private Balance balance = new Balance();

    @Data
    public static class Parallel {
        private boolean enabled = true;
        /**
         * Questions per chunk
         */
        private int chunkSize = 10;
        private int maxWorkers = 5;
        /**
         * Requests above this many questions are fanned out
         */
        private int threshold = 20;
    }

    @Data
    public static class Quality {
        private boolean enabled = true;
        private double minScore = 6.0;
        /**
         * Regeneration rounds for rejected questions
         */
        private int maxRetries = 2;
        private int batchSize = 5;
        private boolean useQuickScore = false;
        private String scorerProvider = "gemini";
    }

    @Data
    public static class Dedup {
        private boolean enabled = true;
        /**
         * Similarity (0-100) at or above which two questions are duplicates
         */
        private double threshold = 85.0;
        private boolean compareOptions = true;
        private int maxReplenishAttempts = 3;
    }

    @Data
    public static class Balance {
        private boolean enabled = true;
        private double easy = 0.30;
        private double medium = 0.40;
        private double hard = 0.30;
        private double tolerance = 0.10;
        private int maxRetries = 2;
    }
}
