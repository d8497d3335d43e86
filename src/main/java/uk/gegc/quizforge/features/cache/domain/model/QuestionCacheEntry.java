package uk.gegc.quizforge.features.cache.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A cached question set. JSON columns hold the serialized questions and metadata;
 * timestamps are epoch milliseconds.
 */
@Entity
@Table(name = "question_cache")
@Data
@NoArgsConstructor
public class QuestionCacheEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "cache_key", nullable = false, unique = true, length = 160)
    private String cacheKey;

    @Column(name = "text_hash", nullable = false, length = 64)
    private String textHash;

    @Column(name = "options_hash", nullable = false, length = 64)
    private String optionsHash;

    @Lob
    @Column(name = "questions", nullable = false)
    private String questions;

    @Lob
    @Column(name = "analysis")
    private String analysis;

    @Lob
    @Column(name = "metadata")
    private String metadata;

    @Column(name = "created_at", nullable = false)
    private long createdAt;

    @Column(name = "accessed_at", nullable = false)
    private long accessedAt;

    @Column(name = "access_count", nullable = false)
    private int accessCount = 1;

    public boolean isExpired(long nowMillis, long ttlMillis) {
        return nowMillis - createdAt >= ttlMillis;
    }
}
