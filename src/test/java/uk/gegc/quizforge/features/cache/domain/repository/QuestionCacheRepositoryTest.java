package uk.gegc.quizforge.features.cache.domain.repository;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.data.domain.PageRequest;
import uk.gegc.quizforge.features.cache.domain.model.QuestionCacheEntry;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@DisplayName("QuestionCacheRepository")
class QuestionCacheRepositoryTest {

    @Autowired
    private TestEntityManager entityManager;

    @Autowired
    private QuestionCacheRepository repository;

    private QuestionCacheEntry persist(String key, long createdAt, long accessedAt) {
        QuestionCacheEntry entry = new QuestionCacheEntry();
        entry.setCacheKey(key);
        entry.setTextHash("t".repeat(64));
        entry.setOptionsHash("o".repeat(64));
        entry.setQuestions("[]");
        entry.setCreatedAt(createdAt);
        entry.setAccessedAt(accessedAt);
        return entityManager.persistAndFlush(entry);
    }

    @Test
    @DisplayName("touch bumps the access time and count")
    void touchUpdatesAccess() {
        // Given
        QuestionCacheEntry entry = persist("key-1", 1_000, 1_000);

        // When
        int updated = repository.touch(entry.getId(), 5_000);
        entityManager.clear();

        // Then
        assertThat(updated).isEqualTo(1);
        QuestionCacheEntry reloaded = repository.findByCacheKey("key-1").orElseThrow();
        assertThat(reloaded.getAccessedAt()).isEqualTo(5_000);
        assertThat(reloaded.getAccessCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("ids come back least recently accessed first")
    void accessOrder() {
        QuestionCacheEntry recent = persist("recent", 1_000, 9_000);
        QuestionCacheEntry stale = persist("stale", 2_000, 3_000);
        QuestionCacheEntry middle = persist("middle", 3_000, 6_000);

        List<Long> ids = repository.findIdsByAccessOrder(PageRequest.of(0, 2));

        assertThat(ids).containsExactly(stale.getId(), middle.getId());
        assertThat(recent.getId()).isNotIn(ids);
    }

    @Test
    @DisplayName("bulk deletes remove by creation cutoff and by id")
    void bulkDeletes() {
        // Given
        QuestionCacheEntry old = persist("old", 1_000, 1_000);
        QuestionCacheEntry fresh = persist("fresh", 8_000, 8_000);
        QuestionCacheEntry other = persist("other", 9_000, 9_000);

        // When
        int expired = repository.deleteCreatedAtOrBefore(5_000);
        int byId = repository.deleteByIds(List.of(other.getId()));
        entityManager.clear();

        // Then
        assertThat(expired).isEqualTo(1);
        assertThat(byId).isEqualTo(1);
        assertThat(repository.findAll()).extracting(QuestionCacheEntry::getId).containsExactly(fresh.getId());
        assertThat(repository.findById(old.getId())).isEmpty();
    }

    @Test
    @DisplayName("aggregates are empty-safe")
    void aggregates() {
        assertThat(repository.sumAccessCount()).isZero();
        assertThat(repository.findLastAccess()).isEmpty();
        assertThat(repository.findOldestCreation()).isEmpty();

        persist("a", 1_000, 4_000);
        persist("b", 2_000, 7_000);

        assertThat(repository.sumAccessCount()).isEqualTo(2);
        assertThat(repository.findLastAccess()).contains(7_000L);
        assertThat(repository.findOldestCreation()).contains(1_000L);
    }
}
