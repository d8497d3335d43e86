package uk.gegc.quizforge.features.cache.domain.repository;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.quizforge.features.cache.domain.model.QuestionCacheEntry;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface QuestionCacheRepository extends JpaRepository<QuestionCacheEntry, Long> {

    Optional<QuestionCacheEntry> findByCacheKey(String cacheKey);

    @Modifying
    @Transactional
    @Query("UPDATE QuestionCacheEntry e SET e.accessedAt = :now, e.accessCount = e.accessCount + 1 WHERE e.id = :id")
    int touch(@Param("id") Long id, @Param("now") long now);

    @Modifying
    @Transactional
    @Query("DELETE FROM QuestionCacheEntry e WHERE e.createdAt <= :cutoff")
    int deleteCreatedAtOrBefore(@Param("cutoff") long cutoff);

    @Query("SELECT e.id FROM QuestionCacheEntry e ORDER BY e.accessedAt ASC, e.id ASC")
    List<Long> findIdsByAccessOrder(Pageable pageable);

    @Modifying
    @Transactional
    @Query("DELETE FROM QuestionCacheEntry e WHERE e.id IN :ids")
    int deleteByIds(@Param("ids") Collection<Long> ids);

    @Query("SELECT COALESCE(SUM(e.accessCount), 0) FROM QuestionCacheEntry e")
    long sumAccessCount();

    @Query("SELECT MAX(e.accessedAt) FROM QuestionCacheEntry e")
    Optional<Long> findLastAccess();

    @Query("SELECT MIN(e.createdAt) FROM QuestionCacheEntry e")
    Optional<Long> findOldestCreation();
}
