package uk.gegc.quizforge.features.job.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.quizforge.features.job.domain.model.GenerationJob;
import uk.gegc.quizforge.features.job.domain.model.JobStatus;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface GenerationJobRepository extends JpaRepository<GenerationJob, UUID> {

    List<GenerationJob> findByStatusOrderByCreatedAtAsc(JobStatus status);

    List<GenerationJob> findAllByOrderByCreatedAtAsc();

    long countByStatus(JobStatus status);

    @Query("SELECT j.id FROM GenerationJob j WHERE j.status = :status ORDER BY j.createdAt ASC")
    List<UUID> findIdsByStatus(@Param("status") JobStatus status);

    /**
     * Raises the progress of a running job. Lower or equal values are ignored so that
     * progress never moves backwards.
     */
    @Modifying(clearAutomatically = true)
    @Query("""
        UPDATE GenerationJob j
        SET j.progress = :progress,
            j.version = COALESCE(j.version, 0) + 1
        WHERE j.id = :id AND j.status = :status AND j.progress < :progress
    """)
    int raiseProgress(@Param("id") UUID id, @Param("progress") int progress, @Param("status") JobStatus status);

    /**
     * Puts interrupted running jobs back in the pending state after a restart.
     */
    @Modifying(clearAutomatically = true)
    @Query("""
        UPDATE GenerationJob j
        SET j.status = :to,
            j.progress = 0,
            j.startedAt = NULL,
            j.version = COALESCE(j.version, 0) + 1
        WHERE j.status = :from
    """)
    int resetStatus(@Param("from") JobStatus from, @Param("to") JobStatus to);

    @Modifying
    @Query("DELETE FROM GenerationJob j WHERE j.status IN :statuses AND j.completedAt < :cutoff")
    int deleteFinishedBefore(@Param("statuses") Collection<JobStatus> statuses, @Param("cutoff") Instant cutoff);
}
