package uk.gegc.quizforge.features.job.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.Data;
import lombok.NoArgsConstructor;
import uk.gegc.quizforge.shared.exception.JobException;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "generation_jobs")
@Data
@NoArgsConstructor
public class GenerationJob {

    @Id
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private JobStatus status;

    @Column(name = "progress", nullable = false)
    private int progress;

    /**
     * JSON of the submitted text and options
     */
    @Lob
    @Column(name = "params", nullable = false)
    private String params;

    /**
     * JSON of the generated question set once completed
     */
    @Lob
    @Column(name = "result")
    private String result;

    @Lob
    @Column(name = "error")
    private String error;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Version
    @Column(name = "version")
    private Long version;

    /**
     * Moves the job to {@code next}.
     *
     * @throws JobException if the lifecycle does not allow it
     */
    public void transitionTo(JobStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new JobException("Job " + id + " cannot move from " + status.getValue() + " to " + next.getValue());
        }
        this.status = next;
    }
}
