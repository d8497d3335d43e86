package uk.gegc.quizforge.features.job.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.quizforge.features.generation.domain.model.QuestionSet;
import uk.gegc.quizforge.features.job.domain.model.JobStatus;

import java.time.Instant;
import java.util.UUID;

@Schema(description = "State of a generation job")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobResponse(
        UUID id,
        JobStatus status,
        @Schema(description = "0-100") int progress,
        @Schema(description = "Generated question set once completed") QuestionSet result,
        String error,
        Instant createdAt,
        Instant startedAt,
        Instant completedAt
) {
}
