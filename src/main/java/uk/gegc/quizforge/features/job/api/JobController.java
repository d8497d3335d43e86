package uk.gegc.quizforge.features.job.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.quizforge.features.job.api.dto.JobResponse;
import uk.gegc.quizforge.features.job.api.dto.JobSubmitRequest;
import uk.gegc.quizforge.features.job.application.GenerationJobQueue;
import uk.gegc.quizforge.features.job.application.GenerationJobStore;
import uk.gegc.quizforge.features.job.application.QueueStats;
import uk.gegc.quizforge.features.job.domain.model.JobStatus;
import uk.gegc.quizforge.shared.exception.QuestionValidationException;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Tag(name = "Jobs", description = "Asynchronous question generation")
@RestController
@RequestMapping("/api/jobs")
@RequiredArgsConstructor
@Validated
public class JobController {

    private final GenerationJobQueue jobQueue;
    private final GenerationJobStore jobStore;
    private final JobMapper jobMapper;

    @Operation(summary = "Queue a generation job", description = "Returns immediately with the pending job")
    @ApiResponses({
            @ApiResponse(responseCode = "202", description = "Job accepted"),
            @ApiResponse(responseCode = "400", description = "Invalid text or options",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping
    public ResponseEntity<JobResponse> submit(@RequestBody @Valid JobSubmitRequest request) {
        JobResponse job = jobMapper.toResponse(jobQueue.submit(request.text(), request.options()));
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(job);
    }

    @Operation(summary = "Get a job")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Job found"),
            @ApiResponse(responseCode = "404", description = "Unknown job",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/{id}")
    public ResponseEntity<JobResponse> get(@Parameter(description = "Job id", required = true) @PathVariable UUID id) {
        return ResponseEntity.ok(jobMapper.toResponse(jobStore.get(id)));
    }

    @Operation(summary = "List jobs", description = "All jobs in creation order, optionally filtered by status")
    @GetMapping
    public ResponseEntity<List<JobResponse>> list(
            @Parameter(description = "pending, running, completed, failed or cancelled")
            @RequestParam(required = false) String status
    ) {
        JobStatus filter = null;
        if (status != null && !status.isBlank()) {
            filter = JobStatus.parse(status)
                    .orElseThrow(() -> new QuestionValidationException("Unknown job status: " + status));
        }
        return ResponseEntity.ok(jobStore.findByStatus(filter).stream().map(jobMapper::toResponse).toList());
    }

    @Operation(summary = "Cancel a pending job")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Job cancelled"),
            @ApiResponse(responseCode = "404", description = "Unknown job",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Job is no longer pending",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @DeleteMapping("/{id}")
    public ResponseEntity<JobResponse> cancel(@PathVariable UUID id) {
        return ResponseEntity.ok(jobMapper.toResponse(jobQueue.cancel(id)));
    }

    @Operation(summary = "Queue statistics")
    @GetMapping("/stats")
    public ResponseEntity<QueueStats> stats() {
        return ResponseEntity.ok(jobQueue.getStats());
    }

    @Operation(summary = "Remove finished jobs", description = "Deletes completed, failed and cancelled jobs older than the given age")
    @DeleteMapping("/finished")
    public ResponseEntity<Map<String, Integer>> clearFinished(
            @RequestParam(defaultValue = "24") @Min(0) int olderThanHours
    ) {
        return ResponseEntity.ok(Map.of("removed", jobStore.clearFinished(Duration.ofHours(olderThanHours))));
    }
}
