package uk.gegc.quizforge.features.job.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import uk.gegc.quizforge.features.generation.domain.model.GenerationOptions;

@Schema(description = "Request payload for queueing a generation job")
public record JobSubmitRequest(
        @Schema(description = "Source text to generate questions from")
        @NotBlank(message = "Text is required")
        String text,

        @Valid
        GenerationOptions options
) {
}
