package uk.gegc.quizforge.features.generation.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import uk.gegc.quizforge.features.generation.domain.model.GenerationOptions;

@Schema(description = "Source text and generation options")
public record GenerateRequest(
        @Schema(description = "Source text to generate questions from", example = "Photosynthesis converts light energy into chemical energy stored in glucose.")
        @NotBlank(message = "Text is required")
        String text,

        @Schema(description = "Generation options; omitted values use the defaults")
        @Valid
        GenerationOptions options
) {
}
