package uk.gegc.quizforge.features.generation.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import uk.gegc.quizforge.features.generation.domain.model.GenerationOptions;

import java.util.List;

@Schema(description = "Several source texts generated one after another with the same options")
public record BatchGenerateRequest(
        @Schema(description = "Source texts")
        @NotEmpty(message = "At least one text is required")
        List<String> texts,

        @Valid
        GenerationOptions options
) {
}
