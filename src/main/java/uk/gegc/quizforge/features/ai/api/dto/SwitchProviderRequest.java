package uk.gegc.quizforge.features.ai.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

@Schema(description = "Request payload for switching the current provider")
public record SwitchProviderRequest(
        @Schema(description = "Provider name", example = "openai")
        @NotBlank(message = "Provider name is required")
        String provider
) {
}
