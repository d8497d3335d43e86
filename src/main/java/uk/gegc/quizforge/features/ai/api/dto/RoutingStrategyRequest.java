package uk.gegc.quizforge.features.ai.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

@Schema(description = "Request payload for changing the routing strategy")
public record RoutingStrategyRequest(
        @Schema(description = "preferred, cheapest, round-robin, fastest, quality or balanced", example = "cheapest")
        @NotBlank(message = "Strategy is required")
        String strategy
) {
}
