package uk.gegc.quizforge.features.ai.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.quizforge.features.ai.api.dto.RoutingStrategyRequest;
import uk.gegc.quizforge.features.ai.api.dto.SwitchProviderRequest;
import uk.gegc.quizforge.features.ai.application.ProviderRouter;
import uk.gegc.quizforge.features.ai.domain.model.ConnectionTestResult;
import uk.gegc.quizforge.features.ai.domain.model.ProviderInfo;
import uk.gegc.quizforge.features.ai.domain.model.RoutingStats;
import uk.gegc.quizforge.shared.exception.QuestionValidationException;

import java.util.List;
import java.util.Map;

@Tag(
        name = "Providers",
        description = "Inspect, switch and test the AI providers"
)
@RestController
@RequestMapping("/api/providers")
@RequiredArgsConstructor
public class ProviderController {

    private final ProviderRouter providerRouter;

    @Operation(summary = "List providers",
            description = "All known providers, including those that failed to load")
    @GetMapping
    public ResponseEntity<List<ProviderInfo>> listProviders() {
        return ResponseEntity.ok(providerRouter.listProviders());
    }

    @Operation(summary = "Switch the current provider")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Provider switched"),
            @ApiResponse(responseCode = "503", description = "Provider unknown or not configured",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/switch")
    public ResponseEntity<ProviderInfo> switchProvider(@RequestBody @Valid SwitchProviderRequest request) {
        return ResponseEntity.ok(providerRouter.switchProvider(request.provider()));
    }

    @Operation(summary = "Test all providers", description = "Runs a connection test against every loaded provider")
    @PostMapping("/test")
    public ResponseEntity<Map<String, ConnectionTestResult>> testAll() {
        return ResponseEntity.ok(providerRouter.testAllProviders());
    }

    @Operation(summary = "Test one provider")
    @PostMapping("/{name}/test")
    public ResponseEntity<ConnectionTestResult> testProvider(
            @Parameter(description = "Provider name", required = true) @PathVariable String name
    ) {
        return ResponseEntity.ok(providerRouter.testProvider(name));
    }

    @Operation(summary = "Routing statistics", description = "Per-provider request counts, success rates and latency")
    @GetMapping("/routing-stats")
    public ResponseEntity<RoutingStats> routingStats() {
        return ResponseEntity.ok(providerRouter.getRoutingStats());
    }

    @Operation(summary = "Reset routing statistics")
    @DeleteMapping("/routing-stats")
    public ResponseEntity<Void> resetRoutingStats() {
        providerRouter.resetRoutingStats();
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Change the routing strategy")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Strategy changed"),
            @ApiResponse(responseCode = "400", description = "Unknown strategy",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PutMapping("/routing-strategy")
    public ResponseEntity<RoutingStats> setRoutingStrategy(@RequestBody @Valid RoutingStrategyRequest request) {
        if (!providerRouter.setRoutingStrategy(request.strategy())) {
            throw new QuestionValidationException("Unknown routing strategy: " + request.strategy());
        }
        return ResponseEntity.ok(providerRouter.getRoutingStats());
    }
}
