package uk.gegc.quizforge.features.generation.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.quizforge.features.generation.api.dto.BatchGenerateRequest;
import uk.gegc.quizforge.features.generation.api.dto.GenerateRequest;
import uk.gegc.quizforge.features.generation.application.BatchGenerationResult;
import uk.gegc.quizforge.features.generation.application.GenerationStatus;
import uk.gegc.quizforge.features.generation.application.QuestionGenerationService;
import uk.gegc.quizforge.features.generation.domain.model.QuestionSet;

import java.util.List;

@Tag(name = "Generation", description = "Synchronous question generation")
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class GenerationController {

    private final QuestionGenerationService generationService;

    @Operation(summary = "Generate questions",
            description = "Runs the full pipeline and returns the question set. Large requests are fanned out.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Questions generated"),
            @ApiResponse(responseCode = "400", description = "Invalid text or options",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "502", description = "Provider failed",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "503", description = "No provider configured",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/generate")
    public ResponseEntity<QuestionSet> generate(@RequestBody @Valid GenerateRequest request) {
        return ResponseEntity.ok(generationService.generate(request.text(), request.options()));
    }

    @Operation(summary = "Generate for several texts",
            description = "Texts are processed one at a time; a failing text is reported without stopping the batch")
    @PostMapping("/generate/batch")
    public ResponseEntity<List<BatchGenerationResult>> batchGenerate(@RequestBody @Valid BatchGenerateRequest request) {
        return ResponseEntity.ok(generationService.batchGenerate(request.texts(), request.options()));
    }

    @Operation(summary = "Service status", description = "Providers, cache, fan-out settings and routing statistics")
    @GetMapping("/status")
    public ResponseEntity<GenerationStatus> status() {
        return ResponseEntity.ok(generationService.getStatus());
    }
}
