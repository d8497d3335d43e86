package uk.gegc.quizforge.features.cache.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.quizforge.features.cache.application.CacheStats;
import uk.gegc.quizforge.features.cache.application.QuestionCacheService;

import java.util.Map;

@Tag(name = "Cache", description = "Inspect and clear the question cache")
@RestController
@RequestMapping("/api/cache")
@RequiredArgsConstructor
public class CacheController {

    private final QuestionCacheService cacheService;

    @Operation(summary = "Cache statistics")
    @GetMapping("/stats")
    public ResponseEntity<CacheStats> stats() {
        return ResponseEntity.ok(cacheService.stats());
    }

    @Operation(summary = "Clear the cache", description = "Removes every cached question set")
    @DeleteMapping
    public ResponseEntity<Map<String, Integer>> clear() {
        return ResponseEntity.ok(Map.of("removed", cacheService.clear()));
    }
}
