package uk.gegc.quizforge.features.generation.application.balance;

import uk.gegc.quizforge.features.generation.domain.model.Question;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record BalanceResult(
        List<Question> questions,
        boolean balanced,
        int attempts,
        DifficultyDistribution distribution,
        int removedCount,
        int addedCount,
        String reason
) {

    public Map<String, Object> toMetadata() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("balanced", balanced);
        metadata.put("attempts", attempts);
        metadata.put("distribution", distribution);
        metadata.put("removedCount", removedCount);
        metadata.put("addedCount", addedCount);
        metadata.put("reason", reason);
        return metadata;
    }
}
