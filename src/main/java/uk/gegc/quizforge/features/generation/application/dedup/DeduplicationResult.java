package uk.gegc.quizforge.features.generation.application.dedup;

import uk.gegc.quizforge.features.generation.domain.model.Question;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record DeduplicationResult(
        List<Question> questions,
        int duplicatesFound,
        int duplicatesRemoved,
        int kept,
        List<DuplicateGroup> groups
) {

    public Map<String, Object> toMetadata() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("duplicatesFound", duplicatesFound);
        metadata.put("duplicatesRemoved", duplicatesRemoved);
        metadata.put("kept", kept);
        metadata.put("groups", groups);
        return metadata;
    }
}
