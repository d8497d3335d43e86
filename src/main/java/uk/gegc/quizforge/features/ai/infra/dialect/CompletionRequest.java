package uk.gegc.quizforge.features.ai.infra.dialect;

import uk.gegc.quizforge.features.generation.domain.model.SourceImage;

import java.util.List;

/**
 * Vendor-neutral description of one completion call.
 *
 * @param systemPrompt optional system instruction
 * @param prompt       user prompt
 * @param images       inline images, empty when none
 * @param jsonOutput   ask the vendor for a JSON-only response where it supports it
 */
public record CompletionRequest(
        String systemPrompt,
        String prompt,
        List<SourceImage> images,
        double temperature,
        int maxTokens,
        boolean jsonOutput
) {

    public CompletionRequest {
        images = images == null ? List.of() : List.copyOf(images);
    }

    public boolean hasImages() {
        return !images.isEmpty();
    }
}
