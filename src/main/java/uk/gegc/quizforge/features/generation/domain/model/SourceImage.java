package uk.gegc.quizforge.features.generation.domain.model;

/**
 * Base64 encoded image passed inline to multimodal providers.
 */
public record SourceImage(String data, String mediaType) {
}
