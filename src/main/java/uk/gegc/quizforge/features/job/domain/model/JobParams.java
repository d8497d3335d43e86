package uk.gegc.quizforge.features.job.domain.model;

import uk.gegc.quizforge.features.generation.domain.model.GenerationOptions;

/**
 * What a job was submitted with, stored as JSON in the job row
 */
public record JobParams(String text, GenerationOptions options) {
}
