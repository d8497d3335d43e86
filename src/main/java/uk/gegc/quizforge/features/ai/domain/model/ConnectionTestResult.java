package uk.gegc.quizforge.features.ai.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome of a provider connectivity check.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConnectionTestResult(boolean success, String message, String provider, String model) {

    public static ConnectionTestResult success(String provider, String model, String message) {
        return new ConnectionTestResult(true, message, provider, model);
    }

    public static ConnectionTestResult failure(String provider, String model, String message) {
        return new ConnectionTestResult(false, message, provider, model);
    }
}
