package uk.gegc.quizforge.shared.api.problem;

import java.net.URI;

/**
 * Catalog of RFC 7807 Problem Detail type URIs.
 *
 * @see ProblemDetailBuilder
 * @see <a href="https://www.rfc-editor.org/rfc/rfc7807">RFC 7807</a>
 */
public final class ErrorTypes {

    private static final String BASE_URL = "https://quizforge.dev/docs/errors";

    // ==================== Resource Errors ====================
    public static final URI JOB_NOT_FOUND = URI.create(BASE_URL + "/job-not-found");

    // ==================== Validation Errors ====================
    public static final URI VALIDATION_FAILED = URI.create(BASE_URL + "/validation-failed");
    public static final URI CONSTRAINT_VIOLATION = URI.create(BASE_URL + "/constraint-violation");
    public static final URI TYPE_MISMATCH = URI.create(BASE_URL + "/type-mismatch");
    public static final URI MALFORMED_JSON = URI.create(BASE_URL + "/malformed-json");

    // ==================== State Errors ====================
    public static final URI ILLEGAL_JOB_STATE = URI.create(BASE_URL + "/illegal-job-state");
    public static final URI OPTIMISTIC_LOCK_CONFLICT = URI.create(BASE_URL + "/optimistic-lock-conflict");

    // ==================== Provider Errors ====================
    public static final URI PROVIDER_ERROR = URI.create(BASE_URL + "/provider-error");
    public static final URI AI_RESPONSE_UNPARSEABLE = URI.create(BASE_URL + "/ai-response-unparseable");
    public static final URI PROVIDER_NOT_CONFIGURED = URI.create(BASE_URL + "/provider-not-configured");
    public static final URI NO_PROVIDER_AVAILABLE = URI.create(BASE_URL + "/no-provider-available");

    // ==================== Generic Errors ====================
    public static final URI PIPELINE_FAILED = URI.create(BASE_URL + "/pipeline-failed");
    public static final URI INTERNAL_SERVER_ERROR = URI.create(BASE_URL + "/internal-server-error");

    private ErrorTypes() {
        throw new AssertionError("Utility class - do not instantiate");
    }
}
