package uk.gegc.quizforge.features.ai.infra.dialect;

import java.util.Map;

/**
 * A vendor HTTP request: path relative to the provider base URL, extra headers and JSON body.
 */
public record DialectRequest(String path, Map<String, String> headers, Object body) {
}
