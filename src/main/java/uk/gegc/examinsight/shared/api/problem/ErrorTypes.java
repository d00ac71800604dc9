package uk.gegc.examinsight.shared.api.problem;

import java.net.URI;

/**
 * Centralised catalog of RFC 7807 Problem Detail type URIs.
 * Each constant should point to documentation describing the error.
 *
 * @see ProblemDetailBuilder
 * @see <a href="https://www.rfc-editor.org/rfc/rfc7807">RFC 7807</a>
 */
public final class ErrorTypes {

    private static final String BASE_URL = "https://examinsight.app/docs/errors";

    // ==================== Resource Errors ====================
    public static final URI RESOURCE_NOT_FOUND = URI.create(BASE_URL + "/resource-not-found");

    // ==================== Validation Errors ====================
    public static final URI VALIDATION_FAILED = URI.create(BASE_URL + "/validation-failed");
    public static final URI INVALID_ARGUMENT = URI.create(BASE_URL + "/invalid-argument");
    public static final URI CONSTRAINT_VIOLATION = URI.create(BASE_URL + "/constraint-violation");
    public static final URI TYPE_MISMATCH = URI.create(BASE_URL + "/type-mismatch");
    public static final URI MALFORMED_JSON = URI.create(BASE_URL + "/malformed-json");

    // ==================== Security Errors ====================
    public static final URI UNAUTHORIZED = URI.create(BASE_URL + "/unauthorized");
    public static final URI ACCESS_DENIED = URI.create(BASE_URL + "/access-denied");

    // ==================== State Errors ====================
    public static final URI ATTEMPT_ALREADY_COMPLETED = URI.create(BASE_URL + "/attempt-already-completed");
    public static final URI ATTEMPT_NOT_COMPLETED = URI.create(BASE_URL + "/attempt-not-completed");
    public static final URI DATA_CONFLICT = URI.create(BASE_URL + "/data-conflict");

    // ==================== Generic Errors ====================
    public static final URI INTERNAL_SERVER_ERROR = URI.create(BASE_URL + "/internal-server-error");

    private ErrorTypes() {
        throw new AssertionError("Utility class - do not instantiate");
    }
}
