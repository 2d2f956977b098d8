package uk.gegc.officeconverter.shared.api.problem;

import java.net.URI;

/**
 * Centralised catalog of RFC 7807 Problem Detail type URIs.
 * Each constant should point to documentation describing the error.
 *
 * <p>Example usage:
 * <pre>
 * ProblemDetail problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
 * problem.setType(ErrorTypes.UNSUPPORTED_FORMAT);
 * problem.setTitle("Unsupported Format");
 * </pre>
 *
 * @see ProblemDetailBuilder
 * @see <a href="https://www.rfc-editor.org/rfc/rfc7807">RFC 7807</a>
 */
public final class ErrorTypes {

    private static final String BASE_URL = "https://office-converter.gegc.uk/docs/errors";

    // ==================== Upload Errors ====================
    public static final URI INVALID_UPLOAD = URI.create(BASE_URL + "/invalid-upload");
    public static final URI MISSING_FILE = URI.create(BASE_URL + "/missing-file");
    public static final URI UPLOAD_TOO_LARGE = URI.create(BASE_URL + "/upload-too-large");
    public static final URI UNSUPPORTED_FORMAT = URI.create(BASE_URL + "/unsupported-format");

    // ==================== Processing Errors ====================
    public static final URI CONVERSION_FAILED = URI.create(BASE_URL + "/conversion-failed");
    public static final URI CONVERSION_TIMEOUT = URI.create(BASE_URL + "/conversion-timeout");

    // ==================== Rate Limiting ====================
    public static final URI RATE_LIMIT_EXCEEDED = URI.create(BASE_URL + "/rate-limit-exceeded");

    // ==================== Generic Errors ====================
    public static final URI INTERNAL_SERVER_ERROR = URI.create(BASE_URL + "/internal-server-error");

    private ErrorTypes() {
        throw new AssertionError("Utility class - do not instantiate");
    }
}
