package uk.gegc.officeconverter.shared.exception;

/**
 * Thrown when the uploaded file cannot be accepted: no name, no extension,
 * empty content or an unreadable multipart body.
 */
public class InvalidUploadException extends RuntimeException {

    public InvalidUploadException(String message) {
        super(message);
    }

    public InvalidUploadException(String message, Throwable cause) {
        super(message, cause);
    }
}
