package uk.gegc.officeconverter.features.conversion.domain;

/**
 * Exception thrown when document conversion fails due to processing errors.
 */
public class ConversionFailedException extends RuntimeException {

    public ConversionFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
