package uk.gegc.officeconverter.features.conversion.domain;

/**
 * Exception thrown when a document format is not supported by any converter.
 */
public class UnsupportedFormatException extends RuntimeException {

    private final String extension;

    public UnsupportedFormatException(String message, String extension) {
        super(message);
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }
}
