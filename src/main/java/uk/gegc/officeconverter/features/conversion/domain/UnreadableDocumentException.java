package uk.gegc.officeconverter.features.conversion.domain;

/**
 * Thrown by in-process converters when the upload cannot be opened as the format its
 * extension claims, i.e. the file is corrupt or mislabelled.
 */
public class UnreadableDocumentException extends ConversionException {

    public UnreadableDocumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
