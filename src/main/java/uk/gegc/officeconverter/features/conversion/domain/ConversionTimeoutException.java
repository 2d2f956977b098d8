package uk.gegc.officeconverter.features.conversion.domain;

/**
 * Thrown when the external office process does not finish within its time budget.
 */
public class ConversionTimeoutException extends ConversionException {

    public ConversionTimeoutException(String message) {
        super(message);
    }
}
