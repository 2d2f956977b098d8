package uk.gegc.officeconverter.features.conversion.domain;

/**
 * Result of document conversion containing the converted file.
 */
public record ConversionResult(String filename, TargetFormat target, byte[] content) {

    public int size() {
        return content.length;
    }
}
