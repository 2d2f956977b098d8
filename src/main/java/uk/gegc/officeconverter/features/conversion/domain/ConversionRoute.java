package uk.gegc.officeconverter.features.conversion.domain;

/**
 * How a given source extension is converted.
 */
public record ConversionRoute(
        String extension,
        DocumentFamily family,
        ConversionStrategy strategy,
        TargetFormat target
) {
}
