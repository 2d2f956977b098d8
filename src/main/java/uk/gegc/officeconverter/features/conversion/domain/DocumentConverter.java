package uk.gegc.officeconverter.features.conversion.domain;

/**
 * Strategy for turning an Office file into its OpenDocument counterpart.
 */
public interface DocumentConverter {

    /**
     * Checks if this converter handles the given route.
     *
     * @param route the dispatch decision for the uploaded file
     * @return true if this converter can handle the route
     */
    boolean supports(ConversionRoute route);

    /**
     * Reads {@link ConversionJob#inputFile()} and writes the converted document to
     * {@link ConversionJob#outputFile()}.
     *
     * @param job the conversion job
     * @throws ConversionException if conversion fails
     */
    void convert(ConversionJob job) throws ConversionException;
}
