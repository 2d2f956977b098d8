package uk.gegc.officeconverter.features.conversion.domain;

public enum ConversionStrategy {
    /** Read with Apache POI and write with odfdom inside the JVM. */
    LIBRARY,
    /** Hand the file to a headless LibreOffice process. */
    OFFICE_PROCESS
}
