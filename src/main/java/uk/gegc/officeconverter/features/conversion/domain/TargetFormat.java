package uk.gegc.officeconverter.features.conversion.domain;

/**
 * OpenDocument container produced by a conversion.
 */
public enum TargetFormat {
    ODS("ods", "application/vnd.oasis.opendocument.spreadsheet"),
    ODT("odt", "application/vnd.oasis.opendocument.text"),
    ODP("odp", "application/vnd.oasis.opendocument.presentation");

    private final String extension;
    private final String mediaType;

    TargetFormat(String extension, String mediaType) {
        this.extension = extension;
        this.mediaType = mediaType;
    }

    public String extension() {
        return extension;
    }

    public String mediaType() {
        return mediaType;
    }
}
