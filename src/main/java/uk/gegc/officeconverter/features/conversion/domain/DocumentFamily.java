package uk.gegc.officeconverter.features.conversion.domain;

public enum DocumentFamily {
    SPREADSHEET,
    WORD_PROCESSING,
    PRESENTATION,
    PUBLISHING,
    DATABASE
}
