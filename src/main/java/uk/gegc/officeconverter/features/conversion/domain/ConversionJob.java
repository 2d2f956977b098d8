package uk.gegc.officeconverter.features.conversion.domain;

import java.nio.file.Path;

/**
 * One conversion attempt. The paths live inside a per-request work directory that is
 * removed when the attempt finishes, whatever the outcome.
 *
 * @param originalFilename name of the uploaded file as sent by the client
 * @param baseName         original filename without its extension
 * @param route            dispatch decision for the file's extension
 * @param workDirectory    directory owned by this job
 * @param inputFile        uploaded bytes, named {@code input.<extension>}
 * @param outputFile       where the converter must write, named {@code input.<target>}
 */
public record ConversionJob(
        String originalFilename,
        String baseName,
        ConversionRoute route,
        Path workDirectory,
        Path inputFile,
        Path outputFile
) {
}
