package uk.gegc.officeconverter.features.conversion.domain;

import uk.gegc.officeconverter.shared.exception.InvalidUploadException;

import java.util.Locale;

/**
 * Uploaded filename split into the part kept for the download name and the lower-cased extension.
 */
public record UploadName(String baseName, String extension) {

    private static final String FALLBACK_BASE_NAME = "converted";

    /**
     * Parses a client supplied filename. Any directory part is dropped, the extension is the
     * text after the last dot.
     *
     * @throws InvalidUploadException if the name is missing or has no extension
     */
    public static UploadName parse(String originalFilename) {
        if (originalFilename == null || originalFilename.isBlank()) {
            throw new InvalidUploadException("File must have a name");
        }
        String name = stripDirectories(originalFilename.trim());
        int dot = name.lastIndexOf('.');
        if (dot < 0) {
            throw new InvalidUploadException("File must have an extension");
        }
        String base = sanitize(name.substring(0, dot));
        String extension = name.substring(dot + 1).toLowerCase(Locale.ROOT);
        return new UploadName(base.isBlank() ? FALLBACK_BASE_NAME : base, extension);
    }

    public String withExtension(String newExtension) {
        return baseName + "." + newExtension;
    }

    private static String stripDirectories(String name) {
        int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        return slash >= 0 ? name.substring(slash + 1) : name;
    }

    // Keeps the Content-Disposition header a single, well-formed line
    private static String sanitize(String base) {
        return base.replaceAll("[\\r\\n\"]", "_").trim();
    }
}
