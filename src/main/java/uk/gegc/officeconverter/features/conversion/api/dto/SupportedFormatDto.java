package uk.gegc.officeconverter.features.conversion.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.officeconverter.features.conversion.domain.ConversionRoute;

@Schema(description = "An accepted upload extension and how it is converted")
public record SupportedFormatDto(
        @Schema(description = "File extension without the dot", example = "xlsx")
        String extension,

        @Schema(description = "Document family", example = "SPREADSHEET")
        String family,

        @Schema(description = "Conversion strategy", example = "LIBRARY")
        String strategy,

        @Schema(description = "Extension of the produced OpenDocument file", example = "ods")
        String target
) {
    public static SupportedFormatDto from(ConversionRoute route) {
        return new SupportedFormatDto(
                route.extension(),
                route.family().name(),
                route.strategy().name(),
                route.target().extension()
        );
    }
}
