package uk.gegc.officeconverter.features.conversion.application;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.officeconverter.features.conversion.domain.ConversionRoute;
import uk.gegc.officeconverter.features.conversion.domain.ConversionStrategy;
import uk.gegc.officeconverter.features.conversion.domain.DocumentFamily;
import uk.gegc.officeconverter.features.conversion.domain.TargetFormat;
import uk.gegc.officeconverter.features.conversion.domain.UnsupportedFormatException;
import uk.gegc.officeconverter.features.conversion.domain.UploadName;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Static extension table deciding the conversion strategy and the OpenDocument target.
 *
 * <p>Formats POI reads reliably stay in-process; binary, template, macro and
 * non-Office-XML formats go to LibreOffice.
 */
@Component
@Slf4j
public class FormatDispatcher {

    private static final Map<String, ConversionRoute> ROUTES = buildRoutes();

    /**
     * Selects the route for an uploaded file.
     *
     * @param uploadName the parsed upload filename
     * @return the route for its extension
     * @throws UnsupportedFormatException if the extension is not in the table
     */
    public ConversionRoute dispatch(UploadName uploadName) {
        ConversionRoute route = ROUTES.get(uploadName.extension());
        if (route == null) {
            log.warn("Unsupported file format: {}", uploadName.extension());
            throw new UnsupportedFormatException("Unsupported file format", uploadName.extension());
        }
        log.debug("Dispatching .{} to {} -> {}", route.extension(), route.strategy(), route.target());
        return route;
    }

    public List<ConversionRoute> supportedRoutes() {
        return List.copyOf(ROUTES.values());
    }

    private static Map<String, ConversionRoute> buildRoutes() {
        Map<String, ConversionRoute> routes = new LinkedHashMap<>();

        register(routes, DocumentFamily.SPREADSHEET, ConversionStrategy.LIBRARY, TargetFormat.ODS,
                "xlsx", "xls", "xlsm");
        register(routes, DocumentFamily.WORD_PROCESSING, ConversionStrategy.LIBRARY, TargetFormat.ODT,
                "docx");
        register(routes, DocumentFamily.PRESENTATION, ConversionStrategy.LIBRARY, TargetFormat.ODP,
                "pptx", "ppt", "ppsx", "pps");

        register(routes, DocumentFamily.SPREADSHEET, ConversionStrategy.OFFICE_PROCESS, TargetFormat.ODS,
                "xlsb", "xltx", "xltm");
        register(routes, DocumentFamily.WORD_PROCESSING, ConversionStrategy.OFFICE_PROCESS, TargetFormat.ODT,
                "doc", "dotx", "dotm");
        register(routes, DocumentFamily.PRESENTATION, ConversionStrategy.OFFICE_PROCESS, TargetFormat.ODP,
                "potx", "potm");
        register(routes, DocumentFamily.PUBLISHING, ConversionStrategy.OFFICE_PROCESS, TargetFormat.ODT,
                "pub");
        // Access databases are exported as spreadsheets
        register(routes, DocumentFamily.DATABASE, ConversionStrategy.OFFICE_PROCESS, TargetFormat.ODS,
                "mdb", "accdb");

        return Collections.unmodifiableMap(routes);
    }

    private static void register(Map<String, ConversionRoute> routes,
                                 DocumentFamily family,
                                 ConversionStrategy strategy,
                                 TargetFormat target,
                                 String... extensions) {
        for (String extension : extensions) {
            ConversionRoute previous = routes.putIfAbsent(extension, new ConversionRoute(extension, family, strategy, target));
            if (previous != null) {
                throw new IllegalStateException("Extension registered twice: " + extension);
            }
        }
    }
}
