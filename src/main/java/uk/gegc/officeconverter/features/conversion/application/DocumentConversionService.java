package uk.gegc.officeconverter.features.conversion.application;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.officeconverter.features.conversion.domain.ConversionException;
import uk.gegc.officeconverter.features.conversion.domain.ConversionFailedException;
import uk.gegc.officeconverter.features.conversion.domain.ConversionResult;
import uk.gegc.officeconverter.features.conversion.domain.ConversionRoute;
import uk.gegc.officeconverter.features.conversion.domain.ConversionTimeoutException;
import uk.gegc.officeconverter.features.conversion.domain.DocumentConverter;
import uk.gegc.officeconverter.features.conversion.domain.UnreadableDocumentException;
import uk.gegc.officeconverter.features.conversion.domain.UnsupportedFormatException;
import uk.gegc.officeconverter.features.conversion.domain.UploadName;
import uk.gegc.officeconverter.shared.exception.InvalidUploadException;

import java.io.IOException;
import java.util.List;
import java.util.Locale;

/**
 * Converts uploaded Office documents to OpenDocument.
 * Dispatches on the file extension, then delegates to the converter that supports the route.
 * Every attempt runs in its own workspace, which is removed before this method returns.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentConversionService {

    private final FormatDispatcher formatDispatcher;
    private final TempFileManager tempFileManager;
    private final List<DocumentConverter> converters;
    private final MeterRegistry meterRegistry;

    /**
     * Converts document bytes to the OpenDocument format chosen for their extension.
     *
     * @param originalFilename the uploaded filename (used for format detection and the result name)
     * @param bytes            the document bytes
     * @return the converted document
     * @throws InvalidUploadException     if the name has no extension, the content is empty or unreadable
     * @throws UnsupportedFormatException if the extension is not supported
     * @throws ConversionFailedException  if conversion fails; a timeout is the cause when the external process overran
     */
    public ConversionResult convert(String originalFilename, byte[] bytes) {
        UploadName uploadName = UploadName.parse(originalFilename);
        if (bytes == null || bytes.length == 0) {
            throw new InvalidUploadException("Uploaded file is empty");
        }
        ConversionRoute route = formatDispatcher.dispatch(uploadName);
        DocumentConverter converter = findConverter(route);

        log.info("Converting {} ({} bytes) to {} using {}", originalFilename, bytes.length,
                route.target().extension(), converter.getClass().getSimpleName());
        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "failure";
        try (ConversionWorkspace workspace = tempFileManager.open(originalFilename, uploadName, route)) {
            workspace.writeInput(bytes);
            converter.convert(workspace.job());
            if (!workspace.hasOutput()) {
                throw new ConversionException("Converter produced no output");
            }

            ConversionResult result = new ConversionResult(
                    uploadName.withExtension(route.target().extension()),
                    route.target(),
                    workspace.readOutput()
            );
            outcome = "success";
            log.info("Successfully converted {} to {} ({} bytes)", originalFilename, result.filename(), result.size());
            return result;
        } catch (UnreadableDocumentException e) {
            outcome = "rejected";
            log.warn("Could not read {} as .{}: {}", originalFilename, route.extension(), e.getMessage());
            throw new InvalidUploadException("File could not be read as ." + route.extension(), e);
        } catch (ConversionTimeoutException e) {
            outcome = "timeout";
            log.error("Conversion timed out for {}: {}", originalFilename, e.getMessage());
            throw new ConversionFailedException("Conversion timed out", e);
        } catch (ConversionException e) {
            log.error("Conversion failed for {}: {}", originalFilename, e.getMessage(), e);
            throw new ConversionFailedException("Conversion failed: " + e.getMessage(), e);
        } catch (IOException e) {
            log.error("Could not stage files for {}: {}", originalFilename, e.getMessage(), e);
            throw new ConversionFailedException("Conversion failed: could not stage temporary files", e);
        } finally {
            String strategy = route.strategy().name().toLowerCase(Locale.ROOT);
            sample.stop(meterRegistry.timer("conversion.duration", "strategy", strategy));
            meterRegistry.counter("conversion.requests", "strategy", strategy, "outcome", outcome).increment();
        }
    }

    /**
     * Lists the routes this service can handle.
     */
    public List<ConversionRoute> supportedRoutes() {
        return formatDispatcher.supportedRoutes().stream()
                .filter(route -> converters.stream().anyMatch(converter -> converter.supports(route)))
                .toList();
    }

    private DocumentConverter findConverter(ConversionRoute route) {
        return converters.stream()
                .filter(converter -> converter.supports(route))
                .findFirst()
                .orElseThrow(() -> new UnsupportedFormatException(
                        "No converter available for ." + route.extension(), route.extension()));
    }
}
