package uk.gegc.officeconverter.features.conversion.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.headers.Header;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import uk.gegc.officeconverter.features.conversion.api.dto.SupportedFormatDto;
import uk.gegc.officeconverter.features.conversion.application.DocumentConversionService;
import uk.gegc.officeconverter.features.conversion.domain.ConversionResult;
import uk.gegc.officeconverter.shared.exception.InvalidUploadException;
import uk.gegc.officeconverter.shared.rate_limit.RateLimitDecision;
import uk.gegc.officeconverter.shared.rate_limit.RateLimitHeaders;
import uk.gegc.officeconverter.shared.rate_limit.RateLimitService;
import uk.gegc.officeconverter.shared.util.TrustedProxyUtil;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

@RestController
@RequestMapping("/convert")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Conversion", description = "Microsoft Office to OpenDocument conversion")
public class ConversionController {

    public static final String CONVERSION_STATUS_HEADER = "X-Conversion-Status";

    private final DocumentConversionService conversionService;
    private final RateLimitService rateLimitService;
    private final TrustedProxyUtil trustedProxyUtil;

    @Operation(
            summary = "Convert an Office document",
            description = "Converts a spreadsheet, word processing, presentation, publisher or database file to " +
                    "ODS, ODT or ODP. Limited to a fixed number of requests per client per window."
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Converted document",
                    content = @Content(mediaType = MediaType.APPLICATION_OCTET_STREAM_VALUE),
                    headers = {
                            @Header(name = CONVERSION_STATUS_HEADER, description = "Always 'success'"),
                            @Header(name = RateLimitHeaders.REMAINING, description = "Requests left in the current window"),
                            @Header(name = RateLimitHeaders.RESET, description = "Window reset time in epoch seconds")
                    }
            ),
            @ApiResponse(responseCode = "400", description = "Missing, empty, unreadable or unsupported file"),
            @ApiResponse(responseCode = "413", description = "Upload too large"),
            @ApiResponse(responseCode = "429", description = "Rate limit exceeded"),
            @ApiResponse(responseCode = "500", description = "Conversion failed"),
            @ApiResponse(responseCode = "504", description = "Conversion timed out")
    })
    @PostMapping({"", "/"})
    public ResponseEntity<byte[]> convert(
            @Parameter(description = "Office document to convert", required = true)
            @RequestParam(value = "file", required = false) MultipartFile file,
            HttpServletRequest request,
            HttpServletResponse response) {

        String clientIp = trustedProxyUtil.getClientIp(request);
        RateLimitDecision decision = rateLimitService.admit(clientIp);
        // Set on the servlet response so error responses carry them too
        RateLimitHeaders.apply(response, decision);

        if (file == null) {
            throw new InvalidUploadException("No file part in request");
        }

        byte[] bytes;
        try {
            bytes = file.getBytes();
        } catch (IOException e) {
            log.error("Could not read upload {}", file.getOriginalFilename(), e);
            throw new InvalidUploadException("Could not read uploaded file", e);
        }

        ConversionResult result = conversionService.convert(file.getOriginalFilename(), bytes);
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_OCTET_STREAM)
                .header(HttpHeaders.CONTENT_DISPOSITION, contentDisposition(result.filename()))
                .header(CONVERSION_STATUS_HEADER, "success")
                .contentLength(result.size())
                .body(result.content());
    }

    @Operation(summary = "List supported formats")
    @ApiResponse(
            responseCode = "200",
            description = "Accepted extensions with their conversion route",
            content = @Content(array = @ArraySchema(schema = @Schema(implementation = SupportedFormatDto.class)))
    )
    @GetMapping("/formats")
    public ResponseEntity<List<SupportedFormatDto>> formats() {
        List<SupportedFormatDto> formats = conversionService.supportedRoutes().stream()
                .map(SupportedFormatDto::from)
                .toList();
        return ResponseEntity.ok(formats);
    }

    static String contentDisposition(String filename) {
        ContentDisposition.Builder builder = ContentDisposition.attachment();
        if (StandardCharsets.US_ASCII.newEncoder().canEncode(filename)) {
            builder.filename(filename);
        } else {
            builder.filename(filename, StandardCharsets.UTF_8);
        }
        return builder.build().toString();
    }
}
