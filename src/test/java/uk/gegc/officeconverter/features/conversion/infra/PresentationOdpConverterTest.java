package uk.gegc.officeconverter.features.conversion.infra;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import uk.gegc.officeconverter.features.conversion.domain.ConversionJob;
import uk.gegc.officeconverter.features.conversion.domain.ConversionRoute;
import uk.gegc.officeconverter.features.conversion.domain.ConversionStrategy;
import uk.gegc.officeconverter.features.conversion.domain.DocumentFamily;
import uk.gegc.officeconverter.features.conversion.domain.TargetFormat;
import uk.gegc.officeconverter.features.conversion.domain.UnreadableDocumentException;
import uk.gegc.officeconverter.support.OdfPackage;
import uk.gegc.officeconverter.support.OfficeFixtures;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static uk.gegc.officeconverter.support.ConversionJobs.jobFor;

class PresentationOdpConverterTest {

    private static final ConversionRoute PPTX = new ConversionRoute(
            "pptx", DocumentFamily.PRESENTATION, ConversionStrategy.LIBRARY, TargetFormat.ODP);
    private static final ConversionRoute PPT = new ConversionRoute(
            "ppt", DocumentFamily.PRESENTATION, ConversionStrategy.LIBRARY, TargetFormat.ODP);

    private final PresentationOdpConverter converter = new PresentationOdpConverter();

    @TempDir
    Path workDir;

    @Test
    void supports_onlyInProcessPresentations() {
        assertThat(converter.supports(PPTX)).isTrue();
        assertThat(converter.supports(new ConversionRoute(
                "potx", DocumentFamily.PRESENTATION, ConversionStrategy.OFFICE_PROCESS, TargetFormat.ODP))).isFalse();
    }

    @Test
    void convert_writesOnePagePerSlideWithTextFrames() throws Exception {
        ConversionJob job = jobFor(workDir, "slides.pptx", PPTX, OfficeFixtures.presentation());

        converter.convert(job);

        byte[] odp = Files.readAllBytes(job.outputFile());
        assertThat(OdfPackage.mimetype(odp)).isEqualTo(TargetFormat.ODP.mediaType());
        String content = OdfPackage.content(odp);
        assertThat(content)
                .contains("draw:name=\"Slide 1\"")
                .contains("draw:name=\"Slide 2\"")
                .doesNotContain("draw:name=\"Slide 3\"")
                .contains("Quarterly results")
                .contains("Revenue up")
                .contains("Costs down")
                .contains("svg:x=\"50.00pt\"");
    }

    @Test
    void convert_includesTextInsideGroupShapes() throws Exception {
        ConversionJob job = jobFor(workDir, "slides.pptx", PPTX, OfficeFixtures.presentation());

        converter.convert(job);

        String content = OdfPackage.content(Files.readAllBytes(job.outputFile()));
        assertThat(content).contains("Next steps");
        assertThat(content.indexOf("Next steps")).isGreaterThan(content.indexOf("draw:name=\"Slide 2\""));
    }

    @Test
    void convert_readsBinaryPresentations() throws Exception {
        ConversionJob job = jobFor(workDir, "legacy.ppt", PPT, OfficeFixtures.legacyPresentation());

        converter.convert(job);

        String content = OdfPackage.content(Files.readAllBytes(job.outputFile()));
        assertThat(content).contains("Legacy deck");
    }

    @Test
    void convert_rejectsContentThatIsNotAPresentation() throws Exception {
        ConversionJob job = jobFor(workDir, "slides.pptx", PPTX, "not a deck".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> converter.convert(job)).isInstanceOf(UnreadableDocumentException.class);
    }
}
