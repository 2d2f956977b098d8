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

class SpreadsheetOdsConverterTest {

    private static final ConversionRoute XLSX = new ConversionRoute(
            "xlsx", DocumentFamily.SPREADSHEET, ConversionStrategy.LIBRARY, TargetFormat.ODS);
    private static final ConversionRoute XLS = new ConversionRoute(
            "xls", DocumentFamily.SPREADSHEET, ConversionStrategy.LIBRARY, TargetFormat.ODS);

    private final SpreadsheetOdsConverter converter = new SpreadsheetOdsConverter();

    @TempDir
    Path workDir;

    @Test
    void supports_onlyLibrarySpreadsheets() {
        assertThat(converter.supports(XLSX)).isTrue();
        assertThat(converter.supports(new ConversionRoute(
                "xlsb", DocumentFamily.SPREADSHEET, ConversionStrategy.OFFICE_PROCESS, TargetFormat.ODS))).isFalse();
        assertThat(converter.supports(new ConversionRoute(
                "docx", DocumentFamily.WORD_PROCESSING, ConversionStrategy.LIBRARY, TargetFormat.ODT))).isFalse();
    }

    @Test
    void convert_writesEverySheetAsTable() throws Exception {
        ConversionJob job = jobFor(workDir, "report.xlsx", XLSX, OfficeFixtures.workbook());

        converter.convert(job);

        byte[] ods = Files.readAllBytes(job.outputFile());
        assertThat(OdfPackage.mimetype(ods)).isEqualTo(TargetFormat.ODS.mediaType());
        String content = OdfPackage.content(ods);
        assertThat(content)
                .contains("table:name=\"Budget\"")
                .contains("table:name=\"Notes\"")
                .contains("Rent")
                .contains("Quarterly review");
    }

    @Test
    void convert_keepsNumbersBooleansAndCachedFormulaResults() throws Exception {
        ConversionJob job = jobFor(workDir, "report.xlsx", XLSX, OfficeFixtures.workbook());

        converter.convert(job);

        String content = OdfPackage.content(Files.readAllBytes(job.outputFile()));
        assertThat(content)
                .contains("office:value=\"1200.5\"")
                .contains("office:boolean-value=\"true\"")
                .contains("office:value=\"2401.0\"")
                .doesNotContain("B2*2");
    }

    @Test
    void convert_readsBinaryWorkbooks() throws Exception {
        ConversionJob job = jobFor(workDir, "legacy.xls", XLS, OfficeFixtures.legacyWorkbook());

        converter.convert(job);

        String content = OdfPackage.content(Files.readAllBytes(job.outputFile()));
        assertThat(content).contains("table:name=\"Budget\"").contains("Rent");
    }

    @Test
    void convert_rejectsContentThatIsNotAWorkbook() throws Exception {
        ConversionJob job = jobFor(workDir, "fake.xlsx", XLSX, "Fake Excel content".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> converter.convert(job))
                .isInstanceOf(UnreadableDocumentException.class)
                .hasMessageStartingWith("Cannot read spreadsheet");
        assertThat(job.outputFile()).doesNotExist();
    }
}
