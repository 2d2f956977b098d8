package uk.gegc.officeconverter.features.conversion.application;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import uk.gegc.officeconverter.features.conversion.domain.ConversionRoute;
import uk.gegc.officeconverter.features.conversion.domain.ConversionStrategy;
import uk.gegc.officeconverter.features.conversion.domain.DocumentFamily;
import uk.gegc.officeconverter.features.conversion.domain.TargetFormat;
import uk.gegc.officeconverter.features.conversion.domain.UnsupportedFormatException;
import uk.gegc.officeconverter.features.conversion.domain.UploadName;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FormatDispatcherTest {

    private final FormatDispatcher dispatcher = new FormatDispatcher();

    @ParameterizedTest
    @CsvSource({
            "report.xlsx, SPREADSHEET, LIBRARY, ODS",
            "legacy.xls, SPREADSHEET, LIBRARY, ODS",
            "macros.xlsm, SPREADSHEET, LIBRARY, ODS",
            "binary.xlsb, SPREADSHEET, OFFICE_PROCESS, ODS",
            "template.xltx, SPREADSHEET, OFFICE_PROCESS, ODS",
            "template.xltm, SPREADSHEET, OFFICE_PROCESS, ODS",
            "notes.docx, WORD_PROCESSING, LIBRARY, ODT",
            "old.doc, WORD_PROCESSING, OFFICE_PROCESS, ODT",
            "letter.dotx, WORD_PROCESSING, OFFICE_PROCESS, ODT",
            "letter.dotm, WORD_PROCESSING, OFFICE_PROCESS, ODT",
            "slides.pptx, PRESENTATION, LIBRARY, ODP",
            "slides.ppt, PRESENTATION, LIBRARY, ODP",
            "show.ppsx, PRESENTATION, LIBRARY, ODP",
            "show.pps, PRESENTATION, LIBRARY, ODP",
            "deck.potx, PRESENTATION, OFFICE_PROCESS, ODP",
            "deck.potm, PRESENTATION, OFFICE_PROCESS, ODP",
            "flyer.pub, PUBLISHING, OFFICE_PROCESS, ODT",
            "contacts.mdb, DATABASE, OFFICE_PROCESS, ODS",
            "contacts.accdb, DATABASE, OFFICE_PROCESS, ODS"
    })
    void dispatch_routesEverySupportedExtension(String filename, DocumentFamily family,
                                                ConversionStrategy strategy, TargetFormat target) {
        ConversionRoute route = dispatcher.dispatch(UploadName.parse(filename));

        assertThat(route.family()).isEqualTo(family);
        assertThat(route.strategy()).isEqualTo(strategy);
        assertThat(route.target()).isEqualTo(target);
    }

    @Test
    void dispatch_ignoresExtensionCase() {
        assertThat(dispatcher.dispatch(UploadName.parse("REPORT.XlSx")).extension()).isEqualTo("xlsx");
    }

    @ParameterizedTest
    @ValueSource(strings = {"archive.zip", "image.png", "report.", "notes.odt", "report.xlsx.bak"})
    void dispatch_rejectsUnsupportedExtensions(String filename) {
        assertThatThrownBy(() -> dispatcher.dispatch(UploadName.parse(filename)))
                .isInstanceOf(UnsupportedFormatException.class)
                .hasMessage("Unsupported file format");
    }

    @Test
    void supportedRoutes_listsEachExtensionOnce() {
        List<ConversionRoute> routes = dispatcher.supportedRoutes();

        assertThat(routes).hasSize(19);
        assertThat(routes).extracting(ConversionRoute::extension).doesNotHaveDuplicates();
    }
}
