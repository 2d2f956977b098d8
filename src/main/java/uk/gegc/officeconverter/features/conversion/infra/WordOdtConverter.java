package uk.gegc.officeconverter.features.conversion.infra;

import lombok.extern.slf4j.Slf4j;
import org.apache.poi.xwpf.usermodel.IBodyElement;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;
import org.apache.poi.xwpf.usermodel.XWPFTableRow;
import org.odftoolkit.odfdom.doc.OdfTextDocument;
import org.springframework.stereotype.Component;
import org.w3c.dom.Element;
import uk.gegc.officeconverter.features.conversion.domain.ConversionException;
import uk.gegc.officeconverter.features.conversion.domain.ConversionJob;
import uk.gegc.officeconverter.features.conversion.domain.ConversionRoute;
import uk.gegc.officeconverter.features.conversion.domain.ConversionStrategy;
import uk.gegc.officeconverter.features.conversion.domain.DocumentConverter;
import uk.gegc.officeconverter.features.conversion.domain.DocumentFamily;
import uk.gegc.officeconverter.features.conversion.domain.UnreadableDocumentException;

import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static uk.gegc.officeconverter.features.conversion.infra.OdfContent.TEXT_NS;

/**
 * Word document converter. Walks the body in order, writing paragraphs, headings and tables
 * into an ODF text document. Character formatting is not carried over.
 */
@Component
@Slf4j
public class WordOdtConverter implements DocumentConverter {

    private static final Pattern HEADING_STYLE = Pattern.compile("(?i)heading\\s*(\\d)");

    @Override
    public boolean supports(ConversionRoute route) {
        return route.strategy() == ConversionStrategy.LIBRARY && route.family() == DocumentFamily.WORD_PROCESSING;
    }

    @Override
    public void convert(ConversionJob job) throws ConversionException {
        try (XWPFDocument source = openDocument(job.inputFile())) {
            OdfTextDocument document = OdfTextDocument.newTextDocument();
            try {
                Element text = document.getContentRoot();
                OdfContent.removeChildren(text, TEXT_NS, "p");

                int tables = 0;
                for (IBodyElement element : source.getBodyElements()) {
                    if (element instanceof XWPFParagraph paragraph) {
                        writeParagraph(text, paragraph);
                    } else if (element instanceof XWPFTable table) {
                        writeTable(text, table, ++tables);
                    }
                }
                try (OutputStream out = Files.newOutputStream(job.outputFile())) {
                    document.save(out);
                }
            } finally {
                document.close();
            }
            log.debug("Converted word document {}: {} body element(s)", job.originalFilename(), source.getBodyElements().size());
        } catch (ConversionException e) {
            throw e;
        } catch (Exception e) {
            throw new ConversionException("Failed to convert word document: " + e.getMessage(), e);
        }
    }

    private XWPFDocument openDocument(Path input) throws UnreadableDocumentException {
        try (InputStream in = Files.newInputStream(input)) {
            return new XWPFDocument(in);
        } catch (Exception e) {
            throw new UnreadableDocumentException("Cannot read word document: " + e.getMessage(), e);
        }
    }

    private void writeParagraph(Element parent, XWPFParagraph paragraph) {
        int level = headingLevel(paragraph.getStyle());
        if (level > 0) {
            OdfContent.appendHeading(parent, paragraph.getText(), level);
        } else {
            OdfContent.appendParagraph(parent, paragraph.getText());
        }
    }

    private void writeTable(Element parent, XWPFTable table, int index) {
        int columns = 1;
        for (XWPFTableRow row : table.getRows()) {
            columns = Math.max(columns, row.getTableCells().size());
        }
        Element odfTable = OdfContent.appendTable(parent, "Table" + index, columns);
        for (XWPFTableRow row : table.getRows()) {
            Element odfRow = OdfContent.appendRow(odfTable);
            int written = 0;
            for (XWPFTableCell cell : row.getTableCells()) {
                Element odfCell = OdfContent.append(odfRow, OdfContent.TABLE_NS, "table:table-cell");
                odfCell.setAttributeNS(OdfContent.OFFICE_NS, "office:value-type", "string");
                for (XWPFParagraph paragraph : cell.getParagraphs()) {
                    OdfContent.appendParagraph(odfCell, paragraph.getText());
                }
                written++;
            }
            // Rows must have as many cells as the table has columns
            for (; written < columns; written++) {
                OdfContent.appendStringCell(odfRow, null);
            }
        }
    }

    static int headingLevel(String styleId) {
        if (styleId == null) {
            return 0;
        }
        if (styleId.equalsIgnoreCase("Title")) {
            return 1;
        }
        Matcher matcher = HEADING_STYLE.matcher(styleId);
        return matcher.matches() ? Integer.parseInt(matcher.group(1)) : 0;
    }
}
