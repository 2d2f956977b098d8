package uk.gegc.officeconverter.features.conversion.infra;

import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.odftoolkit.odfdom.doc.OdfSpreadsheetDocument;
import org.springframework.stereotype.Component;
import org.w3c.dom.Element;
import uk.gegc.officeconverter.features.conversion.domain.ConversionException;
import uk.gegc.officeconverter.features.conversion.domain.ConversionJob;
import uk.gegc.officeconverter.features.conversion.domain.ConversionRoute;
import uk.gegc.officeconverter.features.conversion.domain.ConversionStrategy;
import uk.gegc.officeconverter.features.conversion.domain.DocumentConverter;
import uk.gegc.officeconverter.features.conversion.domain.TargetFormat;
import uk.gegc.officeconverter.features.conversion.domain.UnreadableDocumentException;

import java.io.InputStream;
import java.io.OutputStream;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

import static uk.gegc.officeconverter.features.conversion.infra.OdfContent.OFFICE_NS;
import static uk.gegc.officeconverter.features.conversion.infra.OdfContent.TABLE_NS;

/**
 * Spreadsheet converter using Apache POI for reading and odfdom for writing.
 * Copies every sheet cell by cell, keeping numbers, dates and booleans typed.
 * Formulas are written as their cached results.
 */
@Component
@Slf4j
public class SpreadsheetOdsConverter implements DocumentConverter {

    @Override
    public boolean supports(ConversionRoute route) {
        return route.strategy() == ConversionStrategy.LIBRARY && route.target() == TargetFormat.ODS;
    }

    @Override
    public void convert(ConversionJob job) throws ConversionException {
        try (Workbook workbook = openWorkbook(job.inputFile())) {
            OdfSpreadsheetDocument document = OdfSpreadsheetDocument.newSpreadsheetDocument();
            try {
                Element spreadsheet = document.getContentRoot();
                OdfContent.removeChildren(spreadsheet, TABLE_NS, "table");
                // DataFormatter is not thread-safe
                DataFormatter formatter = new DataFormatter(Locale.ROOT);
                for (int i = 0; i < workbook.getNumberOfSheets(); i++) {
                    writeSheet(spreadsheet, workbook.getSheetAt(i), formatter);
                }
                try (OutputStream out = Files.newOutputStream(job.outputFile())) {
                    document.save(out);
                }
            } finally {
                document.close();
            }
            log.debug("Converted spreadsheet {}: {} sheet(s)", job.originalFilename(), workbook.getNumberOfSheets());
        } catch (ConversionException e) {
            throw e;
        } catch (Exception e) {
            throw new ConversionException("Failed to convert spreadsheet: " + e.getMessage(), e);
        }
    }

    private Workbook openWorkbook(Path input) throws UnreadableDocumentException {
        try (InputStream in = Files.newInputStream(input)) {
            return WorkbookFactory.create(in);
        } catch (Exception e) {
            throw new UnreadableDocumentException("Cannot read spreadsheet: " + e.getMessage(), e);
        }
    }

    private void writeSheet(Element spreadsheet, Sheet sheet, DataFormatter formatter) {
        int columns = 1;
        for (Row row : sheet) {
            columns = Math.max(columns, row.getLastCellNum());
        }
        Element table = OdfContent.appendTable(spreadsheet, sheet.getSheetName(), columns);

        int emptyRows = 0;
        int lastRow = sheet.getLastRowNum();
        for (int r = 0; r <= lastRow; r++) {
            Row row = sheet.getRow(r);
            if (row == null || row.getLastCellNum() <= 0) {
                emptyRows++;
                continue;
            }
            appendEmptyRows(table, emptyRows);
            emptyRows = 0;

            Element odfRow = OdfContent.appendRow(table);
            for (int c = 0; c < row.getLastCellNum(); c++) {
                writeCell(odfRow, row.getCell(c), formatter);
            }
        }
        // A table needs at least one row
        if (table.getElementsByTagNameNS(TABLE_NS, "table-row").getLength() == 0) {
            appendEmptyRows(table, 1);
        }
    }

    private void appendEmptyRows(Element table, int count) {
        if (count == 0) {
            return;
        }
        Element row = OdfContent.appendRow(table);
        if (count > 1) {
            row.setAttributeNS(TABLE_NS, "table:number-rows-repeated", String.valueOf(count));
        }
        OdfContent.appendStringCell(row, null);
    }

    private void writeCell(Element row, Cell cell, DataFormatter formatter) {
        if (cell == null) {
            OdfContent.appendStringCell(row, null);
            return;
        }
        CellType type = cell.getCellType() == CellType.FORMULA ? cell.getCachedFormulaResultType() : cell.getCellType();
        switch (type) {
            case NUMERIC -> writeNumericCell(row, cell, formatter);
            case BOOLEAN -> {
                Element odfCell = OdfContent.append(row, TABLE_NS, "table:table-cell");
                odfCell.setAttributeNS(OFFICE_NS, "office:value-type", "boolean");
                odfCell.setAttributeNS(OFFICE_NS, "office:boolean-value", String.valueOf(cell.getBooleanCellValue()));
                OdfContent.appendParagraph(odfCell, String.valueOf(cell.getBooleanCellValue()).toUpperCase(Locale.ROOT));
            }
            case STRING -> OdfContent.appendStringCell(row, cell.getStringCellValue());
            default -> OdfContent.appendStringCell(row, null);
        }
    }

    private void writeNumericCell(Element row, Cell cell, DataFormatter formatter) {
        Element odfCell = OdfContent.append(row, TABLE_NS, "table:table-cell");
        double value = cell.getNumericCellValue();
        CellStyle style = cell.getCellStyle();
        String display = formatter.formatRawCellContents(value, style.getDataFormat(), style.getDataFormatString());

        if (DateUtil.isCellDateFormatted(cell)) {
            odfCell.setAttributeNS(OFFICE_NS, "office:value-type", "date");
            odfCell.setAttributeNS(OFFICE_NS, "office:date-value",
                    cell.getLocalDateTimeCellValue().format(DateTimeFormatter.ISO_LOCAL_DATE_TIME));
        } else {
            odfCell.setAttributeNS(OFFICE_NS, "office:value-type", "float");
            odfCell.setAttributeNS(OFFICE_NS, "office:value", BigDecimal.valueOf(value).toPlainString());
        }
        OdfContent.appendParagraph(odfCell, display);
    }
}
