package uk.gegc.officeconverter.support;

import org.apache.poi.hslf.usermodel.HSLFSlide;
import org.apache.poi.hslf.usermodel.HSLFSlideShow;
import org.apache.poi.hslf.usermodel.HSLFTextBox;
import org.apache.poi.hssf.usermodel.HSSFWorkbook;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xslf.usermodel.XMLSlideShow;
import org.apache.poi.xslf.usermodel.XSLFGroupShape;
import org.apache.poi.xslf.usermodel.XSLFSlide;
import org.apache.poi.xslf.usermodel.XSLFTextBox;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFTable;

import java.awt.Rectangle;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Small Office documents built with POI for converter and endpoint tests.
 */
public final class OfficeFixtures {

    private OfficeFixtures() {
    }

    /**
     * Sheet "Budget" with a header row, a data row, one blank row and a formula row;
     * sheet "Notes" with one text cell.
     */
    public static byte[] workbook() {
        try (XSSFWorkbook workbook = new XSSFWorkbook()) {
            fillWorkbook(workbook);
            return write(workbook);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static byte[] legacyWorkbook() {
        try (HSSFWorkbook workbook = new HSSFWorkbook()) {
            fillWorkbook(workbook);
            return write(workbook);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static void fillWorkbook(Workbook workbook) {
        Sheet budget = workbook.createSheet("Budget");
        Row header = budget.createRow(0);
        header.createCell(0).setCellValue("Item");
        header.createCell(1).setCellValue("Amount");
        header.createCell(2).setCellValue("Paid");

        Row rent = budget.createRow(1);
        rent.createCell(0).setCellValue("Rent");
        rent.createCell(1).setCellValue(1200.5);
        rent.createCell(2).setCellValue(true);

        Row total = budget.createRow(3);
        total.createCell(0).setCellValue("Double");
        total.createCell(1).setCellFormula("B2*2");

        Sheet notes = workbook.createSheet("Notes");
        notes.createRow(0).createCell(0).setCellValue("Quarterly review");

        workbook.getCreationHelper().createFormulaEvaluator().evaluateAll();
    }

    /**
     * A heading, a body paragraph and a 2x2 table.
     */
    public static byte[] wordDocument() {
        try (XWPFDocument document = new XWPFDocument()) {
            XWPFParagraph heading = document.createParagraph();
            heading.setStyle("Heading1");
            heading.createRun().setText("Meeting notes");

            document.createParagraph().createRun().setText("Budget approved for next quarter.");

            XWPFTable table = document.createTable(2, 2);
            table.getRow(0).getCell(0).setText("Owner");
            table.getRow(0).getCell(1).setText("Task");
            table.getRow(1).getCell(0).setText("Alice");
            table.getRow(1).getCell(1).setText("Draft report");

            return write(document);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Two slides; the second keeps its text inside a group shape.
     */
    public static byte[] presentation() {
        try (XMLSlideShow slideShow = new XMLSlideShow()) {
            XSLFSlide first = slideShow.createSlide();
            XSLFTextBox title = first.createTextBox();
            title.setAnchor(new Rectangle(50, 40, 500, 80));
            title.setText("Quarterly results");
            XSLFTextBox body = first.createTextBox();
            body.setAnchor(new Rectangle(50, 150, 500, 200));
            body.setText("Revenue up\nCosts down");

            XSLFSlide second = slideShow.createSlide();
            XSLFGroupShape group = second.createGroup();
            group.setAnchor(new Rectangle(0, 0, 600, 400));
            XSLFTextBox grouped = group.createTextBox();
            grouped.setAnchor(new Rectangle(60, 60, 300, 60));
            grouped.setText("Next steps");

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            slideShow.write(out);
            return out.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static byte[] legacyPresentation() {
        try (HSLFSlideShow slideShow = new HSLFSlideShow()) {
            HSLFSlide slide = slideShow.createSlide();
            HSLFTextBox box = slide.createTextBox();
            box.setText("Legacy deck");
            box.setAnchor(new Rectangle(50, 50, 400, 60));

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            slideShow.write(out);
            return out.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static byte[] write(Workbook workbook) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        workbook.write(out);
        return out.toByteArray();
    }

    private static byte[] write(XWPFDocument document) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        document.write(out);
        return out.toByteArray();
    }
}
