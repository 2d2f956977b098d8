package uk.gegc.officeconverter.features.conversion.infra;

import lombok.extern.slf4j.Slf4j;
import org.apache.poi.sl.usermodel.GroupShape;
import org.apache.poi.sl.usermodel.Shape;
import org.apache.poi.sl.usermodel.Slide;
import org.apache.poi.sl.usermodel.SlideShow;
import org.apache.poi.sl.usermodel.SlideShowFactory;
import org.apache.poi.sl.usermodel.TableCell;
import org.apache.poi.sl.usermodel.TableShape;
import org.apache.poi.sl.usermodel.TextShape;
import org.odftoolkit.odfdom.doc.OdfPresentationDocument;
import org.springframework.stereotype.Component;
import org.w3c.dom.Element;
import uk.gegc.officeconverter.features.conversion.domain.ConversionException;
import uk.gegc.officeconverter.features.conversion.domain.ConversionJob;
import uk.gegc.officeconverter.features.conversion.domain.ConversionRoute;
import uk.gegc.officeconverter.features.conversion.domain.ConversionStrategy;
import uk.gegc.officeconverter.features.conversion.domain.DocumentConverter;
import uk.gegc.officeconverter.features.conversion.domain.TargetFormat;
import uk.gegc.officeconverter.features.conversion.domain.UnreadableDocumentException;

import java.awt.geom.Rectangle2D;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static uk.gegc.officeconverter.features.conversion.infra.OdfContent.DRAW_NS;
import static uk.gegc.officeconverter.features.conversion.infra.OdfContent.SVG_NS;

/**
 * Presentation converter for both OOXML and binary PowerPoint files. Each slide becomes a
 * draw page; every text-bearing shape becomes a text box at the shape's position.
 * Images, charts and animations are dropped.
 */
@Component
@Slf4j
public class PresentationOdpConverter implements DocumentConverter {

    private static final String DEFAULT_MASTER_PAGE = "Default";

    @Override
    public boolean supports(ConversionRoute route) {
        return route.strategy() == ConversionStrategy.LIBRARY && route.target() == TargetFormat.ODP;
    }

    @Override
    public void convert(ConversionJob job) throws ConversionException {
        try (SlideShow<?, ?> slideShow = openSlideShow(job.inputFile())) {
            OdfPresentationDocument document = OdfPresentationDocument.newPresentationDocument();
            try {
                Element presentation = document.getContentRoot();
                List<Element> placeholders = OdfContent.removeChildren(presentation, DRAW_NS, "page");
                String masterPage = placeholders.isEmpty()
                        ? DEFAULT_MASTER_PAGE
                        : placeholders.get(0).getAttributeNS(DRAW_NS, "master-page-name");
                if (masterPage == null || masterPage.isBlank()) {
                    masterPage = DEFAULT_MASTER_PAGE;
                }

                int number = 0;
                for (Slide<?, ?> slide : slideShow.getSlides()) {
                    writeSlide(presentation, slide, ++number, masterPage);
                }
                try (OutputStream out = Files.newOutputStream(job.outputFile())) {
                    document.save(out);
                }
            } finally {
                document.close();
            }
            log.debug("Converted presentation {}: {} slide(s)", job.originalFilename(), slideShow.getSlides().size());
        } catch (ConversionException e) {
            throw e;
        } catch (Exception e) {
            throw new ConversionException("Failed to convert presentation: " + e.getMessage(), e);
        }
    }

    private SlideShow<?, ?> openSlideShow(Path input) throws UnreadableDocumentException {
        try (InputStream in = Files.newInputStream(input)) {
            return SlideShowFactory.create(in);
        } catch (Exception e) {
            throw new UnreadableDocumentException("Cannot read presentation: " + e.getMessage(), e);
        }
    }

    private void writeSlide(Element presentation, Slide<?, ?> slide, int number, String masterPage) {
        Element page = OdfContent.append(presentation, DRAW_NS, "draw:page");
        page.setAttributeNS(DRAW_NS, "draw:name", "Slide " + number);
        page.setAttributeNS(DRAW_NS, "draw:master-page-name", masterPage);

        List<Shape<?, ?>> shapes = new ArrayList<>();
        collectShapes(slide.getShapes(), shapes);

        int index = 0;
        for (Shape<?, ?> shape : shapes) {
            List<String> lines = textOf(shape);
            if (lines.isEmpty()) {
                continue;
            }
            Element textBox = appendFrame(page, shape.getAnchor(), index++);
            for (String line : lines) {
                OdfContent.appendParagraph(textBox, line);
            }
        }
    }

    private void collectShapes(List<? extends Shape<?, ?>> source, List<Shape<?, ?>> target) {
        for (Shape<?, ?> shape : source) {
            if (shape instanceof GroupShape<?, ?> group) {
                collectShapes(group.getShapes(), target);
            } else {
                target.add(shape);
            }
        }
    }

    private List<String> textOf(Shape<?, ?> shape) {
        List<String> lines = new ArrayList<>();
        if (shape instanceof TableShape<?, ?> table) {
            for (int r = 0; r < table.getNumberOfRows(); r++) {
                List<String> cells = new ArrayList<>();
                for (int c = 0; c < table.getNumberOfColumns(); c++) {
                    TableCell<?, ?> cell = table.getCell(r, c);
                    cells.add(cell == null || cell.getText() == null ? "" : cell.getText().trim());
                }
                lines.add(String.join("\t", cells));
            }
        } else if (shape instanceof TextShape<?, ?> textShape) {
            String text = textShape.getText();
            if (text != null && !text.isBlank()) {
                for (String line : text.split("\\R")) {
                    lines.add(line);
                }
            }
        }
        return lines;
    }

    private Element appendFrame(Element page, Rectangle2D anchor, int index) {
        Element frame = OdfContent.append(page, DRAW_NS, "draw:frame");
        if (anchor != null && anchor.getWidth() > 0 && anchor.getHeight() > 0) {
            frame.setAttributeNS(SVG_NS, "svg:x", points(anchor.getX()));
            frame.setAttributeNS(SVG_NS, "svg:y", points(anchor.getY()));
            frame.setAttributeNS(SVG_NS, "svg:width", points(anchor.getWidth()));
            frame.setAttributeNS(SVG_NS, "svg:height", points(anchor.getHeight()));
        } else {
            // Stack shapes without a usable position down the page
            frame.setAttributeNS(SVG_NS, "svg:x", "2cm");
            frame.setAttributeNS(SVG_NS, "svg:y", (2 + index * 3) + "cm");
            frame.setAttributeNS(SVG_NS, "svg:width", "24cm");
            frame.setAttributeNS(SVG_NS, "svg:height", "2.5cm");
        }
        return OdfContent.append(frame, DRAW_NS, "draw:text-box");
    }

    private static String points(double value) {
        return String.format(Locale.ROOT, "%.2fpt", value);
    }
}
