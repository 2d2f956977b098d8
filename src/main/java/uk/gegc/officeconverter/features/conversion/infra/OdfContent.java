package uk.gegc.officeconverter.features.conversion.infra;

import org.w3c.dom.Element;
import org.w3c.dom.Node;

import java.util.ArrayList;
import java.util.List;

/**
 * DOM helpers for writing into an odfdom content tree.
 */
final class OdfContent {

    static final String OFFICE_NS = "urn:oasis:names:tc:opendocument:xmlns:office:1.0";
    static final String TEXT_NS = "urn:oasis:names:tc:opendocument:xmlns:text:1.0";
    static final String TABLE_NS = "urn:oasis:names:tc:opendocument:xmlns:table:1.0";
    static final String DRAW_NS = "urn:oasis:names:tc:opendocument:xmlns:drawing:1.0";
    static final String SVG_NS = "urn:oasis:names:tc:opendocument:xmlns:svg-compatible:1.0";

    private OdfContent() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    static Element append(Element parent, String namespace, String qualifiedName) {
        Element child = parent.getOwnerDocument().createElementNS(namespace, qualifiedName);
        parent.appendChild(child);
        return child;
    }

    static Element appendParagraph(Element parent, String text) {
        Element paragraph = append(parent, TEXT_NS, "text:p");
        if (text != null && !text.isEmpty()) {
            paragraph.setTextContent(text);
        }
        return paragraph;
    }

    static Element appendHeading(Element parent, String text, int level) {
        Element heading = append(parent, TEXT_NS, "text:h");
        heading.setAttributeNS(TEXT_NS, "text:outline-level", String.valueOf(level));
        if (text != null && !text.isEmpty()) {
            heading.setTextContent(text);
        }
        return heading;
    }

    /**
     * Appends a table with a single column declaration repeated {@code columns} times.
     */
    static Element appendTable(Element parent, String name, int columns) {
        Element table = append(parent, TABLE_NS, "table:table");
        table.setAttributeNS(TABLE_NS, "table:name", name);
        Element column = append(table, TABLE_NS, "table:table-column");
        if (columns > 1) {
            column.setAttributeNS(TABLE_NS, "table:number-columns-repeated", String.valueOf(columns));
        }
        return table;
    }

    static Element appendRow(Element table) {
        return append(table, TABLE_NS, "table:table-row");
    }

    static Element appendStringCell(Element row, String text) {
        Element cell = append(row, TABLE_NS, "table:table-cell");
        if (text != null && !text.isEmpty()) {
            cell.setAttributeNS(OFFICE_NS, "office:value-type", "string");
            appendParagraph(cell, text);
        }
        return cell;
    }

    /**
     * Removes the direct children with the given name, e.g. the placeholder sheet or page
     * of a freshly created template document.
     *
     * @return the removed elements in document order
     */
    static List<Element> removeChildren(Element parent, String namespace, String localName) {
        List<Element> removed = new ArrayList<>();
        Node child = parent.getFirstChild();
        while (child != null) {
            Node next = child.getNextSibling();
            if (child instanceof Element element
                    && namespace.equals(element.getNamespaceURI())
                    && localName.equals(element.getLocalName())) {
                parent.removeChild(element);
                removed.add(element);
            }
            child = next;
        }
        return removed;
    }
}
