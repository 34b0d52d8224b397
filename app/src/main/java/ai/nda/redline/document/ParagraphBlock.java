package ai.nda.redline.document;

import java.util.Objects;
import org.apache.xmlbeans.XmlObject;

/**
 * A paragraph of the body, numbered in document order including paragraphs nested in table cells.
 */
public record ParagraphBlock(int ordinal, XmlObject xml) implements Block {

    public ParagraphBlock {
        if (ordinal < 0) {
            throw new IllegalArgumentException("ordinal must not be negative");
        }
        Objects.requireNonNull(xml, "xml");
    }
}
