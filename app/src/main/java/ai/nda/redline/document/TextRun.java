package ai.nda.redline.document;

import java.util.Objects;
import org.apache.xmlbeans.XmlObject;

/**
 * Snapshot of one visible {@code w:r}: its position among the paragraph's visible runs, the element
 * carrying its formatting, and the text it contributes to the paragraph.
 */
public record TextRun(int index, XmlObject element, String text) {

    public TextRun {
        Objects.requireNonNull(element, "element");
        text = text == null ? "" : text;
    }

    public int length() {
        return text.length();
    }
}
