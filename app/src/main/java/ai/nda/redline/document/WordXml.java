package ai.nda.redline.document;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import javax.xml.namespace.QName;
import org.apache.xmlbeans.XmlCursor;
import org.apache.xmlbeans.XmlObject;

/**
 * WordprocessingML element names and the cursor operations the engine performs on them.
 */
public final class WordXml {

    public static final String NS_W = "http://schemas.openxmlformats.org/wordprocessingml/2006/main";

    public static final QName P = w("p");
    public static final QName R = w("r");
    public static final QName RPR = w("rPr");
    public static final QName T = w("t");
    public static final QName TAB = w("tab");
    public static final QName BR = w("br");
    public static final QName CR = w("cr");
    public static final QName NO_BREAK_HYPHEN = w("noBreakHyphen");
    public static final QName INSTR_TEXT = w("instrText");
    public static final QName DEL_TEXT = w("delText");
    public static final QName DEL_INSTR_TEXT = w("delInstrText");
    public static final QName INS = w("ins");
    public static final QName DEL = w("del");
    public static final QName HYPERLINK = w("hyperlink");
    public static final QName SMART_TAG = w("smartTag");
    public static final QName CUSTOM_XML = w("customXml");
    public static final QName SDT = w("sdt");
    public static final QName SDT_CONTENT = w("sdtContent");
    public static final QName TBL = w("tbl");
    public static final QName TR = w("tr");
    public static final QName TC = w("tc");
    public static final QName ID = w("id");
    public static final QName AUTHOR = w("author");
    public static final QName DATE = w("date");
    public static final QName XML_SPACE = new QName("http://www.w3.org/XML/1998/namespace", "space", "xml");

    private WordXml() {
    }

    private static QName w(String localPart) {
        return new QName(NS_W, localPart);
    }

    public static QName name(XmlObject element) {
        try (XmlCursor cursor = element.newCursor()) {
            return cursor.getName();
        }
    }

    public static boolean is(XmlObject element, QName name) {
        return name.equals(name(element));
    }

    public static List<XmlObject> children(XmlObject element) {
        List<XmlObject> children = new ArrayList<>();
        try (XmlCursor cursor = element.newCursor()) {
            if (cursor.toFirstChild()) {
                do {
                    children.add(cursor.getObject());
                } while (cursor.toNextSibling());
            }
        }
        return children;
    }

    public static Optional<XmlObject> firstChild(XmlObject element, QName name) {
        try (XmlCursor cursor = element.newCursor()) {
            if (cursor.toFirstChild()) {
                do {
                    if (name.equals(cursor.getName())) {
                        return Optional.of(cursor.getObject());
                    }
                } while (cursor.toNextSibling());
            }
        }
        return Optional.empty();
    }

    public static Optional<XmlObject> parent(XmlObject element) {
        try (XmlCursor cursor = element.newCursor()) {
            return cursor.toParent() ? Optional.of(cursor.getObject()) : Optional.empty();
        }
    }

    public static boolean sameElement(XmlObject left, XmlObject right) {
        try (XmlCursor first = left.newCursor(); XmlCursor second = right.newCursor()) {
            return first.isAtSamePositionAs(second);
        }
    }

    public static String text(XmlObject element) {
        try (XmlCursor cursor = element.newCursor()) {
            String value = cursor.getTextValue();
            return value == null ? "" : value;
        }
    }

    /**
     * Inserts an empty element directly after {@code anchor} and returns it.
     */
    public static XmlObject insertAfter(XmlObject anchor, QName name) {
        try (XmlCursor cursor = anchor.newCursor()) {
            cursor.toEndToken();
            cursor.toNextToken();
            cursor.beginElement(name);
        }
        try (XmlCursor cursor = anchor.newCursor()) {
            cursor.toNextSibling();
            return cursor.getObject();
        }
    }

    /**
     * Inserts an empty element directly before {@code anchor} and returns it.
     */
    public static XmlObject insertBefore(XmlObject anchor, QName name) {
        try (XmlCursor cursor = anchor.newCursor()) {
            cursor.beginElement(name);
        }
        try (XmlCursor cursor = anchor.newCursor()) {
            cursor.toPrevSibling();
            return cursor.getObject();
        }
    }

    /**
     * Appends an empty element as the last child of {@code container} and returns it.
     */
    public static XmlObject append(XmlObject container, QName name) {
        try (XmlCursor cursor = container.newCursor()) {
            cursor.toEndToken();
            cursor.beginElement(name);
        }
        try (XmlCursor cursor = container.newCursor()) {
            cursor.toLastChild();
            return cursor.getObject();
        }
    }

    /**
     * Moves {@code element} to the end of {@code container}.
     */
    public static void moveInto(XmlObject element, XmlObject container) {
        try (XmlCursor source = element.newCursor(); XmlCursor target = container.newCursor()) {
            target.toEndToken();
            source.moveXml(target);
        }
    }

    public static void copyInto(XmlObject element, XmlObject container) {
        try (XmlCursor source = element.newCursor(); XmlCursor target = container.newCursor()) {
            target.toEndToken();
            source.copyXml(target);
        }
    }

    public static void remove(XmlObject element) {
        try (XmlCursor cursor = element.newCursor()) {
            cursor.removeXml();
        }
    }

    public static void rename(XmlObject element, QName name) {
        try (XmlCursor cursor = element.newCursor()) {
            cursor.setName(name);
        }
    }

    public static void setAttribute(XmlObject element, QName name, String value) {
        try (XmlCursor cursor = element.newCursor()) {
            cursor.setAttributeText(name, value);
        }
    }

    public static Optional<String> attribute(XmlObject element, QName name) {
        try (XmlCursor cursor = element.newCursor()) {
            return Optional.ofNullable(cursor.getAttributeText(name));
        }
    }

    /**
     * Replaces the character content of a text element. {@code xml:space="preserve"} is added only
     * when {@code value} starts or ends with whitespace; existing attributes are left alone.
     */
    public static void setText(XmlObject textElement, String value) {
        try (XmlCursor cursor = textElement.newCursor()) {
            cursor.setTextValue(value);
            if (needsPreserve(value)) {
                cursor.setAttributeText(XML_SPACE, "preserve");
            }
        }
    }

    private static boolean needsPreserve(String value) {
        return !value.isEmpty()
                && (Character.isWhitespace(value.charAt(0)) || Character.isWhitespace(value.charAt(value.length() - 1)));
    }

    /**
     * Appends run content for {@code value}: {@code w:t} segments with {@code w:tab} and
     * {@code w:br} for tab and line break characters.
     */
    public static void appendRunText(XmlObject run, String value, QName textName) {
        StringBuilder segment = new StringBuilder();
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            if (ch == '\t' || ch == '\n') {
                appendTextElement(run, segment, textName);
                append(run, ch == '\t' ? TAB : BR);
            } else {
                segment.append(ch);
            }
        }
        appendTextElement(run, segment, textName);
    }

    private static void appendTextElement(XmlObject run, StringBuilder segment, QName textName) {
        if (segment.length() == 0) {
            return;
        }
        try (XmlCursor cursor = run.newCursor()) {
            cursor.toEndToken();
            cursor.beginElement(textName);
            cursor.insertAttributeWithValue(XML_SPACE, "preserve");
            cursor.insertChars(segment.toString());
        }
        segment.setLength(0);
    }
}
