package ai.nda.redline.engine;

import ai.nda.redline.document.DocumentModel;
import ai.nda.redline.document.ParagraphBlock;
import ai.nda.redline.document.TextRun;
import ai.nda.redline.document.WordXml;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import javax.xml.namespace.QName;
import org.apache.xmlbeans.XmlCursor;
import org.apache.xmlbeans.XmlObject;

/**
 * Builds the flat text of a paragraph from its visible runs.
 *
 * <p>Visible runs are direct {@code w:r} children of the paragraph and runs inside hyperlinks,
 * smart tags and custom XML wrappers. Content of {@code w:ins} and {@code w:del} revisions, content
 * controls and simple fields is not part of the flat text, so revisions written by earlier edits are
 * never matched again. The pass is read-only.
 */
public class DocumentFlattener {

    public FlatText flatten(ParagraphBlock paragraph) {
        List<XmlObject> elements = new ArrayList<>();
        collectRuns(paragraph.xml(), elements);
        List<TextRun> runs = new ArrayList<>(elements.size());
        for (XmlObject element : elements) {
            runs.add(new TextRun(runs.size(), element, runText(element)));
        }
        return new FlatText(paragraph.ordinal(), runs);
    }

    public List<FlatText> flattenAll(DocumentModel document) {
        return document.paragraphs().stream()
                .map(this::flatten)
                .collect(Collectors.toList());
    }

    /**
     * Visible text of the whole body, one line per paragraph.
     */
    public String documentText(DocumentModel document) {
        return document.paragraphs().stream()
                .map(paragraph -> flatten(paragraph).text())
                .collect(Collectors.joining("\n"));
    }

    static String runText(XmlObject run) {
        StringBuilder text = new StringBuilder();
        try (XmlCursor cursor = run.newCursor()) {
            if (cursor.toFirstChild()) {
                do {
                    text.append(contribution(cursor.getName(), cursor));
                } while (cursor.toNextSibling());
            }
        }
        return text.toString();
    }

    static String contribution(XmlObject child) {
        try (XmlCursor cursor = child.newCursor()) {
            return contribution(cursor.getName(), cursor);
        }
    }

    /**
     * Text a single run child adds to the paragraph. Children without visible text contribute nothing.
     */
    static String contribution(QName name, XmlCursor cursor) {
        if (WordXml.T.equals(name)) {
            String value = cursor.getTextValue();
            return value == null ? "" : value;
        }
        if (WordXml.TAB.equals(name)) {
            return "\t";
        }
        if (WordXml.BR.equals(name) || WordXml.CR.equals(name)) {
            return "\n";
        }
        if (WordXml.NO_BREAK_HYPHEN.equals(name)) {
            return "-";
        }
        return "";
    }

    private void collectRuns(XmlObject container, List<XmlObject> sink) {
        try (XmlCursor cursor = container.newCursor()) {
            if (!cursor.toFirstChild()) {
                return;
            }
            do {
                QName name = cursor.getName();
                if (WordXml.R.equals(name)) {
                    sink.add(cursor.getObject());
                } else if (WordXml.HYPERLINK.equals(name) || WordXml.SMART_TAG.equals(name) || WordXml.CUSTOM_XML.equals(name)) {
                    collectRuns(cursor.getObject(), sink);
                }
            } while (cursor.toNextSibling());
        }
    }
}
