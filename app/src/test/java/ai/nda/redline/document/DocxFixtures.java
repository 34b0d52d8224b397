package ai.nda.redline.document;

import ai.nda.redline.engine.DocumentFlattener;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import javax.xml.namespace.QName;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.apache.xmlbeans.XmlObject;

/**
 * Builds small Word documents in memory and reads text back out of edited ones.
 */
public final class DocxFixtures {

    private static final DocumentFlattener FLATTENER = new DocumentFlattener();

    private DocxFixtures() {
    }

    public static byte[] build(Consumer<XWPFDocument> content) {
        try (XWPFDocument document = new XWPFDocument(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            content.accept(document);
            document.write(out);
            return out.toByteArray();
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    /**
     * One single-run paragraph per text.
     */
    public static byte[] paragraphs(String... texts) {
        return build(document -> {
            for (String text : texts) {
                addParagraph(document, text);
            }
        });
    }

    /**
     * One paragraph whose runs alternate between plain and bold formatting.
     */
    public static byte[] formattedParagraph(String... runs) {
        return build(document -> addFormattedParagraph(document, runs));
    }

    public static XWPFParagraph addParagraph(XWPFDocument document, String text) {
        XWPFParagraph paragraph = document.createParagraph();
        XWPFRun run = paragraph.createRun();
        run.setText(text);
        return paragraph;
    }

    public static XWPFParagraph addFormattedParagraph(XWPFDocument document, String... runs) {
        XWPFParagraph paragraph = document.createParagraph();
        for (int i = 0; i < runs.length; i++) {
            XWPFRun run = paragraph.createRun();
            run.setText(runs[i]);
            if (i % 2 == 1) {
                run.setBold(true);
            }
        }
        return paragraph;
    }

    public static DocumentModel load(byte[] content) {
        return new DocxDocumentLoader().load(content);
    }

    /**
     * Visible text of every paragraph: what a reader sees with revisions hidden from the flat view.
     */
    public static List<String> texts(DocumentModel document) {
        List<String> texts = new ArrayList<>();
        for (ParagraphBlock paragraph : document.paragraphs()) {
            texts.add(FLATTENER.flatten(paragraph).text());
        }
        return texts;
    }

    public static List<String> texts(byte[] content) {
        try (DocumentModel document = load(content)) {
            return texts(document);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    /**
     * Paragraph text with all tracked revisions accepted.
     */
    public static String acceptedText(ParagraphBlock paragraph) {
        StringBuilder text = new StringBuilder();
        collect(paragraph.xml(), false, true, text);
        return text.toString();
    }

    /**
     * Paragraph text with all tracked revisions rejected.
     */
    public static String rejectedText(ParagraphBlock paragraph) {
        StringBuilder text = new StringBuilder();
        collect(paragraph.xml(), false, false, text);
        return text.toString();
    }

    /**
     * Revision wrappers ({@code w:ins} or {@code w:del}) anywhere below {@code element}.
     */
    public static List<XmlObject> revisions(XmlObject element, QName name) {
        List<XmlObject> found = new ArrayList<>();
        for (XmlObject child : WordXml.children(element)) {
            if (WordXml.is(child, name)) {
                found.add(child);
            }
            found.addAll(revisions(child, name));
        }
        return found;
    }

    private static void collect(XmlObject element, boolean inInsertion, boolean accepted, StringBuilder out) {
        for (XmlObject child : WordXml.children(element)) {
            if (WordXml.is(child, WordXml.T)) {
                if (accepted || !inInsertion) {
                    out.append(WordXml.text(child));
                }
            } else if (WordXml.is(child, WordXml.DEL_TEXT)) {
                if (!accepted) {
                    out.append(WordXml.text(child));
                }
            } else if (WordXml.is(child, WordXml.TAB)) {
                out.append('\t');
            } else {
                collect(child, inInsertion || WordXml.is(child, WordXml.INS), accepted, out);
            }
        }
    }
}
