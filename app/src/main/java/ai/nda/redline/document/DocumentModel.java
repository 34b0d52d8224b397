package ai.nda.redline.document;

import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.xmlbeans.XmlCursor;
import org.apache.xmlbeans.XmlObject;

/**
 * In-memory Word document viewed as an ordered tree of {@link Block}s.
 *
 * <p>The block tree is built once when the model is created. Edits only rearrange runs inside
 * paragraphs, so paragraph elements and their ordinals stay valid for the lifetime of the model.
 */
public final class DocumentModel implements Closeable {

    private final XWPFDocument document;
    private final List<Block> blocks;
    private final List<ParagraphBlock> paragraphs;

    DocumentModel(XWPFDocument document) {
        this.document = Objects.requireNonNull(document, "document");
        this.paragraphs = new ArrayList<>();
        this.blocks = List.copyOf(readBlocks(document.getDocument().getBody(), paragraphs));
    }

    public List<Block> blocks() {
        return blocks;
    }

    /**
     * All paragraphs in document order, descending into table cells.
     */
    public List<ParagraphBlock> paragraphs() {
        return List.copyOf(paragraphs);
    }

    public ParagraphBlock paragraph(int ordinal) {
        if (ordinal < 0 || ordinal >= paragraphs.size()) {
            throw new IndexOutOfBoundsException("No paragraph with ordinal " + ordinal);
        }
        return paragraphs.get(ordinal);
    }

    public XWPFDocument document() {
        return document;
    }

    public byte[] toBytes() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            document.write(out);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to serialize document", ex);
        }
        return out.toByteArray();
    }

    @Override
    public void close() throws IOException {
        document.close();
    }

    private List<Block> readBlocks(XmlObject container, List<ParagraphBlock> paragraphSink) {
        List<Block> result = new ArrayList<>();
        try (XmlCursor cursor = container.newCursor()) {
            if (!cursor.toFirstChild()) {
                return result;
            }
            do {
                XmlObject child = cursor.getObject();
                if (WordXml.P.equals(cursor.getName())) {
                    ParagraphBlock paragraph = new ParagraphBlock(paragraphSink.size(), child);
                    paragraphSink.add(paragraph);
                    result.add(paragraph);
                } else if (WordXml.TBL.equals(cursor.getName())) {
                    result.add(readTable(child, paragraphSink));
                } else if (WordXml.SDT.equals(cursor.getName())) {
                    WordXml.firstChild(child, WordXml.SDT_CONTENT)
                            .ifPresent(content -> result.addAll(readBlocks(content, paragraphSink)));
                }
            } while (cursor.toNextSibling());
        }
        return result;
    }

    private TableBlock readTable(XmlObject table, List<ParagraphBlock> paragraphSink) {
        List<TableBlock.Row> rows = new ArrayList<>();
        for (XmlObject row : WordXml.children(table)) {
            if (!WordXml.is(row, WordXml.TR)) {
                continue;
            }
            List<TableBlock.Cell> cells = new ArrayList<>();
            for (XmlObject cell : WordXml.children(row)) {
                if (WordXml.is(cell, WordXml.TC)) {
                    cells.add(new TableBlock.Cell(readBlocks(cell, paragraphSink)));
                }
            }
            rows.add(new TableBlock.Row(cells));
        }
        return new TableBlock(rows);
    }
}
