package ai.nda.redline.document;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens {@code .docx} packages as {@link DocumentModel}s.
 */
public class DocxDocumentLoader {

    private static final Logger LOGGER = LoggerFactory.getLogger(DocxDocumentLoader.class);

    public byte[] readBytes(Path path) {
        Objects.requireNonNull(path, "path");
        try {
            return Files.readAllBytes(path);
        } catch (IOException ex) {
            throw new DocumentLoadException("Failed to read document: " + path, ex);
        }
    }

    public DocumentModel load(Path path) {
        return load(readBytes(path));
    }

    /**
     * Parses a document from its bytes. Each call yields an independent copy.
     */
    public DocumentModel load(byte[] content) {
        Objects.requireNonNull(content, "content");
        try (InputStream in = new ByteArrayInputStream(content)) {
            XWPFDocument document = new XWPFDocument(in);
            DocumentModel model = new DocumentModel(document);
            LOGGER.debug("Loaded document with {} paragraphs", model.paragraphs().size());
            return model;
        } catch (IOException | RuntimeException ex) {
            throw new DocumentLoadException("Failed to parse Word document", ex);
        }
    }
}
