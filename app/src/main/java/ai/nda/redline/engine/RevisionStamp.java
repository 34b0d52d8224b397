package ai.nda.redline.engine;

import ai.nda.redline.document.DocumentModel;
import ai.nda.redline.document.WordXml;
import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.regex.Pattern;
import org.apache.xmlbeans.XmlCursor;
import org.apache.xmlbeans.XmlObject;

/**
 * Author, timestamp and id source for the revisions written during one batch.
 *
 * <p>Ids continue after the highest {@code w:id} already present in the document so that new
 * revisions never collide with existing annotations.
 */
public final class RevisionStamp {

    private static final Pattern NUMERIC_ID = Pattern.compile("\\d{1,9}");

    private final String author;
    private final String date;
    private int nextId;

    RevisionStamp(String author, String date, int firstId) {
        this.author = author;
        this.date = date;
        this.nextId = firstId;
    }

    public static RevisionStamp forDocument(DocumentModel document, String author, Clock clock) {
        String date = DateTimeFormatter.ISO_INSTANT.format(clock.instant().truncatedTo(ChronoUnit.SECONDS));
        return new RevisionStamp(author, date, highestId(document) + 1);
    }

    public String author() {
        return author;
    }

    public String date() {
        return date;
    }

    /**
     * Sets id, author and date on a {@code w:ins} or {@code w:del} element.
     */
    public void mark(XmlObject revision) {
        WordXml.setAttribute(revision, WordXml.ID, Integer.toString(nextId++));
        WordXml.setAttribute(revision, WordXml.AUTHOR, author);
        WordXml.setAttribute(revision, WordXml.DATE, date);
    }

    private static int highestId(DocumentModel document) {
        int highest = 0;
        try (XmlCursor cursor = document.document().getDocument().newCursor()) {
            while (!cursor.toNextToken().isNone()) {
                if (!cursor.isStart()) {
                    continue;
                }
                String value = cursor.getAttributeText(WordXml.ID);
                if (value != null) {
                    highest = Math.max(highest, parseId(value));
                }
            }
        }
        return highest;
    }

    private static int parseId(String value) {
        String trimmed = value.trim();
        return NUMERIC_ID.matcher(trimmed).matches() ? Integer.parseInt(trimmed) : 0;
    }
}
