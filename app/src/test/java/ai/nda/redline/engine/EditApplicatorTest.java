package ai.nda.redline.engine;

import static org.assertj.core.api.Assertions.assertThat;

import ai.nda.redline.document.DocumentModel;
import ai.nda.redline.document.DocxFixtures;
import ai.nda.redline.document.ParagraphBlock;
import ai.nda.redline.document.WordXml;
import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.apache.xmlbeans.XmlObject;
import org.junit.jupiter.api.Test;

class EditApplicatorTest {

    private static final String SENTENCE = "The Recipient shall pay \u20AC50,000 per breach.";
    private static final String CITATION = "pay \u20AC50,000 per breach";
    private static final String REPLACEMENT = "be liable only for proven direct damages";
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T12:00:00.750Z"), ZoneOffset.UTC);

    private final DocumentFlattener flattener = new DocumentFlattener();
    private final EditApplicator applicator = new EditApplicator(flattener, new RunSplitter(flattener));
    private final SpanResolver resolver = new SpanResolver();
    private final EditPolicy policy = EditPolicy.defaults();

    @Test
    void cleanModeReplacesCitedText() throws Exception {
        try (DocumentModel document = DocxFixtures.load(DocxFixtures.paragraphs(SENTENCE))) {
            ParagraphBlock paragraph = document.paragraph(0);

            EditStatus status = apply(document, paragraph, CITATION, REPLACEMENT, RevisionMode.CLEAN);

            assertThat(status).isEqualTo(EditStatus.APPLIED);
            assertThat(flattener.flatten(paragraph).text())
                    .isEqualTo("The Recipient shall be liable only for proven direct damages.");
            assertThat(DocxFixtures.revisions(paragraph.xml(), WordXml.INS)).isEmpty();
            assertThat(DocxFixtures.revisions(paragraph.xml(), WordXml.DEL)).isEmpty();
        }
    }

    @Test
    void trackedModeMarksDeletionAndInsertion() throws Exception {
        try (DocumentModel document = DocxFixtures.load(DocxFixtures.paragraphs(SENTENCE))) {
            ParagraphBlock paragraph = document.paragraph(0);

            EditStatus status = apply(document, paragraph, CITATION, REPLACEMENT, RevisionMode.TRACKED);

            assertThat(status).isEqualTo(EditStatus.APPLIED);
            List<XmlObject> deletions = DocxFixtures.revisions(paragraph.xml(), WordXml.DEL);
            List<XmlObject> insertions = DocxFixtures.revisions(paragraph.xml(), WordXml.INS);
            assertThat(deletions).hasSize(1);
            assertThat(insertions).hasSize(1);
            assertThat(WordXml.attribute(deletions.get(0), WordXml.AUTHOR)).contains(EditPolicy.DEFAULT_AUTHOR);
            assertThat(WordXml.attribute(insertions.get(0), WordXml.AUTHOR)).contains(EditPolicy.DEFAULT_AUTHOR);
            assertThat(WordXml.attribute(insertions.get(0), WordXml.DATE)).contains("2024-05-01T12:00:00Z");
            assertThat(DocxFixtures.revisions(deletions.get(0), WordXml.DEL_TEXT)).extracting(WordXml::text)
                    .containsExactly(CITATION);
            assertThat(DocxFixtures.revisions(deletions.get(0), WordXml.T)).isEmpty();
            assertThat(DocxFixtures.acceptedText(paragraph))
                    .isEqualTo("The Recipient shall be liable only for proven direct damages.");
            assertThat(DocxFixtures.rejectedText(paragraph)).isEqualTo(SENTENCE);
        }
    }

    @Test
    void trackedModeOnlyMarksWordsThatDiffer() throws Exception {
        try (DocumentModel document = DocxFixtures.load(DocxFixtures.paragraphs(SENTENCE))) {
            ParagraphBlock paragraph = document.paragraph(0);

            apply(document, paragraph, CITATION, "pay \u20AC25,000 per breach", RevisionMode.TRACKED);

            XmlObject deletion = DocxFixtures.revisions(paragraph.xml(), WordXml.DEL).get(0);
            XmlObject insertion = DocxFixtures.revisions(paragraph.xml(), WordXml.INS).get(0);
            assertThat(DocxFixtures.revisions(deletion, WordXml.DEL_TEXT)).extracting(WordXml::text).containsExactly("\u20AC50,000");
            assertThat(DocxFixtures.revisions(insertion, WordXml.T)).extracting(WordXml::text).containsExactly("\u20AC25,000");
            assertThat(DocxFixtures.acceptedText(paragraph)).isEqualTo("The Recipient shall pay \u20AC25,000 per breach.");
        }
    }

    @Test
    void skipsReplacementEqualToCitedText() throws Exception {
        try (DocumentModel document = DocxFixtures.load(DocxFixtures.paragraphs(SENTENCE))) {
            ParagraphBlock paragraph = document.paragraph(0);
            String before = paragraph.xml().xmlText();

            EditStatus status = apply(document, paragraph, CITATION, "pay  \u20AC50,000 per breach", RevisionMode.TRACKED);

            assertThat(status).isEqualTo(EditStatus.SKIPPED_UNCHANGED);
            assertThat(paragraph.xml().xmlText()).isEqualTo(before);
        }
    }

    @Test
    void keepSameAppliesEvenIdenticalReplacement() throws Exception {
        try (DocumentModel document = DocxFixtures.load(DocxFixtures.paragraphs(SENTENCE))) {
            ParagraphBlock paragraph = document.paragraph(0);
            MatchSpan span = resolver.resolve(flattener.flatten(paragraph), CITATION, false).orElseThrow();

            EditStatus status = applicator.apply(paragraph, span, CITATION, RevisionMode.CLEAN,
                    policy.withSkipIfSame(false), RevisionStamp.forDocument(document, policy.author(), CLOCK));

            assertThat(status).isEqualTo(EditStatus.APPLIED);
            assertThat(flattener.flatten(paragraph).text()).isEqualTo(SENTENCE);
        }
    }

    @Test
    void cleanModeReplacesAcrossRunsAndKeepsFirstRunFormatting() throws Exception {
        byte[] content = DocxFixtures.formattedParagraph("The Recipient ", "shall pay", " \u20AC50,000 per breach.");
        try (DocumentModel document = DocxFixtures.load(content)) {
            ParagraphBlock paragraph = document.paragraph(0);

            apply(document, paragraph, "shall pay \u20AC50,000", "must pay up to \u20AC10,000", RevisionMode.CLEAN);

            assertThat(flattener.flatten(paragraph).text()).isEqualTo("The Recipient must pay up to \u20AC10,000 per breach.");
            XmlObject edited = flattener.flatten(paragraph).runs().get(1).element();
            assertThat(WordXml.firstChild(edited, WordXml.RPR)).isPresent();
            assertThat(flattener.flatten(paragraph).runs().get(1).text()).isEqualTo("must pay up to \u20AC10,000");
        }
    }

    @Test
    void trackedDeletionWithoutReplacementHasNoInsertion() throws Exception {
        try (DocumentModel document = DocxFixtures.load(DocxFixtures.paragraphs("The Recipient shall promptly return all materials."))) {
            ParagraphBlock paragraph = document.paragraph(0);

            apply(document, paragraph, "promptly", "", RevisionMode.TRACKED);

            assertThat(DocxFixtures.revisions(paragraph.xml(), WordXml.INS)).isEmpty();
            assertThat(DocxFixtures.acceptedText(paragraph)).isEqualTo("The Recipient shall return all materials.");
        }
    }

    @Test
    void trackedPureInsertionHasNoDeletion() throws Exception {
        try (DocumentModel document = DocxFixtures.load(DocxFixtures.paragraphs(SENTENCE))) {
            ParagraphBlock paragraph = document.paragraph(0);

            apply(document, paragraph, CITATION, "pay \u20AC50,000 per proven breach", RevisionMode.TRACKED);

            assertThat(DocxFixtures.revisions(paragraph.xml(), WordXml.DEL)).isEmpty();
            assertThat(DocxFixtures.revisions(paragraph.xml(), WordXml.INS)).hasSize(1);
            assertThat(DocxFixtures.acceptedText(paragraph)).isEqualTo("The Recipient shall pay \u20AC50,000 per proven breach.");
            assertThat(DocxFixtures.rejectedText(paragraph)).isEqualTo(SENTENCE);
        }
    }

    @Test
    void cleanDeletionLeavesNoDoubleSpace() throws Exception {
        try (DocumentModel document = DocxFixtures.load(DocxFixtures.paragraphs("The Recipient shall promptly return all materials."))) {
            ParagraphBlock paragraph = document.paragraph(0);

            apply(document, paragraph, "promptly", "", RevisionMode.CLEAN);

            assertThat(flattener.flatten(paragraph).text()).isEqualTo("The Recipient shall return all materials.");
        }
    }

    @Test
    void trackedInsertionCopiesFormattingOfDeletedText() throws Exception {
        byte[] content = DocxFixtures.formattedParagraph("Term: ", "five years", ".");
        try (DocumentModel document = DocxFixtures.load(content)) {
            ParagraphBlock paragraph = document.paragraph(0);

            apply(document, paragraph, "five years", "three years", RevisionMode.TRACKED);

            XmlObject insertion = DocxFixtures.revisions(paragraph.xml(), WordXml.INS).get(0);
            XmlObject insertedRun = WordXml.firstChild(insertion, WordXml.R).orElseThrow();
            assertThat(WordXml.firstChild(insertedRun, WordXml.RPR)).isPresent();
            assertThat(DocxFixtures.acceptedText(paragraph)).isEqualTo("Term: three years.");
        }
    }

    @Test
    void newRevisionIdsContinueAfterExistingOnes() throws Exception {
        byte[] content = DocxFixtures.build(document -> {
            DocxFixtures.addParagraph(document, SENTENCE).getCTP().addNewIns().setId(BigInteger.valueOf(41));
        });
        try (DocumentModel document = DocxFixtures.load(content)) {
            ParagraphBlock paragraph = document.paragraph(0);

            apply(document, paragraph, CITATION, REPLACEMENT, RevisionMode.TRACKED);

            List<String> ids = DocxFixtures.revisions(paragraph.xml(), WordXml.DEL).stream()
                    .map(element -> WordXml.attribute(element, WordXml.ID).orElseThrow())
                    .toList();
            assertThat(ids).containsExactly("42");
            assertThat(DocxFixtures.revisions(paragraph.xml(), WordXml.INS))
                    .extracting(element -> WordXml.attribute(element, WordXml.ID).orElseThrow())
                    .containsExactlyInAnyOrder("41", "43");
        }
    }

    private EditStatus apply(DocumentModel document, ParagraphBlock paragraph, String citation, String replacement, RevisionMode mode) {
        MatchSpan span = resolver.resolve(flattener.flatten(paragraph), citation, policy.caseFallback(mode)).orElseThrow();
        RevisionStamp stamp = RevisionStamp.forDocument(document, policy.author(), CLOCK);
        return applicator.apply(paragraph, span, replacement, mode, policy, stamp);
    }
}
