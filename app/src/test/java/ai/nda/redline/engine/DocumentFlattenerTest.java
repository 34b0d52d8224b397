package ai.nda.redline.engine;

import static org.assertj.core.api.Assertions.assertThat;

import ai.nda.redline.document.DocumentModel;
import ai.nda.redline.document.DocxFixtures;
import org.apache.poi.xwpf.usermodel.XWPFHyperlinkRun;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTP;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTRunTrackChange;
import org.junit.jupiter.api.Test;

class DocumentFlattenerTest {

    private final DocumentFlattener flattener = new DocumentFlattener();

    @Test
    void concatenatesRunsAndIndexesTheirOffsets() throws Exception {
        try (DocumentModel document = DocxFixtures.load(DocxFixtures.formattedParagraph("The Recipient ", "shall not", " disclose"))) {
            FlatText flat = flattener.flatten(document.paragraph(0));

            assertThat(flat.text()).isEqualTo("The Recipient shall not disclose");
            assertThat(flat.runs()).hasSize(3);
            assertThat(flat.runStart(1)).isEqualTo(14);
            assertThat(flat.runEnd(1)).isEqualTo(23);
            assertThat(flat.runAt(14)).isEqualTo(1);
            assertThat(flat.runAt(13)).isZero();
            assertThat(flat.offsetInRun(16)).isEqualTo(2);
        }
    }

    @Test
    void mapsTabsBreaksAndHyperlinks() throws Exception {
        byte[] content = DocxFixtures.build(document -> {
            XWPFParagraph paragraph = document.createParagraph();
            XWPFRun run = paragraph.createRun();
            run.setText("Clause");
            run.addTab();
            run.setText("1");
            run.addBreak();
            XWPFHyperlinkRun link = paragraph.createHyperlinkRun("https://example.com/terms");
            link.setText("see terms");
        });

        try (DocumentModel document = DocxFixtures.load(content)) {
            FlatText flat = flattener.flatten(document.paragraph(0));

            assertThat(flat.text()).isEqualTo("Clause\t1\nsee terms");
            assertThat(flat.searchText()).isEqualTo("Clause 1 see terms");
        }
    }

    @Test
    void ignoresContentOfExistingRevisions() throws Exception {
        byte[] content = DocxFixtures.build(document -> {
            XWPFParagraph paragraph = DocxFixtures.addParagraph(document, "Visible ");
            CTP ctp = paragraph.getCTP();
            CTRunTrackChange insertion = ctp.addNewIns();
            insertion.addNewR().addNewT().setStringValue("inserted");
            CTRunTrackChange deletion = ctp.addNewDel();
            deletion.addNewR().addNewDelText().setStringValue("deleted");
            paragraph.createRun().setText("text");
        });

        try (DocumentModel document = DocxFixtures.load(content)) {
            assertThat(flattener.flatten(document.paragraph(0)).text()).isEqualTo("Visible text");
        }
    }

    @Test
    void searchTextFoldsCharactersAndMapsBackToRawOffsets() throws Exception {
        try (DocumentModel document = DocxFixtures.load(DocxFixtures.paragraphs("the \u201CParty\u201D\u00A0 shall"))) {
            FlatText flat = flattener.flatten(document.paragraph(0));

            assertThat(flat.searchText()).isEqualTo("the \"Party\" shall");
            int searchStart = flat.searchText().indexOf("shall");
            assertThat(flat.substring(flat.toTextStart(searchStart), flat.toTextEnd(searchStart + 5))).isEqualTo("shall");
        }
    }

    @Test
    void joinsParagraphsIntoDocumentText() throws Exception {
        try (DocumentModel document = DocxFixtures.load(DocxFixtures.paragraphs("One", "Two"))) {
            assertThat(flattener.documentText(document)).isEqualTo("One\nTwo");
        }
    }
}
