package com.libraryindex.agent.document;

import com.libraryindex.agent.config.ResearchProperties;
import com.libraryindex.agent.exception.ResearchException;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PdfBoxDocumentStructurerTest {

    @Test
    void toStructuredText_extractsTextFromEveryPage() throws IOException {
        PdfBoxDocumentStructurer structurer = new PdfBoxDocumentStructurer(new ResearchProperties());
        byte[] pdf = pdf("Graph networks for molecules", "Results on QM9");

        String text = structurer.toStructuredText(new RawDocument(pdf, "test.pdf", "application/pdf"));

        assertThat(text).contains("Graph networks for molecules").contains("Results on QM9");
    }

    @Test
    void toStructuredText_longText_isTruncated() throws IOException {
        ResearchProperties properties = new ResearchProperties();
        properties.getDocument().setMaxChunkLength(10);
        PdfBoxDocumentStructurer structurer = new PdfBoxDocumentStructurer(properties);

        String text = structurer.toStructuredText(
                new RawDocument(pdf("Graph networks for molecules"), "test.pdf", "application/pdf"));

        assertThat(text).isEqualTo("Graph netw\n[truncated]");
    }

    @Test
    void toStructuredText_notAPdf_throws() {
        PdfBoxDocumentStructurer structurer = new PdfBoxDocumentStructurer(new ResearchProperties());

        assertThatThrownBy(() -> structurer.toStructuredText(
                new RawDocument("<html>not a pdf</html>".getBytes(), "page.html", "text/html")))
                .isInstanceOf(ResearchException.class)
                .hasMessageContaining("page.html");
    }

    @Test
    void toStructuredText_emptyDocument_throws() {
        PdfBoxDocumentStructurer structurer = new PdfBoxDocumentStructurer(new ResearchProperties());

        assertThatThrownBy(() -> structurer.toStructuredText(new RawDocument(new byte[0], "empty.pdf", "application/pdf")))
                .isInstanceOf(ResearchException.class);
    }

    @Test
    void normalize_rejoinsHyphenatedWordsAndCollapsesWhitespace() {
        String raw = "graph neu-\nral   networks\r\n\n\n\n\tresults";

        assertThat(PdfBoxDocumentStructurer.normalize(raw)).isEqualTo("graph neural networks\n\n results");
    }

    private static byte[] pdf(String... pages) throws IOException {
        try (PDDocument doc = new PDDocument(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            PDType1Font font = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
            for (String line : pages) {
                PDPage page = new PDPage();
                doc.addPage(page);
                try (PDPageContentStream content = new PDPageContentStream(doc, page)) {
                    content.beginText();
                    content.setFont(font, 12);
                    content.newLineAtOffset(72, 700);
                    content.showText(line);
                    content.endText();
                }
            }
            doc.save(out);
            return out.toByteArray();
        }
    }
}
