package com.libraryindex.agent.document;

import com.libraryindex.agent.config.ResearchProperties;
import com.libraryindex.agent.exception.ResearchException;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Extracts text from PDFs with PDFBox, page order preserved.
 * Output is whitespace-normalized and cut to {@code research.document.max-chunk-length}.
 */
@Component
@Slf4j
public class PdfBoxDocumentStructurer implements DocumentStructurer {

    private final int maxChunkLength;

    public PdfBoxDocumentStructurer(ResearchProperties properties) {
        this.maxChunkLength = properties.getDocument().getMaxChunkLength();
    }

    @Override
    public String toStructuredText(RawDocument document) {
        if (document == null || document.size() == 0) {
            throw new ResearchException("Empty document");
        }

        String text;
        try (PDDocument pdf = Loader.loadPDF(document.content())) {
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);
            text = stripper.getText(pdf);
            log.debug("Extracted {} chars from {} pages [{}]",
                    text.length(), pdf.getNumberOfPages(), document.sourceUri());
        } catch (IOException e) {
            throw new ResearchException("PDF extraction failed for " + document.sourceUri()
                    + ": " + e.getMessage(), e);
        }

        String normalized = normalize(text);
        if (normalized.isBlank()) {
            throw new ResearchException("No extractable text in " + document.sourceUri());
        }
        return truncate(normalized);
    }

    static String normalize(String text) {
        return text
                .replace("\r\n", "\n")
                // re-join words hyphenated across line breaks
                .replaceAll("(\\p{L})-\n(\\p{Ll})", "$1$2")
                .replaceAll("[ \\t\\x0B\\f]+", " ")
                .replaceAll("\n{3,}", "\n\n")
                .trim();
    }

    private String truncate(String text) {
        if (text.length() <= maxChunkLength) {
            return text;
        }
        return text.substring(0, maxChunkLength) + "\n[truncated]";
    }
}
