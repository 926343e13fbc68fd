package com.delta.research.pipeline.extract;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Page-by-page PDF text. Pages after the first are preceded by a {@code --- page N ---} marker.
 */
public final class PdfTextExtractor {

    private PdfTextExtractor() {
    }

    /**
     * @throws IOException when the bytes are missing or are not a readable PDF
     */
    public static PdfText extract(byte[] bytes) throws IOException {
        if (bytes == null || bytes.length == 0) {
            throw new IOException("pdf_bytes_missing");
        }
        try (PDDocument document = Loader.loadPDF(bytes)) {
            int pageCount = document.getNumberOfPages();
            PDFTextStripper stripper = new PDFTextStripper();
            List<String> parts = new ArrayList<>();
            boolean anyText = false;
            for (int page = 1; page <= pageCount; page++) {
                stripper.setStartPage(page);
                stripper.setEndPage(page);
                String pageText = stripper.getText(document);
                pageText = pageText == null ? "" : pageText.strip();
                if (!pageText.isEmpty()) {
                    anyText = true;
                }
                if (page > 1) {
                    parts.add("--- page " + page + " ---");
                }
                parts.add(pageText);
            }
            String text = anyText ? String.join("\n\n", parts) : "";
            return new PdfText(text, pageCount, !anyText);
        }
    }

    public record PdfText(String text, int pageCount, boolean unextractable) {
    }
}
