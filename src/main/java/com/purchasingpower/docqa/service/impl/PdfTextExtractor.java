package com.purchasingpower.docqa.service.impl;

import com.purchasingpower.docqa.exception.UnsupportedDocumentException;
import com.purchasingpower.docqa.service.TextExtractor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Locale;

/**
 * Extracts the text layer of PDF files page by page.
 *
 * Each page is preceded by a {@code --- Page n ---} line so passages can be
 * traced back to their page. Encrypted files and scans without a text layer
 * are rejected.
 */
@Slf4j
@Component
public class PdfTextExtractor implements TextExtractor {

    @Override
    public boolean supports(String filename) {
        return filename != null && filename.toLowerCase(Locale.ROOT).endsWith(".pdf");
    }

    @Override
    public String extract(String filename, byte[] content) {
        if (!supports(filename)) {
            throw new UnsupportedDocumentException(filename, "Not a PDF file: " + filename);
        }

        try (PDDocument document = PDDocument.load(content)) {
            if (document.isEncrypted()) {
                throw new UnsupportedDocumentException(filename, "PDF is encrypted and cannot be read: " + filename);
            }

            PDFTextStripper stripper = new PDFTextStripper();
            int pageCount = document.getNumberOfPages();
            StringBuilder text = new StringBuilder();
            for (int page = 1; page <= pageCount; page++) {
                stripper.setStartPage(page);
                stripper.setEndPage(page);
                text.append("--- Page ").append(page).append(" ---\n")
                        .append(stripper.getText(document).strip())
                        .append("\n\n");
            }

            String extracted = text.toString().strip();
            if (extracted.replaceAll("--- Page \\d+ ---", "").isBlank()) {
                throw new UnsupportedDocumentException(filename, "PDF has no text layer: " + filename);
            }
            log.info("📄 Extracted {} characters from {} page(s) of {}", extracted.length(), pageCount, filename);
            return extracted;
        } catch (IOException e) {
            log.warn("Could not parse PDF {}: {}", filename, e.getMessage());
            throw new UnsupportedDocumentException(filename, "PDF could not be read: " + filename + " (" + e.getMessage() + ")");
        }
    }
}
