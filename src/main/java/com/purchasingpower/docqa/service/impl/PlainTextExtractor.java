package com.purchasingpower.docqa.service.impl;

import com.purchasingpower.docqa.exception.UnsupportedDocumentException;
import com.purchasingpower.docqa.service.TextExtractor;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Set;

/**
 * Extractor for text-based formats (.txt, .md, .csv), read as UTF-8.
 */
@Component
public class PlainTextExtractor implements TextExtractor {

    private static final Set<String> EXTENSIONS = Set.of("txt", "md", "markdown", "csv");

    @Override
    public boolean supports(String filename) {
        return EXTENSIONS.contains(extension(filename));
    }

    @Override
    public String extract(String filename, byte[] content) {
        if (!supports(filename)) {
            throw new UnsupportedDocumentException(filename,
                    "Unsupported file type: " + filename + " (supported: " + String.join(", ", EXTENSIONS) + ")");
        }
        String text = new String(content, StandardCharsets.UTF_8);
        // drop a UTF-8 byte order mark
        return text.startsWith("\uFEFF") ? text.substring(1) : text;
    }

    private static String extension(String filename) {
        if (filename == null) {
            return "";
        }
        int dot = filename.lastIndexOf('.');
        return dot < 0 ? "" : filename.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
