package com.purchasingpower.docqa.service;

/**
 * Turns an uploaded file into plain text.
 */
public interface TextExtractor {

    boolean supports(String filename);

    /**
     * @throws com.purchasingpower.docqa.exception.UnsupportedDocumentException for formats this extractor cannot read
     */
    String extract(String filename, byte[] content);
}
