package com.purchasingpower.docqa.knowledge;

import com.purchasingpower.docqa.model.document.DocumentChunk;
import lombok.Value;

/**
 * A retrieved passage with its relevance score in [0, 1].
 */
@Value
public class ScoredChunk {
    DocumentChunk chunk;
    double score;

    public Long getDocumentId() {
        return chunk.getDocumentId();
    }

    public String getDocumentName() {
        return chunk.getDocument().getFilename();
    }

    public String getContent() {
        return chunk.getContent();
    }
}
