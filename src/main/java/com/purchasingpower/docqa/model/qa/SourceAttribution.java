package com.purchasingpower.docqa.model.qa;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A document cited by an answer, with its best passage.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SourceAttribution {
    private Long documentId;
    private String documentName;
    private String passage;
    private double score;
}
