package com.purchasingpower.docqa.model.qa;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnswerMetadata {

    private AnswerMode mode;

    /**
     * Distinct documents cited.
     */
    private int numSources;

    /**
     * Passages placed into the prompt.
     */
    private int numPassages;

    private int contextLength;

    /**
     * True when retrieval failed and the answer fell back to general knowledge.
     */
    private boolean degraded;

    private String note;
}
