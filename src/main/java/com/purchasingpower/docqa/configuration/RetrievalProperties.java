package com.purchasingpower.docqa.configuration;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class RetrievalProperties {

    /**
     * Upper bound for passages requested from the vector index per question.
     */
    @Min(1)
    private int maxK = 10;

    /**
     * Passages scoring below this value are not treated as evidence.
     * Scores are (1 + cosine) / 2, so 0.5 means orthogonal. Dense embedding models
     * rarely go that low for unrelated text, so the threshold depends on the model.
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double minScore = 0.75;
}
