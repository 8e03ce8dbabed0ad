package com.purchasingpower.docqa.configuration;

import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class ContextProperties {

    /**
     * Maximum characters of retrieved passages placed into one prompt.
     */
    @Min(200)
    private int maxChars = 12000;

    /**
     * Length of the passage snippet returned in source attributions.
     */
    @Min(20)
    private int snippetChars = 200;
}
