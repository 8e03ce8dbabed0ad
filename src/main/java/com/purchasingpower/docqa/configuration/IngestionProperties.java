package com.purchasingpower.docqa.configuration;

import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class IngestionProperties {

    /**
     * Maximum passage length in characters.
     */
    @Min(100)
    private int chunkSize = 1000;

    /**
     * Characters shared between consecutive passages.
     */
    @Min(0)
    private int chunkOverlap = 200;
}
