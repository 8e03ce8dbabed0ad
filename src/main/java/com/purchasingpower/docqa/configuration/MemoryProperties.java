package com.purchasingpower.docqa.configuration;

import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class MemoryProperties {

    /**
     * Turns kept per conversation before the oldest are dropped.
     */
    @Min(2)
    private int maxTurns = 20;

    /**
     * Total characters kept per conversation before the oldest turns are dropped.
     */
    @Min(100)
    private int maxChars = 16000;

    /**
     * Most recent turns handed to the generator with each question.
     */
    @Min(0)
    private int turnsInPrompt = 6;
}
