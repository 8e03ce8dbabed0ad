package com.purchasingpower.docqa.model.qa;

import lombok.Value;

/**
 * Ids of the two messages written for one answered question.
 */
@Value
public class RecordedExchange {
    Long userMessageId;
    Long assistantMessageId;
    int matchCount;
}
