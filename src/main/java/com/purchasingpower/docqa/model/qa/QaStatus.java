package com.purchasingpower.docqa.model.qa;

public enum QaStatus {
    COMPLETED,
    FAILED
}
