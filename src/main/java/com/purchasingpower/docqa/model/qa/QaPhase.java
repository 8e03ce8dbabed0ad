package com.purchasingpower.docqa.model.qa;

import java.util.EnumSet;
import java.util.Set;

/**
 * Phases of one question-answering run.
 */
public enum QaPhase {
    INIT,
    LOAD_DOCUMENTS,
    NO_DOCUMENTS,
    AGENT_MODE,
    HAS_DOCUMENTS,
    RETRIEVE,
    BUILD_CONTEXT,
    GENERATE,
    PERSIST_MATCHES,
    COMPLETE,
    FAILED;

    /**
     * Phases reachable from this one.
     */
    public Set<QaPhase> next() {
        return switch (this) {
            case INIT -> EnumSet.of(LOAD_DOCUMENTS, FAILED);
            case LOAD_DOCUMENTS -> EnumSet.of(NO_DOCUMENTS, HAS_DOCUMENTS, FAILED);
            case NO_DOCUMENTS -> EnumSet.of(AGENT_MODE);
            case HAS_DOCUMENTS -> EnumSet.of(RETRIEVE);
            case RETRIEVE -> EnumSet.of(BUILD_CONTEXT, AGENT_MODE, FAILED);
            case AGENT_MODE, BUILD_CONTEXT -> EnumSet.of(GENERATE);
            case GENERATE -> EnumSet.of(PERSIST_MATCHES, FAILED);
            case PERSIST_MATCHES -> EnumSet.of(COMPLETE, FAILED);
            case COMPLETE, FAILED -> EnumSet.noneOf(QaPhase.class);
        };
    }
}
