package com.al.cdanormalizer.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Per-document lifecycle: UNPARSED, CLASSIFIED, STRATEGY_ATTEMPTED (repeatable),
 * then ASSEMBLED or FAILED.
 */
public enum ProcessingState {
    UNPARSED,
    CLASSIFIED,
    STRATEGY_ATTEMPTED,
    ASSEMBLED,
    FAILED;

    public boolean canMoveTo(ProcessingState next) {
        return allowedNext().contains(next);
    }

    private Set<ProcessingState> allowedNext() {
        switch (this) {
            case UNPARSED:
                return EnumSet.of(CLASSIFIED, FAILED);
            case CLASSIFIED:
                return EnumSet.of(STRATEGY_ATTEMPTED, ASSEMBLED, FAILED);
            case STRATEGY_ATTEMPTED:
                return EnumSet.of(STRATEGY_ATTEMPTED, ASSEMBLED);
            default:
                return EnumSet.noneOf(ProcessingState.class);
        }
    }
}
