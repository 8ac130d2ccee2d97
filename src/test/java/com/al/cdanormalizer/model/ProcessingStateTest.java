package com.al.cdanormalizer.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ProcessingStateTest {

    @Test
    public void testLifecycle() {
        assertTrue(ProcessingState.UNPARSED.canMoveTo(ProcessingState.CLASSIFIED));
        assertTrue(ProcessingState.CLASSIFIED.canMoveTo(ProcessingState.STRATEGY_ATTEMPTED));
        assertTrue(ProcessingState.STRATEGY_ATTEMPTED.canMoveTo(ProcessingState.STRATEGY_ATTEMPTED));
        assertTrue(ProcessingState.STRATEGY_ATTEMPTED.canMoveTo(ProcessingState.ASSEMBLED));
    }

    @Test
    public void testTerminalStatesAreFinal() {
        assertFalse(ProcessingState.ASSEMBLED.canMoveTo(ProcessingState.STRATEGY_ATTEMPTED));
        assertFalse(ProcessingState.FAILED.canMoveTo(ProcessingState.CLASSIFIED));
        assertFalse(ProcessingState.UNPARSED.canMoveTo(ProcessingState.ASSEMBLED));
    }
}
