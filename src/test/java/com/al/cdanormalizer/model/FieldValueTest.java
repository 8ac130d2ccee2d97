package com.al.cdanormalizer.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class FieldValueTest {

    @Test
    public void testDisplayFallsBackToRaw() {
        FieldValue value = FieldValue.builder().raw(" Penicillin ").display("  ").build();

        assertEquals("Penicillin", value.getRaw());
        assertEquals("Penicillin", value.getDisplay());
        assertFalse(value.isCoded());
        assertFalse(value.isEmpty());
    }

    @Test
    public void testCodedValue() {
        FieldValue value = FieldValue.builder()
                .raw("Penicillin")
                .display("Penicilina")
                .code("764146007")
                .codeSystem("2.16.840.1.113883.6.96")
                .codeSystemName("SNOMED CT")
                .hasValueSet(true)
                .build();

        assertTrue(value.isCoded());
        assertEquals("Penicilina", value.getDisplay());
        assertTrue(value.isHasValueSet());
    }

    @Test
    public void testEmptyValue() {
        FieldValue value = FieldValue.builder().build();

        assertTrue(value.isEmpty());
        assertEquals("", value.getDisplay());
    }
}
