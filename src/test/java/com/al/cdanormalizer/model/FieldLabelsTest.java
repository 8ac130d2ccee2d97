package com.al.cdanormalizer.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class FieldLabelsTest {

    @Test
    public void testForColumn_AllergyHeadersMapToCanonicalLabels() {
        assertEquals(FieldLabels.AGENT_DISPLAY, FieldLabels.forColumn("Agent", 0, ClinicalCategory.ALLERGY));
        assertEquals(FieldLabels.AGENT_DISPLAY, FieldLabels.forColumn("Causative agent", 0, ClinicalCategory.ALLERGY));
        assertEquals(FieldLabels.MANIFESTATION, FieldLabels.forColumn("Reaction", 1, ClinicalCategory.ALLERGY));
    }

    @Test
    public void testForColumn_SameHeaderDependsOnCategory() {
        assertEquals(FieldLabels.CONDITION_DISPLAY, FieldLabels.forColumn("Condition", 0, ClinicalCategory.PROBLEM));
        assertEquals(FieldLabels.MEDICATION_DISPLAY, FieldLabels.forColumn("Drug", 0, ClinicalCategory.MEDICATION));
        assertEquals("drug", FieldLabels.forColumn("Drug", 0, ClinicalCategory.GENERIC));
    }

    @Test
    public void testForColumn_UnknownHeaderKeepsNormalizedLabel() {
        assertEquals("comments", FieldLabels.forColumn("Comments", 2, ClinicalCategory.ALLERGY));
        assertEquals("column_4", FieldLabels.forColumn(null, 3, ClinicalCategory.ALLERGY));
        assertEquals("agent", FieldLabels.forColumn("Agent", 0, null));
    }
}
