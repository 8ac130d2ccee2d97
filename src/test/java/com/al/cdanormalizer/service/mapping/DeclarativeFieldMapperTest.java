package com.al.cdanormalizer.service.mapping;

import com.al.cdanormalizer.PipelineFixtures;
import com.al.cdanormalizer.model.ClinicalCategory;
import com.al.cdanormalizer.model.Entry;
import com.al.cdanormalizer.model.ErrorKind;
import com.al.cdanormalizer.model.FieldLabels;
import com.al.cdanormalizer.service.extraction.ExtractionContext;
import com.al.cdanormalizer.service.extraction.SectionNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DeclarativeFieldMapperTest {

    private final PipelineFixtures fixtures = new PipelineFixtures();
    private final DeclarativeFieldMapper mapper = new DeclarativeFieldMapper(fixtures.fieldValueFactory);

    @Test
    public void testMapAllergySection() {
        ExtractionContext context = fixtures.structuredContext(
                PipelineFixtures.read("patient-summary-allergy-medication.xml"), "en", "pt");
        SectionNode allergies = fixtures.structuralParser.findSections(context.getDom()).get(0);

        List<Entry> entries = mapper.mapSection(allergies.getElement(), "48765-2", fixtures.schema, context);

        assertEquals(1, entries.size());
        assertEquals("Penicillin", entries.get(0).field(FieldLabels.AGENT_DISPLAY).getRaw());
        assertEquals("Penicilina", entries.get(0).display(FieldLabels.AGENT_DISPLAY));
        assertEquals("Urticária", entries.get(0).display(FieldLabels.MANIFESTATION));
        assertEquals("2015-06-01", entries.get(0).display(FieldLabels.ONSET_DATE));
        // severity and status are mapped but absent from the entry
        assertTrue(context.getIssues().stream()
                .anyMatch(issue -> issue.getKind() == ErrorKind.FIELD_EXTRACTION_MISS));
    }

    @Test
    public void testRawValuesMatchStructuralWalk() {
        ExtractionContext context = fixtures.structuredContext(
                PipelineFixtures.read("patient-summary-allergy-medication.xml"), "en", "en");
        SectionNode medications = fixtures.structuralParser.findSections(context.getDom()).get(1);

        Entry mapped = mapper.mapSection(medications.getElement(), "10160-0", fixtures.schema, context).get(0);
        Entry walked = fixtures.structuralParser
                .walkSection(medications, ClinicalCategory.MEDICATION, context).get(0);

        for (String label : mapped.getFields().keySet()) {
            assertEquals(walked.field(label).getRaw(), mapped.field(label).getRaw(), label);
        }
    }

    @Test
    public void testUnmappedSectionYieldsNothing() {
        ExtractionContext context = fixtures.structuredContext(
                PipelineFixtures.read("patient-summary-allergy-medication.xml"), "en", "en");
        SectionNode allergies = fixtures.structuralParser.findSections(context.getDom()).get(0);

        assertTrue(mapper.mapSection(allergies.getElement(), "29762-2", fixtures.schema, context).isEmpty());
    }
}
