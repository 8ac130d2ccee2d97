package com.al.cdanormalizer.service.docmap;

import com.al.cdanormalizer.PipelineFixtures;
import com.al.cdanormalizer.model.ClinicalCategory;
import com.al.cdanormalizer.model.DocumentMap;
import com.al.cdanormalizer.model.EntryShape;
import com.al.cdanormalizer.model.FieldLabels;
import com.al.cdanormalizer.service.extraction.ExtractionContext;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

public class DocumentMapBuilderTest {

    private static final Instant NOW = Instant.parse("2024-05-01T08:00:00Z");

    private final PipelineFixtures fixtures = new PipelineFixtures();
    private final DocumentMapBuilder builder = new DocumentMapBuilder(fixtures.structuralParser,
            Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    public void testBuild_ProfilesSectionsAndPatterns() {
        ExtractionContext context = fixtures.structuredContext(
                PipelineFixtures.read("patient-summary-allergy-medication.xml"), "en", "en");

        DocumentMap map = builder.build("hash-1", context.getDom(), 500);

        assertEquals("hash-1", map.getContentHash());
        assertEquals(NOW, map.getCreatedAt());
        assertEquals(2, map.getSections().size());
        assertTrue(map.hasPatterns());

        DocumentMap.SectionProfile allergies = map.getSections().get(0);
        assertEquals("48765-2", allergies.getCode());
        assertEquals(ClinicalCategory.ALLERGY, allergies.getCategory());
        assertEquals(1, allergies.getEntryCount());
        assertEquals(EntryShape.ACT_OBSERVATION_PARTICIPANT, allergies.getEntryShapes().get(0));

        DocumentMap.EntryPattern pattern = allergies.getPatterns().get(0);
        assertTrue(pattern.getPaths().get(FieldLabels.AGENT_DISPLAY).contains("@typeCode='CSM'"));
        // paths that found nothing are not recorded
        assertFalse(pattern.getPaths().containsKey(FieldLabels.SEVERITY));
    }

    @Test
    public void testBuild_Metadata() {
        ExtractionContext context = fixtures.structuredContext(
                PipelineFixtures.read("patient-summary-allergy-medication.xml"), "en", "en");

        DocumentMap map = builder.build("hash-1", context.getDom(), 500);

        assertEquals("PS-0001", map.getMetadata().get("documentId"));
        assertEquals("60591-5", map.getMetadata().get("documentTypeCode"));
        assertEquals("Patient summary Document", map.getMetadata().get("documentType"));
        assertEquals("MT", map.getMetadata().get("realmCode"));
        assertEquals("en-GB", map.getMetadata().get("languageCode"));
    }

    @Test
    public void testBuild_EmptySectionHasNoPatterns() {
        ExtractionContext context = fixtures.structuredContext(
                PipelineFixtures.read("empty-allergy-section.xml"), "en", "en");

        DocumentMap map = builder.build("hash-2", context.getDom(), 500);

        assertEquals(1, map.getSections().size());
        assertEquals(0, map.getSections().get(0).getEntryCount());
        assertFalse(map.hasPatterns());
        assertEquals(0, map.getPatternCount());
    }
}
