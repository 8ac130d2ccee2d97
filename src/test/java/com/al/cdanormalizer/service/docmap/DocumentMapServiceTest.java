package com.al.cdanormalizer.service.docmap;

import com.al.cdanormalizer.PipelineFixtures;
import com.al.cdanormalizer.exception.DocumentMapStoreException;
import com.al.cdanormalizer.model.DocumentMap;
import com.al.cdanormalizer.model.ErrorKind;
import com.al.cdanormalizer.model.FieldLabels;
import com.al.cdanormalizer.model.Section;
import com.al.cdanormalizer.service.extraction.ExtractionContext;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

public class DocumentMapServiceTest {

    private static final String SUMMARY = PipelineFixtures.read("patient-summary-allergy-medication.xml");

    @Test
    public void testBuildOrLoad_BuildsOnceThenReuses() {
        PipelineFixtures fixtures = new PipelineFixtures();
        InMemoryDocumentMapStore store = (InMemoryDocumentMapStore) fixtures.documentMapStore;

        DocumentMap cold = fixtures.documentMapService.buildOrLoad(fixtures.structuredContext(SUMMARY, "en", "en"));
        DocumentMap warm = fixtures.documentMapService.buildOrLoad(fixtures.structuredContext(SUMMARY, "en", "en"));

        assertSame(cold, warm);
        assertEquals(1, store.size());
        assertEquals(1.0, fixtures.meterRegistry.counter("cda.document_map.cache", "result", "miss").count());
        assertEquals(1.0, fixtures.meterRegistry.counter("cda.document_map.cache", "result", "hit").count());
    }

    @Test
    public void testBuildOrLoad_ConcurrentWorkersBuildOnce() throws Exception {
        PipelineFixtures fixtures = new PipelineFixtures();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<DocumentMap>> tasks = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                tasks.add(() -> fixtures.documentMapService.buildOrLoad(
                        fixtures.structuredContext(SUMMARY, "en", "en")));
            }
            List<Future<DocumentMap>> results = pool.invokeAll(tasks);

            DocumentMap first = results.get(0).get();
            for (Future<DocumentMap> result : results) {
                assertSame(first, result.get());
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(1.0, fixtures.meterRegistry.counter("cda.document_map.cache", "result", "miss").count());
    }

    @Test
    public void testExtractUsingMap_ReplaysPatterns() {
        PipelineFixtures fixtures = new PipelineFixtures();
        ExtractionContext context = fixtures.structuredContext(SUMMARY, "en", "en");
        DocumentMap map = fixtures.documentMapService.buildOrLoad(context);

        List<Section> sections = fixtures.documentMapService.extractUsingMap(map, context);

        assertEquals(2, sections.size());
        assertEquals("Penicillin", sections.get(0).getEntries().get(0).display(FieldLabels.AGENT_DISPLAY));
        assertEquals("Amoxicillin 500 mg tablets",
                sections.get(1).getEntries().get(0).field(FieldLabels.MEDICATION_DISPLAY).getRaw());
        assertTrue(context.getIssues().stream()
                .noneMatch(issue -> issue.getKind() == ErrorKind.FIELD_EXTRACTION_MISS));
    }

    @Test
    public void testExtractUsingMap_DriftYieldsEmptySections() {
        PipelineFixtures fixtures = new PipelineFixtures();
        DocumentMap map = fixtures.documentMapService.buildOrLoad(fixtures.structuredContext(SUMMARY, "en", "en"));
        ExtractionContext other = fixtures.structuredContext(
                PipelineFixtures.read("narrative-problem-table.xml"), "en", "en");

        List<Section> sections = fixtures.documentMapService.extractUsingMap(map, other);

        assertEquals(2, sections.size());
        assertEquals("48765-2", sections.get(0).getCode());
        assertTrue(sections.get(0).getEntries().isEmpty());
        assertTrue(sections.get(1).getEntries().isEmpty());
        assertTrue(other.getIssues().stream()
                .anyMatch(issue -> issue.getKind() == ErrorKind.FIELD_EXTRACTION_MISS));
    }

    @Test
    public void testBuildOrLoad_StoreUnavailable() {
        DocumentMapStore failing = mock(DocumentMapStore.class);
        when(failing.get(anyString())).thenThrow(new DocumentMapStoreException("Failed to read document map",
                new IllegalStateException("connection refused")));
        PipelineFixtures fixtures = new PipelineFixtures(failing);
        ExtractionContext context = fixtures.structuredContext(SUMMARY, "en", "en");

        DocumentMap map = fixtures.documentMapService.buildOrLoad(context);

        assertTrue(map.hasPatterns());
        assertEquals(ErrorKind.CACHE_UNAVAILABLE, context.getIssues().get(0).getKind());
        verify(failing, never()).putIfAbsent(anyString(), any());
    }
}
