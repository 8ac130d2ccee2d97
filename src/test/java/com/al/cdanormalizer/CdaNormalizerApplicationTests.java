package com.al.cdanormalizer;

import com.al.cdanormalizer.dto.ProcessingResult;
import com.al.cdanormalizer.model.ExtractionMethod;
import com.al.cdanormalizer.service.ExtractionOrchestrator;
import com.al.cdanormalizer.service.docmap.DocumentMapStore;
import com.al.cdanormalizer.service.docmap.InMemoryDocumentMapStore;
import com.al.cdanormalizer.service.terminology.InMemoryTerminologyCatalogue;
import com.al.cdanormalizer.service.terminology.TerminologyCatalogue;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
public class CdaNormalizerApplicationTests {

    @Autowired
    private ExtractionOrchestrator orchestrator;

    @Autowired
    private TerminologyCatalogue catalogue;

    @Autowired
    private DocumentMapStore documentMapStore;

    @Test
    public void contextLoads() {
        assertInstanceOf(InMemoryTerminologyCatalogue.class, catalogue);
        assertInstanceOf(InMemoryDocumentMapStore.class, documentMapStore);
    }

    @Test
    public void testProcess_WiredPipeline() {
        ProcessingResult result = orchestrator.process(
                PipelineFixtures.read("patient-summary-allergy-medication.xml"), "pt", null);

        assertTrue(result.isSuccess());
        assertEquals(ExtractionMethod.DOCUMENT_MAP, result.getExtractionMethod());
        assertEquals(2, result.getSectionsCount());
    }
}
