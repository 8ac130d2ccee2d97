package com.al.cdanormalizer.service;

import com.al.cdanormalizer.PipelineFixtures;
import com.al.cdanormalizer.dto.BatchProcessingResponse;
import com.al.cdanormalizer.dto.ProcessingRequest;
import com.al.cdanormalizer.dto.ProcessingResult;
import com.al.cdanormalizer.model.ErrorKind;
import com.al.cdanormalizer.model.ExtractionMethod;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class BatchProcessingServiceTest {

    @Mock
    private ExtractionOrchestrator mockOrchestrator;

    private BatchProcessingService batchService;

    @AfterEach
    public void tearDown() {
        if (batchService != null) {
            batchService.shutdown();
        }
    }

    @Test
    public void testProcessBatch_PreservesInputOrder() {
        batchService = new BatchProcessingService(new PipelineFixtures().orchestrator(), 4);
        List<ProcessingRequest> requests = new ArrayList<>();
        requests.add(request(PipelineFixtures.read("patient-summary-allergy-medication.xml")));
        requests.add(request("not a document"));
        requests.add(request(PipelineFixtures.read("rendered-summary.html")));
        requests.add(request(PipelineFixtures.read("narrative-problem-table.xml")));
        requests.add(request(PipelineFixtures.read("patient-summary-allergy-medication.xml")));

        BatchProcessingResponse response = batchService.processBatch(requests);

        assertEquals(5, response.getTotalDocuments());
        assertEquals(4, response.getSuccessCount());
        assertEquals(1, response.getFailureCount());
        assertEquals(ExtractionMethod.DOCUMENT_MAP, response.getResults().get(0).getExtractionMethod());
        assertFalse(response.getResults().get(1).isSuccess());
        assertEquals(ExtractionMethod.RENDERED_MARKUP, response.getResults().get(2).getExtractionMethod());
        assertEquals(response.getResults().get(0).getSections(), response.getResults().get(4).getSections());
    }

    @Test
    public void testProcessBatch_WorkerFailureIsolated() {
        batchService = new BatchProcessingService(mockOrchestrator, 2);
        ProcessingRequest good = request("<html><body><p>ok</p></body></html>");
        ProcessingRequest bad = request("<html><body><p>bad</p></body></html>");
        when(mockOrchestrator.process(good)).thenReturn(ProcessingResult.builder().success(true).build());
        when(mockOrchestrator.process(bad)).thenThrow(new IllegalStateException("worker crashed"));

        BatchProcessingResponse response = batchService.processBatch(List.of(good, bad));

        assertEquals(1, response.getSuccessCount());
        assertEquals(1, response.getFailureCount());
        ProcessingResult failed = response.getResults().get(1);
        assertFalse(failed.isSuccess());
        assertTrue(failed.getErrorDescription().contains("worker crashed"));
        assertEquals(ErrorKind.STRATEGY_FAILED, failed.getIssues().get(0).getKind());
        verify(mockOrchestrator, times(2)).process(any(ProcessingRequest.class));
    }

    @Test
    public void testProcessBatch_Empty() {
        batchService = new BatchProcessingService(mockOrchestrator, 2);

        BatchProcessingResponse response = batchService.processBatch(List.of());

        assertEquals(0, response.getTotalDocuments());
        assertTrue(response.getResults().isEmpty());
        verify(mockOrchestrator, never()).process(any(ProcessingRequest.class));
    }

    private static ProcessingRequest request(String content) {
        return ProcessingRequest.builder().content(content).targetLanguage("en").build();
    }
}
