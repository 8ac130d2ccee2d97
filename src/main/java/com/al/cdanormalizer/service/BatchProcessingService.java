package com.al.cdanormalizer.service;

import com.al.cdanormalizer.dto.BatchProcessingResponse;
import com.al.cdanormalizer.dto.ProcessingIssue;
import com.al.cdanormalizer.dto.ProcessingRequest;
import com.al.cdanormalizer.dto.ProcessingResult;
import com.al.cdanormalizer.model.ErrorKind;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Service for batch processing with parallel workers.
 *
 * <p>
 * Each document runs through {@link ExtractionOrchestrator} on a fixed thread
 * pool. Results come back in input order; a worker that throws is reported as
 * a failed result for its document only.
 *
 * @author CDA Normalizer Team
 * @version 1.0.0
 * @since 1.0.0
 */
@Service
@Slf4j
public class BatchProcessingService {

    private final ExtractionOrchestrator orchestrator;
    private final ExecutorService executorService;

    @Autowired
    public BatchProcessingService(ExtractionOrchestrator orchestrator) {
        this(orchestrator, Math.max(4, Runtime.getRuntime().availableProcessors()));
    }

    BatchProcessingService(ExtractionOrchestrator orchestrator, int threadPoolSize) {
        this.orchestrator = orchestrator;
        this.executorService = Executors.newFixedThreadPool(threadPoolSize);
        log.info("BatchProcessingService initialized with {} threads", threadPoolSize);
    }

    /**
     * Process multiple documents in parallel.
     *
     * @param requests documents to process
     * @return one result per request, in request order
     */
    public BatchProcessingResponse processBatch(List<ProcessingRequest> requests) {
        long startTime = System.currentTimeMillis();
        log.info("Starting batch processing: {} documents", requests.size());

        List<CompletableFuture<ProcessingResult>> futures = new ArrayList<>();
        for (int i = 0; i < requests.size(); i++) {
            final int index = i;
            final ProcessingRequest request = requests.get(i);
            CompletableFuture<ProcessingResult> future = CompletableFuture
                    .supplyAsync(() -> orchestrator.process(request), executorService)
                    .exceptionally(e -> workerFailure(index, e));
            futures.add(future);
        }

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        BatchProcessingResponse response = new BatchProcessingResponse();
        response.setTotalDocuments(requests.size());
        for (CompletableFuture<ProcessingResult> future : futures) {
            ProcessingResult result = future.join();
            response.getResults().add(result);
            if (result.isSuccess()) {
                response.setSuccessCount(response.getSuccessCount() + 1);
            } else {
                response.setFailureCount(response.getFailureCount() + 1);
            }
        }
        response.setProcessingTimeMs(System.currentTimeMillis() - startTime);

        log.info("Batch processing completed: {} success, {} failures, {}ms total",
                response.getSuccessCount(), response.getFailureCount(), response.getProcessingTimeMs());
        return response;
    }

    private ProcessingResult workerFailure(int index, Throwable e) {
        Throwable cause = e.getCause() != null ? e.getCause() : e;
        log.error("Failed to process document at index {}: {}", index, cause.getMessage());
        String description = "Processing failed: " + cause.getMessage();
        return ProcessingResult.failure(description,
                List.of(ProcessingIssue.fatal(ErrorKind.STRATEGY_FAILED, description)));
    }

    @PreDestroy
    public void shutdown() {
        executorService.shutdown();
    }
}
