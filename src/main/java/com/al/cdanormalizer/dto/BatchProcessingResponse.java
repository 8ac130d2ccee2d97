package com.al.cdanormalizer.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Response DTO for batch processing.
 *
 * @author CDA Normalizer Team
 * @version 1.0.0
 * @since 1.0.0
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BatchProcessingResponse {

    /**
     * Total number of documents in the batch.
     */
    private int totalDocuments;

    /**
     * Number of documents whose result reports success.
     */
    private int successCount;

    /**
     * Number of documents that failed (malformed or worker error).
     */
    private int failureCount;

    /**
     * One result per input document, in input order.
     */
    private List<ProcessingResult> results = new ArrayList<>();

    /**
     * Total processing time in milliseconds.
     */
    private long processingTimeMs;
}
