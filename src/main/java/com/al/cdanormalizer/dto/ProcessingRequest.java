package com.al.cdanormalizer.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Input of one pipeline run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProcessingRequest {

    /**
     * Raw document content (structured or rendered markup)
     */
    private String content;

    /**
     * Language code that display values should be rendered in
     */
    private String targetLanguage;

    /**
     * Optional ISO country code selecting a national dialect profile
     */
    private String countryHint;

    /**
     * Optional language of the document itself; detected when absent
     */
    private String sourceLanguage;
}
