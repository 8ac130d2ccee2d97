package com.al.cdanormalizer.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Display text of a concept in one language.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ConceptTranslation {
    private String languageCode;
    private String translatedDisplay;
}
