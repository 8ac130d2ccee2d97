package com.al.cdanormalizer.model;

/**
 * Extraction strategies in chain priority order.
 */
public enum ExtractionMethod {
    COUNTRY_SPECIFIC("country-specific"),
    DOCUMENT_MAP("document-map"),
    FIELD_MAPPING("field-mapping"),
    RENDERED_MARKUP("rendered-markup"),
    NONE("none");

    private final String configKey;

    ExtractionMethod(String configKey) {
        this.configKey = configKey;
    }

    /**
     * Key used under {@code cda-pipeline.strategies} to enable or disable the strategy.
     */
    public String getConfigKey() {
        return configKey;
    }
}
