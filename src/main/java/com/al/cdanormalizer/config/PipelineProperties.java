package com.al.cdanormalizer.config;

import com.al.cdanormalizer.model.ExtractionMethod;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Configuration properties for the extraction pipeline.
 * Loaded from application.yml under {@code cda-pipeline}.
 */
@Configuration
@ConfigurationProperties(prefix = "cda-pipeline")
@Data
public class PipelineProperties {

    /**
     * Display language used when a request does not name one
     */
    private String defaultLanguage = "en";

    /**
     * Location of the field mapping schema
     */
    private String mappingSchemaLocation = "classpath:mappings/cda-field-mappings.json";

    /**
     * Upper bound on entries read from a single section
     */
    private int maxEntriesPerSection = 500;

    /**
     * Derive a country hint from the document header when the request has none
     */
    private boolean detectCountry = false;

    /**
     * Strategy enable/disable flags, keyed by strategy name
     */
    private Map<String, Boolean> strategies = new HashMap<>();

    /**
     * Terminology catalogue backing store
     */
    private StoreSettings catalogue = new StoreSettings();

    /**
     * Document-map cache backing store
     */
    private StoreSettings documentMaps = new StoreSettings();

    /**
     * National dialect profiles, keyed by ISO country code
     */
    private Map<String, CountryProfile> countryVariants = new HashMap<>();

    /**
     * Check if a specific strategy is enabled. Unlisted strategies are enabled.
     */
    public boolean isStrategyEnabled(ExtractionMethod method) {
        return strategies.getOrDefault(method.getConfigKey(), true);
    }

    public CountryProfile countryProfile(String countryCode) {
        if (countryCode == null) {
            return null;
        }
        CountryProfile profile = countryVariants.get(countryCode.toUpperCase(Locale.ROOT));
        return profile != null ? profile : countryVariants.get(countryCode.toLowerCase(Locale.ROOT));
    }

    @Data
    public static class StoreSettings {
        /** memory or mongo */
        private String store = "memory";
        private String seedLocation;
    }

    @Data
    public static class CountryProfile {
        private CategoryVariants allergies = new CategoryVariants();
        private CategoryVariants medications = new CategoryVariants();
        private CategoryVariants problems = new CategoryVariants();
    }

    /**
     * Section codes of one category and the ordered path variants for its
     * required field; the first variant that yields a value wins.
     */
    @Data
    public static class CategoryVariants {
        private List<String> sectionCodes = new ArrayList<>();
        private List<String> paths = new ArrayList<>();
    }
}
