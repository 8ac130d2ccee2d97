package com.al.cdanormalizer.config;

import com.al.cdanormalizer.model.ExtractionMethod;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class PipelinePropertiesTest {

    @Test
    public void testStrategyEnabled_DefaultsToTrue() {
        PipelineProperties properties = new PipelineProperties();
        properties.getStrategies().put("field-mapping", false);

        assertTrue(properties.isStrategyEnabled(ExtractionMethod.DOCUMENT_MAP));
        assertFalse(properties.isStrategyEnabled(ExtractionMethod.FIELD_MAPPING));
    }

    @Test
    public void testBind_CountryVariants() {
        Map<String, String> source = new HashMap<>();
        source.put("cda-pipeline.default-language", "pt");
        source.put("cda-pipeline.strategies.country-specific", "false");
        source.put("cda-pipeline.country-variants.PT.allergies.section-codes[0]", "48765-2");
        source.put("cda-pipeline.country-variants.PT.allergies.paths[0]", ".//hl7:observation/hl7:value");

        PipelineProperties properties = new Binder(new MapConfigurationPropertySource(source))
                .bind("cda-pipeline", PipelineProperties.class)
                .get();

        assertEquals("pt", properties.getDefaultLanguage());
        assertFalse(properties.isStrategyEnabled(ExtractionMethod.COUNTRY_SPECIFIC));
        PipelineProperties.CountryProfile profile = properties.countryProfile("pt");
        assertNotNull(profile);
        assertEquals("48765-2", profile.getAllergies().getSectionCodes().get(0));
        assertTrue(profile.getMedications().getPaths().isEmpty());
        assertNull(properties.countryProfile("ZZ"));
        assertNull(properties.countryProfile(null));
    }
}
