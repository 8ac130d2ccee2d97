package com.al.cdanormalizer.service.mapping;

import com.al.cdanormalizer.exception.MappingSchemaException;
import com.al.cdanormalizer.model.mapping.FieldMappingSchema;
import com.al.cdanormalizer.model.mapping.FieldMappingSpec;
import com.al.cdanormalizer.model.mapping.SectionMapping;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class FieldMappingSchemaLoaderTest {

    private final FieldMappingSchemaLoader loader = new FieldMappingSchemaLoader(new DefaultResourceLoader(),
            new ObjectMapper());

    @Test
    public void testLoadShippedSchema() {
        FieldMappingSchema schema = loader.load("classpath:mappings/cda-field-mappings.json");

        assertEquals("1.2.0", schema.getVersion());
        assertEquals(schema.fieldsFor("48765-2", null), schema.fieldsFor("10155-0", null),
                "aliases share the mapping of their section");
        assertTrue(schema.fieldsFor("29762-2", null).isEmpty());
        assertEquals("agent_display", schema.fieldsFor("48765-2", null).get(0).getLabel());
        assertEquals(schema.fieldsFor("10160-0", null), schema.fieldsFor("29549-3", null));
    }

    @Test
    public void testCountryOverride() {
        FieldMappingSchema schema = loader.load("classpath:mappings/cda-field-mappings.json");

        List<FieldMappingSpec> portuguese = schema.fieldsFor("48765-2", "pt");

        assertEquals(2, portuguese.size());
        assertNotEquals(schema.fieldsFor("48765-2", null), portuguese);
        assertEquals(schema.fieldsFor("10160-0", null), schema.fieldsFor("10160-0", "PT"));
    }

    @Test
    public void testMissingSchema() {
        assertThrows(MappingSchemaException.class, () -> loader.load("classpath:mappings/absent.json"));
    }

    @Test
    public void testInvalidPathRejected() {
        MappingSchemaException e = assertThrows(MappingSchemaException.class,
                () -> loader.load("classpath:mappings/broken-path.json"));
        assertTrue(e.getMessage().contains("agent_display"));
    }

    @Test
    public void testDuplicateLabelRejected() {
        FieldMappingSpec spec = FieldMappingSpec.builder().label("status").path(".//hl7:statusCode/@code").build();
        SectionMapping section = SectionMapping.builder().title("Problems").field(spec).field(spec).build();
        FieldMappingSchema schema = new FieldMappingSchema("1", Map.of("11450-4", section), null);

        assertThrows(MappingSchemaException.class, () -> loader.validate(schema, "inline"));
    }

    @Test
    public void testVersionRequired() {
        FieldMappingSchema schema = new FieldMappingSchema(" ", Map.of(), Map.of());

        assertThrows(MappingSchemaException.class, () -> loader.validate(schema, "inline"));
    }
}
