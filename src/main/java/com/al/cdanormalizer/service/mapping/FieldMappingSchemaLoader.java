package com.al.cdanormalizer.service.mapping;

import com.al.cdanormalizer.exception.MappingSchemaException;
import com.al.cdanormalizer.model.mapping.FieldMappingSchema;
import com.al.cdanormalizer.model.mapping.FieldMappingSpec;
import com.al.cdanormalizer.model.mapping.SectionMapping;
import com.al.cdanormalizer.util.CdaXml;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Loads and validates the field mapping schema. Every path is compiled up
 * front so a broken schema fails at startup rather than per document.
 */
@Component
@Slf4j
public class FieldMappingSchemaLoader {

    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;

    public FieldMappingSchemaLoader(ResourceLoader resourceLoader, ObjectMapper objectMapper) {
        this.resourceLoader = resourceLoader;
        this.objectMapper = objectMapper;
    }

    public FieldMappingSchema load(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new MappingSchemaException("Field mapping schema not found: " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            return validate(objectMapper.readValue(in, SchemaDocument.class).toSchema(), location);
        } catch (IOException e) {
            throw new MappingSchemaException("Field mapping schema could not be read: " + location, e);
        }
    }

    FieldMappingSchema validate(FieldMappingSchema schema, String location) {
        if (StringUtils.isBlank(schema.getVersion())) {
            throw new MappingSchemaException("Field mapping schema has no version: " + location);
        }
        int fields = validateSections(schema.getSections(), location);
        for (Map<String, SectionMapping> override : schema.getCountryOverrides().values()) {
            fields += validateSections(override, location);
        }
        log.info("Loaded field mapping schema {} from {}: {} section codes, {} country overrides, {} fields",
                schema.getVersion(), location, schema.getSections().size(), schema.getCountryOverrides().size(),
                fields);
        return schema;
    }

    private int validateSections(Map<String, SectionMapping> sections, String location) {
        int count = 0;
        for (Map.Entry<String, SectionMapping> section : sections.entrySet()) {
            Set<String> labels = new HashSet<>();
            for (FieldMappingSpec spec : section.getValue().getFields()) {
                if (StringUtils.isAnyBlank(spec.getLabel(), spec.getPath())) {
                    throw new MappingSchemaException("Field without label or path in section "
                            + section.getKey() + " of " + location);
                }
                if (!labels.add(spec.getLabel())) {
                    throw new MappingSchemaException("Duplicate label '" + spec.getLabel() + "' in section "
                            + section.getKey() + " of " + location);
                }
                try {
                    CdaXml.compile(spec.getPath());
                } catch (IllegalArgumentException e) {
                    throw new MappingSchemaException("Invalid path for '" + spec.getLabel() + "' in section "
                            + section.getKey() + ": " + spec.getPath(), e);
                }
                count++;
            }
        }
        return count;
    }

    /**
     * JSON shape of the schema file.
     */
    @Data
    static class SchemaDocument {
        private String version;
        private Map<String, SectionMapping> sections;
        private Map<String, Map<String, SectionMapping>> countryOverrides;

        FieldMappingSchema toSchema() {
            return new FieldMappingSchema(version, sections, countryOverrides);
        }
    }
}
