package com.al.cdanormalizer.config;

import com.al.cdanormalizer.model.mapping.FieldMappingSchema;
import com.al.cdanormalizer.repository.ValueSetConceptRepository;
import com.al.cdanormalizer.service.docmap.DocumentMapStore;
import com.al.cdanormalizer.service.docmap.InMemoryDocumentMapStore;
import com.al.cdanormalizer.service.docmap.MongoDocumentMapStore;
import com.al.cdanormalizer.service.mapping.FieldMappingSchemaLoader;
import com.al.cdanormalizer.service.terminology.InMemoryTerminologyCatalogue;
import com.al.cdanormalizer.service.terminology.MongoTerminologyCatalogue;
import com.al.cdanormalizer.service.terminology.TerminologyCatalogue;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;
import org.springframework.data.mongodb.core.MongoTemplate;

/**
 * Wiring of the pipeline's collaborators. The terminology catalogue and the
 * document-map store are selected by property; both default to in-memory.
 */
@Configuration
public class PipelineConfig {

    /**
     * Field mapping schema, loaded once at startup and shared read-only.
     */
    @Bean
    public FieldMappingSchema fieldMappingSchema(FieldMappingSchemaLoader loader, PipelineProperties properties) {
        return loader.load(properties.getMappingSchemaLocation());
    }

    @Bean
    @ConditionalOnProperty(name = "cda-pipeline.catalogue.store", havingValue = "mongo")
    public TerminologyCatalogue mongoTerminologyCatalogue(ValueSetConceptRepository repository) {
        return new MongoTerminologyCatalogue(repository);
    }

    @Bean
    @ConditionalOnProperty(name = "cda-pipeline.catalogue.store", havingValue = "memory", matchIfMissing = true)
    public TerminologyCatalogue inMemoryTerminologyCatalogue(PipelineProperties properties,
            ResourceLoader resourceLoader, ObjectMapper objectMapper) {
        String seed = properties.getCatalogue().getSeedLocation();
        return InMemoryTerminologyCatalogue.fromResource(seed != null ? resourceLoader.getResource(seed) : null,
                objectMapper);
    }

    @Bean
    @ConditionalOnProperty(name = "cda-pipeline.document-maps.store", havingValue = "mongo")
    public DocumentMapStore mongoDocumentMapStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper) {
        return new MongoDocumentMapStore(mongoTemplate, objectMapper);
    }

    @Bean
    @ConditionalOnProperty(name = "cda-pipeline.document-maps.store", havingValue = "memory", matchIfMissing = true)
    public DocumentMapStore inMemoryDocumentMapStore() {
        return new InMemoryDocumentMapStore();
    }
}
