package com.al.cdanormalizer;

import com.al.cdanormalizer.config.PipelineProperties;
import com.al.cdanormalizer.config.PipelineProperties.CategoryVariants;
import com.al.cdanormalizer.config.PipelineProperties.CountryProfile;
import com.al.cdanormalizer.model.ClinicalDocument;
import com.al.cdanormalizer.model.mapping.FieldMappingSchema;
import com.al.cdanormalizer.service.ExtractionOrchestrator;
import com.al.cdanormalizer.service.ResultAssembler;
import com.al.cdanormalizer.service.docmap.DocumentMapBuilder;
import com.al.cdanormalizer.service.docmap.DocumentMapService;
import com.al.cdanormalizer.service.docmap.DocumentMapStore;
import com.al.cdanormalizer.service.docmap.DocumentMapStrategy;
import com.al.cdanormalizer.service.docmap.InMemoryDocumentMapStore;
import com.al.cdanormalizer.service.extraction.CountrySpecificExtractor;
import com.al.cdanormalizer.service.extraction.CountrySpecificStrategy;
import com.al.cdanormalizer.service.extraction.ExtractionContext;
import com.al.cdanormalizer.service.extraction.FieldMappingStrategy;
import com.al.cdanormalizer.service.extraction.FieldValueFactory;
import com.al.cdanormalizer.service.extraction.GenericStructuralParser;
import com.al.cdanormalizer.service.extraction.RenderedMarkupParser;
import com.al.cdanormalizer.service.extraction.RenderedMarkupStrategy;
import com.al.cdanormalizer.service.mapping.DeclarativeFieldMapper;
import com.al.cdanormalizer.service.mapping.FieldMappingSchemaLoader;
import com.al.cdanormalizer.service.terminology.InMemoryTerminologyCatalogue;
import com.al.cdanormalizer.service.terminology.MedicalTermTranslator;
import com.al.cdanormalizer.service.terminology.SectionTitleTranslator;
import com.al.cdanormalizer.service.terminology.TerminologyCatalogue;
import com.al.cdanormalizer.service.terminology.TerminologyResolver;
import com.al.cdanormalizer.util.CdaXml;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.DefaultResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Hand-wired pipeline over the shipped catalogue seed and mapping schema, for
 * tests that do not need an application context.
 */
public class PipelineFixtures {

    public final ObjectMapper objectMapper = JsonMapper.builder().findAndAddModules().build();
    public final MeterRegistry meterRegistry = new SimpleMeterRegistry();
    public final PipelineProperties properties = defaultProperties();
    public final TerminologyCatalogue catalogue = InMemoryTerminologyCatalogue.fromResource(
            new ClassPathResource("catalogue/concepts.json"), objectMapper);
    public final TerminologyResolver resolver = new TerminologyResolver(catalogue, meterRegistry);
    public final MedicalTermTranslator termTranslator = new MedicalTermTranslator(catalogue);
    public final SectionTitleTranslator titleTranslator = new SectionTitleTranslator(resolver, termTranslator);
    public final ResultAssembler resultAssembler = new ResultAssembler(titleTranslator);
    public final FieldValueFactory fieldValueFactory = new FieldValueFactory(resolver, termTranslator);
    public final GenericStructuralParser structuralParser = new GenericStructuralParser(fieldValueFactory);
    public final FieldMappingSchema schema = new FieldMappingSchemaLoader(new DefaultResourceLoader(), objectMapper)
            .load(properties.getMappingSchemaLocation());
    public final DocumentMapStore documentMapStore;
    public final DocumentMapService documentMapService;

    public PipelineFixtures() {
        this(new InMemoryDocumentMapStore());
    }

    public PipelineFixtures(DocumentMapStore documentMapStore) {
        this.documentMapStore = documentMapStore;
        this.documentMapService = new DocumentMapService(documentMapStore, new DocumentMapBuilder(structuralParser),
                structuralParser, fieldValueFactory, resultAssembler, meterRegistry);
    }

    public ExtractionOrchestrator orchestrator() {
        CountrySpecificExtractor countryExtractor = new CountrySpecificExtractor(properties, structuralParser,
                fieldValueFactory, resultAssembler);
        return new ExtractionOrchestrator(List.of(
                new RenderedMarkupStrategy(new RenderedMarkupParser(fieldValueFactory), resultAssembler),
                new FieldMappingStrategy(structuralParser, new DeclarativeFieldMapper(fieldValueFactory), schema,
                        resultAssembler),
                new DocumentMapStrategy(documentMapService),
                new CountrySpecificStrategy(countryExtractor)),
                resultAssembler, properties, meterRegistry);
    }

    /**
     * Context for a parsed structured fixture, as the orchestrator would set it up.
     */
    public ExtractionContext structuredContext(String content, String sourceLanguage, String targetLanguage) {
        ClinicalDocument document = ClinicalDocument.of(content);
        return ExtractionContext.builder()
                .document(document)
                .dom(CdaXml.parse(content, document.getContentHash()))
                .sourceLanguage(sourceLanguage)
                .targetLanguage(targetLanguage)
                .maxEntriesPerSection(properties.getMaxEntriesPerSection())
                .build();
    }

    public static String read(String fixture) {
        try (InputStream in = new ClassPathResource("cda/" + fixture).getInputStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Missing fixture " + fixture, e);
        }
    }

    public static PipelineProperties defaultProperties() {
        PipelineProperties properties = new PipelineProperties();
        CountryProfile pt = new CountryProfile();
        pt.setAllergies(variants(List.of("48765-2"), List.of(
                ".//hl7:observation/hl7:participant/hl7:participantRole/hl7:playingEntity/hl7:code",
                ".//hl7:observation/hl7:value")));
        pt.setMedications(variants(List.of("10160-0"), List.of(".//hl7:manufacturedMaterial/hl7:name")));
        pt.setProblems(variants(List.of("11450-4"), List.of(".//hl7:observation/hl7:value")));
        properties.getCountryVariants().put("PT", pt);
        return properties;
    }

    private static CategoryVariants variants(List<String> sectionCodes, List<String> paths) {
        CategoryVariants variants = new CategoryVariants();
        variants.setSectionCodes(sectionCodes);
        variants.setPaths(paths);
        return variants;
    }
}
