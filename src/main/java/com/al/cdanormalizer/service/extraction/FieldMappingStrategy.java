package com.al.cdanormalizer.service.extraction;

import com.al.cdanormalizer.model.ClinicalCategory;
import com.al.cdanormalizer.model.Entry;
import com.al.cdanormalizer.model.ErrorKind;
import com.al.cdanormalizer.model.ExtractionMethod;
import com.al.cdanormalizer.model.Section;
import com.al.cdanormalizer.model.mapping.FieldMappingSchema;
import com.al.cdanormalizer.service.ResultAssembler;
import com.al.cdanormalizer.service.mapping.DeclarativeFieldMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Schema-driven extraction over the sections found by the structural parser,
 * falling back to the structural walk for any section the schema yields nothing for.
 */
@Component
@Slf4j
public class FieldMappingStrategy implements ExtractionStrategy {

    private final GenericStructuralParser structuralParser;
    private final DeclarativeFieldMapper fieldMapper;
    private final FieldMappingSchema schema;
    private final ResultAssembler resultAssembler;

    public FieldMappingStrategy(GenericStructuralParser structuralParser, DeclarativeFieldMapper fieldMapper,
            FieldMappingSchema schema, ResultAssembler resultAssembler) {
        this.structuralParser = structuralParser;
        this.fieldMapper = fieldMapper;
        this.schema = schema;
        this.resultAssembler = resultAssembler;
    }

    @Override
    public ExtractionMethod method() {
        return ExtractionMethod.FIELD_MAPPING;
    }

    @Override
    public boolean supports(ExtractionContext context) {
        return context.isStructured();
    }

    @Override
    public List<Section> tryExtract(ExtractionContext context) {
        List<Section> sections = new ArrayList<>();
        for (SectionNode node : structuralParser.findSections(context.getDom())) {
            ClinicalCategory category = ClinicalCategory.resolve(node.getCode(), node.getTitle());
            List<Entry> entries = fieldMapper.mapSection(node.getElement(), node.getCode(), schema, context);
            if (entries.isEmpty()) {
                entries = structuralParser.walkSection(node, category, context);
                if (!entries.isEmpty()) {
                    log.debug("Section {} extracted structurally", node.getCode());
                } else if (!node.getEntryElements().isEmpty()) {
                    context.recordIssue(ErrorKind.FIELD_EXTRACTION_MISS, node.getCode(),
                            "No field could be read from " + node.getEntryElements().size() + " entries");
                }
            }
            sections.add(resultAssembler.buildSection(node.getCode(), node.getTitle(), category, entries, context));
        }
        return sections;
    }
}
