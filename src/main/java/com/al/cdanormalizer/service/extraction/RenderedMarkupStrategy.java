package com.al.cdanormalizer.service.extraction;

import com.al.cdanormalizer.model.ClinicalCategory;
import com.al.cdanormalizer.model.Entry;
import com.al.cdanormalizer.model.ExtractionMethod;
import com.al.cdanormalizer.model.Section;
import com.al.cdanormalizer.service.ResultAssembler;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Last link of the chain for documents that arrive as rendered markup.
 */
@Component
public class RenderedMarkupStrategy implements ExtractionStrategy {

    private final RenderedMarkupParser parser;
    private final ResultAssembler resultAssembler;

    public RenderedMarkupStrategy(RenderedMarkupParser parser, ResultAssembler resultAssembler) {
        this.parser = parser;
        this.resultAssembler = resultAssembler;
    }

    @Override
    public ExtractionMethod method() {
        return ExtractionMethod.RENDERED_MARKUP;
    }

    @Override
    public boolean supports(ExtractionContext context) {
        return context.isRendered();
    }

    @Override
    public List<Section> tryExtract(ExtractionContext context) {
        List<Section> sections = new ArrayList<>();
        for (RenderedMarkupParser.RenderedSection rendered : parser.findSections(context.getHtml())) {
            ClinicalCategory category = ClinicalCategory.resolve(rendered.getCode(), rendered.getTitle());
            List<Entry> entries = parser.readEntries(rendered, category, context);
            sections.add(resultAssembler.buildSection(rendered.getCode(), rendered.getTitle(), category, entries,
                    context));
        }
        return sections;
    }
}
