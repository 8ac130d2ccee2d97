package com.al.cdanormalizer.service.extraction;

import com.al.cdanormalizer.model.ExtractionMethod;
import com.al.cdanormalizer.model.Section;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class CountrySpecificStrategy implements ExtractionStrategy {

    private final CountrySpecificExtractor extractor;

    public CountrySpecificStrategy(CountrySpecificExtractor extractor) {
        this.extractor = extractor;
    }

    @Override
    public ExtractionMethod method() {
        return ExtractionMethod.COUNTRY_SPECIFIC;
    }

    @Override
    public boolean supports(ExtractionContext context) {
        return context.isStructured() && context.getCountryCode() != null;
    }

    @Override
    public List<Section> tryExtract(ExtractionContext context) {
        return extractor.extract(context, context.getCountryCode()).getSections();
    }
}
