package com.al.cdanormalizer.service.extraction;

import com.al.cdanormalizer.model.FieldLabels;
import com.al.cdanormalizer.model.FieldValue;
import com.al.cdanormalizer.service.terminology.MedicalTermTranslator;
import com.al.cdanormalizer.service.terminology.TerminologyResolver;
import com.al.cdanormalizer.util.CdaDateUtil;
import com.al.cdanormalizer.util.CodeSystems;
import com.al.cdanormalizer.util.ExtractedValue;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * Single place where extracted values become {@link FieldValue}s, so every
 * strategy applies the same resolution, date and translation rules.
 */
@Component
public class FieldValueFactory {

    private final TerminologyResolver resolver;
    private final MedicalTermTranslator termTranslator;

    public FieldValueFactory(TerminologyResolver resolver, MedicalTermTranslator termTranslator) {
        this.resolver = resolver;
        this.termTranslator = termTranslator;
    }

    /**
     * Build a field value.
     *
     * @param label               field label; labels ending in {@code _date} get an ISO display
     * @param value               value read from the document
     * @param requiresTranslation translate free text into the target language
     * @param hasValueSet         resolve the value through the terminology resolver
     * @param defaultCodeSystem   code system assumed when the element carries none
     * @param context             languages of the current run
     * @return the field value, or {@code null} when the value is absent
     */
    public FieldValue create(String label, ExtractedValue value, boolean requiresTranslation, boolean hasValueSet,
            String defaultCodeSystem, ExtractionContext context) {
        if (value == null || !value.isPresent()) {
            return null;
        }
        String raw = StringUtils.isNotBlank(value.getRaw()) ? value.getRaw() : value.getCode();
        String codeSystem = CodeSystems.canonical(
                StringUtils.isNotBlank(value.getCodeSystem()) ? value.getCodeSystem() : defaultCodeSystem);
        String code = value.getCode();

        String display;
        if (hasValueSet) {
            display = resolver.resolve(code, codeSystem, value.getRaw(), context.getTargetLanguage());
        } else if (FieldLabels.isDateLabel(label)) {
            display = CdaDateUtil.toDisplay(raw);
        } else if (requiresTranslation) {
            display = termTranslator.translateMedicalTerms(raw, context.getSourceLanguage(),
                    context.getTargetLanguage());
        } else {
            display = raw;
        }

        return FieldValue.builder()
                .raw(raw)
                .display(display)
                .code(code)
                .codeSystem(code != null ? codeSystem : null)
                .codeSystemName(code != null ? CodeSystems.displayName(codeSystem) : null)
                .requiresTranslation(requiresTranslation)
                .hasValueSet(hasValueSet)
                .build();
    }

    /**
     * Field value for structural walks, where no schema says how to treat the
     * value: coded values are resolved, everything else is translated as text.
     */
    public FieldValue createStructural(String label, ExtractedValue value, ExtractionContext context) {
        if (value == null || !value.isPresent()) {
            return null;
        }
        boolean coded = StringUtils.isNotBlank(value.getCode());
        boolean date = FieldLabels.isDateLabel(label);
        return create(label, value, !coded && !date, coded, null, context);
    }
}
