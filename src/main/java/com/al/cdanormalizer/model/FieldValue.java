package com.al.cdanormalizer.model;

import lombok.Builder;
import lombok.Value;
import org.apache.commons.lang3.StringUtils;

/**
 * One extracted field. The display value is never empty when the raw value is
 * not: it falls back to the raw value when terminology resolution finds nothing.
 */
@Value
public class FieldValue {

    String raw;
    String display;
    String code;
    String codeSystem;
    String codeSystemName;
    boolean requiresTranslation;
    boolean hasValueSet;

    @Builder
    public FieldValue(String raw, String display, String code, String codeSystem, String codeSystemName,
            boolean requiresTranslation, boolean hasValueSet) {
        this.raw = StringUtils.trimToEmpty(raw);
        this.display = StringUtils.isBlank(display) ? this.raw : display.trim();
        this.code = StringUtils.trimToNull(code);
        this.codeSystem = StringUtils.trimToNull(codeSystem);
        this.codeSystemName = StringUtils.trimToNull(codeSystemName);
        this.requiresTranslation = requiresTranslation;
        this.hasValueSet = hasValueSet;
    }

    public boolean isCoded() {
        return code != null;
    }

    public boolean isEmpty() {
        return raw.isEmpty() && display.isEmpty() && code == null;
    }
}
