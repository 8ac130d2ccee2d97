package com.al.cdanormalizer.util;

import lombok.Value;
import org.apache.commons.lang3.StringUtils;

/**
 * Value read from one document node before terminology resolution.
 */
@Value
public class ExtractedValue {
    String raw;
    String code;
    String codeSystem;

    public static ExtractedValue text(String raw) {
        return new ExtractedValue(StringUtils.trimToNull(raw), null, null);
    }

    public boolean isPresent() {
        return StringUtils.isNotBlank(raw) || StringUtils.isNotBlank(code);
    }
}
