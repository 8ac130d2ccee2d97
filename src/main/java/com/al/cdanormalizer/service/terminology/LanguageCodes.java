package com.al.cdanormalizer.service.terminology;

import org.apache.commons.lang3.StringUtils;

import java.util.Locale;

/**
 * Language tag helpers.
 */
public final class LanguageCodes {

    private LanguageCodes() {
        throw new UnsupportedOperationException("Utility class - do not instantiate");
    }

    /**
     * Lower-case primary subtag: "pt-PT" and "pt_PT" both become "pt".
     */
    public static String primary(String languageTag) {
        if (StringUtils.isBlank(languageTag)) {
            return "";
        }
        String tag = languageTag.trim().replace('_', '-');
        int dash = tag.indexOf('-');
        return (dash > 0 ? tag.substring(0, dash) : tag).toLowerCase(Locale.ROOT);
    }

    /**
     * Upper-case region subtag, or {@code null}: "pt-PT" becomes "PT".
     */
    public static String region(String languageTag) {
        if (StringUtils.isBlank(languageTag)) {
            return null;
        }
        String tag = languageTag.trim().replace('_', '-');
        int dash = tag.indexOf('-');
        return dash > 0 && dash < tag.length() - 1 ? tag.substring(dash + 1).toUpperCase(Locale.ROOT) : null;
    }

    public static boolean sameLanguage(String left, String right) {
        return !primary(left).isEmpty() && primary(left).equals(primary(right));
    }
}
