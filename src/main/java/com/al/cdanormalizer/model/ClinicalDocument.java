package com.al.cdanormalizer.model;

import lombok.Value;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Raw document as received, with its sniffed content kind and content hash.
 */
@Value
public class ClinicalDocument {

    private static final Pattern MARKUP_TAG = Pattern.compile("<\\s*[A-Za-z!/?][^<>]*>");

    String content;
    ContentKind kind;
    String contentHash;

    public static ClinicalDocument of(String content) {
        String safe = content != null ? content : "";
        return new ClinicalDocument(safe, classify(safe), hash(safe));
    }

    /**
     * Structured markup is recognised by an XML declaration or a ClinicalDocument
     * root; rendered markup by html/body tags. Anything else that still carries
     * markup tags is treated as rendered markup.
     */
    static ContentKind classify(String content) {
        String trimmed = content.strip();
        if (trimmed.isEmpty()) {
            return ContentKind.UNKNOWN;
        }
        String lower = trimmed.toLowerCase(Locale.ROOT);
        if (trimmed.startsWith("<?xml") || trimmed.contains("<ClinicalDocument")) {
            return ContentKind.STRUCTURED_MARKUP;
        }
        if (lower.contains("<html") || lower.contains("<body")) {
            return ContentKind.RENDERED_MARKUP;
        }
        return MARKUP_TAG.matcher(trimmed).find() ? ContentKind.RENDERED_MARKUP : ContentKind.UNKNOWN;
    }

    static String hash(String content) {
        return DigestUtils.md5DigestAsHex(content.getBytes(StandardCharsets.UTF_8));
    }
}
