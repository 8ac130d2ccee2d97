package com.al.cdanormalizer.model;

import lombok.Value;

@Value
public class SectionTitle {
    String original;
    String translated;

    public static SectionTitle untranslated(String original) {
        return new SectionTitle(original, original);
    }
}
