package com.al.cdanormalizer.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * A titled, optionally coded group of entries. Immutable once assembled.
 */
@Value
public class Section {

    String code;
    ClinicalCategory category;
    SectionTitle title;
    List<Entry> entries;

    @Builder
    public Section(String code, ClinicalCategory category, SectionTitle title, List<Entry> entries) {
        this.code = code;
        this.category = category != null ? category : ClinicalCategory.GENERIC;
        this.title = title;
        this.entries = entries != null ? List.copyOf(entries) : List.of();
    }

    public boolean isCoded() {
        return code != null && !code.isBlank();
    }

    public int getEntryCount() {
        return entries.size();
    }
}
