package com.al.cdanormalizer.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Extraction knowledge derived from one document and reused for any document
 * with the same content hash.
 */
@Value
@Builder
@Jacksonized
public class DocumentMap {

    String contentHash;
    Instant createdAt;
    @Singular("metadataEntry")
    Map<String, String> metadata;
    @Singular
    List<SectionProfile> sections;

    public boolean hasPatterns() {
        return sections.stream().anyMatch(section -> !section.getPatterns().isEmpty());
    }

    @JsonIgnore
    public int getPatternCount() {
        return sections.stream().mapToInt(section -> section.getPatterns().size()).sum();
    }

    /**
     * Recorded metadata of one section: position among the document's sections,
     * code, title, entry shapes and one path pattern per entry that yielded data.
     */
    @Value
    @Builder
    @Jacksonized
    public static class SectionProfile {
        int sectionIndex;
        String code;
        String title;
        ClinicalCategory category;
        int entryCount;
        @Singular
        List<EntryShape> entryShapes;
        @Singular
        List<EntryPattern> patterns;
    }

    @Value
    @Builder
    @Jacksonized
    public static class EntryPattern {
        int entryIndex;
        EntryShape shape;
        ClinicalCategory category;
        @Singular
        Map<String, String> paths;
    }
}
