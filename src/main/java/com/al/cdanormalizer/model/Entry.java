package com.al.cdanormalizer.model;

import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One clinical fact inside a section, keyed by field label.
 */
@Value
public class Entry {

    ClinicalCategory category;
    Map<String, FieldValue> fields;

    public Entry(ClinicalCategory category, Map<String, FieldValue> fields) {
        this.category = category;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public FieldValue field(String label) {
        return fields.get(label);
    }

    /**
     * Display value of a field, or {@code null} when the entry has no such field.
     */
    public String display(String label) {
        FieldValue value = fields.get(label);
        return value != null ? value.getDisplay() : null;
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }
}
