package com.al.cdanormalizer.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "value_set_concepts")
@CompoundIndex(def = "{'code': 1, 'codeSystem': 1}", name = "code_system_idx")
public class ValueSetConcept {

    public static final String STATUS_ACTIVE = "active";

    @Id
    private String id;

    private String code;
    private String codeSystem; // OID, e.g. 2.16.840.1.113883.6.96
    private String display;

    @Builder.Default
    private String status = STATUS_ACTIVE;

    @Builder.Default
    private List<ConceptTranslation> translations = new ArrayList<>();

    public boolean isActive() {
        return STATUS_ACTIVE.equalsIgnoreCase(status);
    }
}
