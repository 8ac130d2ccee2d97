package com.al.cdanormalizer.model.mapping;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class SectionMapping {
    String title;
    @Singular
    List<String> aliases;
    @Singular
    List<FieldMappingSpec> fields;
}
