package com.al.cdanormalizer.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Persistent form of a {@link DocumentMap}; the map itself is kept as a JSON payload.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "document_maps")
public class DocumentMapRecord {
    @Id
    private String contentHash;
    private String payload;
    private Instant createdAt;
}
