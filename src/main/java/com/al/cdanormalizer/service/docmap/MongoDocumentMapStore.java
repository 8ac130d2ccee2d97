package com.al.cdanormalizer.service.docmap;

import com.al.cdanormalizer.exception.DocumentMapStoreException;
import com.al.cdanormalizer.model.DocumentMap;
import com.al.cdanormalizer.model.DocumentMapRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.util.Optional;

/**
 * Document maps in the {@code document_maps} collection. The content hash is the
 * document id, so a concurrent second insert fails on the key and yields to the
 * map already stored.
 */
@Slf4j
public class MongoDocumentMapStore implements DocumentMapStore {

    private final MongoTemplate mongoTemplate;
    private final ObjectMapper objectMapper;

    public MongoDocumentMapStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper) {
        this.mongoTemplate = mongoTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<DocumentMap> get(String contentHash) {
        DocumentMapRecord stored;
        try {
            stored = mongoTemplate.findById(contentHash, DocumentMapRecord.class);
        } catch (DataAccessException e) {
            throw new DocumentMapStoreException("Failed to read document map " + contentHash, e);
        }
        return Optional.ofNullable(stored).map(this::fromRecord);
    }

    @Override
    public DocumentMap putIfAbsent(String contentHash, DocumentMap map) {
        try {
            mongoTemplate.insert(new DocumentMapRecord(contentHash, toJson(map), map.getCreatedAt()));
            return map;
        } catch (DuplicateKeyException e) {
            log.debug("Document map {} already stored by another worker", contentHash);
            return get(contentHash).orElse(map);
        } catch (DataAccessException e) {
            throw new DocumentMapStoreException("Failed to store document map " + contentHash, e);
        }
    }

    private String toJson(DocumentMap map) {
        try {
            return objectMapper.writeValueAsString(map);
        } catch (JsonProcessingException e) {
            throw new DocumentMapStoreException("Document map " + map.getContentHash() + " is not serializable", e);
        }
    }

    private DocumentMap fromRecord(DocumentMapRecord stored) {
        try {
            return objectMapper.readValue(stored.getPayload(), DocumentMap.class);
        } catch (JsonProcessingException e) {
            throw new DocumentMapStoreException("Stored document map " + stored.getContentHash()
                    + " cannot be read", e);
        }
    }
}
