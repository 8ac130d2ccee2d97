package com.al.cdanormalizer.service.docmap;

import com.al.cdanormalizer.model.DocumentMap;

import java.util.Optional;

/**
 * Key-value persistence of document maps, keyed by content hash.
 */
public interface DocumentMapStore {

    /**
     * @throws com.al.cdanormalizer.exception.DocumentMapStoreException when the store is unreachable
     */
    Optional<DocumentMap> get(String contentHash);

    /**
     * Store the map unless one already exists for the hash.
     *
     * @return the stored map: the given one, or the one that was already there
     * @throws com.al.cdanormalizer.exception.DocumentMapStoreException when the store is unreachable
     */
    DocumentMap putIfAbsent(String contentHash, DocumentMap map);
}
