package com.al.cdanormalizer.service.docmap;

import com.al.cdanormalizer.model.DocumentMap;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public class InMemoryDocumentMapStore implements DocumentMapStore {

    private final ConcurrentMap<String, DocumentMap> maps = new ConcurrentHashMap<>();

    @Override
    public Optional<DocumentMap> get(String contentHash) {
        return Optional.ofNullable(maps.get(contentHash));
    }

    @Override
    public DocumentMap putIfAbsent(String contentHash, DocumentMap map) {
        DocumentMap existing = maps.putIfAbsent(contentHash, map);
        return existing != null ? existing : map;
    }

    public int size() {
        return maps.size();
    }
}
