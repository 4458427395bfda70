package com.eainde.admission.repository;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryDocumentStore implements DocumentStore {

    private final Map<String, byte[]> blobs = new ConcurrentHashMap<>();

    @Override
    public void put(String documentId, byte[] content) {
        blobs.put(documentId, content.clone());
    }

    @Override
    public Optional<byte[]> get(String documentId) {
        byte[] content = blobs.get(documentId);
        return content == null ? Optional.empty() : Optional.of(content.clone());
    }
}
