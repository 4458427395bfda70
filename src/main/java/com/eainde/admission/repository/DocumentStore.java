package com.eainde.admission.repository;

import java.util.Optional;

/**
 * Keyed blob store for uploaded document bytes.
 */
public interface DocumentStore {

    void put(String documentId, byte[] content);

    Optional<byte[]> get(String documentId);
}
