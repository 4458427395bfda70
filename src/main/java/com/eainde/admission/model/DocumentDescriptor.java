package com.eainde.admission.model;

/**
 * Metadata of one uploaded document. The bytes live in the document store under {@code documentId}.
 */
public record DocumentDescriptor(
        String documentId,
        String filename,
        String contentType,
        long sizeBytes
) {}
