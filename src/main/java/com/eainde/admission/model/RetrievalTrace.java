package com.eainde.admission.model;

import java.util.List;

/**
 * The rule index query issued while deciding an application and the chunk ids it returned.
 */
public record RetrievalTrace(String query, List<String> chunkIds) {

    public RetrievalTrace {
        chunkIds = chunkIds == null ? List.of() : List.copyOf(chunkIds);
    }

    public boolean contains(String chunkId) {
        return chunkIds.contains(chunkId);
    }
}
