package com.eainde.admission.rag;

/**
 * A chunk returned by a rule index query with its cosine similarity to the query.
 */
public record RetrievedChunk(RuleChunk chunk, double similarity) {}
