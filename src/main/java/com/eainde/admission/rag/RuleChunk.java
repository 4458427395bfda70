package com.eainde.admission.rag;

import com.eainde.admission.model.Citation;
import dev.langchain4j.data.embedding.Embedding;

/**
 * A span of rulebook text with its citation metadata and, once indexed, its embedding.
 */
public record RuleChunk(
        String id,
        String text,
        int page,
        String section,
        int chunkIndex,
        Embedding embedding
) {
    public RuleChunk withEmbedding(Embedding vector) {
        return new RuleChunk(id, text, page, section, chunkIndex, vector);
    }

    public Citation citation() {
        return new Citation(id, page, section, text);
    }
}
