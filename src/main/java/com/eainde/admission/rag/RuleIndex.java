package com.eainde.admission.rag;

import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.store.embedding.CosineSimilarity;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import lombok.extern.log4j.Log4j2;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Vector index over rulebook chunks.
 *
 * <p>The active index is an immutable {@link Snapshot}. Queries read the snapshot once and
 * work on it to completion; {@link #rebuild(List)} and {@link #restore(List, String, Instant)}
 * build a complete new snapshot and swap it in atomically, so in-flight queries are never
 * affected by a rebuild.</p>
 */
@Log4j2
public class RuleIndex {

    static final String PAGE = "page";
    static final String SECTION = "section";
    static final String CHUNK_INDEX = "chunk_index";

    private final EmbeddingModel embeddingModel;
    private final RulebookChunker chunker;
    private final Clock clock;
    private final AtomicReference<Snapshot> active = new AtomicReference<>(Snapshot.EMPTY);

    public RuleIndex(EmbeddingModel embeddingModel, RulebookChunker chunker, Clock clock) {
        this.embeddingModel = embeddingModel;
        this.chunker = chunker;
        this.clock = clock;
    }

    /**
     * Chunks and embeds the given pages and activates the result.
     */
    public RuleIndexStatus rebuild(List<RulebookPage> pages) {
        List<RuleChunk> drafts = chunker.chunk(pages);
        if (drafts.isEmpty()) {
            throw new IllegalArgumentException("Rulebook produced no chunks");
        }
        List<TextSegment> segments = drafts.stream().map(RuleIndex::toSegment).collect(Collectors.toList());
        List<Embedding> embeddings = embeddingModel.embedAll(segments).content();

        List<RuleChunk> embedded = new ArrayList<>(drafts.size());
        for (int i = 0; i < drafts.size(); i++) {
            embedded.add(drafts.get(i).withEmbedding(embeddings.get(i)));
        }
        return restore(embedded, UUID.randomUUID().toString(), clock.instant());
    }

    /**
     * Activates already embedded chunks, e.g. read back from a persisted index.
     */
    public RuleIndexStatus restore(List<RuleChunk> chunks, String buildId, Instant builtAt) {
        Snapshot snapshot = Snapshot.of(chunks, buildId, builtAt, dimension());
        Snapshot previous = active.getAndSet(snapshot);
        log.info("Rule index {} activated with {} chunks (replaced {})",
                buildId, chunks.size(), previous.buildId() == null ? "nothing" : previous.buildId());
        return snapshot.status();
    }

    /**
     * Returns the {@code k} chunks most similar to {@code text}, best first.
     *
     * @throws IllegalStateException if no index has been built yet
     */
    public List<RetrievedChunk> query(String text, int k) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Query text must not be blank");
        }
        if (k <= 0) {
            throw new IllegalArgumentException("k must be > 0");
        }
        Snapshot snapshot = current();
        if (!snapshot.isReady()) {
            throw new IllegalStateException("Rule index not initialized");
        }
        Embedding queryEmbedding = embeddingModel.embed(text).content();
        return snapshot.search(queryEmbedding, k);
    }

    public Snapshot current() {
        return active.get();
    }

    public RuleIndexStatus status() {
        return current().status();
    }

    /**
     * Vector length of the embedding model; restored chunks must match it.
     */
    public int dimension() {
        return embeddingModel.dimension();
    }

    public Embedding embed(String text) {
        return embeddingModel.embed(text).content();
    }

    private static TextSegment toSegment(RuleChunk chunk) {
        Metadata metadata = new Metadata();
        metadata.put(PAGE, chunk.page());
        metadata.put(CHUNK_INDEX, chunk.chunkIndex());
        if (chunk.section() != null) {
            metadata.put(SECTION, chunk.section());
        }
        return TextSegment.from(chunk.text(), metadata);
    }

    /**
     * One immutable generation of the index.
     */
    public static final class Snapshot {

        static final Snapshot EMPTY = new Snapshot(null, null, new InMemoryEmbeddingStore<>(), Map.of());

        private final String buildId;
        private final Instant builtAt;
        private final InMemoryEmbeddingStore<TextSegment> store;
        private final Map<String, RuleChunk> chunks;

        private Snapshot(String buildId, Instant builtAt,
                         InMemoryEmbeddingStore<TextSegment> store, Map<String, RuleChunk> chunks) {
            this.buildId = buildId;
            this.builtAt = builtAt;
            this.store = store;
            this.chunks = chunks;
        }

        static Snapshot of(List<RuleChunk> chunks, String buildId, Instant builtAt, int dimension) {
            InMemoryEmbeddingStore<TextSegment> store = new InMemoryEmbeddingStore<>();
            Map<String, RuleChunk> byId = new LinkedHashMap<>();
            for (RuleChunk chunk : chunks) {
                if (chunk.embedding() == null) {
                    throw new IllegalArgumentException("Chunk " + chunk.id() + " has no embedding");
                }
                if (chunk.embedding().dimension() != dimension) {
                    throw new IllegalArgumentException("Chunk " + chunk.id() + " has " + chunk.embedding().dimension()
                            + " dimensions, the embedding model produces " + dimension);
                }
                if (byId.putIfAbsent(chunk.id(), chunk) != null) {
                    throw new IllegalArgumentException("Duplicate chunk id " + chunk.id());
                }
                store.add(chunk.id(), chunk.embedding(), toSegment(chunk));
            }
            return new Snapshot(buildId, builtAt, store, Collections.unmodifiableMap(byId));
        }

        public List<RetrievedChunk> search(Embedding queryEmbedding, int k) {
            if (!isReady() || isZero(queryEmbedding)) {
                return List.of();
            }
            EmbeddingSearchRequest request = EmbeddingSearchRequest.builder()
                    .queryEmbedding(queryEmbedding)
                    .maxResults(k)
                    .minScore(0.0)
                    .build();

            List<RetrievedChunk> results = new ArrayList<>();
            for (EmbeddingMatch<TextSegment> match : store.search(request).matches()) {
                RuleChunk chunk = chunks.get(match.embeddingId());
                if (chunk != null) {
                    results.add(new RetrievedChunk(chunk, CosineSimilarity.fromRelevanceScore(match.score())));
                }
            }
            return results;
        }

        public boolean isReady() {
            return !chunks.isEmpty();
        }

        public String buildId() {
            return buildId;
        }

        public List<RuleChunk> chunks() {
            return List.copyOf(chunks.values());
        }

        RuleIndexStatus status() {
            return isReady()
                    ? new RuleIndexStatus(true, chunks.size(), buildId, builtAt)
                    : RuleIndexStatus.notInitialized();
        }

        Instant builtAt() {
            return builtAt;
        }

        private static boolean isZero(Embedding embedding) {
            for (float v : embedding.vector()) {
                if (v != 0.0f) {
                    return false;
                }
            }
            return true;
        }
    }
}
