package com.eainde.admission.rag;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.embedding.Embedding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Persists the active rule index as a JSON embedding collection keyed by chunk id.
 * Writes go to a temporary file that is moved into place, so readers never see half a file.
 */
public class RuleIndexFileStore {

    private static final Logger log = LoggerFactory.getLogger(RuleIndexFileStore.class);

    private final ObjectMapper objectMapper;

    public RuleIndexFileStore(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void write(RuleIndex.Snapshot snapshot, Path target) {
        if (!snapshot.isReady()) {
            throw new IllegalStateException("Cannot persist an empty rule index");
        }
        List<PersistedChunk> chunks = new ArrayList<>();
        for (RuleChunk chunk : snapshot.chunks()) {
            chunks.add(new PersistedChunk(chunk.id(), chunk.text(), chunk.page(), chunk.section(),
                    chunk.chunkIndex(), chunk.embedding().vector()));
        }
        PersistedIndex index = new PersistedIndex(snapshot.buildId(), snapshot.builtAt(),
                chunks.get(0).vector().length, chunks);
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = Files.createTempFile(parent, "rule-index", ".json.tmp");
            objectMapper.writeValue(tmp.toFile(), index);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.info("Persisted rule index {} ({} chunks) to {}", snapshot.buildId(), chunks.size(), target);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to persist rule index to " + target, e);
        }
    }

    public LoadedIndex read(Path source) {
        try {
            PersistedIndex index = objectMapper.readValue(source.toFile(), PersistedIndex.class);
            List<RuleChunk> chunks = new ArrayList<>(index.chunks().size());
            for (PersistedChunk c : index.chunks()) {
                chunks.add(new RuleChunk(c.id(), c.text(), c.page(), c.section(), c.chunkIndex(),
                        Embedding.from(c.vector())));
            }
            int dimension = index.dimension() > 0 || index.chunks().isEmpty()
                    ? index.dimension()
                    : index.chunks().get(0).vector().length;
            return new LoadedIndex(index.buildId(), index.builtAt(), dimension, chunks);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read rule index from " + source, e);
        }
    }

    public record LoadedIndex(String buildId, Instant builtAt, int dimension, List<RuleChunk> chunks) {}

    /**
     * On-disk form. {@code dimension} is 0 in files written before it was recorded.
     */
    public record PersistedIndex(String buildId, Instant builtAt, int dimension, List<PersistedChunk> chunks) {}

    public record PersistedChunk(String id, String text, int page, String section, int chunkIndex, float[] vector) {}
}
