package com.eainde.admission.rag;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.langchain4j.data.embedding.Embedding;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RuleIndexTest {

    private static RuleIndex emptyIndex() {
        return new RuleIndex(new LocalHashingEmbeddingModel(384), RulebookChunker.withDefaults(), RulebookFixtures.CLOCK);
    }

    @Nested
    @DisplayName("query()")
    class Query {

        @Test
        @DisplayName("querying before any build fails")
        void notInitialized() {
            RuleIndex index = emptyIndex();

            assertThat(index.status().ready()).isFalse();
            assertThatThrownBy(() -> index.query("anything", 3))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("not initialized");
        }

        @Test
        @DisplayName("the matching passage ranks first and carries its citation")
        void ranksDirectAccessRule() {
            List<RetrievedChunk> hits = RulebookFixtures.builtIndex().query(RulebookFixtures.DIRECT_ACCESS_QUERY, 3);

            assertThat(hits).hasSize(3);
            RetrievedChunk top = hits.get(0);
            assertThat(top.chunk().id()).isEqualTo(RulebookFixtures.DIRECT_ACCESS_CHUNK);
            assertThat(top.chunk().page()).isEqualTo(2);
            assertThat(top.chunk().citation().text()).contains("grants direct access");
            assertThat(hits).extracting(RetrievedChunk::similarity).isSortedAccordingTo((a, b) -> Double.compare(b, a));
        }

        @Test
        @DisplayName("a paraphrased direct access rule is retrieved among unrelated passages")
        void paraphrasedRule() {
            RuleIndex index = emptyIndex();
            index.rebuild(RulebookFixtures.distractorPages());

            List<RetrievedChunk> hits = index.query(RulebookFixtures.DIRECT_ACCESS_QUERY, 3);

            assertThat(hits).extracting(hit -> hit.chunk().text())
                    .contains("Allgemeine Hochschulreife grants direct university access");
        }

        @Test
        @DisplayName("k larger than the index returns every chunk")
        void largeK() {
            assertThat(RulebookFixtures.builtIndex().query("admission", 50)).hasSize(4);
        }

        @Test
        @DisplayName("blank queries and non-positive k are rejected")
        void invalidArguments() {
            RuleIndex index = RulebookFixtures.builtIndex();

            assertThatThrownBy(() -> index.query(" ", 3)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> index.query("admission", 0)).isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("rebuild()")
    class Rebuild {

        @Test
        @DisplayName("a held snapshot is not affected by a rebuild")
        void snapshotIsolation() {
            RuleIndex index = RulebookFixtures.builtIndex();
            RuleIndex.Snapshot held = index.current();
            Embedding query = index.embed(RulebookFixtures.DIRECT_ACCESS_QUERY);
            List<RetrievedChunk> before = held.search(query, 4);

            index.rebuild(List.of(new RulebookPage(1, "9 Replacement\nCompletely different rulebook text.")));

            assertThat(held.search(query, 4)).isEqualTo(before);
            assertThat(index.current().buildId()).isNotEqualTo(held.buildId());
            assertThat(index.query(RulebookFixtures.DIRECT_ACCESS_QUERY, 4))
                    .extracting(hit -> hit.chunk().id())
                    .containsExactly("p0001-c00");
        }

        @Test
        @DisplayName("status reports chunk count and build id")
        void status() {
            RuleIndex index = emptyIndex();
            RuleIndexStatus status = index.rebuild(RulebookFixtures.pages());

            assertThat(status.ready()).isTrue();
            assertThat(status.chunkCount()).isEqualTo(4);
            assertThat(status.builtAt()).isEqualTo(RulebookFixtures.CLOCK.instant());
            assertThat(index.status()).isEqualTo(status);
        }

        @Test
        @DisplayName("an empty rulebook is rejected and keeps the previous snapshot")
        void emptyRulebook() {
            RuleIndex index = RulebookFixtures.builtIndex();
            String buildId = index.status().buildId();

            assertThatThrownBy(() -> index.rebuild(List.of())).isInstanceOf(IllegalArgumentException.class);
            assertThat(index.status().buildId()).isEqualTo(buildId);
        }

        @Test
        @DisplayName("restoring duplicate chunk ids is rejected")
        void duplicateIds() {
            RuleIndex index = RulebookFixtures.builtIndex();
            RuleChunk chunk = index.current().chunks().get(0);

            assertThatThrownBy(() -> index.restore(List.of(chunk, chunk), "dup", Instant.EPOCH))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    @DisplayName("chunks embedded at another dimension are rejected and keep the previous snapshot")
    void dimensionMismatch() {
        RuleIndex index = new RuleIndex(new LocalHashingEmbeddingModel(256), RulebookChunker.withDefaults(),
                RulebookFixtures.CLOCK);
        index.rebuild(RulebookFixtures.pages());
        String buildId = index.status().buildId();
        List<RuleChunk> foreign = RulebookFixtures.builtIndex().current().chunks();

        assertThatThrownBy(() -> index.restore(foreign, "foreign", Instant.EPOCH))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("384");
        assertThat(index.status().buildId()).isEqualTo(buildId);
    }

    @Test
    @DisplayName("a persisted index restores to identical query results")
    void persistence(@TempDir Path dir) {
        ObjectMapper mapper = new ObjectMapper().registerModule(new JavaTimeModule());
        RuleIndexFileStore store = new RuleIndexFileStore(mapper);
        RuleIndex original = RulebookFixtures.builtIndex();
        Path file = dir.resolve("nested").resolve("rule-index.json");

        store.write(original.current(), file);
        RuleIndexFileStore.LoadedIndex loaded = store.read(file);
        assertThat(loaded.dimension()).isEqualTo(384);
        RuleIndex restored = emptyIndex();
        restored.restore(loaded.chunks(), loaded.buildId(), loaded.builtAt());

        assertThat(Files.exists(file)).isTrue();
        assertThat(restored.status()).isEqualTo(original.status());
        assertThat(restored.query(RulebookFixtures.DIRECT_ACCESS_QUERY, 4))
                .extracting(hit -> hit.chunk().id())
                .containsExactlyElementsOf(original.query(RulebookFixtures.DIRECT_ACCESS_QUERY, 4).stream()
                        .map(hit -> hit.chunk().id()).toList());
    }
}
