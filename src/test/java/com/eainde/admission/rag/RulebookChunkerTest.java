package com.eainde.admission.rag;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Locale;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RulebookChunkerTest {

    private static String letters(int length) {
        StringBuilder text = new StringBuilder();
        for (int i = 0; i < length; i++) {
            text.append((char) ('a' + (i % 26)));
        }
        return text.toString();
    }

    @Nested
    @DisplayName("splitPages()")
    class SplitPages {

        @Test
        @DisplayName("form feeds separate pages and blank pages keep their number")
        void formFeeds() {
            List<RulebookPage> pages = RulebookChunker.withDefaults().splitPages("first\fsecond\f \ffourth");

            assertThat(pages).extracting(RulebookPage::number).containsExactly(1, 2, 4);
            assertThat(pages).extracting(RulebookPage::text).containsExactly("first", "second", "fourth");
        }

        @Test
        @DisplayName("blank input yields no pages")
        void blank() {
            assertThat(RulebookChunker.withDefaults().splitPages("  ")).isEmpty();
        }
    }

    @Nested
    @DisplayName("chunk()")
    class Chunk {

        @Test
        @DisplayName("windows overlap by the configured amount")
        void overlap() {
            RulebookChunker chunker = RulebookChunker.builder().chunkSize(1000).overlap(200).build();

            List<RuleChunk> chunks = chunker.chunk(List.of(new RulebookPage(1, letters(3000))));

            assertThat(chunks).hasSize(4);
            assertThat(chunks).extracting(RuleChunk::id)
                    .containsExactly("p0001-c00", "p0001-c01", "p0001-c02", "p0001-c03");
            String first = chunks.get(0).text();
            String second = chunks.get(1).text();
            assertThat(second.substring(0, 200)).isEqualTo(first.substring(800));
            assertThat(chunks.get(3).text()).hasSize(600);
        }

        @Test
        @DisplayName("chunk indexes are global and chunks never span pages")
        void globalIndex() {
            RulebookChunker chunker = RulebookChunker.builder().chunkSize(100).overlap(10).build();

            List<RuleChunk> chunks = chunker.chunk(List.of(
                    new RulebookPage(1, letters(150)),
                    new RulebookPage(2, letters(50))));

            assertThat(chunks).extracting(RuleChunk::chunkIndex).containsExactly(0, 1, 2);
            assertThat(chunks).extracting(RuleChunk::page).containsExactly(1, 1, 2);
            assertThat(chunks.get(2).id()).isEqualTo("p0002-c00");
        }

        @Test
        @DisplayName("sections come from numbered headings and carry over to later pages")
        void sections() {
            List<RuleChunk> chunks = RulebookChunker.withDefaults().chunk(RulebookFixtures.pages().subList(0, 2));
            List<RuleChunk> carried = RulebookChunker.withDefaults().chunk(List.of(
                    new RulebookPage(1, "3.2 Admission Quotas\nSome text."),
                    new RulebookPage(2, "continued text without a heading")));

            assertThat(chunks).extracting(RuleChunk::section).containsExactly("1", "2");
            assertThat(carried).extracting(RuleChunk::section).containsExactly("3.2", "3.2");
        }

        @Test
        @DisplayName("pages without any heading have no section")
        void noSection() {
            List<RuleChunk> chunks = RulebookChunker.withDefaults().chunk(List.of(new RulebookPage(1, "plain text")));

            assertThat(chunks.get(0).section()).isNull();
            assertThat(chunks.get(0).citation().label()).isEqualTo("page 1");
        }

        @Test
        @DisplayName("windows end on whitespace instead of inside a word")
        void wordBoundaries() {
            Set<String> words = Set.of("alpha", "beta", "gamma", "delta", "epsilon");
            String text = "alpha beta gamma delta epsilon ".repeat(10).strip();
            RulebookChunker chunker = RulebookChunker.builder().chunkSize(50).overlap(10).build();

            List<RuleChunk> chunks = chunker.chunk(List.of(new RulebookPage(1, text)));

            assertThat(chunks).hasSizeGreaterThan(1);
            assertThat(chunks).allSatisfy(chunk -> {
                assertThat(chunk.text()).hasSizeLessThanOrEqualTo(50);
                String[] tokens = chunk.text().strip().split("\\s+");
                assertThat(words).contains(tokens[tokens.length - 1]);
            });
            for (int i = 1; i < chunks.size(); i++) {
                String previous = chunks.get(i - 1).text();
                assertThat(chunks.get(i).text()).startsWith(previous.substring(previous.length() - 10));
            }
            assertThat(chunks.get(chunks.size() - 1).text()).endsWith("epsilon");
        }

        @Test
        @DisplayName("chunk ids use ASCII digits whatever the default locale")
        void asciiIds() {
            Locale previous = Locale.getDefault();
            Locale.setDefault(Locale.forLanguageTag("th-TH-u-nu-thai"));
            try {
                List<RuleChunk> chunks = RulebookChunker.withDefaults().chunk(RulebookFixtures.pages());

                assertThat(chunks).extracting(RuleChunk::id)
                        .containsExactly("p0001-c00", "p0002-c00", "p0003-c00", "p0004-c00");
            } finally {
                Locale.setDefault(previous);
            }
        }
    }

    @Test
    @DisplayName("overlap must be smaller than the chunk size")
    void invalidOverlap() {
        assertThatThrownBy(() -> RulebookChunker.builder().chunkSize(100).overlap(100).build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
