package com.eainde.admission.rag;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits rulebook pages into overlapping, size-bounded character chunks that carry a
 * page/section citation.
 *
 * <h3>Why overlap?</h3>
 * <p>A requirement often spans a chunk boundary ("applicants holding ... must also ...").
 * Repeating the tail of the previous chunk at the start of the next keeps such sentences
 * retrievable as a whole.</p>
 *
 * <h3>Sections</h3>
 * <p>Lines that start with a numbered heading ({@code 3}, {@code 3.2}, {@code 3.2.1} followed
 * by a capitalised word) open a new section. A chunk cites the section in effect at its
 * first character; the section carries over to following pages until the next heading.</p>
 *
 * <pre>
 * RulebookChunker chunker = RulebookChunker.builder()
 *         .chunkSize(1500)
 *         .overlap(200)
 *         .build();
 *
 * List&lt;RuleChunk&gt; chunks = chunker.chunk(chunker.splitPages(rulebookText));
 * </pre>
 *
 * <p>Pure logic with no Spring dependencies.</p>
 */
public class RulebookChunker {

    private static final Logger log = LoggerFactory.getLogger(RulebookChunker.class);

    /** Default: form-feed character (standard PDF-to-text page delimiter) */
    private static final Pattern DEFAULT_PAGE_DELIMITER = Pattern.compile("\\f");

    private static final Pattern SECTION_HEADING =
            Pattern.compile("(?m)^\\s*(\\d{1,2}(?:\\.\\d{1,2}){0,3})\\.?\\s+\\p{Lu}");

    private final int chunkSize;
    private final int overlap;
    private final Pattern pageDelimiter;

    private RulebookChunker(Builder builder) {
        this.chunkSize = builder.chunkSize;
        this.overlap = builder.overlap;
        this.pageDelimiter = builder.pageDelimiter;

        if (overlap >= chunkSize) {
            throw new IllegalArgumentException(
                    "overlap (" + overlap + ") must be < chunkSize (" + chunkSize + ")");
        }
    }

    // =========================================================================
    //  Public API
    // =========================================================================

    /**
     * Splits plain rulebook text into pages on the configured delimiter.
     * Blank pages are dropped but still consume a page number.
     */
    public List<RulebookPage> splitPages(String text) {
        if (text == null || text.isBlank()) {
            return Collections.emptyList();
        }
        String[] raw = pageDelimiter.split(text, -1);
        List<RulebookPage> pages = new ArrayList<>();
        for (int i = 0; i < raw.length; i++) {
            String trimmed = raw[i].strip();
            if (!trimmed.isEmpty()) {
                pages.add(new RulebookPage(i + 1, trimmed));
            }
        }
        return pages;
    }

    /**
     * Cuts every page into windows of at most {@code chunkSize} characters, each sharing
     * {@code overlap} characters with the previous one. A window that would end inside a word
     * is pulled back to the last whitespace in its second half; unbroken text is cut at
     * {@code chunkSize}. Chunks never span pages.
     *
     * @return chunks in rulebook order, without embeddings
     */
    public List<RuleChunk> chunk(List<RulebookPage> pages) {
        List<RuleChunk> chunks = new ArrayList<>();
        String carriedSection = null;

        for (RulebookPage page : pages) {
            String text = page.text() == null ? "" : page.text().strip();
            if (text.isEmpty()) {
                continue;
            }
            List<Heading> headings = findHeadings(text);

            int indexOnPage = 0;
            int start = 0;
            while (start < text.length()) {
                int end = Math.min(start + chunkSize, text.length());
                if (end < text.length()) {
                    end = breakAtWhitespace(text, start, end);
                }
                String section = sectionAt(headings, start, end, carriedSection);

                chunks.add(new RuleChunk(
                        chunkId(page.number(), indexOnPage),
                        text.substring(start, end),
                        page.number(),
                        section,
                        chunks.size(),
                        null));
                indexOnPage++;

                if (end >= text.length()) break;
                start = end - overlap;
            }
            if (!headings.isEmpty()) {
                carriedSection = headings.get(headings.size() - 1).number();
            }
        }

        log.info("Rulebook split into {} chunks from {} pages (chunkSize={}, overlap={})",
                chunks.size(), pages.size(), chunkSize, overlap);
        return Collections.unmodifiableList(chunks);
    }

    // =========================================================================
    //  Internal
    // =========================================================================

    /**
     * Last whitespace offset in {@code [start + max(overlap + 1, chunkSize / 2), end]}, or {@code end}.
     * The lower bound keeps the next window starting after {@code start}.
     */
    private int breakAtWhitespace(String text, int start, int end) {
        int floor = start + Math.max(overlap + 1, chunkSize / 2);
        for (int i = end; i >= floor; i--) {
            if (Character.isWhitespace(text.charAt(i))) {
                return i;
            }
        }
        return end;
    }

    private static List<Heading> findHeadings(String text) {
        List<Heading> headings = new ArrayList<>();
        Matcher matcher = SECTION_HEADING.matcher(text);
        while (matcher.find()) {
            headings.add(new Heading(matcher.start(1), matcher.group(1)));
        }
        return headings;
    }

    /**
     * Section in effect at {@code start}; if the chunk begins before the page's first
     * heading and no section carried over, the first heading inside the chunk is used.
     */
    private static String sectionAt(List<Heading> headings, int start, int end, String carried) {
        String current = carried;
        for (Heading heading : headings) {
            if (heading.offset() <= start) {
                current = heading.number();
            } else {
                break;
            }
        }
        if (current == null) {
            for (Heading heading : headings) {
                if (heading.offset() < end) {
                    return heading.number();
                }
            }
        }
        return current;
    }

    private static String chunkId(int page, int indexOnPage) {
        return String.format(Locale.ROOT, "p%04d-c%02d", page, indexOnPage);
    }

    private record Heading(int offset, String number) {}

    // =========================================================================
    //  Builder
    // =========================================================================

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a chunker with default settings (1500 characters, 200 overlap, form-feed delimiter).
     */
    public static RulebookChunker withDefaults() {
        return builder().build();
    }

    public static class Builder {
        private int chunkSize = 1500;
        private int overlap = 200;
        private Pattern pageDelimiter = DEFAULT_PAGE_DELIMITER;

        public Builder chunkSize(int chunkSize) {
            if (chunkSize < 2) throw new IllegalArgumentException("chunkSize must be >= 2");
            this.chunkSize = chunkSize;
            return this;
        }

        public Builder overlap(int overlap) {
            if (overlap < 0) throw new IllegalArgumentException("overlap must be >= 0");
            this.overlap = overlap;
            return this;
        }

        public Builder pageDelimiter(Pattern pageDelimiter) {
            this.pageDelimiter = pageDelimiter;
            return this;
        }

        public Builder pageDelimiter(String regex) {
            this.pageDelimiter = Pattern.compile(regex);
            return this;
        }

        public RulebookChunker build() {
            return new RulebookChunker(this);
        }
    }
}
