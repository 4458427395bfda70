package com.eainde.admission.model;

/**
 * Reference from a decision back to the rulebook chunk that supports it.
 *
 * @param chunkId id of the retrieved chunk
 * @param page    1-based rulebook page
 * @param section nearest numbered section heading, null when the page has none
 * @param text    the chunk text, verbatim
 */
public record Citation(
        String chunkId,
        int page,
        String section,
        String text
) {
    public String label() {
        return section == null ? "page " + page : "page " + page + ", section " + section;
    }
}
