package com.eainde.admission.rag;

/**
 * Text of one rulebook page.
 *
 * @param number 1-based page number used in citations
 * @param text   extracted page text
 */
public record RulebookPage(int number, String text) {}
