package com.eainde.admission.rag;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Small rulebook shared by the retrieval and decision tests.
 */
public final class RulebookFixtures {

    public static final String DIRECT_ACCESS_QUERY = "Finanzmanagement direct access requirements";
    public static final String DIRECT_ACCESS_CHUNK = "p0002-c00";

    public static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);

    private RulebookFixtures() {
    }

    public static List<RulebookPage> pages() {
        return List.of(
                new RulebookPage(1, """
                        1 General Provisions
                        These admission regulations apply to all bachelor programmes of the university.
                        Applications must be submitted through the online portal before the deadline."""),
                new RulebookPage(2, """
                        2 Finanzmanagement
                        2.1 Direct access requirements
                        The Abitur (allgemeine Hochschulreife) grants direct access to the Finanzmanagement
                        programme. Applicants holding an Abitur with any passing grade are admitted directly."""),
                new RulebookPage(3, """
                        3 Vocational Pathway
                        Applicants without school leaving qualification may be admitted with a completed
                        apprenticeship and at least 36 months of work experience."""),
                new RulebookPage(4, """
                        4 Language Proficiency
                        International applicants must prove German language proficiency at level C1."""));
    }

    /**
     * Rulebook whose only direct access rule does not repeat the query wording, among unrelated passages.
     */
    public static List<RulebookPage> distractorPages() {
        return List.of(
                new RulebookPage(1, "Tuition fees for Finanzmanagement are payable at the start of each semester."),
                new RulebookPage(2, "Applicants must upload certified copies of all school certificates."),
                new RulebookPage(3, "Allgemeine Hochschulreife grants direct university access"),
                new RulebookPage(4, "Exchange students may attend lectures for one semester without enrolment."),
                new RulebookPage(5, "The examination board decides on the recognition of foreign credits."),
                new RulebookPage(6, "Part-time study is possible after consultation with the programme office."));
    }

    public static String asText() {
        StringBuilder text = new StringBuilder();
        for (RulebookPage page : pages()) {
            if (text.length() > 0) {
                text.append('\f');
            }
            text.append(page.text());
        }
        return text.toString();
    }

    public static RuleIndex builtIndex() {
        RuleIndex index = new RuleIndex(new LocalHashingEmbeddingModel(384), RulebookChunker.withDefaults(), CLOCK);
        index.rebuild(pages());
        return index;
    }
}
