package com.eainde.admission.model;

/**
 * Output of the classification stage for a single document.
 *
 * @param document   the classified upload
 * @param label      assigned label, {@link DocumentLabel#OTHER} when unsure
 * @param confidence classifier confidence in [0,1]
 * @param reasoning  short explanation returned by the classifier, may be null
 */
public record ClassifiedDocument(
        DocumentDescriptor document,
        DocumentLabel label,
        double confidence,
        String reasoning
) {}
