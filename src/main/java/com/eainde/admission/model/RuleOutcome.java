package com.eainde.admission.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Result of evaluating one rule against an applicant profile.
 */
public enum RuleOutcome {
    SATISFIED,
    NOT_SATISFIED,
    INSUFFICIENT_DATA;

    /**
     * Parses interpreter output such as {@code "satisfied"}, {@code "not-satisfied"} or
     * {@code "insufficient_data"}. Returns empty for anything else.
     */
    public static Optional<RuleOutcome> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (RuleOutcome outcome : values()) {
            if (outcome.name().equals(normalized)) {
                return Optional.of(outcome);
            }
        }
        return Optional.empty();
    }
}
