package com.eainde.admission.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Fixed vocabulary of document types the classifier may assign.
 */
public enum DocumentLabel {
    TRANSCRIPT("transcript"),
    QUALIFICATION_CERTIFICATE("qualification-certificate"),
    CV("cv"),
    WORK_CERTIFICATE("work-certificate"),
    OTHER("other");

    private final String value;

    DocumentLabel(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Resolves a label from free text. Underscores, spaces and case are ignored;
     * anything outside the vocabulary maps to {@link #OTHER}.
     */
    @JsonCreator
    public static DocumentLabel fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return OTHER;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('_', '-').replace(' ', '-');
        for (DocumentLabel label : values()) {
            if (label.value.equals(normalized)) {
                return label;
            }
        }
        return OTHER;
    }

    public static String vocabulary() {
        return Arrays.stream(values()).map(DocumentLabel::value).collect(Collectors.joining(", "));
    }
}
