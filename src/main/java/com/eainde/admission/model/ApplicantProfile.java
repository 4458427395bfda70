package com.eainde.admission.model;

import lombok.Builder;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Structured applicant profile assembled by the extraction stage.
 *
 * <p>Fields the documents did not yield stay null; {@link #missingFields()} turns them
 * into the missing-data signals consumed by the decision stage.</p>
 */
@Builder(toBuilder = true)
public record ApplicantProfile(
        String qualificationType,
        Double normalizedGrade,
        String gradingSystem,
        Map<String, String> identifiers,
        Map<String, LocalDate> dates,
        Integer workExperienceMonths,
        Set<String> lowConfidenceFields,
        List<DocumentExtraction> extractions,
        double confidence
) {
    public static final String QUALIFICATION_TYPE = "qualificationType";
    public static final String NORMALIZED_GRADE = "normalizedGrade";
    public static final String GRADING_SYSTEM = "gradingSystem";
    public static final String WORK_EXPERIENCE_MONTHS = "workExperienceMonths";

    public ApplicantProfile {
        identifiers = identifiers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(identifiers));
        dates = dates == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(dates));
        lowConfidenceFields = lowConfidenceFields == null
                ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(lowConfidenceFields));
        extractions = extractions == null ? List.of() : List.copyOf(extractions);
    }

    public List<String> missingFields() {
        List<String> missing = new ArrayList<>();
        if (qualificationType == null) missing.add(QUALIFICATION_TYPE);
        if (normalizedGrade == null) missing.add(NORMALIZED_GRADE);
        if (workExperienceMonths == null) missing.add(WORK_EXPERIENCE_MONTHS);
        return missing;
    }

    public boolean isLowConfidence(String field) {
        return lowConfidenceFields.contains(field);
    }
}
