package com.eainde.admission.stage.extract;

import com.eainde.admission.model.ApplicantProfile;
import com.eainde.admission.model.DocumentExtraction;
import com.eainde.admission.model.DocumentLabel;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Merges per-document extractions into one {@link ApplicantProfile}.
 *
 * <p>Qualification data comes from the most confident qualification certificate, falling
 * back to transcripts. Values taken from documents below the low-confidence threshold, or
 * from best-effort extractions, are listed in {@link ApplicantProfile#lowConfidenceFields()}.</p>
 */
public class ProfileAssembler {

    private final double lowConfidenceThreshold;

    public ProfileAssembler(double lowConfidenceThreshold) {
        this.lowConfidenceThreshold = lowConfidenceThreshold;
    }

    public ApplicantProfile assemble(List<DocumentExtraction> extractions) {
        Set<String> lowConfidence = new LinkedHashSet<>();

        Optional<DocumentExtraction> qualificationSource = best(extractions, DocumentLabel.QUALIFICATION_CERTIFICATE)
                .or(() -> best(extractions, DocumentLabel.TRANSCRIPT));

        String qualificationType = null;
        Double grade = null;
        String gradingSystem = null;
        if (qualificationSource.isPresent()) {
            DocumentExtraction source = qualificationSource.get();
            boolean low = isLow(source);
            qualificationType = GradeNormalizer.canonicalQualification(
                    first(source, "qualification_type", "degree_type"));
            grade = GradeNormalizer.parseGrade(first(source, "overall_grade", "total_points", "final_grade", "gpa"));
            Object system = source.field("grading_system");
            gradingSystem = system != null ? system.toString() : GradeNormalizer.defaultGradingSystem(qualificationType);
            if (low) {
                if (qualificationType != null) lowConfidence.add(ApplicantProfile.QUALIFICATION_TYPE);
                if (grade != null) lowConfidence.add(ApplicantProfile.NORMALIZED_GRADE);
                if (gradingSystem != null) lowConfidence.add(ApplicantProfile.GRADING_SYSTEM);
            }
        }

        Map<String, String> identifiers = new LinkedHashMap<>();
        Map<String, LocalDate> dates = new LinkedHashMap<>();
        for (DocumentExtraction extraction : extractions) {
            for (Map.Entry<String, Object> entry : extraction.data().entrySet()) {
                String field = entry.getKey();
                Object value = entry.getValue();
                if (value == null) {
                    continue;
                }
                if (field.endsWith("_id") || field.endsWith("_number")) {
                    identifiers.putIfAbsent(field, value.toString());
                } else if (field.endsWith("_date")) {
                    GradeNormalizer.parseDate(value).ifPresent(d -> dates.putIfAbsent(field, d));
                }
                if (isLow(extraction)) {
                    lowConfidence.add(field);
                }
            }
        }

        Integer workMonths = workExperienceMonths(extractions, lowConfidence);

        double confidence = extractions.stream()
                .mapToDouble(DocumentExtraction::confidence)
                .average()
                .orElse(0.0);

        return ApplicantProfile.builder()
                .qualificationType(qualificationType)
                .normalizedGrade(grade)
                .gradingSystem(gradingSystem)
                .identifiers(identifiers)
                .dates(dates)
                .workExperienceMonths(workMonths)
                .lowConfidenceFields(lowConfidence)
                .extractions(extractions)
                .confidence(confidence)
                .build();
    }

    private Integer workExperienceMonths(List<DocumentExtraction> extractions, Set<String> lowConfidence) {
        List<DocumentExtraction> certificates = extractions.stream()
                .filter(e -> e.label() == DocumentLabel.WORK_CERTIFICATE)
                .collect(Collectors.toList());
        if (certificates.isEmpty()) {
            return null;
        }
        int total = 0;
        boolean any = false;
        for (DocumentExtraction certificate : certificates) {
            Integer months = months(certificate);
            if (months != null) {
                total += months;
                any = true;
                if (isLow(certificate)) {
                    lowConfidence.add(ApplicantProfile.WORK_EXPERIENCE_MONTHS);
                }
            }
        }
        return any ? total : null;
    }

    private static Integer months(DocumentExtraction certificate) {
        Optional<LocalDate> start = GradeNormalizer.parseDate(certificate.field("start_date"));
        Optional<LocalDate> end = GradeNormalizer.parseDate(certificate.field("end_date"));
        if (start.isPresent() && end.isPresent() && !end.get().isBefore(start.get())) {
            return (int) ChronoUnit.MONTHS.between(start.get(), end.get());
        }
        Double stated = GradeNormalizer.parseGrade(certificate.field("duration_months"));
        return stated == null ? null : stated.intValue();
    }

    private boolean isLow(DocumentExtraction extraction) {
        return ExtractionTemplate.forLabel(extraction.label()).isBestEffort()
                || extraction.confidence() < lowConfidenceThreshold;
    }

    private static Optional<DocumentExtraction> best(List<DocumentExtraction> extractions, DocumentLabel label) {
        return extractions.stream()
                .filter(e -> e.label() == label)
                .max(Comparator.comparingDouble(DocumentExtraction::confidence));
    }

    private static Object first(DocumentExtraction extraction, String... fields) {
        for (String field : fields) {
            Object value = extraction.field(field);
            if (value != null && !value.toString().isBlank()) {
                return value;
            }
        }
        return null;
    }
}
