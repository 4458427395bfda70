package com.eainde.admission.stage.extract;

import com.eainde.admission.model.DocumentLabel;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Fields requested from each document type. Critical fields weigh half of the
 * extraction confidence where a template defines them.
 */
public enum ExtractionTemplate {

    TRANSCRIPT(DocumentLabel.TRANSCRIPT, """
            - institution_name: string
            - degree_type: string (Abitur, Bachelor, Master, etc.)
            - field_of_study: string
            - graduation_date: string (YYYY-MM-DD)
            - final_grade: string
            - gpa: number (if available)
            - grading_system: string
            - subjects: list of {subject_name, grade, credits}
            - country: string
            - student_id: string
            """,
            List.of("institution_name", "degree_type", "field_of_study", "graduation_date", "final_grade",
                    "gpa", "grading_system", "subjects", "country", "student_id"),
            List.of("institution_name", "graduation_date", "final_grade"),
            false),

    QUALIFICATION_CERTIFICATE(DocumentLabel.QUALIFICATION_CERTIFICATE, """
            - qualification_type: string (Abitur, A-Levels, International Baccalaureate, etc.)
            - institution_name: string
            - country: string
            - graduation_date: string (YYYY-MM-DD)
            - overall_grade: string (as printed, e.g. "1,58" or "AAB")
            - total_points: number (IB points out of 45, if applicable)
            - grading_system: string
            - subjects: list of {subject_name, grade, level}
            - candidate_number: string
            - certificate_number: string
            """,
            List.of("qualification_type", "institution_name", "country", "graduation_date", "overall_grade",
                    "total_points", "grading_system", "subjects", "candidate_number", "certificate_number"),
            List.of("qualification_type", "overall_grade", "graduation_date"),
            false),

    CV(DocumentLabel.CV, """
            - full_name: string
            - email: string
            - education: list of education entries
            - work_experience: list of {company, position, start_date, end_date}
            - skills: list of strings
            - languages: list of {language, proficiency_level}
            """,
            List.of("full_name", "email", "education", "work_experience", "skills", "languages"),
            List.of(),
            false),

    WORK_CERTIFICATE(DocumentLabel.WORK_CERTIFICATE, """
            - company_name: string
            - position_title: string
            - start_date: string (YYYY-MM-DD)
            - end_date: string (YYYY-MM-DD)
            - duration_months: number (if stated)
            - employment_type: string (full-time, part-time, internship)
            - responsibilities: list of strings
            """,
            List.of("company_name", "position_title", "start_date", "end_date", "duration_months",
                    "employment_type", "responsibilities"),
            List.of("company_name", "start_date", "end_date"),
            false),

    GENERIC(DocumentLabel.OTHER, """
            - document_type: string (best guess)
            - key_information: list of important facts
            - dates: list of relevant dates
            - institutions: list of mentioned institutions
            """,
            List.of("document_type", "key_information", "dates", "institutions"),
            List.of(),
            true);

    private final DocumentLabel label;
    private final String instructions;
    private final List<String> fields;
    private final List<String> criticalFields;
    private final boolean bestEffort;

    ExtractionTemplate(DocumentLabel label, String instructions, List<String> fields,
                       List<String> criticalFields, boolean bestEffort) {
        this.label = label;
        this.instructions = instructions;
        this.fields = fields;
        this.criticalFields = criticalFields;
        this.bestEffort = bestEffort;
    }

    public static ExtractionTemplate forLabel(DocumentLabel label) {
        for (ExtractionTemplate template : values()) {
            if (template.label == label) {
                return template;
            }
        }
        return GENERIC;
    }

    public DocumentLabel label() {
        return label;
    }

    public String instructions() {
        return instructions;
    }

    public List<String> fields() {
        return fields;
    }

    /**
     * Best-effort templates mark every extracted field as low confidence.
     */
    public boolean isBestEffort() {
        return bestEffort;
    }

    /**
     * Ratio of non-null fields, blended 50/50 with the ratio of present critical fields.
     */
    public double confidence(Map<String, Object> data) {
        if (data == null || data.isEmpty()) {
            return 0.0;
        }
        long nonNull = data.values().stream().filter(Objects::nonNull).count();
        double base = (double) nonNull / data.size();
        if (criticalFields.isEmpty()) {
            return base;
        }
        long critical = criticalFields.stream().filter(f -> data.get(f) != null).count();
        double criticalRatio = (double) critical / criticalFields.size();
        return Math.min(1.0, base * 0.5 + criticalRatio * 0.5);
    }
}
