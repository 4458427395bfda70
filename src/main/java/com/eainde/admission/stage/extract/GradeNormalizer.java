package com.eainde.admission.stage.extract;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lenient parsing of grades, qualification names and dates as they appear in
 * certificates. Nothing here throws; unparsable input yields empty/null.
 */
public final class GradeNormalizer {

    public static final String ABITUR = "Abitur";
    public static final String A_LEVELS = "A-Levels";
    public static final String IB = "IB";

    private static final Pattern NUMBER = Pattern.compile("(\\d+(?:[.,]\\d+)?)");
    private static final Pattern IB_WORD = Pattern.compile("\\bib\\b");
    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ofPattern("dd.MM.yyyy"),
            DateTimeFormatter.ofPattern("d.M.yyyy"));

    private GradeNormalizer() {
    }

    /**
     * Reads a numeric grade. Decimal commas are accepted ({@code "1,58"} is 1.58); letter
     * grades and empty values are not numeric and give null.
     */
    public static Double parseGrade(Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof Number) {
            double value = ((Number) raw).doubleValue();
            return Double.isFinite(value) ? value : null;
        }
        Matcher matcher = NUMBER.matcher(raw.toString());
        if (!matcher.find()) {
            return null;
        }
        try {
            return Double.parseDouble(matcher.group(1).replace(',', '.'));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public static String canonicalQualification(Object raw) {
        if (raw == null || raw.toString().isBlank()) {
            return null;
        }
        String text = raw.toString().trim();
        String lower = text.toLowerCase(Locale.ROOT);
        if (lower.contains("abitur") || lower.contains("hochschulreife")) {
            return ABITUR;
        }
        if (lower.contains("a-level") || lower.contains("a level") || lower.contains("gce advanced")) {
            return A_LEVELS;
        }
        if (lower.contains("baccalaureate") || IB_WORD.matcher(lower).find()) {
            return IB;
        }
        return text;
    }

    public static String defaultGradingSystem(String qualificationType) {
        if (qualificationType == null) {
            return null;
        }
        switch (qualificationType) {
            case ABITUR:
                return "German 1.0-6.0 (1.0 best)";
            case A_LEVELS:
                return "UK A*-E";
            case IB:
                return "IB points (max 45)";
            default:
                return null;
        }
    }

    public static Optional<LocalDate> parseDate(Object raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String text = raw.toString().trim();
        for (DateTimeFormatter format : DATE_FORMATS) {
            try {
                return Optional.of(LocalDate.parse(text, format));
            } catch (DateTimeParseException e) {
                // try the next format
            }
        }
        return Optional.empty();
    }
}
