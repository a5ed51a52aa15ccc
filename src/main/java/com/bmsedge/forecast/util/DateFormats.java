package com.bmsedge.forecast.util;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Lenient parsing of the date spellings found in POS exports. Day-first patterns win over month-first.
 */
public final class DateFormats {

    private static final List<DateTimeFormatter> PATTERNS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ofPattern("dd/MM/yyyy"),
            DateTimeFormatter.ofPattern("d/M/yyyy"),
            DateTimeFormatter.ofPattern("dd-MM-yyyy"),
            DateTimeFormatter.ofPattern("d-M-yyyy"),
            DateTimeFormatter.ofPattern("d/M/yy"),
            DateTimeFormatter.ofPattern("d-M-yy"),
            DateTimeFormatter.ofPattern("MM/dd/yyyy")
    );

    // "2025-04-05 10:31:00", "2025-04-05T10:31"
    private static final Pattern ISO_WITH_TIME = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}[T ].*");

    private DateFormats() {}

    /**
     * @return the parsed date, or null when no supported pattern matches
     */
    public static LocalDate parse(String value) {
        if (value == null) return null;
        String text = value.trim();
        if (text.isEmpty()) return null;
        if (ISO_WITH_TIME.matcher(text).matches()) {
            text = text.substring(0, 10);
        }

        for (DateTimeFormatter pattern : PATTERNS) {
            try {
                return LocalDate.parse(text, pattern);
            } catch (DateTimeParseException ignored) {
                // next pattern
            }
        }
        return null;
    }
}
