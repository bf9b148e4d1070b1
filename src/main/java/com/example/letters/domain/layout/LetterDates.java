package com.example.letters.domain.layout;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Formats letter dates as {@code October 5, 2026} (no leading zero on the day).
 */
public final class LetterDates {

    private static final DateTimeFormatter LETTER_DATE = DateTimeFormatter.ofPattern("MMMM d, yyyy", Locale.US);

    private LetterDates() {
    }

    public static String format(LocalDate date) {
        return LETTER_DATE.format(date);
    }
}
