package com.largomodo.bayalloc.util;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Parsing and formatting of the day-first dates found in pick exports.
 * <p>
 * Accepted shape: {@code D-M-YYYY} or {@code D-M-YY}, optionally followed by a space and a
 * time-of-day that is ignored. Two-digit years are 20YY; other year lengths are rejected. Anything else, including impossible
 * calendar dates such as 31-02-2025, does not parse.
 */
public final class PickDates {

    /**
     * Ordering key for text that does not parse; older than any date that does.
     */
    public static final LocalDate UNPARSED = LocalDate.MIN;

    private PickDates() {
        // Static utility class - prevent instantiation
    }

    /**
     * @param raw exported date or timestamp, may be null
     * @return parsed date, or empty when the text is not a valid day-first date
     */
    public static Optional<LocalDate> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String datePart = datePart(raw);
        String[] parts = datePart.split("-");
        if (parts.length != 3) {
            return Optional.empty();
        }
        try {
            int day = Integer.parseInt(parts[0].trim());
            int month = Integer.parseInt(parts[1].trim());
            String yearText = parts[2].trim();
            if (yearText.length() != 2 && yearText.length() != 4) {
                return Optional.empty();
            }
            int year = Integer.parseInt(yearText);
            if (yearText.length() == 2) {
                year += 2000;
            }
            return Optional.of(LocalDate.of(year, month, day));
        } catch (NumberFormatException | DateTimeException e) {
            return Optional.empty();
        }
    }

    /**
     * Date used for ordering. Unparsable text sorts as the oldest possible value.
     *
     * @return parsed date, or {@link #UNPARSED}
     */
    public static LocalDate derive(String raw) {
        return parse(raw).orElse(UNPARSED);
    }

    /**
     * Formats an exported date as {@code D-M-YYYY} without leading zeros.
     * Unparsable input is returned as its date part, unchanged.
     */
    public static String format(String raw) {
        if (raw == null) {
            return "";
        }
        return parse(raw)
                .map(d -> d.getDayOfMonth() + "-" + d.getMonthValue() + "-" + d.getYear())
                .orElse(datePart(raw));
    }

    private static String datePart(String raw) {
        String trimmed = raw.trim();
        int space = trimmed.indexOf(' ');
        return space >= 0 ? trimmed.substring(0, space) : trimmed;
    }
}
