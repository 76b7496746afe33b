package com.largomodo.bayalloc.util;

import java.time.LocalDate;
import java.time.format.TextStyle;
import java.util.Collection;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Descriptive names for report directories: {@code Full_Aug-Dec-2025_100K-picks}.
 * <p>
 * The date range covers the parseable dates only. Month abbreviations are English so names
 * stay stable across locales.
 */
public final class OutputNaming {

    private static final String PREFIX = "Full";

    private OutputNaming() {
    }

    /**
     * @param dates      dates of the considered events; nulls are ignored
     * @param eventCount number of considered events
     * @return directory name, e.g. "Full_Jul-2025_512-picks"
     */
    public static String describe(Collection<LocalDate> dates, int eventCount) {
        Optional<LocalDate> min = dates.stream().filter(Objects::nonNull).min(LocalDate::compareTo);
        Optional<LocalDate> max = dates.stream().filter(Objects::nonNull).max(LocalDate::compareTo);

        String range = "";
        if (min.isPresent() && max.isPresent()) {
            String startMonth = monthName(min.get());
            String endMonth = monthName(max.get());
            int year = max.get().getYear();
            range = startMonth.equals(endMonth)
                    ? startMonth + "-" + year
                    : startMonth + "-" + endMonth + "-" + year;
        }
        return PREFIX + "_" + range + "_" + formatCount(eventCount) + "-picks";
    }

    /**
     * 999 stays "999"; 1000 and above round to thousands: 100000 → "100K", 1499 → "1K".
     */
    public static String formatCount(int count) {
        if (count >= 1000) {
            return Math.round(count / 1000.0) + "K";
        }
        return Integer.toString(count);
    }

    private static String monthName(LocalDate date) {
        return date.getMonth().getDisplayName(TextStyle.SHORT, Locale.ENGLISH);
    }
}
