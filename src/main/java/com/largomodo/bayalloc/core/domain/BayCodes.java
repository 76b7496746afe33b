package com.largomodo.bayalloc.core.domain;

import java.util.Optional;

/**
 * Construction and decomposition of bay codes.
 */
public final class BayCodes {

    public static final char SEPARATOR = '-';

    private BayCodes() {
    }

    public static String of(String aisle, String bay) {
        return nullToEmpty(aisle).trim() + SEPARATOR + nullToEmpty(bay).trim();
    }

    /**
     * Infers a bay code from a raw location code: the structural prefix before the first
     * separator joined with the segment after it. {@code "Z99-14-02"} yields {@code "Z99-14"}.
     *
     * @param locationCode raw code, may be null
     * @return inferred bay code, or empty when the code has no separator or an empty segment
     */
    public static Optional<String> infer(String locationCode) {
        if (locationCode == null) {
            return Optional.empty();
        }
        String[] parts = locationCode.trim().split(String.valueOf(SEPARATOR), -1);
        if (parts.length < 2 || parts[0].isEmpty() || parts[1].isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(parts[0] + SEPARATOR + parts[1]);
    }

    /**
     * Zone flag for a bay: true when the numeric bay part (after the first separator) is even.
     * A code without separator counts as bay 0; a bay part without leading digits is never even.
     */
    public static boolean isEvenZone(String bayCode) {
        int separator = bayCode.indexOf(SEPARATOR);
        if (separator < 0) {
            return true;
        }
        String bayPart = bayCode.substring(separator + 1);
        StringBuilder digits = new StringBuilder();
        for (char c : bayPart.toCharArray()) {
            if (Character.isDigit(c)) {
                digits.append(c);
            } else {
                break;
            }
        }
        if (digits.length() == 0) {
            return false;
        }
        // Last digit decides parity without overflow on long codes
        return (digits.charAt(digits.length() - 1) - '0') % 2 == 0;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
