package com.largomodo.bayalloc.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * European decimal notation (comma as decimal separator) used by client exports and reports.
 */
public final class Decimals {

    private Decimals() {
    }

    /**
     * Parses "12,5" or "12.5". Blank or unparsable input yields 0.
     */
    public static double parseEuropean(String value) {
        if (value == null || value.isBlank()) {
            return 0;
        }
        try {
            double parsed = Double.parseDouble(value.trim().replace(',', '.'));
            return Double.isFinite(parsed) ? parsed : 0;
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    /**
     * Formats a weight with two decimals and a decimal comma: 0.5 becomes "0,50".
     * Null renders as an empty string.
     */
    public static String formatWeight(BigDecimal weight) {
        if (weight == null) {
            return "";
        }
        return weight.setScale(2, RoundingMode.HALF_UP).toPlainString().replace('.', ',');
    }
}
