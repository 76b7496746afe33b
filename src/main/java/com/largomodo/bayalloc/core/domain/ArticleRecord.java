package com.largomodo.bayalloc.core.domain;

/**
 * One row of the client article master.
 * <p>
 * Dimensions are in centimetres; 0 when absent or unparsable. The pick location is used only to
 * cross-check the location mapping, never for allocation.
 */
public record ArticleRecord(long article, String description, double length, double width,
                            double height, String pickLocation) {

    public ArticleRecord {
        description = description == null ? "" : description;
        pickLocation = pickLocation == null ? "" : pickLocation.trim();
    }

    /**
     * Unit volume in cm³, rounded to the nearest integer.
     */
    public long volume() {
        return Math.round(length * width * height);
    }
}
