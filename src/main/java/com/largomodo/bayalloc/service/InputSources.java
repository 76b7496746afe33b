package com.largomodo.bayalloc.service;

import java.nio.file.Path;

/**
 * Locations of the three client exports of one dataset.
 *
 * @param locations location master
 * @param articles  article master
 * @param picks     pick history
 * @param area      pick area filter, or null to keep every row
 */
public record InputSources(Path locations, Path articles, Path picks, String area) {

    public InputSources {
        if (locations == null || articles == null || picks == null) {
            throw new IllegalArgumentException("Input file paths cannot be null");
        }
        area = area == null || area.isBlank() ? null : area.trim();
    }

    public boolean hasAreaFilter() {
        return area != null;
    }
}
