package com.largomodo.bayalloc.core.domain;

import java.util.List;

/**
 * One classified consistency finding.
 *
 * @param scope       entity set the finding is about ("Pick", "Location", "ArticleLocation", ...)
 * @param severity    blocking or informational
 * @param category    short stable name of the check outcome
 * @param description human-readable explanation
 * @param count       number of offending items
 * @param samples     up to {@value #MAX_SAMPLES} offending keys, in discovery order
 */
public record Finding(String scope, Severity severity, String category, String description, int count,
                      List<String> samples) {

    public static final int MAX_SAMPLES = 5;

    public Finding {
        if (severity == null) {
            throw new IllegalArgumentException("severity must not be null");
        }
        samples = samples == null ? List.of() : List.copyOf(samples.subList(0, Math.min(MAX_SAMPLES, samples.size())));
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }
}
