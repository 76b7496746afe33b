package com.largomodo.bayalloc.core.domain;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered findings of one run.
 */
public record ValidationReport(List<Finding> findings) {

    public ValidationReport {
        findings = List.copyOf(findings);
    }

    public List<Finding> errors() {
        return findings.stream().filter(Finding::isError).toList();
    }

    public List<Finding> warnings() {
        return findings.stream().filter(f -> !f.isError()).toList();
    }

    public boolean hasErrors() {
        return findings.stream().anyMatch(Finding::isError);
    }

    /**
     * Data is ready for use when no finding is an error; warnings never block.
     */
    public boolean isReadyForUse() {
        return !hasErrors();
    }

    /**
     * Returns a report with {@code leading} placed before this report's findings.
     */
    public ValidationReport prependedWith(List<Finding> leading) {
        List<Finding> merged = new ArrayList<>(leading);
        merged.addAll(findings);
        return new ValidationReport(merged);
    }
}
