package com.largomodo.bayalloc.core.domain;

/**
 * Finding severity. Errors block "ready for use"; warnings are expected steady-state conditions.
 */
public enum Severity {
    ERROR,
    WARNING
}
