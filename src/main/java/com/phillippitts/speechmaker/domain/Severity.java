package com.phillippitts.speechmaker.domain;

/**
 * Severity of a classified failure. {@code CRITICAL} means the application cannot convert anything
 * (no voices at all); the host decides whether to exit.
 */
public enum Severity {
    CRITICAL,
    ERROR,
    WARNING,
    INFO
}
