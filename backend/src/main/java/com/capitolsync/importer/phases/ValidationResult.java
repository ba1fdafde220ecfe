package com.capitolsync.importer.phases;

/**
 * Outcome of one post-import check.
 */
public record ValidationResult(String check, boolean passed, Severity severity, String expected, String actual,
                               String message) {

    public enum Severity {
        INFO, WARNING, ERROR
    }

    /** Passed checks are INFO; failed checks take {@code failure}. */
    static ValidationResult of(String check, boolean passed, Severity failure, Object expected, Object actual,
                               String message) {
        return new ValidationResult(check, passed, passed ? Severity.INFO : failure,
                String.valueOf(expected), String.valueOf(actual), message);
    }

    boolean isError() {
        return !passed && severity == Severity.ERROR;
    }

    boolean isWarning() {
        return !passed && severity == Severity.WARNING;
    }
}
