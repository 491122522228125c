package domain.model;

/**
 * Standard warning codes for a query-log fingerprint run.
 *
 * <p>Keep the set small and stable.</p>
 */
public enum WarningCode {

    /**
     * SQL text column is blank and the row is skipped.
     */
    SQL_TEXT_EMPTY,

    /**
     * Fingerprinting failed (lexing error, unbalanced parentheses).
     */
    FINGERPRINT_ERROR,

    /**
     * Duration column is present but not a number; the row is counted without a duration.
     */
    DURATION_INVALID,

    /**
     * Fingerprinting a single row took at least the configured slow threshold.
     */
    SLOW_FINGERPRINT
}
