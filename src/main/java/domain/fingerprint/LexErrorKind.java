package domain.fingerprint;

/**
 * Closed set of lexing/structural failures raised while fingerprinting.
 */
public enum LexErrorKind {

    /**
     * Single-quoted string literal has no closing quote.
     */
    UNTERMINATED_STRING,

    /**
     * Backtick or double-quoted identifier has no closing quote.
     */
    UNTERMINATED_IDENTIFIER,

    /**
     * Block comment has no closing {@code *}{@code /}.
     */
    UNTERMINATED_COMMENT,

    /**
     * A {@code (} without matching {@code )} or the other way round.
     */
    UNBALANCED_PARENTHESIS,

    /**
     * Parentheses nested more than 1000 levels deep.
     */
    NESTING_TOO_DEEP,

    /**
     * Character that no token class accepts (control characters, stray symbols).
     */
    UNRECOGNIZED_CHARACTER
}
