package domain.fingerprint;

/**
 * Raised by the normalizer, tokenizer and tree builder when the input cannot be consumed.
 */
public final class SqlLexException extends RuntimeException {

    private final LexErrorKind kind;
    private final int position;

    public SqlLexException(LexErrorKind kind, int position, String message) {
        super(message + " (at " + position + ")");
        this.kind = kind;
        this.position = position;
    }

    public LexErrorKind getKind() {
        return kind;
    }

    /** 0-based character offset in the text being scanned. */
    public int getPosition() {
        return position;
    }
}
