package domain.fingerprint;

/**
 * Generic fingerprinting failure. Always wraps the underlying cause; no partial fingerprint is
 * ever produced.
 */
public final class FingerprintException extends RuntimeException {

    public FingerprintException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * @return lexing error kind when the cause is a {@link SqlLexException}, otherwise {@code null}
     */
    public LexErrorKind getKind() {
        Throwable c = getCause();
        if (c instanceof SqlLexException lex) return lex.getKind();
        return null;
    }
}
