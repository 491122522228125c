package domain.fingerprint;

import java.util.List;

/**
 * Converts a SQL statement into its fingerprint: a canonical, literal-redacted string that is
 * identical for statements differing only in literal values, whitespace, casing or
 * {@code IN (...)} list length.
 *
 * <p>Pipeline (strictly forward):
 * <ol>
 *   <li>{@link SqlLexicalNormalizer}: comments, case, canonical layout</li>
 *   <li>{@link SqlTokenizer}: classified token stream</li>
 *   <li>{@link TokenTreeBuilder}: parenthesized groups</li>
 *   <li>{@link LiteralSubstitutor}: clause-aware literal redaction</li>
 *   <li>{@link FingerprintCleanup}: ordered text rewrites</li>
 * </ol>
 *
 * <p>Stateless; one instance can be shared across threads.</p>
 */
public final class SqlFingerprinter {

    /**
     * @return the fingerprint, or {@code ""} for null/empty input
     * @throws FingerprintException when the input cannot be lexed or its parentheses do not balance
     */
    public String fingerprint(String sql) {
        if (sql == null || sql.isEmpty()) return "";

        try {
            String normalized = SqlLexicalNormalizer.normalize(sql);
            if (normalized.isEmpty()) return "";

            List<Token> tokens = SqlTokenizer.tokenize(normalized);
            TokenGroup statement = TokenTreeBuilder.build(tokens);
            TokenGroup redacted = LiteralSubstitutor.substitute(statement);

            return FingerprintCleanup.apply(redacted.toSql());
        } catch (RuntimeException e) {
            throw new FingerprintException("Fingerprint failed: " + e.getMessage(), e);
        }
    }
}
