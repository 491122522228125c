package domain.fingerprint;

/**
 * Immutable lexical unit.
 *
 * @param position 0-based offset in the normalized text
 */
public record Token(TokenType type, String value, int position) implements TokenNode {

    static final String PLACEHOLDER = "?";

    static Token placeholder(int position) {
        return new Token(TokenType.OPERATOR, PLACEHOLDER, position);
    }

    boolean isKeyword(String lowerWord) {
        return type == TokenType.KEYWORD && value.equalsIgnoreCase(lowerWord);
    }

    boolean isPunctuation(String p) {
        return type == TokenType.PUNCTUATION && value.equals(p);
    }

    @Override
    public void appendTo(StringBuilder out) {
        out.append(value);
    }
}
