package domain.fingerprint;

/** Semantic class of a {@link Token}. */
public enum TokenType {
    KEYWORD,
    IDENTIFIER,
    OPERATOR,
    PUNCTUATION,
    WHITESPACE,
    COMMENT,
    LITERAL_STRING,
    LITERAL_NUMBER,
    LITERAL_BOOLEAN,
    GROUP_OPEN,
    GROUP_CLOSE
}
