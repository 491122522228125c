package domain.fingerprint;

/**
 * Cursor over SQL text shared by the normalizer and the tokenizer.
 *
 * <p>Both passes must agree on where strings, quoted identifiers and comments start and end,
 * so all boundary rules live here.</p>
 */
final class SqlScan {
    final String s;
    int pos = 0;

    SqlScan(String s) {
        this.s = (s == null) ? "" : s;
    }

    static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$' || c == '#';
    }

    /** Unicode space separators ({@code U+00A0}, {@code U+3000}) count as whitespace too. */
    static boolean isSpace(char c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c);
    }

    /** Characters that form operators or punctuation. Anything else outside words/quotes is rejected. */
    static boolean isSymbolChar(char c) {
        return "+-*/%=<>!|&^~?:;.,@[]{}\\".indexOf(c) >= 0;
    }

    boolean hasNext() {
        return pos < s.length();
    }

    char peek() {
        return (pos < s.length()) ? s.charAt(pos) : '\0';
    }

    char peekAt(int offset) {
        int p = pos + offset;
        return (p >= 0 && p < s.length()) ? s.charAt(p) : '\0';
    }

    char read() {
        return (pos < s.length()) ? s.charAt(pos++) : '\0';
    }

    String readWord() {
        int start = pos;
        while (pos < s.length() && isWordChar(s.charAt(pos))) pos++;
        return s.substring(start, pos);
    }

    String readSpaces() {
        int start = pos;
        while (pos < s.length() && isSpace(s.charAt(pos))) pos++;
        return s.substring(start, pos);
    }

    boolean peekIsLineComment() {
        return pos + 1 < s.length() && s.charAt(pos) == '-' && s.charAt(pos + 1) == '-';
    }

    boolean peekIsBlockComment() {
        return pos + 1 < s.length() && s.charAt(pos) == '/' && s.charAt(pos + 1) == '*';
    }

    boolean peekIsSingleQuotedString() {
        return pos < s.length() && s.charAt(pos) == '\'';
    }

    boolean peekIsQuotedIdentifier() {
        return pos < s.length() && (s.charAt(pos) == '`' || s.charAt(pos) == '"');
    }

    String readLineComment() {
        int start = pos;
        while (pos < s.length()) {
            char c = s.charAt(pos++);
            if (c == '\n') break;
        }
        return s.substring(start, pos);
    }

    String readBlockComment() {
        int start = pos;
        int end = s.indexOf("*/", pos + 2);
        if (end < 0) {
            throw new SqlLexException(LexErrorKind.UNTERMINATED_COMMENT, start, "unterminated block comment");
        }
        pos = end + 2;
        return s.substring(start, pos);
    }

    /**
     * Reads a single-quoted literal, quotes included.
     *
     * <p>Escapes: doubled quote {@code ''} and backslash + any char ({@code \'}, {@code \%}, {@code \\}).
     * When the escape-greedy scan runs off the end, the literal closes at the last quote an escape
     * swallowed, so {@code '\'} is a string holding one backslash.</p>
     */
    String readSingleQuotedString() {
        int start = pos;
        int p = pos + 1;
        int fallbackClose = -1;

        while (p < s.length()) {
            char c = s.charAt(p);
            if (c == '\\' && p + 1 < s.length()) {
                if (s.charAt(p + 1) == '\'') fallbackClose = p + 1;
                p += 2;
                continue;
            }
            if (c == '\'') {
                // escaped ''
                if (p + 1 < s.length() && s.charAt(p + 1) == '\'') {
                    fallbackClose = p;
                    p += 2;
                    continue;
                }
                pos = p + 1;
                return s.substring(start, pos);
            }
            p++;
        }

        if (fallbackClose < 0) {
            throw new SqlLexException(LexErrorKind.UNTERMINATED_STRING, start, "unterminated string literal");
        }
        pos = fallbackClose + 1;
        return s.substring(start, pos);
    }

    /** Backtick or double-quoted identifier, quotes included. A doubled quote char is an escape. */
    String readQuotedIdentifier() {
        int start = pos;
        char q = s.charAt(pos++);
        while (pos < s.length()) {
            char c = s.charAt(pos++);
            if (c == q) {
                if (pos < s.length() && s.charAt(pos) == q) {
                    pos++;
                    continue;
                }
                return s.substring(start, pos);
            }
        }
        throw new SqlLexException(LexErrorKind.UNTERMINATED_IDENTIFIER, start, "unterminated quoted identifier");
    }

    SqlLexException unrecognized() {
        char c = peek();
        return new SqlLexException(LexErrorKind.UNRECOGNIZED_CHARACTER, pos,
                "unrecognized character '" + c + "' (U+" + String.format("%04X", (int) c) + ")");
    }
}
