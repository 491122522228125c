package domain.fingerprint;

import java.util.ArrayList;
import java.util.List;

/**
 * Second pipeline stage: flat, classified token stream. Whitespace is kept as tokens so the
 * serializer reproduces spacing without re-deriving it.
 */
final class SqlTokenizer {

    private static final String MULTI_CHAR_OPERATOR_CHARS = "<>=!|&:~^";

    private SqlTokenizer() {}

    static List<Token> tokenize(String sql) {
        List<Token> out = new ArrayList<>(64);
        SqlScan st = new SqlScan(sql);

        // last token that is neither whitespace nor comment
        Token prev = null;

        while (st.hasNext()) {
            Token t = next(st, prev);
            out.add(t);
            if (t.type() != TokenType.WHITESPACE && t.type() != TokenType.COMMENT) prev = t;
        }
        return out;
    }

    private static Token next(SqlScan st, Token prev) {
        int start = st.pos;

        if (st.peekIsLineComment()) return new Token(TokenType.COMMENT, st.readLineComment(), start);
        if (st.peekIsBlockComment()) return new Token(TokenType.COMMENT, st.readBlockComment(), start);
        if (st.peekIsSingleQuotedString()) {
            return new Token(TokenType.LITERAL_STRING, st.readSingleQuotedString(), start);
        }
        if (st.peekIsQuotedIdentifier()) return new Token(TokenType.IDENTIFIER, st.readQuotedIdentifier(), start);

        char ch = st.peek();
        if (SqlScan.isSpace(ch)) return new Token(TokenType.WHITESPACE, st.readSpaces(), start);
        if (ch == '(') return new Token(TokenType.GROUP_OPEN, String.valueOf(st.read()), start);
        if (ch == ')') return new Token(TokenType.GROUP_CLOSE, String.valueOf(st.read()), start);

        String number = tryReadNumber(st, prev);
        if (number != null) return new Token(TokenType.LITERAL_NUMBER, number, start);

        if (SqlScan.isWordChar(ch)) {
            String word = st.readWord();
            return new Token(classifyWord(word, prev, start), word, start);
        }
        if (ch == ',' || ch == ';' || ch == '.') return new Token(TokenType.PUNCTUATION, String.valueOf(st.read()), start);
        if (SqlScan.isSymbolChar(ch)) return new Token(TokenType.OPERATOR, readOperator(st), start);

        throw st.unrecognized();
    }

    private static TokenType classifyWord(String word, Token prev, int start) {
        // qualified name part (t.order, s.from_date): never a keyword
        if (prev != null && prev.isPunctuation(".") && prev.position() + 1 == start) return TokenType.IDENTIFIER;

        if (SqlKeywords.isBoolean(word)) return TokenType.LITERAL_BOOLEAN;
        if (SqlKeywords.isKeyword(word)) return TokenType.KEYWORD;
        return TokenType.IDENTIFIER;
    }

    /**
     * Integer, decimal, exponent and hex forms. A leading {@code -} or {@code .} only counts in
     * operand position (after an operator, keyword, comma or {@code (}), so {@code a - 1} keeps its
     * binary minus. A number directly followed by a word character ({@code 2nd_col}) is not a number.
     */
    private static String tryReadNumber(SqlScan st, Token prev) {
        char ch = st.peek();
        boolean signed = ch == '-';
        if (!isDigit(ch) && ch != '.' && !signed) return null;
        if ((signed || ch == '.') && !isOperandPosition(prev)) return null;

        int save = st.pos;
        if (signed) st.pos++;

        if (!readUnsignedNumber(st) || SqlScan.isWordChar(st.peek())) {
            st.pos = save;
            return null;
        }
        return st.s.substring(save, st.pos);
    }

    private static boolean readUnsignedNumber(SqlScan st) {
        int start = st.pos;

        if (st.peek() == '0' && (st.peekAt(1) == 'x' || st.peekAt(1) == 'X') && isHexDigit(st.peekAt(2))) {
            st.pos += 2;
            while (isHexDigit(st.peek())) st.pos++;
            return true;
        }

        boolean digits = false;
        while (isDigit(st.peek())) {
            st.pos++;
            digits = true;
        }
        if (st.peek() == '.' && isDigit(st.peekAt(1))) {
            st.pos++;
            while (isDigit(st.peek())) st.pos++;
            digits = true;
        }
        if (!digits) {
            st.pos = start;
            return false;
        }

        char e = st.peek();
        if (e == 'e' || e == 'E') {
            int p = (st.peekAt(1) == '+' || st.peekAt(1) == '-') ? 2 : 1;
            if (isDigit(st.peekAt(p))) {
                st.pos += p;
                while (isDigit(st.peek())) st.pos++;
            }
        }
        return true;
    }

    private static boolean isOperandPosition(Token prev) {
        if (prev == null) return true;
        switch (prev.type()) {
            case OPERATOR:
            case GROUP_OPEN:
            case KEYWORD:
                return true;
            case PUNCTUATION:
                return !prev.value().equals(".");
            default:
                return false;
        }
    }

    private static String readOperator(SqlScan st) {
        int start = st.pos;
        char first = st.read();
        if (MULTI_CHAR_OPERATOR_CHARS.indexOf(first) >= 0) {
            while (st.hasNext() && MULTI_CHAR_OPERATOR_CHARS.indexOf(st.peek()) >= 0) st.pos++;
        }
        return st.s.substring(start, st.pos);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }
}
