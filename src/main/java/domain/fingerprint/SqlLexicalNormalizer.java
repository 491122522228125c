package domain.fingerprint;

import java.util.Locale;

/**
 * First pipeline stage: comment stripping, case folding and canonical layout.
 *
 * <p>Rules:
 * <ul>
 *   <li>{@code --} and {@code /* *}{@code /} comments become whitespace</li>
 *   <li>words and quoted identifiers are lowercased; single-quoted literals are copied verbatim</li>
 *   <li>whitespace runs collapse to one space</li>
 *   <li>no space after {@code (} or before {@code )} / {@code ,}; exactly one space after {@code ,}</li>
 *   <li>no leading/trailing whitespace</li>
 * </ul>
 * Operators keep the (collapsed) spacing of the input, e.g. {@code age>=21} stays glued.
 */
final class SqlLexicalNormalizer {

    private SqlLexicalNormalizer() {}

    static String normalize(String sql) {
        if (sql == null || sql.isEmpty()) return "";

        StringBuilder out = new StringBuilder(sql.length());
        SqlScan st = new SqlScan(sql);
        boolean pendingSpace = false;

        while (st.hasNext()) {
            if (st.peekIsLineComment()) { st.readLineComment(); pendingSpace = true; continue; }
            if (st.peekIsBlockComment()) { st.readBlockComment(); pendingSpace = true; continue; }

            char ch = st.peek();
            if (SqlScan.isSpace(ch)) {
                st.readSpaces();
                pendingSpace = true;
                continue;
            }

            String text;
            if (st.peekIsSingleQuotedString()) {
                text = st.readSingleQuotedString();
            } else if (st.peekIsQuotedIdentifier()) {
                text = st.readQuotedIdentifier().toLowerCase(Locale.ROOT);
            } else if (SqlScan.isWordChar(ch)) {
                text = st.readWord().toLowerCase(Locale.ROOT);
            } else if (ch == '(' || ch == ')' || SqlScan.isSymbolChar(ch)) {
                text = String.valueOf(st.read());
            } else {
                throw st.unrecognized();
            }

            append(out, text, pendingSpace);
            pendingSpace = false;
        }

        return out.toString();
    }

    private static void append(StringBuilder out, String text, boolean pendingSpace) {
        if (out.length() == 0) {
            out.append(text);
            return;
        }

        char last = out.charAt(out.length() - 1);
        char first = text.charAt(0);

        boolean space = pendingSpace || last == ',';
        if (last == '(' || first == ')' || first == ',') space = false;

        if (space) out.append(' ');
        out.append(text);
    }
}
