package domain.fingerprint;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text rewrites applied to the serialized tree, in this exact order:
 * <ol>
 *   <li>{@code in (?, ?, ...)} collapses to {@code in (?)}</li>
 *   <li>whitespace right after {@code (} / before {@code )} becomes one space</li>
 *   <li>{@code like in and or not exists is null} are forced to lowercase</li>
 *   <li>whitespace runs collapse to one space</li>
 *   <li>backticks around identifiers are stripped</li>
 *   <li>trim</li>
 * </ol>
 * Rules are whole-string and do not know about literals: a kept projection literal such as
 * {@code 'Tom AND Jerry'} is lowercased by rule 3.
 */
final class FingerprintCleanup {

    private static final Pattern IN_LIST = Pattern.compile(
            "\\bin\\s*\\(\\s*\\?(?:\\s*,\\s*\\?)+\\s*\\)", Pattern.CASE_INSENSITIVE);
    private static final Pattern OPEN_PAREN_SPACES = Pattern.compile("\\(\\s+");
    private static final Pattern CLOSE_PAREN_SPACES = Pattern.compile("\\s+\\)");
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");
    private static final Pattern BACKTICKED = Pattern.compile("`([^`]+)`");

    static final List<String> LOWERCASE_KEYWORDS = List.of("like", "in", "and", "or", "not", "exists", "is null");

    private static final List<Pattern> LOWERCASE_KEYWORD_PATTERNS = compileKeywordPatterns();

    static final List<UnaryOperator<String>> STAGES = List.of(
            FingerprintCleanup::collapseInLists,
            FingerprintCleanup::normalizeParenSpacing,
            FingerprintCleanup::lowercaseKeywords,
            FingerprintCleanup::collapseWhitespace,
            FingerprintCleanup::stripBackticks,
            String::trim
    );

    private FingerprintCleanup() {}

    static String apply(String sql) {
        String out = sql;
        for (UnaryOperator<String> stage : STAGES) {
            out = stage.apply(out);
        }
        return out;
    }

    static String collapseInLists(String sql) {
        return IN_LIST.matcher(sql).replaceAll("in (?)");
    }

    static String normalizeParenSpacing(String sql) {
        String out = OPEN_PAREN_SPACES.matcher(sql).replaceAll("( ");
        return CLOSE_PAREN_SPACES.matcher(out).replaceAll(" )");
    }

    static String lowercaseKeywords(String sql) {
        String out = sql;
        for (int i = 0; i < LOWERCASE_KEYWORDS.size(); i++) {
            String replacement = Matcher.quoteReplacement(LOWERCASE_KEYWORDS.get(i));
            out = LOWERCASE_KEYWORD_PATTERNS.get(i).matcher(out).replaceAll(replacement);
        }
        return out;
    }

    static String collapseWhitespace(String sql) {
        return WHITESPACE_RUN.matcher(sql).replaceAll(" ");
    }

    static String stripBackticks(String sql) {
        return BACKTICKED.matcher(sql).replaceAll("$1");
    }

    private static List<Pattern> compileKeywordPatterns() {
        List<Pattern> out = new ArrayList<>(LOWERCASE_KEYWORDS.size());
        for (String kw : LOWERCASE_KEYWORDS) {
            out.add(Pattern.compile("\\b" + Pattern.quote(kw) + "\\b", Pattern.CASE_INSENSITIVE));
        }
        return out;
    }
}
