package domain.fingerprint;

import java.util.Locale;
import java.util.Set;

/**
 * Reserved words recognized by the tokenizer. Lookups are case-insensitive.
 *
 * <p>Function names (count, sum, concat, ...) are deliberately absent: they are identifiers.</p>
 */
final class SqlKeywords {

    private SqlKeywords() {}

    static boolean isKeyword(String word) {
        if (word == null || word.isEmpty()) return false;
        return KEYWORDS.contains(word.toLowerCase(Locale.ROOT));
    }

    static boolean isBoolean(String word) {
        return "true".equalsIgnoreCase(word) || "false".equalsIgnoreCase(word);
    }

    /** Keywords that end a projection list. */
    static boolean isProjectionTerminator(Token t) {
        return t.isKeyword("from")
                || t.isKeyword("where")
                || t.isKeyword("group")
                || t.isKeyword("having")
                || t.isKeyword("order");
    }

    private static final Set<String> KEYWORDS = Set.of(
            // statements
            "select", "insert", "update", "delete", "merge", "replace", "upsert",
            "create", "alter", "drop", "truncate", "with", "recursive", "values", "set", "into",
            "returning", "explain", "call", "begin", "commit", "rollback",
            // clauses
            "from", "where", "group", "by", "having", "order", "limit", "offset", "fetch", "first",
            "next", "rows", "row", "only", "top", "distinct", "all", "any", "some", "as", "on", "using",
            "window", "over", "partition", "range", "preceding", "following", "unbounded", "current",
            "qualify", "for", "lock", "share", "nowait", "skip", "locked",
            // joins / set operations
            "join", "inner", "left", "right", "full", "outer", "cross", "natural", "lateral",
            "union", "intersect", "except", "minus",
            // predicates / expressions
            "and", "or", "not", "in", "exists", "between", "like", "ilike", "similar", "escape", "is",
            "null", "case", "when", "then", "else", "end", "asc", "desc", "nulls", "last",
            "interval", "cast", "collate", "default", "unique", "primary", "key", "foreign",
            "references", "check", "constraint", "table", "view", "index", "if", "matched",
            "ignore", "duplicate", "conflict", "do", "nothing"
    );
}
