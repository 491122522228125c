package domain.fingerprint;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered children bounded by a matching {@code (} … {@code )} pair.
 *
 * <p>The root statement has no bounding tokens. Children are owned exclusively and never
 * shared between trees; transformations build a new group via {@link #withChildren(List)}.</p>
 */
public final class TokenGroup implements TokenNode {

    private final Token open;
    private final List<TokenNode> children;
    private final Token close;

    TokenGroup(Token open, List<TokenNode> children, Token close) {
        this.open = open;
        this.children = Collections.unmodifiableList(new ArrayList<>(children));
        this.close = close;
    }

    static TokenGroup statement(List<TokenNode> children) {
        return new TokenGroup(null, children, null);
    }

    public boolean isStatement() {
        return open == null;
    }

    public Token getOpen() {
        return open;
    }

    public Token getClose() {
        return close;
    }

    public List<TokenNode> getChildren() {
        return children;
    }

    TokenGroup withChildren(List<TokenNode> newChildren) {
        return new TokenGroup(open, newChildren, close);
    }

    @Override
    public void appendTo(StringBuilder out) {
        if (open != null) open.appendTo(out);
        for (TokenNode child : children) {
            child.appendTo(out);
        }
        if (close != null) close.appendTo(out);
    }

    /** Serializes the tree back to text in child order, whitespace tokens included. */
    public String toSql() {
        StringBuilder out = new StringBuilder(64);
        appendTo(out);
        return out.toString();
    }
}
