package domain.fingerprint;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Third pipeline stage: nests tokens between matching parentheses. Purely structural.
 *
 * <p>Only the first statement is kept: tokens after the first top-level {@code ;} are dropped
 * (the {@code ;} itself stays).</p>
 */
final class TokenTreeBuilder {

    /** Tree walks recurse per group level; deeper input is rejected instead of overflowing the stack. */
    static final int MAX_DEPTH = 1000;

    private TokenTreeBuilder() {}

    static TokenGroup build(List<Token> tokens) {
        Deque<OpenGroup> stack = new ArrayDeque<>();
        OpenGroup root = new OpenGroup(null);
        stack.push(root);

        for (Token t : tokens) {
            if (t.type() == TokenType.GROUP_OPEN) {
                if (stack.size() > MAX_DEPTH) {
                    throw new SqlLexException(LexErrorKind.NESTING_TOO_DEEP, t.position(),
                            "parentheses nested deeper than " + MAX_DEPTH);
                }
                stack.push(new OpenGroup(t));
                continue;
            }
            if (t.type() == TokenType.GROUP_CLOSE) {
                if (stack.size() == 1) {
                    throw new SqlLexException(LexErrorKind.UNBALANCED_PARENTHESIS, t.position(), "unmatched ')'");
                }
                OpenGroup g = stack.pop();
                stack.peek().children.add(new TokenGroup(g.open, g.children, t));
                continue;
            }

            stack.peek().children.add(t);
            if (stack.size() == 1 && t.isPunctuation(";")) break;
        }

        if (stack.size() > 1) {
            Token open = stack.peek().open;
            throw new SqlLexException(LexErrorKind.UNBALANCED_PARENTHESIS, open.position(), "unclosed '('");
        }
        return TokenGroup.statement(root.children);
    }

    private static final class OpenGroup {
        final Token open;
        final List<TokenNode> children = new ArrayList<>();

        OpenGroup(Token open) {
            this.open = open;
        }
    }
}
