package domain.fingerprint;

import java.util.ArrayList;
import java.util.List;

/**
 * Fourth pipeline stage: replaces literal tokens with {@code ?} according to clause context.
 *
 * <p>Each group's direct children are scanned left to right. {@code select} enters
 * {@link ClauseState#PROJECTION}; {@code from}/{@code where}/{@code group}/{@code having}/{@code order}
 * leave it. Inside a projection string literals are kept; numbers and booleans are always replaced.</p>
 *
 * <p>A nested group starts from the state active where it was entered, it is not reset to
 * {@link ClauseState#OTHER}. A subquery inside a projection list therefore keeps string literals
 * until its own {@code from}/{@code where} is reached.</p>
 */
final class LiteralSubstitutor {

    private LiteralSubstitutor() {}

    static TokenGroup substitute(TokenGroup statement) {
        return substitute(statement, ClauseState.OTHER);
    }

    static TokenGroup substitute(TokenGroup group, ClauseState inherited) {
        ClauseState state = inherited;
        List<TokenNode> out = new ArrayList<>(group.getChildren().size());

        for (TokenNode node : group.getChildren()) {
            if (node instanceof TokenGroup nested) {
                out.add(substitute(nested, state));
                continue;
            }

            Token t = (Token) node;
            state = nextState(state, t);
            out.add(replace(t, state));
        }

        return group.withChildren(out);
    }

    static ClauseState nextState(ClauseState state, Token t) {
        if (t.isKeyword("select")) return ClauseState.PROJECTION;
        if (state == ClauseState.PROJECTION && SqlKeywords.isProjectionTerminator(t)) return ClauseState.OTHER;
        return state;
    }

    static Token replace(Token t, ClauseState state) {
        switch (t.type()) {
            case LITERAL_STRING:
                return (state == ClauseState.PROJECTION) ? t : Token.placeholder(t.position());
            case LITERAL_NUMBER:
            case LITERAL_BOOLEAN:
                return Token.placeholder(t.position());
            default:
                return t;
        }
    }
}
