package domain.fingerprint;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;

class LiteralSubstitutorTest {

    private static String substitute(String normalizedSql) {
        TokenGroup tree = TokenTreeBuilder.build(SqlTokenizer.tokenize(normalizedSql));
        return LiteralSubstitutor.substitute(tree).toSql();
    }

    @Test
    void should_keep_projection_strings_and_redact_other_strings() {
        assertEquals("select 'a', ? from t where b = ?", substitute("select 'a', 1 from t where b = 'c'"));
    }

    @Test
    void every_projection_terminator_leaves_projection() {
        assertEquals("select a from t group by ? having ? order by ?",
                substitute("select a from t group by 'x' having 'y' order by 'z'"));
        assertEquals("select a where ?", substitute("select a where 'x'"));
    }

    @Test
    void strings_before_any_select_are_redacted() {
        assertEquals("insert into t values (?, ?)", substitute("insert into t values ('a', 'b')"));
    }

    @Test
    void nested_group_inherits_projection_state() {
        assertEquals("select f('kept') from t where g(?)", substitute("select f('kept') from t where g('gone')"));
    }

    @Test
    void nested_select_state_does_not_leak_to_parent() {
        // the inner group ends in projection; the parent where clause is still OTHER
        assertEquals("select a from t where x in (select ?) and y = ?",
                substitute("select a from t where x in (select 1) and y = 'v'"));
        assertEquals("select a from t where x = (select 'p') and y = ?",
                substitute("select a from t where x = (select 'p') and y = 'v'"));
    }

    @Test
    void union_re_enters_projection() {
        assertEquals("select 'a' from t where x = ? union select 'b' from u",
                substitute("select 'a' from t where x = 'q' union select 'b' from u"));
    }

    @Test
    void should_build_new_tree_and_leave_input_untouched() {
        TokenGroup tree = TokenTreeBuilder.build(SqlTokenizer.tokenize("select 1 from t"));
        TokenGroup out = LiteralSubstitutor.substitute(tree);

        assertNotSame(tree, out);
        assertEquals("select 1 from t", tree.toSql());
        assertEquals("select ? from t", out.toSql());
        // untouched tokens are shared, replaced ones are new
        assertSame(tree.getChildren().get(0), out.getChildren().get(0));
    }

    @Test
    void next_state_transitions() {
        Token select = new Token(TokenType.KEYWORD, "select", 0);
        Token from = new Token(TokenType.KEYWORD, "from", 0);
        Token join = new Token(TokenType.KEYWORD, "join", 0);

        assertEquals(ClauseState.PROJECTION, LiteralSubstitutor.nextState(ClauseState.OTHER, select));
        assertEquals(ClauseState.OTHER, LiteralSubstitutor.nextState(ClauseState.PROJECTION, from));
        assertEquals(ClauseState.PROJECTION, LiteralSubstitutor.nextState(ClauseState.PROJECTION, join));
        assertEquals(ClauseState.OTHER, LiteralSubstitutor.nextState(ClauseState.OTHER, from));
    }

    @Test
    void numbers_and_booleans_are_replaced_in_every_state() {
        Token num = new Token(TokenType.LITERAL_NUMBER, "5", 3);
        Token bool = new Token(TokenType.LITERAL_BOOLEAN, "true", 4);
        Token str = new Token(TokenType.LITERAL_STRING, "'s'", 5);

        for (ClauseState state : ClauseState.values()) {
            assertEquals("?", LiteralSubstitutor.replace(num, state).value());
            assertEquals("?", LiteralSubstitutor.replace(bool, state).value());
        }
        assertEquals("'s'", LiteralSubstitutor.replace(str, ClauseState.PROJECTION).value());
        assertEquals("?", LiteralSubstitutor.replace(str, ClauseState.OTHER).value());
        assertEquals(5, LiteralSubstitutor.replace(str, ClauseState.OTHER).position());
    }
}
