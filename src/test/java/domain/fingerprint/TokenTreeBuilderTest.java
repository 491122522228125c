package domain.fingerprint;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TokenTreeBuilderTest {

    private static TokenGroup build(String sql) {
        return TokenTreeBuilder.build(SqlTokenizer.tokenize(sql));
    }

    @Test
    void should_nest_parenthesized_tokens() {
        TokenGroup root = build("f(a, (b))");

        assertTrue(root.isStatement());
        assertEquals(2, root.getChildren().size());

        TokenGroup outer = (TokenGroup) root.getChildren().get(1);
        assertFalse(outer.isStatement());
        assertEquals("(", outer.getOpen().value());
        assertEquals(")", outer.getClose().value());

        TokenGroup inner = (TokenGroup) outer.getChildren().get(3);
        assertEquals(1, inner.getChildren().size());
        assertEquals("b", ((Token) inner.getChildren().get(0)).value());
    }

    @Test
    void serialization_round_trips_text() {
        String sql = "select a, (select b from t where c in (1, 2)) from u";
        assertEquals(sql, build(sql).toSql());
    }

    @Test
    void should_drop_tokens_after_first_top_level_semicolon() {
        assertEquals("select 1;", build("select 1; select 2").toSql());
    }

    @Test
    void should_fail_on_unmatched_close() {
        SqlLexException e = assertThrows(SqlLexException.class, () -> build("a)"));
        assertEquals(LexErrorKind.UNBALANCED_PARENTHESIS, e.getKind());
        assertEquals(1, e.getPosition());
    }

    @Test
    void should_fail_on_unclosed_open_at_its_position() {
        SqlLexException e = assertThrows(SqlLexException.class, () -> build("f((a)"));
        assertEquals(LexErrorKind.UNBALANCED_PARENTHESIS, e.getKind());
        assertEquals(1, e.getPosition());
    }

    @Test
    void should_reject_nesting_beyond_max_depth_at_the_offending_paren() {
        int depth = TokenTreeBuilder.MAX_DEPTH;
        build("(".repeat(depth) + "a" + ")".repeat(depth));

        SqlLexException e = assertThrows(SqlLexException.class,
                () -> build("(".repeat(depth + 1) + "a" + ")".repeat(depth + 1)));
        assertEquals(LexErrorKind.NESTING_TOO_DEEP, e.getKind());
        assertEquals(depth, e.getPosition());
    }

    @Test
    void children_are_unmodifiable() {
        TokenGroup root = build("a b");
        assertThrows(UnsupportedOperationException.class,
                () -> root.getChildren().add(Token.placeholder(0)));
    }
}
