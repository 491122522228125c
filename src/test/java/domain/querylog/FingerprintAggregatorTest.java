package domain.querylog;

import domain.fingerprint.FingerprintDigest;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class FingerprintAggregatorTest {

    private static QueryLogEntry entry(int row, String id, String sql, Double ms) {
        return new QueryLogEntry(row, id, sql, ms, ms == null ? "" : String.valueOf(ms));
    }

    @Test
    void should_group_by_fingerprint_and_return_hash() {
        FingerprintAggregator agg = new FingerprintAggregator();

        String h1 = agg.add("select * from t where a = ?", entry(1, "q1", "SELECT * FROM t WHERE a = 1", 10.0));
        String h2 = agg.add("select * from t where a = ?", entry(2, "q2", "SELECT * FROM t WHERE a = 2", 30.0));
        agg.add("select b from u", entry(3, "q3", "SELECT b FROM u", null));

        assertEquals(h1, h2);
        assertEquals(FingerprintDigest.sha256Hex("select * from t where a = ?"), h1);
        assertEquals(2, agg.size());
    }

    @Test
    void should_sum_durations_of_timed_rows_only() {
        FingerprintAggregator agg = new FingerprintAggregator();
        agg.add("f", entry(1, "q1", "s1", 10.0));
        agg.add("f", entry(2, "q2", "s2", null));
        agg.add("f", entry(3, "q3", "s3", 30.0));

        FingerprintSummary s = agg.summaries().get(0);
        assertEquals(3, s.getCount());
        assertEquals(2, s.getTimedCount());
        assertEquals(40.0, s.getTotalDurationMs(), 1e-9);
        assertEquals(20.0, s.getAvgDurationMs(), 1e-9);
        assertEquals(30.0, s.getMaxDurationMs(), 1e-9);
        assertEquals("q1", s.getFirstQueryId());
        assertEquals("s1", s.getSampleSql());
    }

    @Test
    void avg_is_zero_without_timed_rows() {
        FingerprintAggregator agg = new FingerprintAggregator();
        agg.add("f", entry(1, "q1", "s1", null));
        assertEquals(0.0, agg.summaries().get(0).getAvgDurationMs(), 1e-9);
    }

    @Test
    void summaries_sorted_by_count_then_total_duration_then_first_seen() {
        FingerprintAggregator agg = new FingerprintAggregator();
        agg.add("rare", entry(1, "1", "r", 500.0));
        agg.add("tie-a", entry(2, "2", "a", 5.0));
        agg.add("tie-b", entry(3, "3", "b", 5.0));
        agg.add("busy", entry(4, "4", "x", 1.0));
        agg.add("busy", entry(5, "5", "x", 1.0));

        List<FingerprintSummary> out = agg.summaries();
        assertEquals(List.of("busy", "rare", "tie-a", "tie-b"),
                out.stream().map(FingerprintSummary::getFingerprint).toList());
    }

    @Test
    void blank_query_id_defaults_to_row_number() {
        QueryLogEntry e = new QueryLogEntry(7, "  ", "select 1", null, "");
        assertEquals("7", e.getQueryId());
    }

    @Test
    void invalid_duration_is_flagged() {
        assertEquals(true, new QueryLogEntry(1, "q", "s", null, "abc").isDurationInvalid());
        assertEquals(false, new QueryLogEntry(1, "q", "s", null, "").isDurationInvalid());
        assertEquals(false, new QueryLogEntry(1, "q", "s", 3.0, "3").isDurationInvalid());
    }
}
