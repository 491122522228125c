package domain.querylog;

import domain.fingerprint.FingerprintDigest;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups query-log rows by fingerprint.
 *
 * <p>Not thread-safe; the batch loop feeds it from a single thread.</p>
 */
public final class FingerprintAggregator {

    private final Map<String, Bucket> buckets = new LinkedHashMap<>();

    /**
     * @return the fingerprint hash the entry was grouped under
     */
    public String add(String fingerprint, QueryLogEntry entry) {
        String hash = FingerprintDigest.sha256Hex(fingerprint);
        Bucket b = buckets.computeIfAbsent(hash, h -> new Bucket(h, fingerprint, entry));
        b.count++;

        Double d = entry.getDurationMs();
        if (d != null) {
            b.timedCount++;
            b.totalDurationMs += d;
            b.maxDurationMs = Math.max(b.maxDurationMs, d);
        }
        return hash;
    }

    public int size() {
        return buckets.size();
    }

    /**
     * Sorted by count desc, then total duration desc; ties keep first-seen order.
     */
    public List<FingerprintSummary> summaries() {
        List<FingerprintSummary> out = new ArrayList<>(buckets.size());
        for (Bucket b : buckets.values()) {
            out.add(new FingerprintSummary(
                    b.hash, b.fingerprint, b.count, b.timedCount,
                    b.totalDurationMs, b.maxDurationMs, b.firstQueryId, b.sampleSql));
        }
        out.sort(Comparator.comparingInt(FingerprintSummary::getCount).reversed()
                .thenComparing(Comparator.comparingDouble(FingerprintSummary::getTotalDurationMs).reversed()));
        return out;
    }

    private static final class Bucket {
        final String hash;
        final String fingerprint;
        final String firstQueryId;
        final String sampleSql;
        int count;
        int timedCount;
        double totalDurationMs;
        double maxDurationMs;

        Bucket(String hash, String fingerprint, QueryLogEntry first) {
            this.hash = hash;
            this.fingerprint = fingerprint;
            this.firstQueryId = first.getQueryId();
            this.sampleSql = first.getSqlText();
        }
    }
}
