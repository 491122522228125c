package domain.querylog;

/**
 * Aggregate of all query-log rows sharing one fingerprint.
 */
public final class FingerprintSummary {

    private final String fingerprintHash;
    private final String fingerprint;
    private final int count;

    /**
     * rows that carried a valid duration
     */
    private final int timedCount;
    private final double totalDurationMs;
    private final double maxDurationMs;
    private final String firstQueryId;
    private final String sampleSql;

    public FingerprintSummary(
            String fingerprintHash,
            String fingerprint,
            int count,
            int timedCount,
            double totalDurationMs,
            double maxDurationMs,
            String firstQueryId,
            String sampleSql
    ) {
        this.fingerprintHash = fingerprintHash;
        this.fingerprint = fingerprint;
        this.count = count;
        this.timedCount = timedCount;
        this.totalDurationMs = totalDurationMs;
        this.maxDurationMs = maxDurationMs;
        this.firstQueryId = firstQueryId;
        this.sampleSql = sampleSql;
    }

    public String getFingerprintHash() {
        return fingerprintHash;
    }

    public String getFingerprint() {
        return fingerprint;
    }

    public int getCount() {
        return count;
    }

    public int getTimedCount() {
        return timedCount;
    }

    public double getTotalDurationMs() {
        return totalDurationMs;
    }

    public double getMaxDurationMs() {
        return maxDurationMs;
    }

    /** Average over timed rows; 0 when no row had a duration. */
    public double getAvgDurationMs() {
        return timedCount == 0 ? 0d : totalDurationMs / timedCount;
    }

    public String getFirstQueryId() {
        return firstQueryId;
    }

    public String getSampleSql() {
        return sampleSql;
    }
}
