package domain.querylog;

/**
 * One row of a query log.
 */
public final class QueryLogEntry {

    /**
     * 1-based data row number (header excluded)
     */
    private final int rowNumber;
    private final String queryId;
    private final String sqlText;

    /**
     * parsed duration in ms, null when the column is absent, blank or invalid
     */
    private final Double durationMs;

    /**
     * raw duration cell, kept for DURATION_INVALID reporting
     */
    private final String durationRaw;

    public QueryLogEntry(int rowNumber, String queryId, String sqlText, Double durationMs, String durationRaw) {
        this.rowNumber = rowNumber;
        this.queryId = (queryId == null || queryId.isBlank()) ? String.valueOf(rowNumber) : queryId.trim();
        this.sqlText = sqlText == null ? "" : sqlText;
        this.durationMs = durationMs;
        this.durationRaw = durationRaw == null ? "" : durationRaw.trim();
    }

    public int getRowNumber() {
        return rowNumber;
    }

    public String getQueryId() {
        return queryId;
    }

    public String getSqlText() {
        return sqlText;
    }

    public Double getDurationMs() {
        return durationMs;
    }

    public String getDurationRaw() {
        return durationRaw;
    }

    /** Duration cell was filled in but could not be parsed. */
    public boolean isDurationInvalid() {
        return durationMs == null && !durationRaw.isEmpty();
    }
}
