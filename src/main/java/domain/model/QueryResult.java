package domain.model;

/**
 * Outcome of fingerprinting one query-log row.
 */
public final class QueryResult {

    public static final String SUCCESS = "SUCCESS";
    public static final String SKIP = "SKIP";

    /**
     * SUCCESS / SKIP
     */
    private final String status;
    private final String queryId;
    private final String fingerprintHash;
    private final String fingerprint;

    /**
     * reason for SKIP (warning code or exception class)
     */
    private final String message;

    public QueryResult(String status, String queryId, String fingerprintHash, String fingerprint, String message) {
        this.status = nullToEmpty(status);
        this.queryId = nullToEmpty(queryId);
        this.fingerprintHash = nullToEmpty(fingerprintHash);
        this.fingerprint = nullToEmpty(fingerprint);
        this.message = nullToEmpty(message);
    }

    public static QueryResult success(String queryId, String fingerprintHash, String fingerprint) {
        return new QueryResult(SUCCESS, queryId, fingerprintHash, fingerprint, "");
    }

    public static QueryResult skip(String queryId, String message) {
        return new QueryResult(SKIP, queryId, "", "", message);
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    public String getStatus() {
        return status;
    }

    public boolean isSuccess() {
        return SUCCESS.equals(status);
    }

    public String getQueryId() {
        return queryId;
    }

    public String getFingerprintHash() {
        return fingerprintHash;
    }

    public String getFingerprint() {
        return fingerprint;
    }

    public String getMessage() {
        return message;
    }
}
