package domain.model;

/**
 * A single non-fatal warning raised while processing a query log.
 */
public final class FingerprintWarning {

    private final WarningCode code;
    private final String queryId;
    private final String message;
    private final String detail;

    public FingerprintWarning(WarningCode code, String queryId, String message, String detail) {
        this.code = code == null ? WarningCode.FINGERPRINT_ERROR : code;
        this.queryId = nullToEmpty(queryId);
        this.message = nullToEmpty(message);
        this.detail = nullToEmpty(detail);
    }

    public static FingerprintWarning of(WarningCode code, String queryId, String message) {
        return new FingerprintWarning(code, queryId, message, "");
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    public WarningCode getCode() {
        return code;
    }

    public String getQueryId() {
        return queryId;
    }

    public String getMessage() {
        return message;
    }

    public String getDetail() {
        return detail;
    }
}
