package domain.fingerprint;

/** Whether the scan is inside a SELECT projection list. */
enum ClauseState {
    PROJECTION,
    OTHER
}
