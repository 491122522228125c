package cli;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryUsage;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Console progress for the query-log batch run: a periodic {@code [PROGRESS]} line driven by the
 * loop and a {@code [HEARTBEAT]} daemon for rows that take long.
 */
public final class CliProgressMonitor {

    static final long HEARTBEAT_INTERVAL_MS = 30_000L;
    private static final long MB = 1024L * 1024L;

    private static final AtomicInteger rowsStarted = new AtomicInteger(0);
    private static volatile String currentQueryId = "";

    private CliProgressMonitor() {
    }

    /** Records the row now being fingerprinted; read by the heartbeat thread. */
    public static void setCurrent(String queryId, int rowNumber) {
        currentQueryId = (queryId == null) ? "" : queryId;
        rowsStarted.set(Math.max(0, rowNumber));
    }

    /**
     * @return the daemon thread; interrupt it once the loop ends
     */
    public static Thread startHeartbeat(int total) {
        Thread t = new Thread(() -> {
            try {
                while (!Thread.currentThread().isInterrupted()) {
                    Thread.sleep(HEARTBEAT_INTERVAL_MS);
                    System.out.println("[HEARTBEAT] row " + rowsStarted.get() + "/" + total
                            + " (" + percent(rowsStarted.get(), total) + ") query=" + currentQueryId);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "sql-fingerprint-heartbeat");
        t.setDaemon(true);
        t.start();
        return t;
    }

    public static void logProgress(int done, int total, int success, int skip, int distinct,
                                   long loopStartNs, String lastQueryId) {
        long elapsedMs = Math.max(1L, (System.nanoTime() - loopStartNs) / 1_000_000L);
        long rowsPerSec = done * 1000L / elapsedMs;
        MemoryUsage heap = ManagementFactory.getMemoryMXBean().getHeapMemoryUsage();

        System.out.printf("[PROGRESS] %d/%d (%s) success=%d skip=%d fingerprints=%d rows/s=%d heap=%d/%dMB last=%s%n",
                done, total, percent(done, total), success, skip, distinct, rowsPerSec,
                heap.getUsed() / MB, heap.getMax() / MB, lastQueryId);
    }

    static String percent(int done, int total) {
        if (total <= 0) return "-";
        return String.format(Locale.ROOT, "%.1f%%", done * 100.0 / total);
    }
}
