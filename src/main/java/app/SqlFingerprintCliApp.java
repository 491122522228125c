package app;

import java.nio.file.Path;

import java.util.ArrayList;

import java.util.List;

import java.util.Map;

import cli.CliArgParser;

import cli.CliPathResolver;

import cli.CliProgressMonitor;

import cli.SqlFingerprintCli;

import domain.fingerprint.FingerprintException;

import domain.fingerprint.LexErrorKind;

import domain.fingerprint.SqlFingerprinter;

import domain.model.FingerprintWarning;

import domain.model.ListWarningSink;

import domain.model.QueryResult;

import domain.model.WarningCode;

import domain.model.WarningSink;

import domain.output.ResultWriter;

import domain.querylog.FingerprintAggregator;

import domain.querylog.FingerprintSummary;

import domain.querylog.QueryLogEntry;

import infra.output.FingerprintSummaryCsvWriter;

/**
 * CLI entry (invoked by {@link SqlFingerprintCli}).
 *
 * <pre>
 *   --sql="SELECT ..."                  print one fingerprint
 *   --in=query-log.csv [--out=report.xlsx] [--csvOut=summary.csv]
 *        [--max=n] [--logEvery=n] [--slowMs=n] [--failFast] [--noResult] [--baseDir=dir]
 * </pre>
 * {@code --input} is an alias of {@code --in}, {@code --noXlsx} of {@code --noResult}.
 */
public final class SqlFingerprintCliApp {

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILED = 1;
    public static final int EXIT_USAGE = 2;

    static final String DEFAULT_OUT = "output/fingerprint-report.xlsx";
    static final int DEFAULT_LOG_EVERY = 1000;
    static final long DEFAULT_SLOW_MS = 50L;

    private SqlFingerprintCliApp() {}

    public static void main(String[] args) {
        int code = run(args);
        if (code != EXIT_OK) System.exit(code);
    }

    /**
     * @return process exit status ({@link #EXIT_OK}, {@link #EXIT_FAILED}, {@link #EXIT_USAGE})
     */
    public static int run(String[] args) {
        Map<String, String> argv = CliArgParser.parseArgs(args);

        if (argv.containsKey("sql")) {
            return runSingle(argv.get("sql"));
        }

        String in = CliArgParser.firstNonBlank(argv, "in", "input");
        if (in == null) {
            printUsage();
            return EXIT_USAGE;
        }

        try {
            return runBatch(argv, in);
        } catch (IllegalArgumentException e) {
            System.out.println("[ERROR] " + e.getMessage());
            return EXIT_USAGE;
        }
    }

    static int runSingle(String sql) {
        try {
            System.out.println(new SqlFingerprinter().fingerprint(sql));
            return EXIT_OK;
        } catch (FingerprintException e) {
            System.err.println("[ERROR] " + e.getMessage());
            return EXIT_FAILED;
        }
    }

    private static int runBatch(Map<String, String> argv, String in) {
        long t0 = System.nanoTime();

        // ------------------------------------------------------------
        // baseDir + paths
        // ------------------------------------------------------------
        Path baseDir = CliPathResolver.resolveBaseDir(argv);

        Path queryLogCsv = CliPathResolver.resolveOption(baseDir, in);
        Path resultXlsx = CliPathResolver.resolveOption(baseDir, argv.get("out"), DEFAULT_OUT);
        Path summaryCsv = CliPathResolver.resolveOption(baseDir, argv.get("csvOut"));

        int max = CliArgParser.parseInt(argv.get("max"), -1);
        int logEvery = Math.max(1, CliArgParser.parseInt(argv.get("logEvery"), DEFAULT_LOG_EVERY));
        long slowMs = CliArgParser.parseLong(argv.get("slowMs"), DEFAULT_SLOW_MS);
        boolean failFast = CliArgParser.flag(argv, "failFast");
        boolean noResult = CliArgParser.flag(argv, "noResult") || CliArgParser.flag(argv, "noXlsx");

        System.out.println("==================================================");
        System.out.println("[START] SQL fingerprint run");
        System.out.println("[CONF] baseDir        = " + baseDir);
        System.out.println("[CONF] in             = " + queryLogCsv);
        System.out.println("[CONF] out            = " + resultXlsx);
        System.out.println("[CONF] csvOut         = " + (summaryCsv == null ? "-" : summaryCsv));
        System.out.println("[CONF] max            = " + max);
        System.out.println("[CONF] logEvery       = " + logEvery);
        System.out.println("[CONF] slowMs         = " + slowMs);
        System.out.println("[CONF] failFast       = " + failFast);
        System.out.println("[CONF] enableResult   = " + (!noResult) + " (use --noResult)");
        System.out.println("==================================================");

        CliPathResolver.requireReadableFile(queryLogCsv, "query log csv (--in)");

        // ------------------------------------------------------------
        // assemble runtime components
        // ------------------------------------------------------------
        SqlFingerprintComponentsFactory factory = new SqlFingerprintComponentsFactory();

        long tLoad0 = System.nanoTime();
        System.out.println("[STEP1] loading query log...");
        List<QueryLogEntry> entries = factory.loadQueryLog(queryLogCsv);
        System.out.println("[STEP1] query log loaded. size=" + entries.size() + ", elapsed=" + ms(tLoad0) + "ms");

        if (max > 0 && entries.size() > max) {
            entries = entries.subList(0, max);
            System.out.println("[STEP1] apply max => truncated to " + entries.size());
        }

        SqlFingerprinter fingerprinter = factory.createFingerprinter();
        FingerprintAggregator aggregator = factory.createAggregator();
        ResultWriter resultWriter = factory.createResultWriter(!noResult);
        FingerprintSummaryCsvWriter summaryCsvWriter = factory.createSummaryCsvWriter(summaryCsv);

        // warnings (collected even when result xlsx is disabled)
        List<FingerprintWarning> warnings = new ArrayList<>(128);
        WarningSink warningSink = new ListWarningSink(warnings);

        int total = entries.size();
        List<QueryResult> results = new ArrayList<>(Math.max(16, total));
        int success = 0;
        int skip = 0;
        boolean aborted = false;

        Thread heartbeat = CliProgressMonitor.startHeartbeat(total);
        long tLoop0 = System.nanoTime();
        System.out.println("[STEP2] fingerprinting start. total=" + total);

        try {
            for (int i = 0; i < total; i++) {
                QueryLogEntry entry = entries.get(i);
                String key = entry.getQueryId();
                CliProgressMonitor.setCurrent(key, i + 1);

                if (entry.isDurationInvalid()) {
                    warningSink.warn(new FingerprintWarning(
                            WarningCode.DURATION_INVALID, key,
                            "duration is not a number", entry.getDurationRaw()
                    ));
                }

                String sqlText = entry.getSqlText();
                if (sqlText.isBlank()) {
                    skip++;
                    results.add(QueryResult.skip(key, WarningCode.SQL_TEXT_EMPTY.name()));
                    warningSink.warn(FingerprintWarning.of(WarningCode.SQL_TEXT_EMPTY, key, "SQL text empty"));
                    logProgressIfDue(i + 1, total, logEvery, success, skip, aggregator, tLoop0, key);
                    continue;
                }

                long one0 = System.nanoTime();
                try {
                    String fingerprint = fingerprinter.fingerprint(sqlText);

                    if (fingerprint.isEmpty()) {
                        // comment-only statement
                        skip++;
                        results.add(QueryResult.skip(key, WarningCode.SQL_TEXT_EMPTY.name()));
                        warningSink.warn(FingerprintWarning.of(
                                WarningCode.SQL_TEXT_EMPTY, key, "SQL text has no tokens after comment removal"));
                    } else {
                        String hash = aggregator.add(fingerprint, entry);
                        success++;
                        results.add(QueryResult.success(key, hash, fingerprint));
                    }

                } catch (FingerprintException e) {
                    LexErrorKind kind = e.getKind();
                    String reason = (kind == null) ? e.getClass().getSimpleName() : kind.name();

                    skip++;
                    results.add(QueryResult.skip(key, reason));
                    warningSink.warn(new FingerprintWarning(
                            WarningCode.FINGERPRINT_ERROR, key, reason, safe(e.getMessage())
                    ));

                    System.out.println("[ERROR] fingerprint failed: " + key);
                    System.out.println("        " + safe(e.getMessage()));

                    if (failFast) {
                        System.out.println("[FAILFAST] stop on first error.");
                        aborted = true;
                        break;
                    }
                }

                long oneMs = (System.nanoTime() - one0) / 1_000_000L;
                if (oneMs >= slowMs) {
                    System.out.println("[SLOW] " + oneMs + "ms : " + key);
                    warningSink.warn(new FingerprintWarning(
                            WarningCode.SLOW_FINGERPRINT, key,
                            "slowMs=" + slowMs + ", actualMs=" + oneMs, ""
                    ));
                }

                logProgressIfDue(i + 1, total, logEvery, success, skip, aggregator, tLoop0, key);
            }
        } finally {
            heartbeat.interrupt();
        }

        List<FingerprintSummary> summaries = aggregator.summaries();

        System.out.println("[STEP2] fingerprinting done. elapsed=" + ms(tLoop0) + "ms");
        System.out.println("[STAT] success=" + success + ", skip=" + skip + ", fingerprints=" + summaries.size());
        System.out.println("[STAT] warnings=" + warnings.size());

        if (!noResult) {
            long tXlsx0 = System.nanoTime();
            System.out.println("[STEP3] writing result xlsx... fingerprints=" + summaries.size() + ", rows=" + results.size());
            resultWriter.write(resultXlsx, summaries, results, warnings);
            System.out.println("[STEP3] result xlsx written. elapsed=" + ms(tXlsx0) + "ms");
        } else {
            System.out.println("[STEP3] result xlsx skipped (--noResult). rows=" + results.size());
        }

        if (summaryCsvWriter != null) {
            long tCsv0 = System.nanoTime();
            System.out.println("[STEP4] writing summary csv... rows=" + summaries.size());
            summaryCsvWriter.write(summaryCsv, summaries);
            System.out.println("[STEP4] summary csv written. elapsed=" + ms(tCsv0) + "ms");
        } else {
            System.out.println("[STEP4] summary csv skipped (no --csvOut).");
        }

        System.out.println("==================================================");
        System.out.println("[DONE] totalElapsed=" + ms(t0) + "ms" + (aborted ? " (aborted by --failFast)" : ""));
        System.out.println("==================================================");

        return aborted ? EXIT_FAILED : EXIT_OK;
    }

    private static void logProgressIfDue(int done, int total, int logEvery, int success, int skip,
                                         FingerprintAggregator aggregator, long loopStartNs, String key) {
        if (done % logEvery == 0 || done == total) {
            CliProgressMonitor.logProgress(done, total, success, skip, aggregator.size(), loopStartNs, key);
        }
    }

    private static void printUsage() {
        System.out.println("usage:");
        System.out.println("  --sql=\"<statement>\"            print the fingerprint of one statement");
        System.out.println("  --in=<query-log.csv>           fingerprint a query log (alias --input)");
        System.out.println("     [--out=<report.xlsx>]       default " + DEFAULT_OUT);
        System.out.println("     [--csvOut=<summary.csv>] [--max=<n>] [--logEvery=<n>] [--slowMs=<n>]");
        System.out.println("     [--failFast] [--noResult|--noXlsx] [--baseDir=<dir>]");
    }

    private static long ms(long nanoStart) {
        return (System.nanoTime() - nanoStart) / 1_000_000L;
    }

    private static String safe(String s) {
        return (s == null) ? "" : s;
    }
}
