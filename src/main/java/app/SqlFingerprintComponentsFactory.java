package app;

import domain.fingerprint.SqlFingerprinter;
import domain.output.ResultWriter;
import domain.querylog.FingerprintAggregator;
import domain.querylog.QueryLogEntry;
import infra.output.FingerprintReportXlsxWriter;
import infra.output.FingerprintSummaryCsvWriter;
import infra.output.NullResultWriter;
import infra.output.XlsxResultWriter;
import infra.querylog.QueryLogCsvLoader;

import java.nio.file.Path;
import java.util.List;

/**
 * Object-assembly factory for {@link SqlFingerprintCliApp}.
 * <p>
 * Keeps the CLI app focused on orchestration/logging; object creation lives here.
 */
final class SqlFingerprintComponentsFactory {

    List<QueryLogEntry> loadQueryLog(Path queryLogCsv) {
        return new QueryLogCsvLoader().load(queryLogCsv);
    }

    SqlFingerprinter createFingerprinter() {
        return new SqlFingerprinter();
    }

    FingerprintAggregator createAggregator() {
        return new FingerprintAggregator();
    }

    ResultWriter createResultWriter(boolean enable) {
        if (!enable) return new NullResultWriter();
        return new XlsxResultWriter(new FingerprintReportXlsxWriter());
    }

    /** null when no {@code --csvOut} was given. */
    FingerprintSummaryCsvWriter createSummaryCsvWriter(Path csvOut) {
        return (csvOut == null) ? null : new FingerprintSummaryCsvWriter();
    }
}
