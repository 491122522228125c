package infra.output;

import java.nio.file.Path;

import java.util.List;

import domain.model.FingerprintWarning;

import domain.model.QueryResult;

import domain.output.ResultWriter;

import domain.querylog.FingerprintSummary;

/** {@link ResultWriter} backed by {@link FingerprintReportXlsxWriter}. */
public final class XlsxResultWriter implements ResultWriter {

    private final FingerprintReportXlsxWriter delegate;

    public XlsxResultWriter(FingerprintReportXlsxWriter delegate) {
        this.delegate = delegate;
    }

    @Override
    public void write(
            Path target,
            List<FingerprintSummary> summaries,
            List<QueryResult> results,
            List<FingerprintWarning> warnings
    ) {
        delegate.write(target, summaries, results, warnings);
    }
}
