package infra.output;

import domain.model.FingerprintWarning;
import domain.model.QueryResult;
import domain.output.ResultWriter;
import domain.querylog.FingerprintSummary;

import java.nio.file.Path;
import java.util.List;

/**
 * No-op implementation (feature toggle).
 */
public final class NullResultWriter implements ResultWriter {
    @Override
    public void write(
            Path target,
            List<FingerprintSummary> summaries,
            List<QueryResult> results,
            List<FingerprintWarning> warnings
    ) {
        // intentionally no-op
    }
}
