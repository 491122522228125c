package domain.output;

import java.nio.file.Path;

import java.util.List;

import domain.model.FingerprintWarning;

import domain.model.QueryResult;

import domain.querylog.FingerprintSummary;

/** Stores the report of a fingerprint run. */
public interface ResultWriter {

    void write(
            Path target,
            List<FingerprintSummary> summaries,
            List<QueryResult> results,
            List<FingerprintWarning> warnings
    );
}
