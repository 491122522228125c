package infra.output;

import domain.querylog.FingerprintSummary;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes the fingerprint summary as CSV (same columns as the {@code fingerprints} sheet).
 */
public final class FingerprintSummaryCsvWriter {

    public void write(Path csv, List<FingerprintSummary> summaries) {
        if (csv == null) throw new IllegalArgumentException("csv is null");
        if (summaries == null) throw new IllegalArgumentException("summaries is null");

        try {
            Path parent = csv.toAbsolutePath().normalize().getParent();
            if (parent != null) Files.createDirectories(parent);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to create csv parent dir: " + csv, e);
        }

        CSVFormat format = CSVFormat.DEFAULT
                .builder()
                .setHeader(FingerprintReportXlsxWriter.FINGERPRINT_HEADERS)
                .build();

        try (Writer w = Files.newBufferedWriter(csv, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(w, format)) {
            for (FingerprintSummary it : summaries) {
                printer.printRecord(
                        it.getFingerprintHash(),
                        it.getFingerprint(),
                        it.getCount(),
                        it.getTimedCount(),
                        it.getTotalDurationMs(),
                        it.getAvgDurationMs(),
                        it.getMaxDurationMs(),
                        it.getFirstQueryId(),
                        it.getSampleSql()
                );
            }
        } catch (Exception e) {
            throw new IllegalStateException("Failed to write csv: " + csv, e);
        }
    }
}
