package infra.output;

import domain.model.FingerprintWarning;
import domain.model.QueryResult;
import domain.querylog.FingerprintSummary;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * XLSX report writer.
 *
 * <p>Sheets:
 * <ul>
 *   <li>fingerprints: one row per fingerprint, most frequent first</li>
 *   <li>queries: SUCCESS/SKIP per query-log row</li>
 *   <li>warnings: non-fatal warnings (standard codes)</li>
 * </ul>
 */
public final class FingerprintReportXlsxWriter {

    static final String SHEET_FINGERPRINTS = "fingerprints";
    static final String SHEET_QUERIES = "queries";
    static final String SHEET_WARNINGS = "warnings";

    // Excel cell text limit
    static final int MAX_CELL_TEXT = 32_767;

    static final String[] FINGERPRINT_HEADERS = {
            "fingerprintHash", "fingerprint", "count", "timedCount",
            "totalDurationMs", "avgDurationMs", "maxDurationMs", "firstQueryId", "sampleSql"
    };

    private static void writeFingerprintsSheet(Workbook wb, List<FingerprintSummary> summaries) {
        Sheet sh = wb.createSheet(SHEET_FINGERPRINTS);
        int r = 0;
        writeHeader(sh.createRow(r++), FINGERPRINT_HEADERS);

        for (FingerprintSummary it : summaries) {
            Row row = sh.createRow(r++);
            row.createCell(0)
                    .setCellValue(text(it.getFingerprintHash()));
            row.createCell(1)
                    .setCellValue(text(it.getFingerprint()));
            row.createCell(2)
                    .setCellValue(it.getCount());
            row.createCell(3)
                    .setCellValue(it.getTimedCount());
            row.createCell(4)
                    .setCellValue(it.getTotalDurationMs());
            row.createCell(5)
                    .setCellValue(it.getAvgDurationMs());
            row.createCell(6)
                    .setCellValue(it.getMaxDurationMs());
            row.createCell(7)
                    .setCellValue(text(it.getFirstQueryId()));
            row.createCell(8)
                    .setCellValue(text(it.getSampleSql()));
        }
    }

    private static void writeQueriesSheet(Workbook wb, List<QueryResult> results) {
        Sheet sh = wb.createSheet(SHEET_QUERIES);
        int r = 0;
        writeHeader(sh.createRow(r++), new String[]{"status", "queryId", "fingerprintHash", "fingerprint", "message"});

        for (QueryResult it : results) {
            Row row = sh.createRow(r++);
            row.createCell(0)
                    .setCellValue(text(it.getStatus()));
            row.createCell(1)
                    .setCellValue(text(it.getQueryId()));
            row.createCell(2)
                    .setCellValue(text(it.getFingerprintHash()));
            row.createCell(3)
                    .setCellValue(text(it.getFingerprint()));
            row.createCell(4)
                    .setCellValue(text(it.getMessage()));
        }
    }

    private static void writeWarningsSheet(Workbook wb, List<FingerprintWarning> warnings) {
        Sheet sh = wb.createSheet(SHEET_WARNINGS);
        int r = 0;
        writeHeader(sh.createRow(r++), new String[]{"code", "queryId", "message", "detail"});

        for (FingerprintWarning w : warnings) {
            Row row = sh.createRow(r++);
            row.createCell(0)
                    .setCellValue(w.getCode().name());
            row.createCell(1)
                    .setCellValue(text(w.getQueryId()));
            row.createCell(2)
                    .setCellValue(text(w.getMessage()));
            row.createCell(3)
                    .setCellValue(text(w.getDetail()));
        }
    }

    private static void writeHeader(Row header, String[] names) {
        for (int i = 0; i < names.length; i++) {
            header.createCell(i)
                    .setCellValue(names[i]);
        }
    }

    /** null-safe and clipped to the cell limit (POI rejects longer strings). */
    static String text(String s) {
        if (s == null) return "";
        return s.length() > MAX_CELL_TEXT ? s.substring(0, MAX_CELL_TEXT) : s;
    }

    public void write(
            Path resultXlsx,
            List<FingerprintSummary> summaries,
            List<QueryResult> results,
            List<FingerprintWarning> warnings
    ) {
        if (resultXlsx == null) throw new IllegalArgumentException("resultXlsx is null");
        if (summaries == null) throw new IllegalArgumentException("summaries is null");
        if (results == null) throw new IllegalArgumentException("results is null");
        if (warnings == null) throw new IllegalArgumentException("warnings is null");

        try {
            Path parent = resultXlsx.toAbsolutePath()
                    .normalize()
                    .getParent();
            if (parent != null) Files.createDirectories(parent);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to create resultXlsx parent dir: " + resultXlsx, e);
        }

        try (Workbook wb = new XSSFWorkbook()) {
            writeFingerprintsSheet(wb, summaries);
            writeQueriesSheet(wb, results);
            writeWarningsSheet(wb, warnings);

            try (OutputStream os = Files.newOutputStream(resultXlsx)) {
                wb.write(os);
            }
        } catch (Exception e) {
            throw new IllegalStateException("Failed to write xlsx: " + resultXlsx, e);
        }
    }
}
