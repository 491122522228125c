package infra.querylog;

import org.apache.commons.csv.CSVFormat;

import org.apache.commons.csv.CSVParser;

import org.apache.commons.csv.CSVRecord;

import java.io.IOException;

import java.io.InputStreamReader;

import java.io.Reader;

import java.nio.charset.StandardCharsets;

import java.nio.file.Files;

import java.nio.file.Path;

import java.util.*;

import domain.querylog.QueryLogEntry;

/**
 * Query-log CSV loader.
 *
 * <p>The first row is the header. Header names are matched after normalization
 * (case, BOM, spaces and punctuation ignored), so {@code SQL Text}, {@code sql_text} and
 * {@code sqlText} are the same column.</p>
 * <ul>
 *   <li>SQL text (required): sql_text, sql, query, statement, query_text</li>
 *   <li>query id (optional): query_id, id, queryid, digest_id</li>
 *   <li>duration ms (optional): duration_ms, duration, elapsed_ms, elapsed, time_ms</li>
 * </ul>
 * Blank header cells become {@code COL_n}. Rows with a blank SQL cell are kept so the caller can
 * report them.
 */
public class QueryLogCsvLoader {

    static final String[] SQL_HEADERS = {"sql_text", "sql", "query", "statement", "query_text"};
    static final String[] ID_HEADERS = {"query_id", "id", "queryid", "digest_id"};
    static final String[] DURATION_HEADERS = {"duration_ms", "duration", "elapsed_ms", "elapsed", "time_ms"};

    public List<QueryLogEntry> load(Path csv) {
        if (csv == null) throw new IllegalArgumentException("csv path is null");

        try (Reader reader = new InputStreamReader(Files.newInputStream(csv), StandardCharsets.UTF_8);
             CSVParser parser = CSVFormat.DEFAULT
                     .builder()
                     .setTrim(true)
                     .build()
                     .parse(reader)) {

            Iterator<CSVRecord> it = parser.iterator();
            if (!it.hasNext()) return Collections.emptyList();

            // header row (raw)
            CSVRecord headerRec = it.next();
            List<String> headers = new ArrayList<>(headerRec.size());
            for (int i = 0; i < headerRec.size(); i++) {
                String h = stripBom(safe(headerRec.get(i))).trim();
                if (h.isBlank()) h = "COL_" + (i + 1);
                headers.add(h);
            }

            // normalized header -> index (first wins)
            Map<String, Integer> headerIndex = new LinkedHashMap<>();
            for (int i = 0; i < headers.size(); i++) {
                headerIndex.putIfAbsent(norm(headers.get(i)), i);
            }

            Integer sqlIdx = findIndex(headerIndex, SQL_HEADERS);
            if (sqlIdx == null) {
                throw new IllegalArgumentException("query log has no SQL column (expected one of "
                        + Arrays.toString(SQL_HEADERS) + "): headers=" + headers);
            }
            Integer idIdx = findIndex(headerIndex, ID_HEADERS);
            Integer durationIdx = findIndex(headerIndex, DURATION_HEADERS);

            List<QueryLogEntry> out = new ArrayList<>(1024);
            int rowNumber = 0;

            while (it.hasNext()) {
                CSVRecord r = it.next();
                rowNumber++;

                String sqlText = cell(r, sqlIdx);
                String queryId = cell(r, idIdx).trim();
                String durationRaw = cell(r, durationIdx).trim();

                out.add(new QueryLogEntry(rowNumber, queryId, sqlText, parseDuration(durationRaw), durationRaw));
            }

            System.out.println("[QUERYLOG] loaded=" + out.size() + " sqlColumn=" + headers.get(sqlIdx)
                    + " idColumn=" + (idIdx == null ? "-" : headers.get(idIdx))
                    + " durationColumn=" + (durationIdx == null ? "-" : headers.get(durationIdx)));

            return out;

        } catch (IOException e) {
            throw new IllegalStateException("Failed to load query log csv: " + csv, e);
        }
    }

    /**
     * Accepts plain numbers and an optional {@code ms} suffix ({@code 12.5}, {@code 12ms}).
     *
     * @return null when blank or not a number
     */
    static Double parseDuration(String raw) {
        if (raw == null) return null;
        String t = raw.trim().toLowerCase(Locale.ROOT);
        if (t.endsWith("ms")) t = t.substring(0, t.length() - 2).trim();
        if (t.isEmpty()) return null;
        try {
            double d = Double.parseDouble(t);
            if (Double.isNaN(d) || Double.isInfinite(d) || d < 0) return null;
            return d;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String cell(CSVRecord r, Integer idx) {
        if (idx == null) return "";
        if (idx < 0 || idx >= r.size()) return "";
        return safe(r.get(idx));
    }

    private static Integer findIndex(Map<String, Integer> headerIndex, String... candidates) {
        for (String c : candidates) {
            Integer i = headerIndex.get(norm(c));
            if (i != null) return i;
        }
        return null;
    }

    static String norm(String s) {
        String t = stripBom(safe(s)).trim().toLowerCase(Locale.ROOT);
        // letters/digits only
        return t.replaceAll("[^\\p{L}\\p{Nd}]+", "");
    }

    private static String stripBom(String s) {
        if (s == null) return "";
        if (!s.isEmpty() && s.charAt(0) == '\uFEFF') return s.substring(1);
        return s;
    }

    private static String safe(String s) {
        return s == null ? "" : s;
    }
}
