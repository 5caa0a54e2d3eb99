package com.imagebuilder.metrics.ingest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pipe-delimited database dump: a header row of column names, a row of dashes, data rows, and a
 * {@code (N rows)} footer. Cells are trimmed; missing trailing cells read as empty.
 */
final class DumpTable {
    private static final Logger LOG = LoggerFactory.getLogger(DumpTable.class);

    private static final Pattern ROW_COUNT = Pattern.compile("\\((\\d+) rows?\\)");

    private final List<String> columns;
    private final List<Map<String, String>> rows;
    private final int declaredRows;

    private DumpTable(List<String> columns, List<Map<String, String>> rows, int declaredRows) {
        this.columns = Collections.unmodifiableList(columns);
        this.rows = Collections.unmodifiableList(rows);
        this.declaredRows = declaredRows;
    }

    static DumpTable read(Path path) {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            DumpTable table = parse(reader, path.toString());
            LOG.info("Read {} rows with columns {} from {}", table.rows.size(), table.columns, path);
            return table;
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read dump file: " + path, ex);
        }
    }

    static DumpTable parse(BufferedReader reader, String source) throws IOException {
        String header = reader.readLine();
        if (header == null) {
            throw new IllegalStateException("Dump " + source + " is empty");
        }
        List<String> columns = splitRow(header);
        // Separator row of dashes.
        reader.readLine();

        List<Map<String, String>> rows = new ArrayList<>();
        int declaredRows = -1;
        int lineNo = 2;
        String line;
        while ((line = reader.readLine()) != null) {
            lineNo++;
            Matcher footer = ROW_COUNT.matcher(line.trim());
            if (footer.matches()) {
                declaredRows = Integer.parseInt(footer.group(1));
                break;
            }
            if (line.isBlank()) {
                continue;
            }
            List<String> cells = splitRow(line);
            if (cells.size() > columns.size()) {
                throw new IllegalStateException("Dump " + source + " line " + lineNo + " has " + cells.size()
                        + " cells but header declares " + columns.size() + " columns");
            }
            Map<String, String> row = new LinkedHashMap<>();
            for (int i = 0; i < columns.size(); i++) {
                row.put(columns.get(i), i < cells.size() ? cells.get(i) : "");
            }
            rows.add(row);
        }

        if (declaredRows == -1) {
            LOG.warn("Failed to parse row count footer in {}", source);
        } else if (declaredRows != rows.size()) {
            LOG.warn("Read {} records but row count in dump footer of {} states {} rows",
                    rows.size(), source, declaredRows);
        }
        return new DumpTable(columns, rows, declaredRows);
    }

    List<String> columns() {
        return columns;
    }

    List<Map<String, String>> rows() {
        return rows;
    }

    int declaredRows() {
        return declaredRows;
    }

    private static List<String> splitRow(String line) {
        List<String> cells = new ArrayList<>();
        for (String cell : line.split("\\|", -1)) {
            cells.add(cell.trim());
        }
        return cells;
    }
}
