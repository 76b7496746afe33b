package com.largomodo.bayalloc.service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parsed delimited file: trimmed header names plus data rows.
 */
public final class CsvTable {

    private final Path source;
    private final Map<String, Integer> columns;
    private final List<Row> rows;

    CsvTable(Path source, List<String> headers, List<Record> records) {
        this.source = source;
        Map<String, Integer> index = new LinkedHashMap<>();
        for (int i = 0; i < headers.size(); i++) {
            index.putIfAbsent(headers.get(i).trim(), i);
        }
        this.columns = Collections.unmodifiableMap(index);
        List<Row> parsed = new ArrayList<>();
        for (Record record : records) {
            parsed.add(new Row(columns, record.lineNumber(), record.fields()));
        }
        this.rows = Collections.unmodifiableList(parsed);
    }

    public Path source() {
        return source;
    }

    public boolean hasColumn(String name) {
        return columns.containsKey(name);
    }

    /**
     * @throws InputDataException if the header line lacks one of the columns
     */
    public void requireColumns(String... names) throws InputDataException {
        for (String name : names) {
            if (!hasColumn(name)) {
                throw new InputDataException(source, "missing required column '" + name + "' (found "
                        + columns.keySet() + ")");
            }
        }
    }

    public List<Row> rows() {
        return rows;
    }

    /**
     * Raw record as split by the reader.
     */
    record Record(int lineNumber, List<String> fields) {
    }

    /**
     * One data record.
     */
    public static final class Row {

        private final Map<String, Integer> columns;
        private final int lineNumber;
        private final List<String> values;

        Row(Map<String, Integer> columns, int lineNumber, List<String> values) {
            this.columns = columns;
            this.lineNumber = lineNumber;
            this.values = List.copyOf(values);
        }

        /**
         * Physical line where the record starts (header is line 1).
         */
        public int lineNumber() {
            return lineNumber;
        }

        /**
         * Trimmed value of a column; empty when the column or the cell is absent.
         */
        public String get(String column) {
            Integer index = columns.get(column);
            if (index == null || index >= values.size()) {
                return "";
            }
            return values.get(index).trim();
        }

        /**
         * Value of the first column present among {@code candidates}.
         */
        public String first(String... candidates) {
            for (String candidate : candidates) {
                if (columns.containsKey(candidate)) {
                    return get(candidate);
                }
            }
            return "";
        }
    }
}
