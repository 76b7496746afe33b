package com.largomodo.bayalloc.service;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads client exports saved from spreadsheet tools.
 * <p>
 * UTF-8 with optional byte order mark. The delimiter (';' or ',') is sniffed from the header
 * line and handed to Commons CSV: fields may be double-quoted, with {@code ""} as an escaped quote
 * and line breaks allowed inside quotes. A quote inside an unquoted field is kept as text. Blank
 * lines are ignored; records keep the physical line they start on.
 */
public class CsvTableReader {

    private static final char BOM = '\uFEFF';

    /**
     * @throws InputDataException if the file is missing, has no header line or cannot be tokenized
     * @throws IOException        if the file cannot be read
     */
    public CsvTable read(Path file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("File cannot be null");
        }
        if (!Files.isRegularFile(file)) {
            throw new InputDataException(file, "input file does not exist");
        }

        String content;
        try {
            content = stripBom(Files.readString(file, StandardCharsets.UTF_8));
        } catch (CharacterCodingException e) {
            throw new InputDataException(file, "file is not valid UTF-8", e);
        }
        char delimiter = sniffDelimiter(firstLine(content));

        List<CsvTable.Record> records = parse(file, content, delimiter);
        if (records.isEmpty()) {
            throw new InputDataException(file, "file is empty");
        }

        return new CsvTable(file, records.get(0).fields(), records.subList(1, records.size()));
    }

    static String stripBom(String value) {
        if (value == null || value.isEmpty()) {
            return value;
        }
        return value.charAt(0) == BOM ? value.substring(1) : value;
    }

    /**
     * Semicolon wins whenever it occurs in the sample; comma otherwise.
     */
    static char sniffDelimiter(String sample) {
        if (sample == null || sample.isEmpty()) {
            return ',';
        }
        return sample.indexOf(';') >= 0 ? ';' : ',';
    }

    private static String firstLine(String content) {
        int end = content.indexOf('\n');
        return end >= 0 ? content.substring(0, end) : content;
    }

    private static List<CsvTable.Record> parse(Path file, String content, char delimiter)
            throws InputDataException {
        // Empty lines come through as records so the parser's line counter stays in step
        CSVFormat format = CSVFormat.DEFAULT.withDelimiter(delimiter).withIgnoreEmptyLines(false);

        List<CsvTable.Record> records = new ArrayList<>();
        try (CSVParser parser = CSVParser.parse(new StringReader(content), format)) {
            long recordStart = 1;
            for (CSVRecord record : parser) {
                List<String> fields = new ArrayList<>(record.size());
                for (String value : record) {
                    fields.add(value);
                }
                if (!fields.stream().allMatch(String::isBlank)) {
                    records.add(new CsvTable.Record((int) recordStart, fields));
                }
                recordStart = parser.getCurrentLineNumber() + 1;
            }
        } catch (IOException | UncheckedIOException e) {
            throw new InputDataException(file, "malformed delimited data: " + e.getMessage(), e);
        }
        return records;
    }
}
