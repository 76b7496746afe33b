package com.largomodo.bayalloc.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class CsvTableReaderTest {

    @TempDir
    Path tempDir;

    private final CsvTableReader reader = new CsvTableReader();

    @Test
    void testStripBom() {
        assertEquals("a,b", CsvTableReader.stripBom("\uFEFFa,b"));
        assertEquals("", CsvTableReader.stripBom(""));
        assertNull(CsvTableReader.stripBom(null));
    }

    @Test
    void testSniffDelimiterPrefersSemicolon() {
        assertEquals(';', CsvTableReader.sniffDelimiter("a;b;c"));
        assertEquals(';', CsvTableReader.sniffDelimiter("a,b;c"));
        assertEquals(',', CsvTableReader.sniffDelimiter("a,b,c"));
        assertEquals(',', CsvTableReader.sniffDelimiter(""));
    }

    @Test
    void testReadsSemicolonFileWithBom() throws IOException {
        Path file = write("\uFEFFLocation;Slot Type\r\nD11-021-11;PP3\r\nD11-021-12;BLL\r\n");

        CsvTable table = reader.read(file);

        assertTrue(table.hasColumn("Location"), "BOM must not stick to the first header");
        assertEquals(2, table.rows().size());
        assertEquals("D11-021-11", table.rows().get(0).get("Location"));
        assertEquals("BLL", table.rows().get(1).get("Slot Type"));
    }

    @Test
    void testQuotedFields() throws IOException {
        Path file = write("Artikelnummer,Artikeloms Verkoop\n"
                + "1,\"Koffie, bonen\"\n"
                + "2,\"Thee \"\"Earl\"\" Grey\"\n"
                + "3,\"Two\nlines\"\n"
                + "4,Plain\n");

        CsvTable table = reader.read(file);

        assertEquals("Koffie, bonen", table.rows().get(0).get("Artikeloms Verkoop"));
        assertEquals("Thee \"Earl\" Grey", table.rows().get(1).get("Artikeloms Verkoop"));
        assertEquals("Two\nlines", table.rows().get(2).get("Artikeloms Verkoop"));
        assertEquals(6, table.rows().get(3).lineNumber(), "Line numbers count physical lines");
    }

    @Test
    void testQuoteInsideUnquotedFieldIsText() throws IOException {
        Path file = write("Artikelnummer;Locatiecode;Omschrijving\n"
                + "1;A-1-1;12\" pipe\n"
                + "2;A-1-2;x\n"
                + "3;A-1-3;y\n");

        CsvTable table = reader.read(file);

        assertEquals(3, table.rows().size(), "An inch mark must not swallow the following rows");
        assertEquals("12\" pipe", table.rows().get(0).get("Omschrijving"));
        assertEquals("A-1-3", table.rows().get(2).get("Locatiecode"));
        assertEquals(4, table.rows().get(2).lineNumber());
    }

    @Test
    void testUnterminatedQuoteFailsTheFile() throws IOException {
        Path file = write("Artikelnummer;Omschrijving\n1;\"open\n2;x\n");

        InputDataException e = assertThrows(InputDataException.class, () -> reader.read(file));
        assertEquals(file, e.getSource());
    }

    @Test
    void testBlankLinesIgnoredAndMissingCellsEmpty() throws IOException {
        Path file = write("A;B;C\n\n1;2\n;;\n4;5;6");

        CsvTable table = reader.read(file);

        assertEquals(2, table.rows().size());
        assertEquals("", table.rows().get(0).get("C"));
        assertEquals("", table.rows().get(0).get("Unknown"));
        assertEquals(3, table.rows().get(0).lineNumber());
        assertEquals("6", table.rows().get(1).get("C"), "Last record without trailing newline");
    }

    @Test
    void testHeadersAreTrimmed() throws IOException {
        Path file = write(" Location ; Area \nX-1-1;D\n");

        CsvTable table = reader.read(file);

        assertEquals("D", table.rows().get(0).get("Area"));
    }

    @Test
    void testFirstAvailableColumn() throws IOException {
        Path file = write("Order_type;Artikelnummer\nRUSH;1\n");

        CsvTable.Row row = reader.read(file).rows().get(0);

        assertEquals("RUSH", row.first("Ordertype", "Order_type"));
        assertEquals("", row.first("Nope"));
    }

    @Test
    void testRequireColumns() throws IOException {
        CsvTable table = reader.read(write("Location;Aisle\nX;1\n"));

        table.requireColumns("Location");
        InputDataException e = assertThrows(InputDataException.class, () -> table.requireColumns("Bay"));
        assertTrue(e.getMessage().contains("'Bay'"));
    }

    @Test
    void testMissingAndEmptyFiles() throws IOException {
        assertThrows(InputDataException.class, () -> reader.read(tempDir.resolve("missing.csv")));
        assertThrows(InputDataException.class, () -> reader.read(write("")));
        assertThrows(InputDataException.class, () -> reader.read(write("\n\n")));
    }

    private Path write(String content) throws IOException {
        Path file = Files.createTempFile(tempDir, "table", ".csv");
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }
}
