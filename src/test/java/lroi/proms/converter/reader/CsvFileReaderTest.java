package lroi.proms.converter.reader;

import lroi.proms.converter.model.SourceRow;
import lroi.proms.converter.util.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for CsvFileReader
 * Tests delimiter detection, quoting, BOM handling and blank rows
 */
class CsvFileReaderTest {

    @TempDir
    Path tempDir;

    private CsvFileReader reader;

    @BeforeEach
    void setUp() {
        reader = new CsvFileReader();
    }

    // ========== parseRecords Tests ==========

    @Test
    void testParseRecords_SimpleValues() {
        List<List<String>> records = reader.parseRecords("P001,45,15/03/2024\nP002,40,16/03/2024\n", ',');

        assertEquals(List.of(List.of("P001", "45", "15/03/2024"), List.of("P002", "40", "16/03/2024")), records);
    }

    @Test
    void testParseRecords_QuotedDelimiter() {
        List<List<String>> records = reader.parseRecords("P001,\"Pre-Op, left\",45", ',');

        assertEquals(List.of(List.of("P001", "Pre-Op, left", "45")), records);
    }

    @Test
    void testParseRecords_EscapedQuotes() {
        List<List<String>> records = reader.parseRecords("\"say \"\"hi\"\"\",1", ',');

        assertEquals(List.of(List.of("say \"hi\"", "1")), records);
    }

    @Test
    void testParseRecords_EmptyFields() {
        List<List<String>> records = reader.parseRecords("a,,c,", ',');

        assertEquals(List.of(List.of("a", "", "c", "")), records);
    }

    @Test
    void testParseRecords_LineBreakInsideQuotes() {
        // Given: a free-text comment typed over two lines, CRLF line endings
        String content = "P001,\"knee hurts\r\nat night\",3\r\nP002,,4\r\n";

        // When
        List<List<String>> records = reader.parseRecords(content, ',');

        // Then
        assertEquals(2, records.size());
        assertEquals(List.of("P001", "knee hurts\r\nat night", "3"), records.get(0));
        assertEquals(List.of("P002", "", "4"), records.get(1));
    }

    @Test
    void testParseRecords_EmptyLineIsRecordWithOneEmptyField() {
        List<List<String>> records = reader.parseRecords("a\n\nb", ',');

        assertEquals(List.of(List.of("a"), List.of(""), List.of("b")), records);
    }

    @Test
    void testDetectDelimiter() {
        assertEquals(';', reader.detectDelimiter("Patient;OKS Score;Completed"));
        assertEquals(',', reader.detectDelimiter("Patient,OKS Score,Completed"));
        assertEquals(',', reader.detectDelimiter("Patient"));
    }

    // ========== read Tests ==========

    @Test
    void testRead_HeadersAndRows() throws Exception {
        Path file = TestDataFactory.writeCsv(tempDir.resolve("export.csv"),
                " Patient , OKS Score ,Completed",
                "P001,40,15/03/2024",
                "P002,38");

        TabularSheet sheet = reader.read(file, SheetSelection.ACTIVE);

        assertEquals(List.of("Patient", "OKS Score", "Completed"), sheet.getHeaders());
        assertEquals(2, sheet.getRows().size());
        SourceRow first = sheet.getRows().get(0);
        assertEquals("P001", first.get("Patient").asText());
        assertEquals(2, first.getRowNumber());
        assertTrue(sheet.getRows().get(1).get("Completed").isEmpty());
    }

    @Test
    void testRead_SemicolonWithBom() throws Exception {
        Path file = tempDir.resolve("export.csv");
        Files.writeString(file, "\uFEFFPatient;OKS Score\nP001;40\n", StandardCharsets.UTF_8);

        TabularSheet sheet = reader.read(file, SheetSelection.ACTIVE);

        assertEquals(List.of("Patient", "OKS Score"), sheet.getHeaders());
        assertEquals("40", sheet.getRows().get(0).get("OKS Score").asText());
    }

    @Test
    void testRead_BlankRowsCountedNotReturned() throws Exception {
        Path file = TestDataFactory.writeCsv(tempDir.resolve("export.csv"),
                "Patient,OKS Score",
                ",",
                "P001,40",
                "");

        TabularSheet sheet = reader.read(file, SheetSelection.ACTIVE);

        assertEquals(1, sheet.getRows().size());
        assertEquals(2, sheet.getBlankRows());
        assertEquals(3, sheet.getRows().get(0).getRowNumber());
    }

    @Test
    void testRead_MultiLineFieldKeepsRowNumbering() throws Exception {
        Path file = TestDataFactory.writeCsv(tempDir.resolve("export.csv"),
                "Patient,Comment,Q1",
                "P001,\"first line",
                "second line\",2",
                "P002,ok,3");

        TabularSheet sheet = reader.read(file, SheetSelection.ACTIVE);

        assertEquals(2, sheet.getRows().size());
        assertEquals("first line\nsecond line", sheet.getRows().get(0).get("Comment").asText());
        assertEquals("2", sheet.getRows().get(0).get("Q1").asText());
        assertEquals(3, sheet.getRows().get(1).getRowNumber());
    }

    @Test
    void testRead_EmptyFile() throws Exception {
        Path file = tempDir.resolve("empty.csv");
        Files.writeString(file, "");

        TabularSheet sheet = reader.read(file, SheetSelection.ACTIVE);

        assertTrue(sheet.isEmpty());
    }

    @Test
    void testSupports() {
        assertTrue(reader.supports(Path.of("export.CSV")));
        assertFalse(reader.supports(Path.of("export.xlsx")));
    }
}
