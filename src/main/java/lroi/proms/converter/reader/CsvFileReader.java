package lroi.proms.converter.reader;

import lombok.extern.slf4j.Slf4j;
import lroi.proms.converter.model.CellValue;
import lroi.proms.converter.model.SourceRow;
import lroi.proms.converter.util.InputPathUtil;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reader for CSV exports.
 *
 * Features:
 * - Quoted fields with embedded delimiters, doubled quotes and line breaks (RFC 4180)
 * - Comma or semicolon delimiter, detected from the header line
 * - UTF-8 with or without byte order mark; LF or CRLF line endings
 *
 * Every non-empty field becomes a TEXT cell; CSV carries no type information.
 * Row numbers count records, not physical lines, with the header as row 1.
 */
@Slf4j
@Component
public class CsvFileReader implements TabularFileReader {

    private static final char BOM = '\uFEFF';
    private static final char QUOTE = '"';

    @Override
    public boolean supports(Path path) {
        return "csv".equals(InputPathUtil.extensionOf(path));
    }

    @Override
    public TabularSheet read(Path path, SheetSelection sheet) throws IOException {
        String sourceName = path.getFileName().toString();
        log.debug("Reading CSV file: {}", path);

        String content = Files.readString(path, StandardCharsets.UTF_8);
        if (!content.isEmpty() && content.charAt(0) == BOM) {
            content = content.substring(1);
        }
        if (content.isEmpty()) {
            return TabularSheet.empty(sourceName);
        }

        char delimiter = detectDelimiter(firstLine(content));
        List<List<String>> records = parseRecords(content, delimiter);

        List<String> headers = new ArrayList<>();
        for (String header : records.get(0)) {
            headers.add(header.trim());
        }

        List<SourceRow> rows = new ArrayList<>();
        int blankRows = 0;
        for (int index = 1; index < records.size(); index++) {
            List<CellValue> cells = new ArrayList<>();
            for (String field : records.get(index)) {
                cells.add(field.isEmpty() ? CellValue.empty() : CellValue.text(field));
            }
            if (cells.stream().allMatch(CellValue::isEmpty)) {
                blankRows++;
                continue;
            }
            rows.add(SourceRow.of(headers, cells, index + 1L));
        }

        log.debug("Read {} data rows ({} blank) from {}", rows.size(), blankRows, sourceName);
        return new TabularSheet(sourceName, headers, rows, blankRows);
    }

    /**
     * Semicolon when the header has semicolons and no commas (regional Excel
     * exports), comma otherwise.
     */
    char detectDelimiter(String headerLine) {
        return headerLine.indexOf(';') >= 0 && headerLine.indexOf(',') < 0 ? ';' : ',';
    }

    /**
     * Split CSV text into records of trimmed fields.
     *
     * A line break inside quotes belongs to the field. A quote directly
     * followed by another quote inside a quoted field is one literal quote.
     * Each unquoted line break ends a record, so an empty line is a record
     * with one empty field; a final line break does not start another record.
     *
     * Examples (comma):
     *   "P001,45\nP002,40" → [["P001", "45"], ["P002", "40"]]
     *   "P001,\"Pre-Op,\nleft\",45" → [["P001", "Pre-Op,\nleft", "45"]]
     */
    List<List<String>> parseRecords(String content, char delimiter) {
        List<List<String>> records = new ArrayList<>();
        List<String> fields = new ArrayList<>();
        StringBuilder field = new StringBuilder();
        boolean quoted = false;

        int position = 0;
        while (position < content.length()) {
            char c = content.charAt(position);
            if (quoted) {
                if (c != QUOTE) {
                    field.append(c);
                } else if (position + 1 < content.length() && content.charAt(position + 1) == QUOTE) {
                    field.append(QUOTE);
                    position++;
                } else {
                    quoted = false;
                }
            } else if (c == QUOTE) {
                quoted = true;
            } else if (c == delimiter) {
                fields.add(field.toString().trim());
                field.setLength(0);
            } else if (c == '\n' || c == '\r') {
                fields.add(field.toString().trim());
                field.setLength(0);
                records.add(fields);
                fields = new ArrayList<>();
                if (c == '\r' && position + 1 < content.length() && content.charAt(position + 1) == '\n') {
                    position++;
                }
            } else {
                field.append(c);
            }
            position++;
        }

        if (field.length() > 0 || !fields.isEmpty()) {
            fields.add(field.toString().trim());
            records.add(fields);
        }
        if (quoted) {
            log.warn("CSV ends inside a quoted field; the rest of the file was read as one value");
        }
        return records;
    }

    private static String firstLine(String content) {
        for (int i = 0; i < content.length(); i++) {
            char c = content.charAt(i);
            if (c == '\n' || c == '\r') {
                return content.substring(0, i);
            }
        }
        return content;
    }
}
