package lroi.proms.converter.reader;

import lombok.extern.slf4j.Slf4j;
import lroi.proms.converter.model.CellValue;
import lroi.proms.converter.model.SourceRow;
import lroi.proms.converter.util.InputPathUtil;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Reader for Excel workbooks (.xlsx and .xls) based on Apache POI.
 *
 * Cell kinds are resolved here: text cells become TEXT, date-formatted numeric
 * cells become DATE, other numeric cells NUMBER. A date-formatted value with
 * no day part is a time of day and becomes TEXT ("08:30:00"). Formula cells
 * are read by their cached result, the way Excel last calculated them.
 */
@Slf4j
@Component
public class SpreadsheetReader implements TabularFileReader {

    private static final DateTimeFormatter TIME_OF_DAY = DateTimeFormatter.ofPattern("HH:mm:ss");

    @Override
    public boolean supports(Path path) {
        String extension = InputPathUtil.extensionOf(path);
        return "xlsx".equals(extension) || "xls".equals(extension);
    }

    @Override
    public TabularSheet read(Path path, SheetSelection selection) throws IOException {
        String sourceName = path.getFileName().toString();
        log.debug("Opening workbook: {}", path);

        try (Workbook workbook = WorkbookFactory.create(path.toFile(), null, true)) {
            if (workbook.getNumberOfSheets() == 0) {
                return TabularSheet.empty(sourceName);
            }
            int sheetIndex = selection == SheetSelection.ACTIVE ? workbook.getActiveSheetIndex() : 0;
            Sheet sheet = workbook.getSheetAt(sheetIndex);
            log.debug("Reading sheet '{}' of {}", sheet.getSheetName(), sourceName);
            return readSheet(sourceName, sheet);
        } catch (RuntimeException e) {
            // POI reports corrupt or encrypted files with unchecked exceptions
            throw new IOException("Cannot read workbook " + sourceName + ": " + e.getMessage(), e);
        }
    }

    private TabularSheet readSheet(String sourceName, Sheet sheet) {
        if (sheet.getPhysicalNumberOfRows() == 0) {
            return TabularSheet.empty(sourceName);
        }

        int headerRowIndex = sheet.getFirstRowNum();
        List<String> headers = new ArrayList<>();
        for (CellValue cell : readCells(sheet.getRow(headerRowIndex))) {
            headers.add(cell.asText().trim());
        }

        List<SourceRow> rows = new ArrayList<>();
        int blankRows = 0;
        for (int rowIndex = headerRowIndex + 1; rowIndex <= sheet.getLastRowNum(); rowIndex++) {
            List<CellValue> cells = readCells(sheet.getRow(rowIndex));
            if (cells.stream().allMatch(CellValue::isEmpty)) {
                blankRows++;
                continue;
            }
            // 1-based row number as Excel shows it
            rows.add(SourceRow.of(headers, cells, rowIndex + 1L));
        }

        log.debug("Read {} data rows ({} blank) from {}", rows.size(), blankRows, sourceName);
        return new TabularSheet(sourceName, headers, rows, blankRows);
    }

    private List<CellValue> readCells(Row row) {
        List<CellValue> cells = new ArrayList<>();
        if (row == null || row.getLastCellNum() < 0) {
            return cells;
        }
        for (int column = 0; column < row.getLastCellNum(); column++) {
            cells.add(toCellValue(row.getCell(column)));
        }
        return cells;
    }

    CellValue toCellValue(Cell cell) {
        if (cell == null) {
            return CellValue.empty();
        }
        CellType type = cell.getCellType();
        if (type == CellType.FORMULA) {
            type = cell.getCachedFormulaResultType();
        }

        switch (type) {
            case STRING:
                String text = cell.getStringCellValue();
                return text == null || text.isEmpty() ? CellValue.empty() : CellValue.text(text);
            case NUMERIC:
                if (DateUtil.isCellDateFormatted(cell)) {
                    double serial = cell.getNumericCellValue();
                    // no day part: a time of day, kept as text
                    if (serial >= 0 && serial < 1.0) {
                        return CellValue.text(cell.getLocalDateTimeCellValue().toLocalTime().format(TIME_OF_DAY));
                    }
                    return CellValue.date(cell.getLocalDateTimeCellValue());
                }
                return CellValue.number(cell.getNumericCellValue());
            case BOOLEAN:
                return CellValue.text(Boolean.toString(cell.getBooleanCellValue()));
            default:
                return CellValue.empty();
        }
    }
}
