package lroi.proms.converter.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One data row of an input file, keyed by trimmed column header.
 *
 * Rows are immutable; merging lookup-table columns produces a new row.
 */
public final class SourceRow {

    private final Map<String, CellValue> values;
    private final long rowNumber;

    public SourceRow(Map<String, CellValue> values, long rowNumber) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        this.rowNumber = rowNumber;
    }

    /**
     * Build a row from a header line and the cells of one data line.
     * Missing trailing cells become EMPTY; a repeated header keeps the later cell.
     */
    public static SourceRow of(List<String> headers, List<CellValue> cells, long rowNumber) {
        Map<String, CellValue> values = new LinkedHashMap<>();
        for (int i = 0; i < headers.size(); i++) {
            values.put(headers.get(i), i < cells.size() ? cells.get(i) : CellValue.empty());
        }
        return new SourceRow(values, rowNumber);
    }

    public boolean contains(String column) {
        return values.containsKey(column);
    }

    /**
     * @return the cell for the column, or EMPTY when the column is absent
     */
    public CellValue get(String column) {
        CellValue value = values.get(column);
        return value != null ? value : CellValue.empty();
    }

    public boolean hasValue(String column) {
        return contains(column) && !get(column).isBlank();
    }

    /**
     * Copy of this row with the given columns added, overwriting same-named keys.
     */
    public SourceRow withColumns(Map<String, CellValue> extra) {
        Map<String, CellValue> merged = new LinkedHashMap<>(values);
        merged.putAll(extra);
        return new SourceRow(merged, rowNumber);
    }

    public Map<String, CellValue> asMap() {
        return values;
    }

    public long getRowNumber() {
        return rowNumber;
    }

    @Override
    public String toString() {
        return "SourceRow{row=" + rowNumber + ", values=" + values + "}";
    }
}
