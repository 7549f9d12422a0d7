package lroi.proms.converter.reader;

import lroi.proms.converter.model.SourceRow;

import java.util.Collections;
import java.util.List;

/**
 * Contents of one input table, fully read into memory: the trimmed header row
 * and every non-blank data row.
 */
public final class TabularSheet {

    private final String sourceName;
    private final List<String> headers;
    private final List<SourceRow> rows;
    private final int blankRows;

    public TabularSheet(String sourceName, List<String> headers, List<SourceRow> rows, int blankRows) {
        this.sourceName = sourceName;
        this.headers = Collections.unmodifiableList(headers);
        this.rows = Collections.unmodifiableList(rows);
        this.blankRows = blankRows;
    }

    public static TabularSheet empty(String sourceName) {
        return new TabularSheet(sourceName, List.of(), List.of(), 0);
    }

    /**
     * True when the file has no rows at all, not even a header.
     */
    public boolean isEmpty() {
        return headers.isEmpty() && rows.isEmpty();
    }

    public String getSourceName() {
        return sourceName;
    }

    public List<String> getHeaders() {
        return headers;
    }

    public List<SourceRow> getRows() {
        return rows;
    }

    public int getBlankRows() {
        return blankRows;
    }
}
