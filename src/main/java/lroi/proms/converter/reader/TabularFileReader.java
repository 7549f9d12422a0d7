package lroi.proms.converter.reader;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Reads one tabular input format into a {@link TabularSheet}.
 *
 * Implementations read the whole table and release the file before returning,
 * whether reading succeeded or not.
 */
public interface TabularFileReader {

    /**
     * @return true if this reader handles the file's extension
     */
    boolean supports(Path path);

    /**
     * Read the header row and all data rows.
     *
     * Headers are trimmed, a blank header becomes "". Rows shorter than the
     * header are padded with EMPTY cells. Rows whose cells are all empty are
     * counted as blank and left out.
     *
     * @param path  file to read
     * @param sheet which sheet to use for multi-sheet formats
     * @throws IOException if the file cannot be opened or parsed
     */
    TabularSheet read(Path path, SheetSelection sheet) throws IOException;
}
