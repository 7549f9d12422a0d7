package lroi.proms.converter.service;

import lroi.proms.converter.event.ConversionEvent;
import lroi.proms.converter.event.ConversionEventListener;
import lroi.proms.converter.exception.ConfigurationException;
import lroi.proms.converter.exception.UnsupportedInputException;
import lroi.proms.converter.model.CellValue;
import lroi.proms.converter.model.LutIndex;
import lroi.proms.converter.model.SourceRow;
import lroi.proms.converter.reader.SheetSelection;
import lroi.proms.converter.reader.TabularReaderFactory;
import lroi.proms.converter.reader.TabularSheet;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Loads the lookup table (demographics export) into a {@link LutIndex}.
 *
 * The first sheet is read, its first row gives the column names. Each data row
 * is indexed under the trimmed text of its join column; a later row with the
 * same key replaces the earlier one.
 */
@Service
public class LookupTableService {

    private final TabularReaderFactory readerFactory;

    public LookupTableService(TabularReaderFactory readerFactory) {
        this.readerFactory = readerFactory;
    }

    /**
     * @param lutFile    lookup-table file
     * @param joinColumn column whose value is the index key
     * @param events     receives the load summary
     * @return the index, empty when the file has no rows
     * @throws ConfigurationException if the file cannot be read or lacks the join column
     */
    public LutIndex load(Path lutFile, String joinColumn, ConversionEventListener events) {
        events.info(ConversionEvent.Type.LUT_LOADED, "Loading LUT: " + lutFile);

        TabularSheet sheet;
        try {
            sheet = readerFactory.getReader(lutFile).read(lutFile, SheetSelection.FIRST);
        } catch (IOException | UnsupportedInputException e) {
            throw new ConfigurationException("Cannot read LUT file " + lutFile + ": " + e.getMessage(), e);
        }

        if (sheet.isEmpty()) {
            events.warning(ConversionEvent.Type.LUT_LOADED, "LUT file appears to be empty: " + lutFile);
            return new LutIndex(joinColumn, Map.of(), 0, 0);
        }

        if (!sheet.getHeaders().contains(joinColumn)) {
            throw new ConfigurationException(String.format(
                    "LUT join column '%s' not found in %s. Available columns: %s",
                    joinColumn, lutFile, sheet.getHeaders()));
        }

        Map<String, Map<String, CellValue>> index = new LinkedHashMap<>();
        int loaded = 0;
        int skipped = 0;
        for (SourceRow row : sheet.getRows()) {
            CellValue key = row.get(joinColumn);
            if (key.isBlank()) {
                skipped++;
                continue;
            }
            index.put(key.asText().trim(), row.asMap());
            loaded++;
        }

        LutIndex lutIndex = new LutIndex(joinColumn, index, loaded, skipped);
        events.info(ConversionEvent.Type.LUT_LOADED, String.format(
                "LUT loaded: %d records indexed by '%s' (%d distinct keys, %d skipped)",
                lutIndex.getLoaded(), lutIndex.getJoinColumn(), lutIndex.size(), lutIndex.getSkipped()));
        return lutIndex;
    }
}
