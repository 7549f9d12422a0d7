package lroi.proms.converter.service;

import lroi.proms.converter.event.ConversionEvent;
import lroi.proms.converter.event.ConversionEventListener;
import lroi.proms.converter.model.CellValue;
import lroi.proms.converter.model.LookupSpec;
import lroi.proms.converter.model.LutIndex;
import lroi.proms.converter.model.MergeResult;
import lroi.proms.converter.model.RowTypeDefinition;
import lroi.proms.converter.model.SourceRow;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Joins lookup-table columns into a source row.
 *
 * Columns are added as {@code prefix + lookupColumn} so they never collide
 * with source columns. A missing join key or a key absent from the lookup
 * table is reported, and the row carries on without the extra columns.
 */
@Service
public class RowMergerService {

    public MergeResult merge(SourceRow row, LutIndex index, RowTypeDefinition rowType,
                             String prefix, ConversionEventListener events) {
        if (!rowType.requiresLookup()) {
            return MergeResult.unchanged(row, MergeResult.Status.NOT_REQUIRED, null);
        }
        LookupSpec lookup = rowType.getLookup();
        Long rowNumber = row.getRowNumber();

        String joinColumn = lookup.getJoinColumn();
        if (joinColumn == null || joinColumn.trim().isEmpty()) {
            events.emit(ConversionEvent.Level.WARNING, ConversionEvent.Type.JOIN_KEY_MISSING, rowNumber,
                    "LUT required for " + rowType.getKey() + " but join_column not specified");
            return MergeResult.unchanged(row, MergeResult.Status.NO_JOIN_KEY, null);
        }

        CellValue joinValue = row.get(joinColumn);
        if (joinValue.isBlank()) {
            events.emit(ConversionEvent.Level.WARNING, ConversionEvent.Type.JOIN_KEY_MISSING, rowNumber,
                    "Join column '" + joinColumn + "' not found or empty in row");
            return MergeResult.unchanged(row, MergeResult.Status.NO_JOIN_KEY, null);
        }

        String joinKey = joinValue.asText().trim();
        Optional<Map<String, CellValue>> lutRow = index.find(joinKey);
        if (lutRow.isEmpty()) {
            events.emit(ConversionEvent.Level.ERROR, ConversionEvent.Type.LOOKUP_MISS, rowNumber,
                    "No LUT record found for " + joinColumn + "='" + joinKey + "'");
            return MergeResult.unchanged(row, MergeResult.Status.LOOKUP_MISS, joinKey);
        }

        Map<String, CellValue> added = new LinkedHashMap<>();
        for (String lutColumn : lookup.auxiliaryColumns()) {
            if (lutRow.get().containsKey(lutColumn)) {
                added.put(prefix + lutColumn, lutRow.get().get(lutColumn));
            }
        }
        events.emit(ConversionEvent.Level.DEBUG, ConversionEvent.Type.LUT_MERGED, rowNumber,
                "Merged LUT columns " + added.keySet() + " for " + joinColumn + "='" + joinKey + "'");
        return new MergeResult(row.withColumns(added), MergeResult.Status.MERGED, joinKey);
    }
}
