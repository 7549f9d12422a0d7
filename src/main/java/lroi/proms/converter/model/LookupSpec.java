package lroi.proms.converter.model;

import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Per row type lookup-table join settings ({@code [PROM.<KEY>.lookup]}).
 *
 * Two forms are accepted: {@code add_columns}, an explicit list of lookup-table
 * columns, and the legacy form where every other key maps an output element to
 * a lookup-table column. When both are present {@code add_columns} wins and the
 * legacy entries are ignored.
 */
@Value
public class LookupSpec {

    boolean required;
    String joinColumn;
    List<String> addColumns;
    Map<String, String> legacyColumns;

    public LookupSpec(boolean required, String joinColumn, List<String> addColumns, Map<String, String> legacyColumns) {
        this.required = required;
        this.joinColumn = joinColumn;
        this.addColumns = addColumns == null ? List.of() : List.copyOf(addColumns);
        this.legacyColumns = legacyColumns == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(legacyColumns));
    }

    public static LookupSpec addColumns(String joinColumn, List<String> columns) {
        return new LookupSpec(true, joinColumn, columns, null);
    }

    public static LookupSpec notRequired() {
        return new LookupSpec(false, null, null, null);
    }

    public boolean usesLegacyForm() {
        return addColumns.isEmpty() && !legacyColumns.isEmpty();
    }

    /**
     * Lookup-table columns to copy into a matched row, in declaration order.
     */
    public List<String> auxiliaryColumns() {
        if (!usesLegacyForm()) {
            return addColumns;
        }
        return new ArrayList<>(new LinkedHashSet<>(legacyColumns.values()));
    }
}
