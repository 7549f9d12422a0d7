package lroi.proms.converter.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Lookup-table rows keyed by the trimmed text of their join column.
 * Built once per run and read-only afterwards.
 */
public final class LutIndex {

    private static final LutIndex EMPTY = new LutIndex(null, Map.of(), 0, 0);

    private final String joinColumn;
    private final Map<String, Map<String, CellValue>> rows;
    private final int loaded;
    private final int skipped;

    public LutIndex(String joinColumn, Map<String, Map<String, CellValue>> rows, int loaded, int skipped) {
        this.joinColumn = joinColumn;
        Map<String, Map<String, CellValue>> copy = new LinkedHashMap<>();
        rows.forEach((key, values) -> copy.put(key, Collections.unmodifiableMap(new LinkedHashMap<>(values))));
        this.rows = Collections.unmodifiableMap(copy);
        this.loaded = loaded;
        this.skipped = skipped;
    }

    public static LutIndex empty() {
        return EMPTY;
    }

    public Optional<Map<String, CellValue>> find(String joinKey) {
        return Optional.ofNullable(rows.get(joinKey == null ? null : joinKey.trim()));
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public int size() {
        return rows.size();
    }

    public String getJoinColumn() {
        return joinColumn;
    }

    /** Data rows indexed, including those later overwritten by a duplicate key. */
    public int getLoaded() {
        return loaded;
    }

    /** Data rows without a usable join key. */
    public int getSkipped() {
        return skipped;
    }
}
