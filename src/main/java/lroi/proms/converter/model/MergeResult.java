package lroi.proms.converter.model;

import lombok.Value;

/**
 * Row produced by the lookup-table merge, with what happened to it.
 */
@Value
public class MergeResult {

    public enum Status {
        /** Row type does not use the lookup table. */
        NOT_REQUIRED,
        /** Lookup-table columns were added under the prefix. */
        MERGED,
        /** Join column absent or empty in the source row. */
        NO_JOIN_KEY,
        /** Join key not present in the lookup table. */
        LOOKUP_MISS
    }

    SourceRow row;
    Status status;
    String joinKey;

    public static MergeResult unchanged(SourceRow row, Status status, String joinKey) {
        return new MergeResult(row, status, joinKey);
    }
}
