package lroi.proms.converter.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Validated, immutable form of the declarative mapping file.
 *
 * Row types keep their declaration order; detection relies on it.
 */
@Value
@Builder(toBuilder = true)
public class MappingConfig {

    public static final String DEFAULT_LUT_COLUMN_PREFIX = "__LUT__";
    public static final String DEFAULT_LUT_JOIN_COLUMN = "PatientRecordID";

    @Builder.Default
    int hospital = 0;

    @Builder.Default
    String lutColumnPrefix = DEFAULT_LUT_COLUMN_PREFIX;

    @Builder.Default
    String lutJoinColumn = DEFAULT_LUT_JOIN_COLUMN;

    @Singular
    List<RowTypeDefinition> rowTypes;

    public Optional<RowTypeDefinition> rowType(String key) {
        return rowTypes.stream().filter(rowType -> rowType.getKey().equals(key)).findFirst();
    }
}
