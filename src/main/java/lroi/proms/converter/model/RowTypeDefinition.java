package lroi.proms.converter.model;

import lombok.NonNull;
import lombok.Value;

import java.util.List;

/**
 * One questionnaire variant ({@code [PROM.<KEY>]}): how to recognise its rows
 * and which output elements to extract from them.
 */
@Value
public class RowTypeDefinition {

    @NonNull String key;
    @NonNull String detectionColumn;
    @NonNull List<FieldMapping> fields;
    LookupSpec lookup;

    public RowTypeDefinition(String key, String detectionColumn, List<FieldMapping> fields, LookupSpec lookup) {
        this.key = key;
        this.detectionColumn = detectionColumn;
        this.fields = List.copyOf(fields);
        this.lookup = lookup;
    }

    public boolean requiresLookup() {
        return lookup != null && lookup.isRequired();
    }
}
