package lroi.proms.converter.model;

import lombok.NonNull;
import lombok.Value;

import java.util.List;

/**
 * Maps one source column onto one output element, with an ordered list of
 * conversion rules applied to the raw value.
 */
@Value
public class FieldMapping {

    @NonNull String outputName;
    @NonNull String sourceColumn;
    @NonNull List<ConversionRule> conversions;

    public FieldMapping(String outputName, String sourceColumn, List<ConversionRule> conversions) {
        this.outputName = outputName;
        this.sourceColumn = sourceColumn;
        this.conversions = conversions == null ? List.of() : List.copyOf(conversions);
    }

    public static FieldMapping direct(String outputName, String sourceColumn) {
        return new FieldMapping(outputName, sourceColumn, List.of());
    }
}
