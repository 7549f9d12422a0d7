package lroi.proms.converter.service;

import lroi.proms.converter.event.ConversionEvent;
import lroi.proms.converter.event.ConversionEventListener;
import lroi.proms.converter.model.CellValue;
import lroi.proms.converter.model.ConversionOutcome;
import lroi.proms.converter.model.FieldMapping;
import lroi.proms.converter.model.RowTypeDefinition;
import lroi.proms.converter.model.SourceRow;
import lroi.proms.converter.model.ValidationFailure;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Produces the output elements of one row from its row type's field mappings.
 *
 * Empty source values are left out. Date cells are reduced to their calendar
 * date before conversion, the registry schema has no time component. A value
 * rejected by a validation rule drops that element only; the rest of the row
 * is still extracted.
 */
@Service
public class ElementExtractorService {

    private final ValueConversionService valueConversionService;

    public ElementExtractorService(ValueConversionService valueConversionService) {
        this.valueConversionService = valueConversionService;
    }

    /**
     * @return output element name to converted value, in mapping order
     */
    public Map<String, String> extract(SourceRow row, RowTypeDefinition rowType, ConversionEventListener events) {
        Map<String, String> elements = new LinkedHashMap<>();
        Long rowNumber = row.getRowNumber();

        for (FieldMapping field : rowType.getFields()) {
            CellValue cell = row.get(field.getSourceColumn());
            if (cell.isBlank()) {
                continue;
            }

            String raw;
            if (cell.isDate()) {
                raw = cell.asDateString();
                events.emit(ConversionEvent.Level.DEBUG, ConversionEvent.Type.VALUE_CONVERTED, rowNumber,
                        "Converted datetime to date: " + field.getOutputName() + " = " + raw);
            } else {
                raw = cell.asText();
            }

            ConversionOutcome outcome = valueConversionService.convert(
                    field.getOutputName(), raw, field.getConversions(), rowNumber, events);
            if (outcome.isConverted()) {
                elements.put(field.getOutputName(), outcome.getValue());
            } else {
                events.emit(ConversionEvent.Level.ERROR, ConversionEvent.Type.VALIDATION_FAILED, rowNumber,
                        "Skipping element " + field.getOutputName() + ": "
                                + outcome.failure().map(ValidationFailure::describe).orElse(""));
            }
        }
        return elements;
    }
}
