package lroi.proms.converter.service;

import lroi.proms.converter.model.OutputRecord;
import lroi.proms.converter.util.SchemaElementOrder;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Lays out extracted elements in the registry's schema order.
 *
 * Only elements with a value are written, except GENDER which the schema
 * requires even when empty. HOSPITAL always comes from the run, never from
 * the source row.
 */
@Service
public class DocumentAssemblerService {

    /**
     * @param elements extracted element values
     * @param rowType  PROM type key
     * @param hospital submitting site number
     * @throws IllegalArgumentException if the row type has no schema order
     */
    public OutputRecord assemble(Map<String, String> elements, String rowType, int hospital) {
        List<String> order = SchemaElementOrder.forRowType(rowType)
                .orElseThrow(() -> new IllegalArgumentException("No schema element order for row type " + rowType));

        List<OutputRecord.Element> output = new ArrayList<>();
        for (String name : order) {
            if (SchemaElementOrder.HOSPITAL.equals(name)) {
                output.add(new OutputRecord.Element(name, Integer.toString(hospital)));
            } else if (SchemaElementOrder.GENDER.equals(name)) {
                output.add(new OutputRecord.Element(name, genderValue(elements.get(name))));
            } else {
                String value = elements.get(name);
                if (value != null && !value.trim().isEmpty()) {
                    output.add(new OutputRecord.Element(name, value));
                }
            }
        }
        return new OutputRecord(rowType, output);
    }

    private String genderValue(String value) {
        if (value == null) {
            return "";
        }
        String lower = value.trim().toLowerCase(Locale.ROOT);
        return "none".equals(lower) || "null".equals(lower) ? "" : value;
    }
}
