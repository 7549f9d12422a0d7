package lroi.proms.converter.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * One {@code questionaire} element: its row type and its child elements in
 * schema order.
 */
public final class OutputRecord {

    public static final class Element {
        private final String name;
        private final String value;

        public Element(String name, String value) {
            this.name = name;
            this.value = value;
        }

        public String getName() {
            return name;
        }

        public String getValue() {
            return value;
        }

        @Override
        public String toString() {
            return name + "=" + value;
        }
    }

    private final String rowType;
    private final List<Element> elements;

    public OutputRecord(String rowType, List<Element> elements) {
        this.rowType = rowType;
        this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
    }

    public String getRowType() {
        return rowType;
    }

    public List<Element> getElements() {
        return elements;
    }

    public Optional<String> value(String name) {
        return elements.stream()
                .filter(element -> element.getName().equals(name))
                .map(Element::getValue)
                .findFirst();
    }

    @Override
    public String toString() {
        return "OutputRecord{" + rowType + ", " + elements + "}";
    }
}
