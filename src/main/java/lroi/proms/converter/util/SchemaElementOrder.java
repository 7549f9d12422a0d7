package lroi.proms.converter.util;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Element order of a {@code questionaire} per PROM type, as the registry XSD
 * requires it. Names and order must not change.
 */
public final class SchemaElementOrder {

    public static final String ENTRY_DATE = "DATUMINVUL";
    public static final String HOSPITAL = "HOSPITAL";
    public static final String PERSON_ID = "UPNNUM";
    public static final String GENDER = "GENDER";
    public static final String BIRTH_DATE = "DATBIRTH";

    private static final List<String> COMMON = List.of(ENTRY_DATE, HOSPITAL, PERSON_ID, GENDER, BIRTH_DATE);

    private static final Map<String, List<String>> ORDER = Map.of(
            "OKS", build(List.of("FUPK", "SIDEPK"), numbered("OKS", "PK", 12), List.of("ANKERPK")),
            "OHS", build(List.of("FUPH", "SIDEP"), numbered("OHS", "P", 12), numbered("OHS", "PN", 12), List.of("ANKERP")),
            "KOOS", build(List.of("FUPK", "SIDEPK"),
                    List.of("KOOS26P", "KOOS25P", "KOOS19P", "KOOS21P", "KOOS09P", "KOOS38P", "KOOS34P")),
            "HOOS", build(List.of("FUPH", "SIDEP"),
                    List.of("HOOS16P", "HOOS28P", "HOOS29P", "HOOS34P", "HOOS35P")));

    private SchemaElementOrder() {
        // Private constructor to prevent instantiation
    }

    /**
     * @param rowType PROM type key, e.g. "OKS"
     * @return the element names in schema order, or empty for an unknown type
     */
    public static Optional<List<String>> forRowType(String rowType) {
        return Optional.ofNullable(ORDER.get(rowType));
    }

    public static Set<String> knownRowTypes() {
        return ORDER.keySet();
    }

    /** Elements without which a record is not submitted. */
    public static List<String> mandatoryElements() {
        return List.of(PERSON_ID, ENTRY_DATE);
    }

    @SafeVarargs
    private static List<String> build(List<String>... groups) {
        List<String> order = new ArrayList<>(COMMON);
        for (List<String> group : groups) {
            order.addAll(group);
        }
        return List.copyOf(order);
    }

    private static List<String> numbered(String prefix, String suffix, int count) {
        List<String> names = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            names.add(prefix + i + suffix);
        }
        return names;
    }
}
