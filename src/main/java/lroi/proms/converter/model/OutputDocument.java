package lroi.proms.converter.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * All records produced by one conversion run, in the order they were converted.
 * Owned by the run that creates it.
 */
public final class OutputDocument {

    public static final String ROOT_ELEMENT = "LROIPROM";
    public static final String COLLECTION_ELEMENT = "questionaires";
    public static final String RECORD_ELEMENT = "questionaire";

    private final List<OutputRecord> records = new ArrayList<>();

    public void append(OutputRecord record) {
        records.add(record);
    }

    public List<OutputRecord> getRecords() {
        return Collections.unmodifiableList(records);
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }
}
