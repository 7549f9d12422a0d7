package lroi.proms.converter.event;

import lombok.Builder;
import lombok.Value;

/**
 * Something worth telling the user about during a conversion run.
 */
@Value
@Builder
public class ConversionEvent {

    public enum Level {
        DEBUG,
        INFO,
        WARNING,
        ERROR
    }

    public enum Type {
        LUT_LOADED,
        FILE_STARTED,
        FILE_EMPTY,
        FILE_FAILED,
        ROW_TYPE_DETECTED,
        ROW_SKIPPED,
        JOIN_KEY_MISSING,
        LOOKUP_MISS,
        LUT_MERGED,
        VALUE_CONVERTED,
        VALIDATION_FAILED,
        PATTERN_ERROR,
        RECORD_CONVERTED,
        DOCUMENT_WRITTEN,
        RUN_SUMMARY
    }

    Level level;
    Type type;
    String message;
    String sourceFile;
    Long rowNumber;
}
