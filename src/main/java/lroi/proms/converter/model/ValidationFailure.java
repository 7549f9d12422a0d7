package lroi.proms.converter.model;

import lombok.Value;

/**
 * A validation-only rule rejected a value.
 */
@Value
public class ValidationFailure {

    String field;
    String value;
    String pattern;

    public String describe() {
        return String.format("Validation failed for %s: '%s' does not match '%s'", field, value, pattern);
    }
}
