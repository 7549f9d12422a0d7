package lroi.proms.converter.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of running one value through its conversion rules: either the
 * converted text or the validation failure that rejected it.
 */
public final class ConversionOutcome {

    private final String value;
    private final ValidationFailure failure;

    private ConversionOutcome(String value, ValidationFailure failure) {
        this.value = value;
        this.failure = failure;
    }

    public static ConversionOutcome converted(String value) {
        return new ConversionOutcome(Objects.requireNonNull(value), null);
    }

    public static ConversionOutcome failed(ValidationFailure failure) {
        return new ConversionOutcome(null, Objects.requireNonNull(failure));
    }

    public boolean isConverted() {
        return failure == null;
    }

    /**
     * @throws IllegalStateException if the value was rejected
     */
    public String getValue() {
        if (failure != null) {
            throw new IllegalStateException(failure.describe());
        }
        return value;
    }

    public Optional<ValidationFailure> failure() {
        return Optional.ofNullable(failure);
    }

    @Override
    public String toString() {
        return isConverted() ? "converted(" + value + ")" : "failed(" + failure.describe() + ")";
    }
}
