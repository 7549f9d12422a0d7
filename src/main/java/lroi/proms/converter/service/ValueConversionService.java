package lroi.proms.converter.service;

import lroi.proms.converter.event.ConversionEvent;
import lroi.proms.converter.event.ConversionEventListener;
import lroi.proms.converter.model.ConversionOutcome;
import lroi.proms.converter.model.ConversionRule;
import lroi.proms.converter.model.ValidationFailure;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Applies a field's conversion rules to one raw value.
 *
 * Rules run in order:
 * - a substitution rule replaces every match; if that changed the value, the
 *   result is final and later rules are not tried
 * - a validation-only rule requires the whole value to match, otherwise the
 *   value is rejected
 * - a rule whose expression does not compile is reported and ignored
 * When nothing changed the value it is returned as read (trimmed).
 */
@Service
public class ValueConversionService {

    public ConversionOutcome convert(String field, String rawValue, List<ConversionRule> rules) {
        return convert(field, rawValue, rules, null, ConversionEventListener.none());
    }

    /**
     * @param field     output element name, for messages
     * @param rawValue  value as read; null is treated as ""
     * @param rules     ordered conversion rules, may be empty
     * @param rowNumber source row for messages, may be null
     * @param events    receives conversion, validation and pattern events
     */
    public ConversionOutcome convert(String field, String rawValue, List<ConversionRule> rules,
                                     Long rowNumber, ConversionEventListener events) {
        String value = rawValue == null ? "" : rawValue.trim();
        if (rules == null || rules.isEmpty()) {
            return ConversionOutcome.converted(value);
        }

        for (ConversionRule rule : rules) {
            if (rule.isInert()) {
                events.emit(ConversionEvent.Level.WARNING, ConversionEvent.Type.PATTERN_ERROR, rowNumber,
                        String.format("Invalid regex in %s conversion: '%s' - %s",
                                field, rule.getMatch(), rule.getPatternError()));
                continue;
            }

            if (!rule.isValidationOnly()) {
                String result;
                try {
                    result = rule.getReplacement().replaceAll(rule.getPattern(), value);
                } catch (IllegalArgumentException | IndexOutOfBoundsException e) {
                    // unknown named group in the replacement
                    events.emit(ConversionEvent.Level.WARNING, ConversionEvent.Type.PATTERN_ERROR, rowNumber,
                            String.format("Invalid replacement in %s conversion: '%s' - %s",
                                    field, rule.getReplace(), e.getMessage()));
                    continue;
                }
                if (!result.equals(value)) {
                    events.emit(ConversionEvent.Level.DEBUG, ConversionEvent.Type.VALUE_CONVERTED, rowNumber,
                            String.format("Converted %s: '%s' -> '%s' (matched: %s)",
                                    field, value, result, rule.getMatch()));
                    return ConversionOutcome.converted(result);
                }
            } else if (!rule.getPattern().matcher(value).matches()) {
                ValidationFailure failure = new ValidationFailure(field, value, rule.getMatch());
                events.emit(ConversionEvent.Level.ERROR, ConversionEvent.Type.VALIDATION_FAILED, rowNumber,
                        "VALIDATION FAILED: " + field + "='" + value + "' does not match pattern '"
                                + rule.getMatch() + "'");
                return ConversionOutcome.failed(failure);
            }
        }

        return ConversionOutcome.converted(value);
    }
}
