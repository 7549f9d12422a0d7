package lroi.proms.converter.model;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;

class ConversionRuleTest {

    @Test
    void testOf_DefaultsToCaseInsensitive() {
        ConversionRule rule = ConversionRule.substitution("^male$", "1");

        assertThat(rule.getFlags()).isEqualTo("i");
        assertThat(rule.getPattern().matcher("MALE").matches()).isTrue();
    }

    @Test
    void testOf_ExplicitFlagsWithoutIAreCaseSensitive() {
        ConversionRule rule = ConversionRule.of("^male$", "1", "");

        assertThat(rule.getPattern().matcher("MALE").matches()).isFalse();
        assertThat(rule.getPattern().matcher("male").matches()).isTrue();
    }

    @Test
    void testToPatternFlags() {
        int flags = ConversionRule.toPatternFlags("ims");

        assertThat(flags & Pattern.CASE_INSENSITIVE).isNotZero();
        assertThat(flags & Pattern.MULTILINE).isNotZero();
        assertThat(flags & Pattern.DOTALL).isNotZero();
        assertThat(ConversionRule.toPatternFlags("") & Pattern.CASE_INSENSITIVE).isZero();
    }

    @Test
    void testToJavaSyntax_NamedGroups() {
        assertThat(ConversionRule.toJavaSyntax("(?P<day>\\d+)-(?P=day)"))
                .isEqualTo("(?<day>\\d+)-\\k<day>");

        ConversionRule rule = ConversionRule.validation("(?P<x>a)(?P=x)");
        assertThat(rule.isInert()).isFalse();
        assertThat(rule.getPattern().matcher("aa").matches()).isTrue();
    }

    @Test
    void testToJavaSyntax_RenamesGroupNamesJavaRejects() {
        Map<String, String> aliases = new HashMap<>();

        String expression = ConversionRule.toJavaSyntax("(?P<_a>x)(?P<day_num>\\d+)(?P=day_num)(?P<gdaynum>y)", aliases);

        assertThat(aliases).containsEntry("_a", "ga").containsEntry("day_num", "gdaynum1");
        assertThat(expression).isEqualTo("(?<ga>x)(?<gdaynum1>\\d+)\\k<gdaynum1>(?<gdaynum>y)");
        assertThat(Pattern.compile(expression).matcher("x77y").matches()).isTrue();
    }

    @Test
    void testValidationOnly() {
        ConversionRule rule = ConversionRule.validation("^[0-4]$");

        assertThat(rule.isValidationOnly()).isTrue();
        assertThat(rule.getReplacement()).isNull();
    }

    @Test
    void testOf_InvalidRegexIsInert() {
        ConversionRule rule = ConversionRule.substitution("([", "x");

        assertThat(rule.isInert()).isTrue();
        assertThat(rule.patternError()).isPresent();
        assertThat(rule.getMatch()).isEqualTo("([");
    }

    @Test
    void testOf_ReplacementReferencingMissingGroupIsInert() {
        ConversionRule rule = ConversionRule.substitution("(a)", "\\2");

        assertThat(rule.isInert()).isTrue();
        assertThat(rule.patternError()).hasValueSatisfying(error -> assertThat(error).contains("invalid group reference"));
    }
}
