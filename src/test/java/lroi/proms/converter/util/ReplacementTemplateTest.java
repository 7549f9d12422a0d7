package lroi.proms.converter.util;

import org.junit.jupiter.api.Test;

import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReplacementTemplateTest {

    @Test
    void testReplaceAll_NumberedGroups() {
        Pattern pattern = Pattern.compile("^(\\d{2})-(\\d{2})-(\\d{4})$");

        String result = ReplacementTemplate.parse("\\3-\\2-\\1").replaceAll(pattern, "15-03-2024");

        assertThat(result).isEqualTo("2024-03-15");
    }

    @Test
    void testReplaceAll_NamedAndBracketedGroups() {
        Pattern pattern = Pattern.compile("(?<year>\\d{4})(\\d{2})");

        assertThat(ReplacementTemplate.parse("\\g<year>/\\g<2>").replaceAll(pattern, "202403"))
                .isEqualTo("2024/03");
    }

    @Test
    void testReplaceAll_ReplacesEveryOccurrence() {
        Pattern pattern = Pattern.compile("\\.");

        assertThat(ReplacementTemplate.parse("-").replaceAll(pattern, "15.03.2024")).isEqualTo("15-03-2024");
    }

    @Test
    void testReplaceAll_DollarIsLiteral() {
        Pattern pattern = Pattern.compile("a");

        assertThat(ReplacementTemplate.parse("$1").replaceAll(pattern, "abc")).isEqualTo("$1bc");
    }

    @Test
    void testReplaceAll_UnmatchedGroupIsEmpty() {
        Pattern pattern = Pattern.compile("(a)?b");

        assertThat(ReplacementTemplate.parse("[\\1]").replaceAll(pattern, "b")).isEqualTo("[]");
    }

    @Test
    void testParse_Escapes() {
        Pattern pattern = Pattern.compile("x");

        assertThat(ReplacementTemplate.parse("\\\\").replaceAll(pattern, "x")).isEqualTo("\\");
        assertThat(ReplacementTemplate.parse("\\t").replaceAll(pattern, "x")).isEqualTo("\t");
        assertThat(ReplacementTemplate.parse("\\q").replaceAll(pattern, "x")).isEqualTo("\\q");
    }

    @Test
    void testParse_MalformedNamedReference() {
        assertThatThrownBy(() -> ReplacementTemplate.parse("\\g<year"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ReplacementTemplate.parse("\\gyear"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testCheckGroups_MissingGroup() {
        ReplacementTemplate template = ReplacementTemplate.parse("\\2");

        assertThatThrownBy(() -> template.checkGroups(Pattern.compile("(a)")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("invalid group reference");
    }

    @Test
    void testReplaceAll_UnknownNamedGroup() {
        ReplacementTemplate template = ReplacementTemplate.parse("\\g<missing>");

        assertThatThrownBy(() -> template.replaceAll(Pattern.compile("(a)"), "a"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
