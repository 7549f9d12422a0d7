package lroi.proms.converter.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replacement text of a conversion rule, parsed once.
 *
 * Mapping files write back-references in backslash form:
 *   \1 .. \99        numbered group
 *   \g<2>, \g<name>  numbered or named group
 *   \\               literal backslash
 *   \n \t \r         newline, tab, carriage return
 * Everything else, including '$', is literal text.
 */
public final class ReplacementTemplate {

    private interface Part {
        void appendTo(StringBuilder out, Matcher matcher);
    }

    private final String source;
    private final List<Part> parts;
    private final int highestGroupNumber;

    private ReplacementTemplate(String source, List<Part> parts, int highestGroupNumber) {
        this.source = source;
        this.parts = Collections.unmodifiableList(parts);
        this.highestGroupNumber = highestGroupNumber;
    }

    /**
     * Parse a replacement string.
     *
     * @throws IllegalArgumentException on a malformed {@code \g<...>} reference
     */
    public static ReplacementTemplate parse(String replacement) {
        return parse(replacement, Map.of());
    }

    /**
     * Parse a replacement string whose pattern had group names renamed.
     *
     * @param groupAliases original group name to the name used in the compiled pattern
     * @throws IllegalArgumentException on a malformed {@code \g<...>} reference
     */
    public static ReplacementTemplate parse(String replacement, Map<String, String> groupAliases) {
        List<Part> parts = new ArrayList<>();
        StringBuilder literal = new StringBuilder();
        int highestGroup = 0;
        int i = 0;

        while (i < replacement.length()) {
            char c = replacement.charAt(i);
            if (c != '\\' || i + 1 >= replacement.length()) {
                literal.append(c);
                i++;
                continue;
            }

            char next = replacement.charAt(i + 1);
            if (next == '0') {
                // octal escape, up to three digits
                int end = i + 1;
                while (end < replacement.length() && end < i + 4 && isOctal(replacement.charAt(end))) {
                    end++;
                }
                literal.append((char) Integer.parseInt(replacement.substring(i + 1, end), 8));
                i = end;
            } else if (Character.isDigit(next)) {
                int end = i + 2;
                if (end < replacement.length() && Character.isDigit(replacement.charAt(end))) {
                    end++;
                }
                int group = Integer.parseInt(replacement.substring(i + 1, end));
                flushLiteral(parts, literal);
                parts.add(numberedGroup(group));
                highestGroup = Math.max(highestGroup, group);
                i = end;
            } else if (next == 'g') {
                if (i + 2 >= replacement.length() || replacement.charAt(i + 2) != '<') {
                    throw new IllegalArgumentException("Missing '<' after \\g at index " + i);
                }
                int close = replacement.indexOf('>', i + 3);
                if (close < 0) {
                    throw new IllegalArgumentException("Unterminated group name at index " + i);
                }
                String name = replacement.substring(i + 3, close);
                if (name.isEmpty()) {
                    throw new IllegalArgumentException("Empty group name at index " + i);
                }
                flushLiteral(parts, literal);
                if (name.chars().allMatch(Character::isDigit)) {
                    int group = Integer.parseInt(name);
                    parts.add(numberedGroup(group));
                    highestGroup = Math.max(highestGroup, group);
                } else {
                    parts.add(namedGroup(groupAliases.getOrDefault(name, name)));
                }
                i = close + 1;
            } else {
                switch (next) {
                    case '\\':
                        literal.append('\\');
                        break;
                    case 'n':
                        literal.append('\n');
                        break;
                    case 't':
                        literal.append('\t');
                        break;
                    case 'r':
                        literal.append('\r');
                        break;
                    default:
                        literal.append('\\').append(next);
                }
                i += 2;
            }
        }
        flushLiteral(parts, literal);
        return new ReplacementTemplate(replacement, parts, highestGroup);
    }

    /**
     * Check that every numbered group the template refers to exists in the pattern.
     *
     * @throws IllegalArgumentException naming the first missing group
     */
    public void checkGroups(Pattern pattern) {
        int groupCount = pattern.matcher("").groupCount();
        if (highestGroupNumber > groupCount) {
            throw new IllegalArgumentException(
                    "invalid group reference " + highestGroupNumber + " (pattern has " + groupCount + " groups)");
        }
    }

    /**
     * Replace every match of the pattern in the input.
     *
     * @throws IllegalArgumentException when a named group does not exist
     */
    public String replaceAll(Pattern pattern, String input) {
        Matcher matcher = pattern.matcher(input);
        StringBuilder out = new StringBuilder();
        int last = 0;
        while (matcher.find()) {
            out.append(input, last, matcher.start());
            for (Part part : parts) {
                part.appendTo(out, matcher);
            }
            last = matcher.end();
        }
        out.append(input, last, input.length());
        return out.toString();
    }

    public String getSource() {
        return source;
    }

    private static boolean isOctal(char c) {
        return c >= '0' && c <= '7';
    }

    private static void flushLiteral(List<Part> parts, StringBuilder literal) {
        if (literal.length() > 0) {
            String text = literal.toString();
            parts.add((out, matcher) -> out.append(text));
            literal.setLength(0);
        }
    }

    private static Part numberedGroup(int group) {
        return (out, matcher) -> {
            String value = matcher.group(group);
            if (value != null) {
                out.append(value);
            }
        };
    }

    private static Part namedGroup(String name) {
        return (out, matcher) -> {
            String value = matcher.group(name);
            if (value != null) {
                out.append(value);
            }
        };
    }

    @Override
    public String toString() {
        return source;
    }
}
