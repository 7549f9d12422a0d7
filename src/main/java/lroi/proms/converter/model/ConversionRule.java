package lroi.proms.converter.model;

import lombok.Getter;
import lroi.proms.converter.util.ReplacementTemplate;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * One {@code {match, replace?, flags?}} entry of a field's {@code value} list.
 *
 * With a replacement the rule rewrites the value; without one it only
 * validates that the whole value matches. A rule whose expression does not
 * compile is kept, with {@link #getPatternError()} set, and is inert when applied.
 */
@Getter
public final class ConversionRule {

    public static final String DEFAULT_FLAGS = "i";

    private static final Pattern GROUP_DEFINITION = Pattern.compile("\\(\\?P?<([A-Za-z_]\\w*)>");
    private static final Pattern GROUP_REFERENCE = Pattern.compile("\\(\\?P=([A-Za-z_]\\w*)\\)|\\\\k<([A-Za-z_]\\w*)>");
    private static final Pattern JAVA_GROUP_NAME = Pattern.compile("[A-Za-z][A-Za-z0-9]*");

    private final String match;
    private final String replace;
    private final String flags;

    private final Pattern pattern;
    private final ReplacementTemplate replacement;
    private final String patternError;

    private ConversionRule(String match, String replace, String flags,
                           Pattern pattern, ReplacementTemplate replacement, String patternError) {
        this.match = match;
        this.replace = replace;
        this.flags = flags;
        this.pattern = pattern;
        this.replacement = replacement;
        this.patternError = patternError;
    }

    public static ConversionRule substitution(String match, String replace) {
        return of(match, replace, null);
    }

    public static ConversionRule validation(String match) {
        return of(match, null, null);
    }

    /**
     * @param match   regular expression; {@code (?P<name>...)} groups are accepted,
     *                including names Java does not allow such as {@code day_num}
     * @param replace replacement text, or null for a validation-only rule
     * @param flags   any of "i", "m", "s"; null means {@value #DEFAULT_FLAGS}
     */
    public static ConversionRule of(String match, String replace, String flags) {
        String effectiveFlags = flags != null ? flags : DEFAULT_FLAGS;
        Pattern pattern = null;
        ReplacementTemplate template = null;
        String error = null;
        Map<String, String> groupAliases = new HashMap<>();
        try {
            pattern = Pattern.compile(toJavaSyntax(match, groupAliases), toPatternFlags(effectiveFlags));
            if (replace != null) {
                template = ReplacementTemplate.parse(replace, groupAliases);
                template.checkGroups(pattern);
            }
        } catch (PatternSyntaxException e) {
            pattern = null;
            error = e.getDescription() + " near index " + e.getIndex();
        } catch (IllegalArgumentException e) {
            pattern = null;
            error = e.getMessage();
        }
        return new ConversionRule(match, replace, effectiveFlags, pattern, template, error);
    }

    public boolean isValidationOnly() {
        return replace == null;
    }

    public boolean isInert() {
        return pattern == null;
    }

    public Optional<String> patternError() {
        return Optional.ofNullable(patternError);
    }

    static int toPatternFlags(String flags) {
        String lower = flags.toLowerCase(Locale.ROOT);
        int result = Pattern.UNICODE_CHARACTER_CLASS;
        if (lower.contains("i")) {
            result |= Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
        }
        if (lower.contains("m")) {
            result |= Pattern.MULTILINE;
        }
        if (lower.contains("s")) {
            result |= Pattern.DOTALL;
        }
        return result;
    }

    static String toJavaSyntax(String expression) {
        return toJavaSyntax(expression, new HashMap<>());
    }

    /**
     * Rewrites {@code (?P<name>...)} and {@code (?P=name)} into Java syntax.
     * Group names Java rejects (underscores, leading underscore) are renamed;
     * the renames are recorded in {@code aliases} for the replacement text.
     */
    static String toJavaSyntax(String expression, Map<String, String> aliases) {
        Set<String> taken = new HashSet<>();
        Matcher names = GROUP_DEFINITION.matcher(expression);
        while (names.find()) {
            taken.add(names.group(1));
        }

        StringBuilder defined = new StringBuilder();
        Matcher definitions = GROUP_DEFINITION.matcher(expression);
        while (definitions.find()) {
            String alias = aliasFor(definitions.group(1), aliases, taken);
            definitions.appendReplacement(defined, Matcher.quoteReplacement("(?<" + alias + ">"));
        }
        definitions.appendTail(defined);

        StringBuilder result = new StringBuilder();
        Matcher references = GROUP_REFERENCE.matcher(defined);
        while (references.find()) {
            String name = references.group(1) != null ? references.group(1) : references.group(2);
            String alias = aliases.getOrDefault(name, name);
            references.appendReplacement(result, Matcher.quoteReplacement("\\k<" + alias + ">"));
        }
        references.appendTail(result);
        return result.toString();
    }

    private static String aliasFor(String name, Map<String, String> aliases, Set<String> taken) {
        if (JAVA_GROUP_NAME.matcher(name).matches()) {
            return name;
        }
        String existing = aliases.get(name);
        if (existing != null) {
            return existing;
        }
        String base = "g" + name.replaceAll("[^A-Za-z0-9]", "");
        String alias = base;
        int suffix = 1;
        while (taken.contains(alias) || aliases.containsValue(alias)) {
            alias = base + suffix++;
        }
        aliases.put(name, alias);
        return alias;
    }

    @Override
    public String toString() {
        return replace == null
                ? "ConversionRule{match='" + match + "', flags='" + flags + "'}"
                : "ConversionRule{match='" + match + "', replace='" + replace + "', flags='" + flags + "'}";
    }
}
