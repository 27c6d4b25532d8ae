package dateparserjava;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A single {@code pattern → replacement} simplification rule.
 *
 * <p>The replacement is a template: {@code \1} and {@code \g<1>} refer to capture
 * groups of the pattern, {@code \\} is a literal backslash, {@code \n} and {@code \t}
 * are control characters, and everything else is copied literally. Unmatched groups
 * expand to the empty string.</p>
 *
 * <p>When a rule is applied in boundary-wrapped form the surrounding boundary groups
 * are re-emitted around the expansion and the template's group references are
 * shifted by one so that {@code \1} keeps pointing at the rule's own first group.</p>
 */
public final class Simplification {
    private final String pattern;
    private final String replacement;

    /**
     * Parsed template, built on first use; concurrent builds produce equal results.
     */
    private volatile List<Object> template;

    public Simplification(String pattern, String replacement) {
        this.pattern = Objects.requireNonNull(pattern, "pattern");
        this.replacement = Objects.requireNonNull(replacement, "replacement");
    }

    public Simplification(String pattern, int replacement) {
        this(pattern, String.valueOf(replacement));
    }

    public String getPattern() {
        return pattern;
    }

    public String getReplacement() {
        return replacement;
    }

    /**
     * Returns this rule with both pattern and replacement Unicode-normalized.
     *
     * @return the normalized rule
     */
    public Simplification normalized() {
        return new Simplification(UnicodeNormalizer.normalize(pattern), UnicodeNormalizer.normalize(replacement));
    }

    /**
     * Returns the boundary-wrapped form of the pattern used by whitespace-delimited languages.
     * The rule only matches when flanked by start/end of text, a digit, an underscore or a
     * non-word character.
     *
     * @return the wrapped regular expression
     */
    public String wrappedPattern() {
        return "(\\A|\\d|_|\\W)" + pattern + "(\\d|_|\\W|\\z)";
    }

    /**
     * Replaces every match of {@code compiled} in {@code text}.
     *
     * @param text     the text to rewrite
     * @param compiled the compiled pattern (raw or wrapped)
     * @param wrapped  whether {@code compiled} was built from {@link #wrappedPattern()}
     * @return the rewritten text
     * @throws LanguageConfigurationException if the replacement template is malformed
     *                                        or references a group the pattern lacks
     */
    public String apply(String text, Pattern compiled, boolean wrapped) {
        Matcher m = compiled.matcher(text);
        if (!m.find()) return text;

        List<Object> parts = template();
        int last = m.groupCount();
        StringBuilder sb = new StringBuilder(text.length() + 16);
        do {
            String expansion;
            if (wrapped) {
                expansion = group(m, 1) + expand(parts, m, 1) + group(m, last);
            } else {
                expansion = expand(parts, m, 0);
            }
            m.appendReplacement(sb, Matcher.quoteReplacement(expansion));
        } while (m.find());
        m.appendTail(sb);
        return sb.toString();
    }

    private String expand(List<Object> parts, Matcher m, int offset) {
        if (parts.size() == 1 && parts.get(0) instanceof String) {
            return (String) parts.get(0);
        }
        StringBuilder sb = new StringBuilder();
        for (Object part : parts) {
            if (part instanceof Integer) {
                int index = (Integer) part + offset;
                if (index > m.groupCount()) {
                    throw new LanguageConfigurationException(
                            "Replacement '" + replacement + "' references missing group " + part
                                    + " of pattern '" + pattern + "'");
                }
                sb.append(group(m, index));
            } else {
                sb.append((String) part);
            }
        }
        return sb.toString();
    }

    private static String group(Matcher m, int index) {
        String g = m.group(index);
        return g == null ? "" : g;
    }

    private List<Object> template() {
        List<Object> t = template;
        if (t == null) {
            t = parseTemplate(replacement);
            template = t;
        }
        return t;
    }

    /**
     * Splits a replacement template into literal strings and {@link Integer} group references.
     */
    static List<Object> parseTemplate(String replacement) {
        List<Object> parts = new ArrayList<>();
        StringBuilder literal = new StringBuilder();
        int n = replacement.length();
        int i = 0;
        while (i < n) {
            char c = replacement.charAt(i);
            if (c != '\\' || i + 1 >= n) {
                literal.append(c);
                i++;
                continue;
            }

            char next = replacement.charAt(i + 1);
            if (Character.isDigit(next)) {
                // at most two digits, as in \12
                int end = i + 2;
                if (end < n && Character.isDigit(replacement.charAt(end))) end++;
                flush(literal, parts);
                parts.add(Integer.parseInt(replacement.substring(i + 1, end)));
                i = end;
            } else if (next == 'g' && i + 2 < n && replacement.charAt(i + 2) == '<') {
                int close = replacement.indexOf('>', i + 3);
                if (close < 0) {
                    throw new LanguageConfigurationException("Unterminated group reference in replacement: " + replacement);
                }
                String ref = replacement.substring(i + 3, close);
                if (!TokenSets.isDigits(ref)) {
                    throw new LanguageConfigurationException("Named group references are not supported: " + replacement);
                }
                flush(literal, parts);
                parts.add(Integer.parseInt(ref));
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
                    default:
                        literal.append('\\').append(next);
                        break;
                }
                i += 2;
            }
        }
        flush(literal, parts);
        if (parts.isEmpty()) parts.add("");
        return Collections.unmodifiableList(parts);
    }

    private static void flush(StringBuilder literal, List<Object> parts) {
        if (literal.length() > 0) {
            parts.add(literal.toString());
            literal.setLength(0);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Simplification)) return false;
        Simplification s = (Simplification) o;
        return s.pattern.equals(pattern) && s.replacement.equals(replacement);
    }

    @Override
    public int hashCode() {
        return pattern.hashCode() * 31 + replacement.hashCode();
    }

    @Override
    public String toString() {
        return pattern + " → " + replacement;
    }
}
