package dateparserjava;

import java.util.*;

/**
 * Fixed token vocabularies shared by the dictionary, the tokenizer and the search segmenter.
 */
public final class TokenSets {
    private TokenSets() {
    }

    /**
     * Punctuation the downstream grammar engine understands on its own.
     */
    public static final List<String> PARSER_HARDCODED_TOKENS =
            Collections.unmodifiableList(Arrays.asList(":", ".", " ", "-", "/"));

    /**
     * Tokens the grammar engine knows, mapped by the dictionary from their lowercase form.
     */
    public static final List<String> PARSER_KNOWN_TOKENS =
            Collections.unmodifiableList(Arrays.asList("am", "pm", "UTC", "GMT", "Z"));

    /**
     * Tokens that are never dropped by the tokenizer and never get a separator when joined.
     */
    public static final List<String> ALWAYS_KEEP_TOKENS;

    static {
        List<String> keep = new ArrayList<>();
        keep.add("+");
        keep.addAll(PARSER_HARDCODED_TOKENS);
        ALWAYS_KEEP_TOKENS = Collections.unmodifiableList(keep);
    }

    /**
     * Canonical weekday names, in grammar-engine order.
     */
    public static final List<String> WEEKDAYS = Collections.unmodifiableList(Arrays.asList(
            "monday", "tuesday", "wednesday", "thursday", "friday", "saturday", "sunday"));

    /**
     * Canonical month names, in grammar-engine order.
     */
    public static final List<String> MONTHS = Collections.unmodifiableList(Arrays.asList(
            "january", "february", "march", "april", "may", "june",
            "july", "august", "september", "october", "november", "december"));

    /**
     * Canonical hour, minute and second unit names.
     */
    public static final List<String> HMS = Collections.unmodifiableList(Arrays.asList("hour", "minute", "second"));

    /**
     * Every canonical word a language file may provide surface forms for.
     */
    public static final List<String> KNOWN_WORD_TOKENS;

    static {
        List<String> words = new ArrayList<>(WEEKDAYS);
        words.addAll(MONTHS);
        words.addAll(Arrays.asList("decade", "year", "month", "week", "day",
                "hour", "minute", "second", "ago", "in", "am", "pm"));
        KNOWN_WORD_TOKENS = Collections.unmodifiableList(words);
    }

    /**
     * Time units whose presence keeps a translated "in" (as in "in 3 days").
     */
    public static final Set<String> FRESHNESS_WORDS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            "day", "week", "month", "year", "hour", "minute", "second")));

    /**
     * Dash-like tokens that never count as dictionary hits while searching.
     */
    public static final Set<String> SEARCH_DASHES = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            "-", "——", "—", "～")));

    /**
     * Characters stripped from both ends of a word before the search lookup.
     */
    public static final String SEARCH_STRIP_CHARS = "()\"{}[],.";

    private static final String COMMA_LIKE = "，,、";

    /**
     * Returns whether the token is a single comma-like mark (ASCII, full-width or ideographic).
     *
     * @param token the token to test
     * @return {@code true} for {@code ","}, {@code "，"} and {@code "、"}
     */
    public static boolean isCommaLike(String token) {
        return token != null && token.length() == 1 && COMMA_LIKE.indexOf(token.charAt(0)) >= 0;
    }

    /**
     * Removes every leading and trailing character contained in {@code chars}.
     *
     * @param s     the string to strip
     * @param chars the characters to remove
     * @return the stripped string (possibly empty)
     */
    public static String strip(String s, String chars) {
        int start = 0;
        int end = s.length();
        while (start < end && chars.indexOf(s.charAt(start)) >= 0) start++;
        while (end > start && chars.indexOf(s.charAt(end - 1)) >= 0) end--;
        return s.substring(start, end);
    }

    /**
     * Returns whether the token is non-empty and made of decimal digits only.
     *
     * @param token the token to test
     * @return {@code true} if every code point is a digit
     */
    public static boolean isDigits(String token) {
        if (token == null || token.isEmpty()) return false;
        for (int i = 0; i < token.length(); ) {
            int cp = token.codePointAt(i);
            if (!Character.isDigit(cp)) return false;
            i += Character.charCount(cp);
        }
        return true;
    }
}
