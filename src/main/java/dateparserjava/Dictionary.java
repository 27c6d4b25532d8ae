package dateparserjava;

import java.util.*;
import java.util.logging.Logger;

/**
 * Lowercase phrase table of one language: maps a word or multi-word phrase to its
 * canonical translation, or to the empty string for words that are deleted.
 *
 * <p>The table is built from a {@link LanguageInfo} in this order, later sources
 * overriding earlier ones:</p>
 * <ol>
 *   <li>skip and pertain words → deletion</li>
 *   <li>surface forms of every canonical word → that canonical word</li>
 *   <li>{@link TokenSets#ALWAYS_KEEP_TOKENS} → themselves</li>
 *   <li>{@link TokenSets#PARSER_KNOWN_TOKENS}, lowercased → their canonical spelling</li>
 *   <li>relative phrases → their canonical phrase</li>
 *   <li>{@link Settings#getSkipTokens()} → deletion</li>
 * </ol>
 *
 * <p>The normalized variant ({@link #normalized(LanguageInfo, Settings)}) folds every key
 * with {@link UnicodeNormalizer}. Instances are immutable and safe to share.</p>
 */
public class Dictionary {
    private static final Logger LOGGER = Logger.getLogger(Dictionary.class.getName());

    private final Map<String, String> entries;
    private final boolean noWordSpacing;

    /**
     * Longest key, in UTF-16 units.
     */
    private final int maxLength;

    /**
     * Shortest key, in UTF-16 units.
     */
    private final int minLength;

    private Dictionary(Map<String, String> entries, boolean noWordSpacing) {
        this.entries = Collections.unmodifiableMap(entries);
        this.noWordSpacing = noWordSpacing;

        int max = 0;
        int min = Integer.MAX_VALUE;
        for (String key : entries.keySet()) {
            int len = key.length();
            if (len > max) max = len;
            if (len < min) min = len;
        }
        if (entries.isEmpty()) {
            min = 0;
        }
        this.maxLength = max;
        this.minLength = min;
    }

    /**
     * Builds the raw dictionary of a language.
     *
     * @param info     the language configuration
     * @param settings supplies the extra skip tokens
     * @return the dictionary
     */
    public static Dictionary of(LanguageInfo info, Settings settings) {
        Map<String, String> entries = baseEntries(info);
        addSkipTokens(entries, settings);
        LOGGER.fine(() -> "Built dictionary for " + info.getName() + " with " + entries.size() + " entries");
        return new Dictionary(entries, info.isNoWordSpacing());
    }

    /**
     * Builds the Unicode-normalized dictionary of a language.
     *
     * <p>When folding a key collides with a key that is already in folded form, the
     * folded key keeps its own translation unless the colliding key is a skip or
     * pertain word.</p>
     *
     * @param info     the language configuration
     * @param settings supplies the extra skip tokens
     * @return the normalized dictionary
     */
    public static Dictionary normalized(LanguageInfo info, Settings settings) {
        Map<String, String> base = baseEntries(info);
        Map<String, String> folded = new LinkedHashMap<>();
        List<String> conflicting = new ArrayList<>();

        for (Map.Entry<String, String> e : base.entrySet()) {
            String key = e.getKey();
            String normalizedKey = UnicodeNormalizer.normalize(key);
            if (!key.equals(normalizedKey) && base.containsKey(normalizedKey)) {
                conflicting.add(key);
            } else {
                folded.put(normalizedKey, e.getValue());
            }
        }

        Set<String> inert = new HashSet<>();
        for (String word : info.getSkip()) inert.add(lower(word));
        for (String word : info.getPertain()) inert.add(lower(word));
        for (String key : conflicting) {
            if (inert.contains(key)) {
                folded.put(UnicodeNormalizer.normalize(key), base.get(key));
            }
        }

        addSkipTokens(folded, settings);
        LOGGER.fine(() -> "Built normalized dictionary for " + info.getName() + " with " + folded.size() + " entries");
        return new Dictionary(folded, info.isNoWordSpacing());
    }

    private static Map<String, String> baseEntries(LanguageInfo info) {
        Map<String, String> entries = new LinkedHashMap<>();
        for (String word : info.getSkip()) entries.put(lower(word), "");
        for (String word : info.getPertain()) entries.put(lower(word), "");

        for (String canonical : TokenSets.KNOWN_WORD_TOKENS) {
            for (String form : info.getWords(canonical)) {
                entries.put(lower(form), canonical);
            }
        }

        for (String token : TokenSets.ALWAYS_KEEP_TOKENS) entries.put(token, token);
        for (String token : TokenSets.PARSER_KNOWN_TOKENS) entries.put(lower(token), token);

        for (Map.Entry<String, List<String>> e : info.getRelativeType().entrySet()) {
            for (String phrase : e.getValue()) {
                entries.put(lower(phrase), e.getKey());
            }
        }

        entries.remove("");
        return entries;
    }

    private static void addSkipTokens(Map<String, String> entries, Settings settings) {
        for (String token : settings.getSkipTokens()) {
            if (!token.isEmpty()) entries.put(token, "");
        }
    }

    private static String lower(String s) {
        return s.toLowerCase(Locale.ROOT);
    }

    /**
     * Returns whether the word or phrase is known, ignoring case.
     *
     * @param word the word to look up
     * @return {@code true} if the dictionary has an entry for it
     */
    public boolean contains(String word) {
        return word != null && entries.containsKey(lower(word));
    }

    /**
     * Returns the canonical translation of a word, ignoring case.
     *
     * @param word the word to look up
     * @return the translation, the empty string for deleted words, or {@code null} if unknown
     */
    public String translate(String word) {
        return word == null ? null : entries.get(lower(word));
    }

    /**
     * All keys of this dictionary, including the settings skip tokens.
     *
     * @return an unmodifiable view of the keys
     */
    public Set<String> words() {
        return entries.keySet();
    }

    public int size() {
        return entries.size();
    }

    public int getMaxLength() {
        return maxLength;
    }

    public int getMinLength() {
        return minLength;
    }

    public boolean isNoWordSpacing() {
        return noWordSpacing;
    }

    // ---------------------------------------------------------------------
    // Splitting
    // ---------------------------------------------------------------------

    /**
     * Splits text into known words/phrases and the fragments between them.
     *
     * <p>Scanning runs left to right. At each position the longest key is tried first;
     * for whitespace-delimited languages a candidate only matches when flanked on both
     * sides by the start/end of the segment, a non-word character, an underscore or a
     * digit. Fragments between matches are further split on digit runs. A fragment is
     * kept when {@code keepFormatting} is set, when it is one of
     * {@link TokenSets#ALWAYS_KEEP_TOKENS}, or when it contains a letter or digit.</p>
     *
     * @param text           the text to split
     * @param keepFormatting whether punctuation-only and whitespace-only fragments are kept
     * @return the tokens, in order; never containing empty strings
     */
    public List<String> split(String text, boolean keepFormatting) {
        return split(text, keepFormatting, null, Collections.<String>emptySet());
    }

    /**
     * Splits text like {@link #split(String, boolean)}, honouring a language's splitters.
     *
     * <p>Plain splitters match wherever they occur, even inside a run of letters.
     * Word-char splitters match unless both neighbouring characters belong to
     * {@code wordChars}.</p>
     *
     * @param text           the text to split
     * @param keepFormatting whether punctuation-only and whitespace-only fragments are kept
     * @param splitters      the language's splitter sets, or {@code null} for none
     * @param wordChars      lowercase characters that occur inside dictionary words
     * @return the tokens, in order; never containing empty strings
     */
    public List<String> split(String text, boolean keepFormatting, Splitters splitters, Set<String> wordChars) {
        List<String> tokens = new ArrayList<>();
        if (text == null || text.isEmpty()) return tokens;

        final int n = text.length();
        int start = 0;
        int i = 0;
        while (i < n) {
            int len = longestMatchAt(text, i, start, splitters, wordChars);
            if (len > 0) {
                if (i > start) {
                    addFragment(text.substring(start, i), keepFormatting, tokens);
                }
                String known = text.substring(i, i + len);
                if (shouldCapture(known, keepFormatting)) {
                    tokens.add(known);
                }
                i += len;
                start = i;
            } else {
                i += Character.charCount(text.codePointAt(i));
            }
        }
        if (start < n) {
            addFragment(text.substring(start), keepFormatting, tokens);
        }
        return tokens;
    }

    /**
     * Returns the length of the longest key matching at {@code i}, or 0.
     * {@code segmentStart} is where the text following the previous match begins.
     */
    private int longestMatchAt(String text, int i, int segmentStart, Splitters splitters, Set<String> wordChars) {
        final int n = text.length();
        boolean startOk = noWordSpacing || i == segmentStart || isBoundary(text.codePointBefore(i));

        int maxScanLen = Math.min(maxLength, n - i);
        for (int len = maxScanLen; len > 0 && len >= minLength; len--) {
            final int end = i + len;
            String key = lower(text.substring(i, end));
            if (!entries.containsKey(key)) continue;

            if (splitters != null) {
                if (splitters.getPlain().contains(key)) return len;
                if (splitters.getWordchars().contains(key)) {
                    if (!isFlankedByWordChars(text, i, end, wordChars)) return len;
                    continue;
                }
            }
            if (!startOk) continue;
            if (!noWordSpacing && end < n && !isBoundary(text.codePointAt(end))) continue;
            return len;
        }
        return 0;
    }

    private static boolean isFlankedByWordChars(String text, int start, int end, Set<String> wordChars) {
        if (start == 0 || end >= text.length()) return false;
        String before = new String(Character.toChars(text.codePointBefore(start))).toLowerCase(Locale.ROOT);
        String after = new String(Character.toChars(text.codePointAt(end))).toLowerCase(Locale.ROOT);
        return wordChars.contains(before) && wordChars.contains(after);
    }

    private void addFragment(String fragment, boolean keepFormatting, List<String> out) {
        if (shouldCapture(fragment, keepFormatting)) {
            splitByNumerals(fragment, keepFormatting, out);
        }
    }

    private static void splitByNumerals(String fragment, boolean keepFormatting, List<String> out) {
        for (String piece : splitDigitRuns(fragment)) {
            if (shouldCapture(piece, keepFormatting)) out.add(piece);
        }
    }

    private static boolean shouldCapture(String token, boolean keepFormatting) {
        return keepFormatting || TokenSets.ALWAYS_KEEP_TOKENS.contains(token) || hasLetterOrDigit(token);
    }

    /**
     * Splits text into alternating digit runs and non-digit runs, dropping empty pieces.
     *
     * @param text the text to split
     * @return the pieces in order
     */
    public static List<String> splitDigitRuns(String text) {
        List<String> pieces = new ArrayList<>();
        int n = text.length();
        int start = 0;
        boolean inDigits = false;
        for (int i = 0; i < n; ) {
            int cp = text.codePointAt(i);
            boolean digit = Character.isDigit(cp);
            if (i > start && digit != inDigits) {
                pieces.add(text.substring(start, i));
                start = i;
            }
            inDigits = digit;
            i += Character.charCount(cp);
        }
        if (start < n) pieces.add(text.substring(start));
        return pieces;
    }

    /**
     * Returns whether the code point may flank a word: anything but a letter or combining mark.
     * Digits and underscores count as boundaries.
     */
    static boolean isBoundary(int cp) {
        return !Character.isLetter(cp) && !isMark(cp);
    }

    private static boolean isMark(int cp) {
        int type = Character.getType(cp);
        return type == Character.NON_SPACING_MARK
                || type == Character.COMBINING_SPACING_MARK
                || type == Character.ENCLOSING_MARK;
    }

    private static boolean hasLetterOrDigit(String token) {
        for (int i = 0; i < token.length(); ) {
            int cp = token.codePointAt(i);
            if (Character.isLetterOrDigit(cp) || isMark(cp)) return true;
            i += Character.charCount(cp);
        }
        return false;
    }

    @Override
    public String toString() {
        return "<Dictionary with " + entries.size() + " entries" + (noWordSpacing ? ", no word spacing>" : ">");
    }
}
