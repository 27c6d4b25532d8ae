package dateparserjava;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * A language able to normalize, tokenize and translate date expressions into the
 * canonical English vocabulary understood by the downstream date-grammar engine.
 *
 * <p>Two processing paths are offered:</p>
 * <ul>
 *   <li>{@link #translate(String, boolean, Settings)} for a single date string:
 *       simplify → split → translate tokens → join</li>
 *   <li>{@link #translateSearch(String, Settings)} for free text: split sentences →
 *       split words → collect runs of known or numeric words → join each run</li>
 * </ul>
 *
 * <p>All heavy state (dictionary, compiled simplification patterns, derived character
 * and splitter sets) is built lazily on first use, separately for each cache family
 * selected by {@link Settings}, and never invalidated afterwards. A {@code Language}
 * may be shared between threads.</p>
 *
 * <h3>Usage Example:</h3>
 * <pre>{@code
 * Language ru = LanguageLoader.getDefault().get("ru");
 * ru.translate("10 января 2015", false, Settings.defaults()); // "10 january 2015"
 * }</pre>
 */
public class Language {
    /**
     * Internal logger for cache builds. Disabled by default.
     */
    private static final Logger LOGGER = Logger.getLogger(Language.class.getName());

    static {
        LOGGER.setLevel(Level.OFF);
    }

    /**
     * Enables or disables verbose logging of cache builds.
     *
     * @param enabled {@code true} to log at {@code FINE}, {@code false} to disable logging
     */
    public static void setVerboseLogging(boolean enabled) {
        LOGGER.setLevel(enabled ? Level.FINE : Level.OFF);
    }

    private static final Pattern NON_WORD_TOKEN = Pattern.compile("^\\W+$", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern NON_LETTER_WORD = Pattern.compile("^[\\W\\d_]+$", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern DIGIT = Pattern.compile("\\d", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern DIGIT_OR_NUMERIC_PUNCT = Pattern.compile("[\\d.:\\-/]", Pattern.UNICODE_CHARACTER_CLASS);

    private final String shortname;
    private final LanguageInfo info;
    private final OffsetStripper offsetStripper;

    /**
     * Cache families, keyed by normalization mode and skip tokens.
     */
    private final ConcurrentMap<Settings.CacheKey, ModeCache> caches = new ConcurrentHashMap<>();

    /**
     * Creates a language using the default {@link TimezoneOffsets} stripper.
     *
     * @param shortname the language code, e.g. {@code "en"}
     * @param info      the language configuration
     */
    public Language(String shortname, LanguageInfo info) {
        this(shortname, info, TimezoneOffsets.INSTANCE);
    }

    /**
     * Creates a language.
     *
     * @param shortname      the language code, e.g. {@code "en"}
     * @param info           the language configuration
     * @param offsetStripper strips trailing timezones for {@link #isApplicable(String, boolean, Settings)}
     */
    public Language(String shortname, LanguageInfo info, OffsetStripper offsetStripper) {
        this.shortname = Objects.requireNonNull(shortname, "shortname");
        this.info = Objects.requireNonNull(info, "info");
        this.offsetStripper = Objects.requireNonNull(offsetStripper, "offsetStripper");
    }

    public String getShortname() {
        return shortname;
    }

    public LanguageInfo getInfo() {
        return info;
    }

    /**
     * Validates this language's configuration with the default {@link LanguageValidator}.
     *
     * @return {@code true} if the configuration is valid
     */
    public boolean validateInfo() {
        return validateInfo(new LanguageValidator());
    }

    public boolean validateInfo(LanguageValidator validator) {
        return validator.validate(shortname, info);
    }

    // ---------------------------------------------------------------------
    // Public operations
    // ---------------------------------------------------------------------

    /**
     * Returns whether every token of {@code text} is digits or a dictionary word.
     *
     * @param text          the date string
     * @param stripTimezone whether to strip a trailing timezone first
     * @param settings      processing options
     * @return {@code true} if this language can translate the whole string
     */
    public boolean isApplicable(String text, boolean stripTimezone, Settings settings) {
        Objects.requireNonNull(text, "text");
        if (stripTimezone) {
            text = offsetStripper.popOffset(text).getRemaining();
        }

        String simplified = simplify(text, settings);
        List<String> tokens = split(simplified, false, settings);
        if (isDigitsOnly(tokens)) {
            return true;
        }
        return areAllWordsInDictionary(tokens, settings);
    }

    /**
     * Translates a date string into canonical vocabulary.
     *
     * <p>Known tokens are replaced by their translation, deleted words are dropped and
     * unknown tokens pass through unchanged. A translated {@code "in"} is dropped unless
     * a time unit word (day, week, ...) is also present.</p>
     *
     * @param text           the date string
     * @param keepFormatting whether punctuation and spacing tokens are kept verbatim
     * @param settings       processing options
     * @return the translated string; tokens joined by a space, or by nothing when
     * {@code keepFormatting} is set
     */
    public String translate(String text, boolean keepFormatting, Settings settings) {
        Objects.requireNonNull(text, "text");
        String simplified = simplify(text, settings);
        List<String> words = split(simplified, keepFormatting, settings);

        Dictionary dictionary = getDictionary(settings);
        for (int i = 0; i < words.size(); i++) {
            String translation = dictionary.translate(words.get(i).toLowerCase(Locale.ROOT));
            if (translation != null) {
                words.set(i, translation);
            }
        }
        if (words.contains("in")) {
            clearFutureWords(words);
        }
        words.removeIf(String::isEmpty);

        return join(words, keepFormatting ? "" : " ", settings);
    }

    /**
     * Finds date-like spans in free text.
     *
     * <p>The text is split into sentences and words; each maximal run of dictionary
     * words and numeric words becomes one chunk. Unknown words end the current chunk
     * and belong to none. Deleted words (skip and pertain words) count as unknown here,
     * so they never become part of a span.</p>
     *
     * @param text     the free text to scan
     * @param settings processing options
     * @return translated chunks with their original text, aligned by index
     * @throws LanguageConfigurationException if the sentence splitter group is invalid
     */
    public SearchResult translateSearch(String text, Settings settings) {
        Objects.requireNonNull(text, "text");
        SentenceSplitter splitter = SentenceSplitter.forInfo(info);
        Dictionary dictionary = getDictionary(settings);

        List<List<String>> translated = new ArrayList<>();
        List<List<String>> original = new ArrayList<>();

        for (String sentence : splitter.split(text)) {
            List<String> translatedChunk = new ArrayList<>();
            List<String> originalChunk = new ArrayList<>();

            for (String word : wordSplit(sentence, settings)) {
                String simplified = simplify(word.toLowerCase(Locale.ROOT), settings);
                String stripped = TokenSets.strip(simplified, TokenSets.SEARCH_STRIP_CHARS);

                String translation = dictionary.translate(stripped);
                if (isSearchHit(translation, simplified)) {
                    translatedChunk.add(translation);
                    originalChunk.add(word);
                } else if (tokenWithDigitsIsOk(simplified)) {
                    translatedChunk.add(simplified);
                    originalChunk.add(word);
                } else if (!translatedChunk.isEmpty()) {
                    translated.add(translatedChunk);
                    original.add(originalChunk);
                    translatedChunk = new ArrayList<>();
                    originalChunk = new ArrayList<>();
                }
            }
            if (!translatedChunk.isEmpty()) {
                translated.add(translatedChunk);
                original.add(originalChunk);
            }
        }

        List<String> translatedStrings = new ArrayList<>(translated.size());
        List<String> originalStrings = new ArrayList<>(original.size());
        for (int i = 0; i < translated.size(); i++) {
            List<String> chunk = translated.get(i);
            if (chunk.contains("in")) {
                clearFutureWords(chunk);
            }
            chunk.removeIf(String::isEmpty);
            List<String> originalChunk = original.get(i);
            originalChunk.removeIf(String::isEmpty);

            translatedStrings.add(joinChunk(chunk, settings));
            originalStrings.add(joinChunk(originalChunk, settings));
        }
        return new SearchResult(translatedStrings, originalStrings);
    }

    /**
     * Lowercases {@code text} and applies every simplification rule once, in order.
     *
     * <p>For whitespace-delimited languages each rule only matches when flanked by a
     * word boundary, a digit, an underscore or a non-word character.</p>
     *
     * @param text     the text to simplify
     * @param settings processing options
     * @return the simplified, lowercase text
     * @throws LanguageConfigurationException if a rule's pattern does not compile
     */
    public String simplify(String text, Settings settings) {
        ModeCache cache = cache(settings);
        String result = text.toLowerCase(Locale.ROOT);
        boolean wrapped = !info.isNoWordSpacing();

        for (Simplification rule : getSimplifications(settings)) {
            Pattern pattern = cache.patterns.get(wrapped ? rule.wrappedPattern() : rule.getPattern());
            result = rule.apply(result, pattern, wrapped).toLowerCase(Locale.ROOT);
        }
        return result;
    }

    /**
     * Splits simplified text into digit runs and dictionary words/phrases.
     *
     * <p>Punctuation-only skip tokens split wherever they occur, except word-char
     * splitters, which are left inside a word when word characters surround them.</p>
     *
     * @param text           the (simplified) text
     * @param keepFormatting whether punctuation-only and whitespace-only tokens are kept
     * @param settings       processing options
     * @return the tokens in order, never empty strings
     */
    public List<String> split(String text, boolean keepFormatting, Settings settings) {
        Dictionary dictionary = getDictionary(settings);
        Splitters splitters = getSplitters(settings);
        Set<String> wordChars = getWordChars(settings);
        List<String> tokens = new ArrayList<>();
        for (String piece : Dictionary.splitDigitRuns(text)) {
            tokens.addAll(dictionary.split(piece, keepFormatting, splitters, wordChars));
        }
        return tokens;
    }

    /**
     * Joins tokens, never putting {@code separator} next to a capturing splitter.
     *
     * @param tokens    the tokens to join
     * @param separator the separator between ordinary tokens
     * @param settings  processing options
     * @return the joined string
     */
    public String join(List<String> tokens, String separator, Settings settings) {
        if (tokens.isEmpty()) return "";
        return new Joiner(getSplitters(settings).getCapturing()).join(tokens, separator);
    }

    /**
     * Projects this language's name lists for the date-grammar engine.
     *
     * @return the descriptor
     * @throws LanguageConfigurationException if a weekday, month or hour/minute/second
     *                                        list is missing
     */
    public ParserInfo toParserInfo() {
        return new ParserInfo(info.getName(), info.getSkip(), info.getPertain(),
                nameLists(TokenSets.WEEKDAYS), nameLists(TokenSets.MONTHS), nameLists(TokenSets.HMS));
    }

    // ---------------------------------------------------------------------
    // Caches
    // ---------------------------------------------------------------------

    /**
     * Returns the dictionary of the cache family selected by {@code settings}.
     *
     * @param settings processing options
     * @return the raw or normalized dictionary
     */
    public Dictionary getDictionary(Settings settings) {
        ModeCache cache = cache(settings);
        return ModeCache.getOrInit(cache.dictionary, () -> {
            LOGGER.fine(() -> shortname + ": building dictionary (" + settings.cacheKey() + ")");
            return settings.isNormalize() ? Dictionary.normalized(info, settings) : Dictionary.of(info, settings);
        });
    }

    /**
     * Characters occurring in dictionary words (space excluded), plus the ten ASCII digits.
     *
     * @param settings processing options
     * @return the lowercase word characters
     */
    public Set<String> getWordChars(Settings settings) {
        ModeCache cache = cache(settings);
        return ModeCache.getOrInit(cache.wordchars, () -> buildWordChars(settings));
    }

    /**
     * Returns the derived splitter sets.
     *
     * @param settings processing options
     * @return the wordchars, plain and capturing splitters
     */
    public Splitters getSplitters(Settings settings) {
        ModeCache cache = cache(settings);
        return ModeCache.getOrInit(cache.splitters, () -> buildSplitters(settings));
    }

    /**
     * Returns the simplification rules of the cache family selected by {@code settings}.
     *
     * @param settings processing options
     * @return the rules, Unicode-normalized in normalized mode
     */
    public List<Simplification> getSimplifications(Settings settings) {
        ModeCache cache = cache(settings);
        return ModeCache.getOrInit(cache.simplifications, () -> {
            if (!settings.isNormalize()) return info.getSimplifications();
            List<Simplification> rules = new ArrayList<>(info.getSimplifications().size());
            for (Simplification rule : info.getSimplifications()) {
                rules.add(rule.normalized());
            }
            return Collections.unmodifiableList(rules);
        });
    }

    /**
     * Number of simplification patterns compiled so far for the given cache family.
     *
     * @param settings processing options
     * @return the pattern cache size
     */
    public int compiledPatternCount(Settings settings) {
        return cache(settings).patterns.size();
    }

    private ModeCache cache(Settings settings) {
        Objects.requireNonNull(settings, "settings");
        return caches.computeIfAbsent(settings.cacheKey(), k -> new ModeCache());
    }

    private Set<String> buildWordChars(Settings settings) {
        Set<String> chars = new HashSet<>();
        for (String word : getDictionary(settings).words()) {
            if (NON_LETTER_WORD.matcher(word).matches()) continue;
            for (int i = 0; i < word.length(); ) {
                int cp = word.codePointAt(i);
                chars.add(new String(Character.toChars(cp)).toLowerCase(Locale.ROOT));
                i += Character.charCount(cp);
            }
        }
        chars.remove(" ");
        for (char d = '0'; d <= '9'; d++) {
            chars.add(String.valueOf(d));
        }
        LOGGER.fine(() -> shortname + ": " + chars.size() + " word characters");
        return Collections.unmodifiableSet(chars);
    }

    private Splitters buildSplitters(Settings settings) {
        Set<String> capturing = new LinkedHashSet<>(TokenSets.ALWAYS_KEEP_TOKENS);
        Set<String> wordcharSplitters = new LinkedHashSet<>();
        Set<String> plainSplitters = new LinkedHashSet<>();

        Set<String> wordchars = getWordChars(settings);
        Set<String> candidates = new LinkedHashSet<>(info.getSkip());
        candidates.addAll(capturing);
        for (String token : candidates) {
            if (!NON_WORD_TOKEN.matcher(token).matches()) continue;
            String key = token.toLowerCase(Locale.ROOT);
            if (wordchars.contains(key)) {
                wordcharSplitters.add(key);
            } else {
                plainSplitters.add(key);
            }
        }
        return new Splitters(wordcharSplitters, plainSplitters, capturing);
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private List<String> wordSplit(String sentence, Settings settings) {
        if (info.isNoWordSpacing()) {
            return split(sentence, true, settings);
        }
        List<String> words = new ArrayList<>();
        for (String word : WHITESPACE.split(sentence)) {
            if (!word.isEmpty()) words.add(word);
        }
        return words;
    }

    private String joinChunk(List<String> chunk, Settings settings) {
        if (info.isNoWordSpacing()) {
            return join(chunk, "", settings);
        }
        return String.join(" ", chunk);
    }

    private static boolean isSearchHit(String translation, String simplified) {
        return translation != null && !translation.isEmpty() && !TokenSets.SEARCH_DASHES.contains(simplified);
    }

    private boolean tokenWithDigitsIsOk(String token) {
        Pattern p = info.isNoWordSpacing() ? DIGIT_OR_NUMERIC_PUNCT : DIGIT;
        return p.matcher(token).find();
    }

    /**
     * Drops the first {@code "in"} unless a time unit word is present.
     */
    private static void clearFutureWords(List<String> words) {
        if (Collections.disjoint(words, TokenSets.FRESHNESS_WORDS)) {
            words.remove("in");
        }
    }

    private static boolean isDigitsOnly(List<String> tokens) {
        for (String token : tokens) {
            if (!TokenSets.isDigits(token)) return false;
        }
        return true;
    }

    private boolean areAllWordsInDictionary(List<String> tokens, Settings settings) {
        Dictionary dictionary = getDictionary(settings);
        for (String token : tokens) {
            String word = token.toLowerCase(Locale.ROOT);
            if (!TokenSets.isDigits(word) && !dictionary.contains(word)) {
                return false;
            }
        }
        return true;
    }

    private List<List<String>> nameLists(List<String> canonicalWords) {
        List<List<String>> lists = new ArrayList<>(canonicalWords.size());
        for (String canonical : canonicalWords) {
            if (!info.hasWords(canonical)) {
                throw new LanguageConfigurationException("Language " + shortname + " has no translations for '"
                        + canonical + "'");
            }
            lists.add(info.getWords(canonical));
        }
        return lists;
    }

    @Override
    public String toString() {
        return "<Language " + shortname + ">";
    }
}
