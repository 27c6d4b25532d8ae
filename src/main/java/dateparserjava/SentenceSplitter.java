package dateparserjava;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Script-family sentence boundary rules, selected by a language's
 * {@code sentence_splitter_group}.
 *
 * <p>Each constant owns its compiled boundary pattern. Groups are resolved through a
 * lookup table, so adding a script family only means adding a constant.</p>
 */
public enum SentenceSplitter {

    /**
     * Group 1: most European languages, Tagalog, Hebrew, Georgian, Indonesian, Vietnamese.
     */
    DEFAULT(1, "[.!?;…\\r\\n]+\\s*"),

    /**
     * Group 2: Spanish, with inverted opening marks. Terminal punctuation only splits
     * when followed by whitespace or the end of text.
     */
    SPANISH(2, "(?:[¡¿]+|[.!?;…\\r\\n]+(?:\\s|$))+"),

    /**
     * Group 3: Hindi and Bangla.
     */
    HINDI_BANGLA(3, "[|!?;\\r\\n]+\\s*"),

    /**
     * Group 4: Japanese and Chinese.
     */
    CJK(4, "[。…‥.!?？！;\\r\\n]+\\s*"),

    /**
     * Group 5: Thai, which only breaks on line ends.
     */
    THAI(5, "[\\r\\n]+"),

    /**
     * Group 6: Arabic and Farsi.
     */
    ARABIC(6, "[\\r\\n؟!.…]+\\s*");

    private final int group;
    private final Pattern pattern;

    SentenceSplitter(int group, String regex) {
        this.group = group;
        this.pattern = Pattern.compile(regex, Pattern.UNICODE_CHARACTER_CLASS);
    }

    private static final Map<Integer, SentenceSplitter> LOOKUP = buildLookup();

    private static Map<Integer, SentenceSplitter> buildLookup() {
        Map<Integer, SentenceSplitter> m = new HashMap<>();
        for (SentenceSplitter s : values()) {
            m.put(s.group, s);
        }
        return Collections.unmodifiableMap(m);
    }

    /**
     * Returns the splitter used when a language configures no group.
     *
     * @return {@link #DEFAULT}
     */
    public static SentenceSplitter defaultSplitter() {
        return DEFAULT;
    }

    /**
     * Resolves a configured group number.
     *
     * @param group the group number
     * @return the matching splitter, or {@code null} if the group is unknown
     */
    public static SentenceSplitter tryParse(int group) {
        return LOOKUP.get(group);
    }

    /**
     * Resolves a configured group number, strictly.
     *
     * @param group the group number
     * @return the matching splitter
     * @throws LanguageConfigurationException if the group is unknown
     */
    public static SentenceSplitter forGroup(int group) {
        SentenceSplitter s = tryParse(group);
        if (s == null) {
            throw new LanguageConfigurationException("Unknown sentence splitter group: " + group);
        }
        return s;
    }

    /**
     * Resolves the splitter of a language configuration.
     *
     * @param info the language configuration
     * @return the configured splitter, or {@link #DEFAULT} when none is configured
     * @throws LanguageConfigurationException if the configured group is unknown
     */
    public static SentenceSplitter forInfo(LanguageInfo info) {
        Integer group = info.getSentenceSplitterGroup();
        return group == null ? defaultSplitter() : forGroup(group);
    }

    public int getGroup() {
        return group;
    }

    public Pattern getPattern() {
        return pattern;
    }

    /**
     * Splits text into sentences, dropping empty ones.
     *
     * @param text the text to split
     * @return the non-empty sentences in order
     */
    public List<String> split(String text) {
        List<String> sentences = new ArrayList<>();
        for (String sentence : pattern.split(text, -1)) {
            if (!sentence.isEmpty()) sentences.add(sentence);
        }
        return sentences;
    }
}
