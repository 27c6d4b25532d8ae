package dateparserjava;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Cache for regular expression text → compiled {@link Pattern}.
 *
 * <p>Patterns are compiled case-insensitively with Unicode character classes, so
 * {@code \w}, {@code \d} and {@code \s} follow Unicode definitions. Compiled patterns
 * are immutable; entries are never evicted.</p>
 */
public final class PatternCache {
    private static final Logger LOGGER = Logger.getLogger(PatternCache.class.getName());

    /**
     * Flags used for every cached pattern.
     */
    public static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS;

    private final ConcurrentMap<String, Pattern> patterns = new ConcurrentHashMap<>();

    /**
     * Returns the compiled form of {@code regex}, compiling it on first request.
     *
     * @param regex the regular expression text
     * @return the cached pattern
     * @throws LanguageConfigurationException if {@code regex} does not compile
     */
    public Pattern get(String regex) {
        return patterns.computeIfAbsent(regex, PatternCache::compile);
    }

    /**
     * Number of compiled patterns held.
     *
     * @return the cache size
     */
    public int size() {
        return patterns.size();
    }

    /**
     * Compiles {@code regex} with {@link #FLAGS}.
     *
     * @param regex the regular expression text
     * @return the compiled pattern
     * @throws LanguageConfigurationException if {@code regex} does not compile
     */
    public static Pattern compile(String regex) {
        try {
            Pattern p = Pattern.compile(regex, FLAGS);
            LOGGER.fine(() -> "Compiled pattern: " + regex);
            return p;
        } catch (PatternSyntaxException e) {
            throw new LanguageConfigurationException("Invalid simplification pattern: " + regex, e);
        }
    }
}
