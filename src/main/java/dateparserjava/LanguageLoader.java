package dateparserjava;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Locates, parses and memoizes {@link Language} instances by language code.
 *
 * <p>A code is resolved in the following order (first access only):</p>
 * <ol>
 *   <li><b>JSON file from the file system:</b> {@code <baseDir>/<code>.json}</li>
 *   <li><b>Embedded JSON resource:</b> {@code /languages/<code>.json} from the classpath</li>
 * </ol>
 *
 * <p>Each language is loaded once per loader and shared afterwards, so its lazily
 * built caches are shared too.</p>
 */
public class LanguageLoader {
    private static final Logger LOGGER = Logger.getLogger(LanguageLoader.class.getName());

    /**
     * Language codes shipped as classpath resources.
     */
    public static final List<String> BUNDLED_LANGUAGES =
            Collections.unmodifiableList(Arrays.asList("en", "es", "ru", "zh"));

    private static final String RESOURCE_DIR = "/languages/";

    private final Path baseDir;
    private final ConcurrentMap<String, Language> loaded = new ConcurrentHashMap<>();

    /**
     * Creates a loader that looks in {@code languages/} under the working directory
     * before falling back to the classpath.
     */
    public LanguageLoader() {
        this(Paths.get("languages"));
    }

    /**
     * Creates a loader with a custom file system directory.
     *
     * @param baseDir directory holding {@code <code>.json} files; may not exist
     */
    public LanguageLoader(Path baseDir) {
        this.baseDir = Objects.requireNonNull(baseDir, "baseDir");
    }

    /**
     * Internal holder for the lazily initialized shared loader.
     */
    private static class Holder {
        private static final LanguageLoader DEFAULT = new LanguageLoader();
    }

    /**
     * Returns the shared loader.
     *
     * @return the default loader instance
     */
    public static LanguageLoader getDefault() {
        return Holder.DEFAULT;
    }

    /**
     * Returns the language for a code, loading it on first request.
     *
     * @param code language code such as {@code "en"}
     * @return the shared language instance
     * @throws IllegalArgumentException       if no file or resource exists for the code
     * @throws LanguageConfigurationException if the JSON document is malformed
     * @throws UncheckedIOException           if reading fails
     */
    public Language get(String code) {
        Objects.requireNonNull(code, "code");
        String key = code.trim().toLowerCase(Locale.ROOT);
        return loaded.computeIfAbsent(key, this::load);
    }

    /**
     * Returns whether a language for the code has already been loaded.
     *
     * @param code language code
     * @return {@code true} if cached
     */
    public boolean isLoaded(String code) {
        return loaded.containsKey(code.trim().toLowerCase(Locale.ROOT));
    }

    private Language load(String code) {
        try {
            Path path = baseDir.resolve(code + ".json");
            if (Files.exists(path)) {
                LOGGER.fine(() -> "Loading language " + code + " from " + path);
                return new Language(code, LanguageInfo.fromJson(path));
            }
            try (InputStream in = LanguageLoader.class.getResourceAsStream(RESOURCE_DIR + code + ".json")) {
                if (in != null) {
                    LOGGER.fine(() -> "Loading language " + code + " from classpath");
                    return new Language(code, LanguageInfo.fromJson(in));
                }
            }
        } catch (IOException e) {
            LOGGER.log(Level.SEVERE, "Failed to read language " + code, e);
            throw new UncheckedIOException("Failed to read language " + code, e);
        }
        throw new IllegalArgumentException("Unknown language: " + code);
    }

    /**
     * Loads a language from an explicit JSON file, without memoizing it.
     * The language code is the file name without its extension.
     *
     * @param path the JSON file
     * @return the language
     * @throws IOException if the file cannot be read
     */
    public static Language fromFile(Path path) throws IOException {
        String fileName = path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String code = dot > 0 ? fileName.substring(0, dot) : fileName;
        return new Language(code, LanguageInfo.fromJson(path));
    }

    /**
     * Loads a language from a JSON stream, without memoizing it.
     *
     * @param code the language code
     * @param in   the JSON document; not closed
     * @return the language
     * @throws IOException if the stream cannot be read
     */
    public static Language fromJson(String code, InputStream in) throws IOException {
        return new Language(code, LanguageInfo.fromJson(in));
    }

    /**
     * Language codes shipped with this library.
     *
     * @return the bundled codes
     */
    public static List<String> bundledLanguages() {
        return BUNDLED_LANGUAGES;
    }
}
