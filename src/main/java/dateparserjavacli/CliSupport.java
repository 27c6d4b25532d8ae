package dateparserjavacli;

import dateparserjava.Language;
import dateparserjava.LanguageLoader;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Helpers shared by the subcommands.
 */
final class CliSupport {
    private CliSupport() {
    }

    /**
     * Resolves a {@code -l} argument: a path to a {@code .json} language file, or a language code.
     *
     * @param language file path or code
     * @return the language
     * @throws IOException              if the language file cannot be read
     * @throws IllegalArgumentException if the code is unknown
     */
    static Language resolveLanguage(String language) throws IOException {
        if (language.endsWith(".json")) {
            Path path = Paths.get(language);
            if (Files.isRegularFile(path)) {
                return LanguageLoader.fromFile(path);
            }
        }
        return LanguageLoader.getDefault().get(language);
    }

    /**
     * Reads non-empty lines from a stream as UTF-8.
     *
     * @param in the stream; not closed
     * @return the lines
     * @throws IOException if reading fails
     */
    static List<String> readLines(InputStream in) throws IOException {
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        List<String> lines = new ArrayList<>();
        String line;
        while ((line = reader.readLine()) != null) {
            if (!line.trim().isEmpty()) lines.add(line);
        }
        return lines;
    }
}
