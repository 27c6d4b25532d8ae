package dateparserjavacli;

import dateparserjava.Language;
import dateparserjava.SearchResult;
import dateparserjava.Settings;
import picocli.CommandLine.*;

import java.io.File;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.logging.*;

/**
 * Subcommand for finding date-like spans in free text.
 * Prints one {@code translated<TAB>original} line per span.
 */
@Command(name = "search", description = "\033[1;34mFind date expressions in free text\033[0m", mixinStandardHelpOptions = true)
public class SearchCommand implements Callable<Integer> {
    @Option(names = {"-l", "--language"}, paramLabel = "<code|file.json>", description = "Language code or language file", required = true)
    private String language;

    @Option(names = {"-i", "--input"}, paramLabel = "<file>", description = "Input file (default: stdin)")
    private File input;

    @Option(names = "--normalize", description = "Use Unicode-normalized matching (default: false)")
    private boolean normalize;

    @Parameters(paramLabel = "<text>", description = "Text to scan; overrides --input")
    private List<String> texts;

    @Spec
    private Model.CommandSpec spec;

    private static final Logger LOGGER = Logger.getLogger(SearchCommand.class.getName());

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        try {
            Language lang = CliSupport.resolveLanguage(language);
            Settings settings = Settings.defaults().withNormalize(normalize);

            String text;
            if (texts != null) {
                text = String.join(" ", texts);
            } else if (input != null) {
                text = new String(Files.readAllBytes(input.toPath()), StandardCharsets.UTF_8);
            } else {
                text = new String(System.in.readAllBytes(), StandardCharsets.UTF_8);
            }

            SearchResult result = lang.translateSearch(text, settings);
            for (int i = 0; i < result.size(); i++) {
                out.println(result.getTranslated().get(i) + "\t" + result.getOriginal().get(i));
            }
            out.flush();
            return 0;
        } catch (Exception e) {
            LOGGER.log(Level.SEVERE, "Error during search", e);
            spec.commandLine().getErr().println("❌ Exception occurred: " + e.getMessage());
            return 1;
        }
    }
}
