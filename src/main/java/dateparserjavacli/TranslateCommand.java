package dateparserjavacli;

import dateparserjava.Language;
import dateparserjava.Settings;
import picocli.CommandLine.*;

import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.logging.*;

/**
 * Subcommand for translating date strings into canonical vocabulary.
 */
@Command(name = "translate", description = "\033[1;34mTranslate date strings into canonical English tokens\033[0m", mixinStandardHelpOptions = true)
public class TranslateCommand implements Callable<Integer> {
    @Option(names = {"-l", "--language"}, paramLabel = "<code|file.json>", description = "Language code or language file", required = true)
    private String language;

    @Option(names = {"-k", "--keep-formatting"}, description = "Keep punctuation and spacing tokens verbatim (default: false)")
    private boolean keepFormatting;

    @Option(names = "--normalize", description = "Use Unicode-normalized matching (default: false)")
    private boolean normalize;

    @Parameters(paramLabel = "<text>", description = "Date strings to translate; read from stdin when omitted")
    private List<String> texts;

    @Spec
    private Model.CommandSpec spec;

    private static final Logger LOGGER = Logger.getLogger(TranslateCommand.class.getName());

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        try {
            Language lang = CliSupport.resolveLanguage(language);
            Settings settings = Settings.defaults().withNormalize(normalize);
            List<String> inputs = texts != null ? texts : CliSupport.readLines(System.in);

            for (String text : inputs) {
                out.println(lang.translate(text, keepFormatting, settings));
            }
            out.flush();
            return 0;
        } catch (Exception e) {
            LOGGER.log(Level.SEVERE, "Error during translation", e);
            spec.commandLine().getErr().println("❌ Exception occurred: " + e.getMessage());
            return 1;
        }
    }
}
