package dateparserjavacli;

import dateparserjava.Language;
import dateparserjava.Settings;
import picocli.CommandLine.*;

import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.logging.*;

/**
 * Subcommand reporting whether a language can translate each date string.
 */
@Command(name = "check", description = "\033[1;34mCheck whether a language applies to date strings\033[0m", mixinStandardHelpOptions = true)
public class CheckCommand implements Callable<Integer> {
    @Option(names = {"-l", "--language"}, paramLabel = "<code|file.json>", description = "Language code or language file", required = true)
    private String language;

    @Option(names = "--strip-timezone", description = "Ignore a trailing timezone (default: false)")
    private boolean stripTimezone;

    @Option(names = "--normalize", description = "Use Unicode-normalized matching (default: false)")
    private boolean normalize;

    @Parameters(paramLabel = "<text>", arity = "1..*", description = "Date strings to check")
    private List<String> texts;

    @Spec
    private Model.CommandSpec spec;

    private static final Logger LOGGER = Logger.getLogger(CheckCommand.class.getName());

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        try {
            Language lang = CliSupport.resolveLanguage(language);
            Settings settings = Settings.defaults().withNormalize(normalize);
            for (String text : texts) {
                out.println(lang.isApplicable(text, stripTimezone, settings));
            }
            out.flush();
            return 0;
        } catch (Exception e) {
            LOGGER.log(Level.SEVERE, "Error during applicability check", e);
            spec.commandLine().getErr().println("❌ Exception occurred: " + e.getMessage());
            return 1;
        }
    }
}
