package dateparserjavacli;

import dateparserjava.Language;
import picocli.CommandLine.*;

import java.io.PrintWriter;
import java.util.concurrent.Callable;
import java.util.logging.*;

/**
 * Subcommand validating a language configuration. Problems are logged; the exit
 * code is 0 when the configuration is valid and 1 otherwise.
 */
@Command(name = "validate", description = "\033[1;34mValidate a language configuration\033[0m", mixinStandardHelpOptions = true)
public class ValidateCommand implements Callable<Integer> {
    @Option(names = {"-l", "--language"}, paramLabel = "<code|file.json>", description = "Language code or language file", required = true)
    private String language;

    @Spec
    private Model.CommandSpec spec;

    private static final Logger LOGGER = Logger.getLogger(ValidateCommand.class.getName());
    private static final String BLUE = "\033[1;34m";
    private static final String RESET = "\033[0m";

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        try {
            Language lang = CliSupport.resolveLanguage(language);
            if (lang.validateInfo()) {
                out.println(BLUE + lang.getShortname() + ": valid" + RESET);
                out.flush();
                return 0;
            }
            out.println(lang.getShortname() + ": invalid");
            out.flush();
            return 1;
        } catch (Exception e) {
            LOGGER.log(Level.SEVERE, "Error during validation", e);
            spec.commandLine().getErr().println("❌ Exception occurred: " + e.getMessage());
            return 1;
        }
    }
}
