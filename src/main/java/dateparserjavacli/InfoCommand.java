package dateparserjavacli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dateparserjava.Language;
import dateparserjava.ParserInfo;
import picocli.CommandLine.*;

import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.logging.*;

/**
 * Subcommand printing the grammar-engine projection of a language as JSON.
 */
@Command(name = "info", description = "\033[1;34mPrint weekday, month and time unit names of a language\033[0m", mixinStandardHelpOptions = true)
public class InfoCommand implements Callable<Integer> {
    @Option(names = {"-l", "--language"}, paramLabel = "<code|file.json>", description = "Language code or language file", required = true)
    private String language;

    @Spec
    private Model.CommandSpec spec;

    private static final Logger LOGGER = Logger.getLogger(InfoCommand.class.getName());
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        try {
            Language lang = CliSupport.resolveLanguage(language);
            out.println(MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(lang.toParserInfo())));
            out.flush();
            return 0;
        } catch (Exception e) {
            LOGGER.log(Level.SEVERE, "Error while reading language info", e);
            spec.commandLine().getErr().println("❌ Exception occurred: " + e.getMessage());
            return 1;
        }
    }

    static ObjectNode toJson(ParserInfo info) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("name", info.getName());
        addStrings(root.putArray("jump"), info.getJump());
        addStrings(root.putArray("pertain"), info.getPertain());
        addSlots(root.putArray("weekdays"), info.getWeekdays());
        addSlots(root.putArray("months"), info.getMonths());
        addSlots(root.putArray("hms"), info.getHms());
        return root;
    }

    private static void addSlots(ArrayNode array, List<List<String>> slots) {
        for (List<String> slot : slots) {
            addStrings(array.addArray(), slot);
        }
    }

    private static void addStrings(ArrayNode array, List<String> values) {
        for (String value : values) {
            array.add(value);
        }
    }
}
