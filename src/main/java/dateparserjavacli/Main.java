package dateparserjavacli;

import picocli.CommandLine;
import picocli.CommandLine.Command;

@Command(
        name = "dateparsercli",
        mixinStandardHelpOptions = true,
        version = "1.0.0",
        description = "\033[1;34mPer-language date text translator with multiple tools\033[0m",
        subcommands = {
                TranslateCommand.class,
                SearchCommand.class,
                CheckCommand.class,
                ValidateCommand.class,
                InfoCommand.class
        }
)
public class Main implements Runnable {

    @Override
    public void run() {
        // Called when no subcommand is provided
        System.out.println("Use --help or a subcommand (translate / search / check / validate / info)");
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }
}
