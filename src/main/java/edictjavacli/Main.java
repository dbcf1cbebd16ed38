package edictjavacli;

import picocli.CommandLine;
import picocli.CommandLine.Command;

@Command(
        name = "edictjava",
        mixinStandardHelpOptions = true,
        version = "1.0.0",
        description = "\033[1;34mEDICT2 sub-dictionary and lookup tools\033[0m",
        subcommands = {
                AnnotateCommand.class,
                LookupCommand.class,
                DeinflectCommand.class,
                StatsCommand.class
        }
)
public class Main implements Runnable {

    @Override
    public void run() {
        // Called when no subcommand is provided
        System.out.println("Use --help or a subcommand (annotate / lookup / deinflect / stats)");
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }
}
