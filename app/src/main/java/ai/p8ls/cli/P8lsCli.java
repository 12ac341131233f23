package ai.p8ls.cli;

import java.util.concurrent.Callable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

@CommandLine.Command(
        name = "p8ls",
        mixinStandardHelpOptions = true,
        version = "p8ls 0.1.0",
        description = "Checks, formats and outlines PICO-8 Lua sources.",
        subcommands = {CheckCommand.class, FormatCommand.class, SymbolsCommand.class, ProjectsCommand.class})
public final class P8lsCli implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(P8lsCli.class);

    /** Exit status when a checked workspace has parse errors. */
    public static final int EXIT_PARSE_ERRORS = 1;

    /** Exit status when the formatter refuses a file. */
    public static final int EXIT_NOT_FORMATTED = 2;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    public static void main(String[] args) {
        logger.debug("Starting p8ls with {} argument(s)", args.length);
        int exitCode = new CommandLine(new P8lsCli()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        spec.commandLine().getOut().flush();
        return 0;
    }
}
