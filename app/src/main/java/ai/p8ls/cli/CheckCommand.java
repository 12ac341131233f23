package ai.p8ls.cli;

import ai.p8ls.analyzer.diagnostics.CodeProblem;
import ai.p8ls.analyzer.diagnostics.ParseError;
import ai.p8ls.settings.SettingsLoader;
import ai.p8ls.workspace.NioFileResolver;
import ai.p8ls.workspace.WorkspaceScanner;
import ai.p8ls.workspace.WorkspaceState;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.concurrent.Executors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

@CommandLine.Command(name = "check", description = "Report parse errors and warnings for every source file in a directory.")
final class CheckCommand implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CheckCommand.class);

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", description = "Workspace directory.")
    Path directory;

    @CommandLine.Option(names = "--threads", description = "Parallel file reads (default: ${DEFAULT-VALUE}).")
    int threads = Math.max(2, Runtime.getRuntime().availableProcessors());

    @Override
    public Integer call() {
        if (threads < 1) {
            throw new CommandLine.ParameterException(spec.commandLine(), "--threads must be at least 1, was " + threads);
        }
        var out = spec.commandLine().getOut();
        var settings = SettingsLoader.load(directory);
        var resolver = new NioFileResolver();
        var executor = Executors.newFixedThreadPool(threads);
        WorkspaceState state;
        try {
            var contents = new WorkspaceScanner(resolver, executor).scan(directory);
            state = WorkspaceState.fromScan(contents, resolver, settings);
        } catch (IOException e) {
            spec.commandLine().getErr().println("Cannot scan " + directory + ": " + e.getMessage());
            return CommandLine.ExitCode.SOFTWARE;
        } finally {
            executor.shutdown();
        }

        int errors = 0;
        int warnings = 0;
        for (var entry : state.diagnostics().entrySet()) {
            for (var problem : entry.getValue()) {
                out.println(describe(entry.getKey().path(), problem));
                if (problem instanceof ParseError) {
                    errors++;
                } else {
                    warnings++;
                }
            }
        }
        out.printf("%d file(s), %d error(s), %d warning(s)%n", state.documents().size(), errors, warnings);
        out.flush();
        logger.debug("Checked {}: {} errors, {} warnings", directory, errors, warnings);
        return errors > 0 ? P8lsCli.EXIT_PARSE_ERRORS : CommandLine.ExitCode.OK;
    }

    static String describe(String path, CodeProblem problem) {
        var start = problem.bounds().start();
        return "%s:%d:%d: %s: %s"
                .formatted(
                        path,
                        start.line(),
                        start.column() + 1,
                        problem.severity().name().toLowerCase(Locale.ROOT),
                        problem.message());
    }
}
