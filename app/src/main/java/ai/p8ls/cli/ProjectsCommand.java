package ai.p8ls.cli;

import ai.p8ls.analyzer.project.ProjectDocumentNode;
import ai.p8ls.settings.SettingsLoader;
import ai.p8ls.workspace.NioFileResolver;
import ai.p8ls.workspace.WorkspaceScanner;
import ai.p8ls.workspace.WorkspaceState;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.concurrent.Executors;
import picocli.CommandLine;

@CommandLine.Command(name = "projects", description = "Print each project root with the files it includes.")
final class ProjectsCommand implements Callable<Integer> {

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", description = "Workspace directory.")
    Path directory;

    @Override
    public Integer call() {
        var resolver = new NioFileResolver();
        var executor = Executors.newFixedThreadPool(Math.max(2, Runtime.getRuntime().availableProcessors()));
        WorkspaceState state;
        try {
            var contents = new WorkspaceScanner(resolver, executor).scan(directory);
            state = WorkspaceState.fromScan(contents, resolver, SettingsLoader.load(directory));
        } catch (IOException e) {
            spec.commandLine().getErr().println("Cannot scan " + directory + ": " + e.getMessage());
            return CommandLine.ExitCode.SOFTWARE;
        } finally {
            executor.shutdown();
        }

        var out = spec.commandLine().getOut();
        var root = directory.toAbsolutePath().normalize();
        for (var project : state.projects()) {
            print(out, project.root(), root, 0);
        }
        out.flush();
        return CommandLine.ExitCode.OK;
    }

    private static void print(PrintWriter out, ProjectDocumentNode node, Path root, int depth) {
        var path = Path.of(node.document().file().path());
        var shown = path.startsWith(root) ? root.relativize(path).toString().replace('\\', '/') : path.toString();
        out.println("  ".repeat(depth) + shown);
        for (var child : node.included()) {
            print(out, child, root, depth + 1);
        }
    }
}
