package ai.p8ls.cli;

import ai.p8ls.analyzer.ResolvedFile;
import ai.p8ls.analyzer.format.Formatter;
import ai.p8ls.analyzer.parser.Parser;
import ai.p8ls.settings.SettingsLoader;
import ai.p8ls.workspace.NioFileResolver;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(name = "format", description = "Print a source file in canonical form, or rewrite it in place.")
final class FormatCommand implements Callable<Integer> {

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", description = "A .p8 or .lua file.")
    Path file;

    @CommandLine.Option(names = "--write", description = "Replace the file contents instead of printing them.")
    boolean write;

    @Override
    public Integer call() {
        var err = spec.commandLine().getErr();
        var absolute = file.toAbsolutePath();
        var parent = absolute.getParent();
        var settings = SettingsLoader.load(parent == null ? absolute : parent);
        var resolved = ResolvedFile.fromPath(absolute.toString());

        String text;
        try {
            text = Files.readString(absolute);
        } catch (IOException e) {
            err.println("Cannot read " + file + ": " + e.getMessage());
            return CommandLine.ExitCode.SOFTWARE;
        }

        var chunk = Parser.parse(text, resolved, new NioFileResolver(), settings.suppressBuiltinGlobals());
        var formatter = new Formatter(settings.format().toFormatterOptions());
        var result = formatter.format(chunk, text, !resolved.isCartridge());
        if (result.isEmpty()) {
            if (chunk.hasErrors()) {
                err.println("Not formatting " + file + ": " + chunk.errors().size() + " parse error(s)");
                chunk.errors().forEach(e -> err.println(CheckCommand.describe(resolved.path(), e)));
            } else {
                err.println("Not formatting " + file + ": no __lua__ section");
            }
            return P8lsCli.EXIT_NOT_FORMATTED;
        }

        var formatted = FormatEdits.apply(text, result.get());
        if (!write) {
            spec.commandLine().getOut().print(formatted);
            spec.commandLine().getOut().flush();
            return CommandLine.ExitCode.OK;
        }
        try {
            Files.writeString(absolute, formatted);
        } catch (IOException e) {
            err.println("Cannot write " + file + ": " + e.getMessage());
            return CommandLine.ExitCode.SOFTWARE;
        }
        return CommandLine.ExitCode.OK;
    }
}
