package ai.p8ls.cli;

import ai.p8ls.analyzer.ResolvedFile;
import ai.p8ls.analyzer.parser.Parser;
import ai.p8ls.analyzer.symbols.CodeSymbol;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import org.jetbrains.annotations.Nullable;
import picocli.CommandLine;

@CommandLine.Command(name = "symbols", description = "Print the outline of a source file as JSON.")
final class SymbolsCommand implements Callable<Integer> {
    private static final ObjectMapper objectMapper = new ObjectMapper();

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", description = "A .p8 or .lua file.")
    Path file;

    /** Outline entry as printed; lines are 1-based, columns 0-based. */
    record SymbolJson(
            String name,
            @Nullable String detail,
            String kind,
            int startLine,
            int startColumn,
            int endLine,
            int endColumn,
            List<SymbolJson> children) {

        static SymbolJson of(CodeSymbol symbol) {
            var bounds = symbol.bounds();
            return new SymbolJson(
                    symbol.name(),
                    symbol.detail(),
                    symbol.kind().name(),
                    bounds.start().line(),
                    bounds.start().column(),
                    bounds.end().line(),
                    bounds.end().column(),
                    symbol.children().stream().map(SymbolJson::of).toList());
        }
    }

    @Override
    public Integer call() {
        var absolute = file.toAbsolutePath();
        String text;
        try {
            text = Files.readString(absolute);
        } catch (IOException e) {
            spec.commandLine().getErr().println("Cannot read " + file + ": " + e.getMessage());
            return CommandLine.ExitCode.SOFTWARE;
        }
        var chunk = Parser.parse(text, ResolvedFile.fromPath(absolute.toString()));
        var symbols = chunk.symbols().stream().map(SymbolJson::of).toList();
        try {
            spec.commandLine().getOut().println(toJson(symbols));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Outline is not serializable", e);
        }
        spec.commandLine().getOut().flush();
        return CommandLine.ExitCode.OK;
    }

    static String toJson(List<SymbolJson> symbols) throws JsonProcessingException {
        return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(symbols);
    }
}
