package ai.p8ls.analyzer.parser;

import ai.p8ls.analyzer.ResolvedFile;
import ai.p8ls.analyzer.ast.Block;
import ai.p8ls.analyzer.ast.Comment;
import ai.p8ls.analyzer.diagnostics.ParseError;
import ai.p8ls.analyzer.diagnostics.Warning;
import ai.p8ls.analyzer.symbols.CodeSymbol;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * The result of parsing one file. Always produced, even for malformed input; {@link #errors()} tells whether the
 * tree is complete.
 *
 * @param block top-level statements
 * @param errors grammar violations in source order, without duplicates
 * @param warnings advisories found while parsing, such as unresolvable includes
 * @param comments every comment in the code section, in source order
 * @param includes {@code #include} directives with their resolved targets
 * @param symbols outline of the file
 * @param file the file the text came from, or null for anonymous input
 * @param cartridge true when the text is a {@code .p8} cartridge rather than plain Lua
 * @param suppressBuiltinGlobals true when scope resolution should not predefine the PICO-8 API
 */
public record Chunk(
        Block block,
        List<ParseError> errors,
        List<Warning> warnings,
        List<Comment> comments,
        List<Include> includes,
        List<CodeSymbol> symbols,
        @Nullable ResolvedFile file,
        boolean cartridge,
        boolean suppressBuiltinGlobals) {

    public Chunk {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
        comments = List.copyOf(comments);
        includes = List.copyOf(includes);
        symbols = List.copyOf(symbols);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /** Targets of the include directives, in order of appearance. */
    public List<ResolvedFile> includedFiles() {
        return includes.stream().map(Include::file).distinct().toList();
    }
}
