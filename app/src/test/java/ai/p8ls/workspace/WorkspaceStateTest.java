package ai.p8ls.workspace;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.p8ls.analyzer.FileResolver;
import ai.p8ls.analyzer.ResolvedFile;
import ai.p8ls.analyzer.diagnostics.CodeProblem;
import ai.p8ls.analyzer.format.FormatRange;
import ai.p8ls.settings.AnalyzerSettings;
import ai.p8ls.settings.FormatSettings;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class WorkspaceStateTest {
    private static final String HEADER = "pico-8 cartridge // http://www.pico-8.com\nversion 41\n__lua__\n";

    @TempDir
    Path root;

    private ResolvedFile main;
    private ResolvedFile lib;

    @BeforeEach
    void writeWorkspace() throws IOException {
        main = write("main.p8", HEADER + "#include lib.lua\nlib_fn()\nundefined_fn()\n__gfx__\n0000\n");
        lib = write("lib.lua", "function lib_fn() end");
        write(".hidden/skipped.lua", "x = 1");
        write("notes.txt", "not code");
    }

    private ResolvedFile write(String name, String text) throws IOException {
        var path = root.resolve(name);
        Files.createDirectories(path.getParent());
        Files.writeString(path, text);
        return ResolvedFile.fromPath(path.toAbsolutePath().toString());
    }

    private WorkspaceState scan(AnalyzerSettings settings) throws IOException {
        var resolver = new NioFileResolver();
        var contents = new WorkspaceScanner(resolver, Runnable::run).scan(root);
        return WorkspaceState.fromScan(contents, resolver, settings);
    }

    private static List<String> messages(List<CodeProblem> problems) {
        return problems.stream().map(CodeProblem::message).toList();
    }

    @Test
    void testScannerFindsSources() throws IOException {
        var contents = new WorkspaceScanner(new NioFileResolver(), Runnable::run).scan(root);
        assertEquals(List.of(lib, main), List.copyOf(contents.keySet()));
        assertEquals("function lib_fn() end", contents.get(lib));

        assertTrue(WorkspaceScanner.isSourceFile(Path.of("game.P8")));
        assertTrue(WorkspaceScanner.isSourceFile(Path.of("util.lua")));
        assertFalse(WorkspaceScanner.isSourceFile(Path.of("notes.txt")));
    }

    @Test
    void testProjectsAndDiagnostics() throws IOException {
        var state = scan(AnalyzerSettings.DEFAULT);
        assertEquals(1, state.projects().size());
        assertEquals(List.of(main, lib), state.projects().get(0).files());
        assertEquals(List.of("undefined variable: undefined_fn"), messages(state.diagnostics(main)));
        assertTrue(state.diagnostics(lib).isEmpty());
        assertEquals(List.of(lib, main), List.copyOf(state.diagnostics().keySet()));
    }

    @Test
    void testDefinitionAcrossFiles() throws IOException {
        var state = scan(AnalyzerSettings.DEFAULT);
        var found = state.definitionsUsagesAt(main, 5, 0).orElseThrow();
        assertEquals("lib_fn", found.symbolName());
        var definition = found.definitions().get(0);
        assertEquals(lib, definition.start().file());
        assertEquals(1, definition.start().line());
        assertEquals(9, definition.start().column());

        assertTrue(state.definitionsUsagesAt(main, 1, 0).isEmpty());
    }

    @Test
    void testUpdateWithSameIncludes() throws IOException {
        var state = scan(AnalyzerSettings.DEFAULT);
        state.update(main, HEADER + "#include lib.lua\nlib_fn()\n");
        assertTrue(state.diagnostics(main).isEmpty());
        assertEquals(1, state.projects().size());
    }

    @Test
    void testUpdateWithNewIncludeLoadsItFromDisk() throws IOException {
        var state = scan(AnalyzerSettings.DEFAULT);
        var other = write("other.lua", "function other_fn() end");

        state.update(main, HEADER + "#include lib.lua\n#include other.lua\nlib_fn()\nother_fn()\n");
        assertTrue(state.document(other).isPresent());
        assertTrue(state.diagnostics(main).isEmpty());
        assertEquals(List.of(main, lib, other), state.projects().get(0).files());
    }

    @Test
    void testMissingIncludeIsReported() throws IOException {
        var state = scan(AnalyzerSettings.DEFAULT);
        state.update(main, HEADER + "#include gone.lua\n");
        assertEquals(List.of("Can't #include gone.lua: file does not exist"), messages(state.diagnostics(main)));
        // lib is no longer included and becomes a project of its own
        assertEquals(2, state.projects().size());
    }

    @Test
    void testUnreadableIncludeIsReported() {
        var inMemoryMain = ResolvedFile.fromPath("/ws/main.lua");
        var text = "x = 1\n#include lib.lua\n";
        var resolver = new FileResolver() {
            @Override
            public boolean exists(String path) {
                return true;
            }

            @Override
            public boolean isRegularFile(String path) {
                return true;
            }

            @Override
            public String readContents(String path) throws IOException {
                if (path.endsWith("lib.lua")) {
                    throw new IOException("permission denied");
                }
                return text;
            }
        };

        var state = WorkspaceState.fromScan(Map.of(inMemoryMain, text), resolver, AnalyzerSettings.DEFAULT);
        var problems = state.diagnostics(inMemoryMain);
        assertEquals(List.of("Can't #include lib.lua: permission denied"), messages(problems));
        assertEquals(CodeProblem.Severity.WARNING, problems.get(0).severity());
        assertEquals(2, problems.get(0).bounds().start().line());
        assertTrue(state.document(ResolvedFile.fromPath("/ws/lib.lua")).isEmpty());
    }

    @Test
    void testCloseForgetsDocument() throws IOException {
        var state = scan(AnalyzerSettings.DEFAULT);
        state.close(lib);
        assertTrue(state.document(lib).isEmpty());
        assertTrue(state.diagnostics(lib).isEmpty());
        assertTrue(messages(state.diagnostics(main)).contains("undefined variable: lib_fn"));
    }

    @Test
    void testDiagnosticsAreCapped() throws IOException {
        var state = scan(new AnalyzerSettings(1, false, FormatSettings.DEFAULT));
        var extra = write("extra.lua", "a()\nb()\nc()");
        state.update(extra, "a()\nb()\nc()");
        assertEquals(List.of("undefined variable: a"), messages(state.diagnostics(extra)));
    }

    @Test
    void testSuppressedBuiltins() throws IOException {
        var plain = scan(AnalyzerSettings.DEFAULT);
        var file = write("draw.lua", "print(1)");
        plain.update(file, "print(1)");
        assertTrue(plain.diagnostics(file).isEmpty());

        var suppressed = scan(new AnalyzerSettings(1000, true, FormatSettings.DEFAULT));
        suppressed.update(file, "print(1)");
        assertEquals(List.of("undefined variable: print"), messages(suppressed.diagnostics(file)));
    }

    @Test
    void testFormat() throws IOException {
        var state = scan(new AnalyzerSettings(1000, false, new FormatSettings(4, true, false)));
        var file = write("fmt.lua", "function f()\nreturn 1\nend");
        state.update(file, "function f()\nreturn 1\nend");
        assertEquals("function f()\n    return 1\nend", state.format(file).orElseThrow().formattedText());

        var cartridge = state.format(main).orElseThrow();
        assertEquals(new FormatRange(3, 0, 6, 0), cartridge.range());
        assertEquals("#include lib.lua\nlib_fn()\nundefined_fn()\n\n", cartridge.formattedText());

        state.update(file, "x = = 1");
        assertTrue(state.format(file).isEmpty());
    }

    @Test
    void testVisibleNames() throws IOException {
        var state = scan(AnalyzerSettings.DEFAULT);
        var file = write("scope.lua", "local a = 1\nfunction f(p)\nreturn p\nend");
        state.update(file, "local a = 1\nfunction f(p)\nreturn p\nend");

        var names = state.visibleNames(file, 3, 7);
        assertEquals("p", names.get(0));
        assertTrue(names.containsAll(List.of("a", "f", "print")));
        assertTrue(state.symbols(file).size() >= 2);
        assertTrue(state.visibleNames(ResolvedFile.fromPath("/nowhere.lua"), 1, 0).isEmpty());
    }
}
