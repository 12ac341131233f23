package ai.p8ls.analyzer.parser;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.p8ls.analyzer.FileResolver;
import ai.p8ls.analyzer.ResolvedFile;
import ai.p8ls.analyzer.ast.AstDump;
import ai.p8ls.analyzer.diagnostics.CodeProblem;
import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ParserTest {

    /** In-memory files keyed by normalized path. */
    static final class MapFileResolver implements FileResolver {
        private final Map<String, String> files;

        MapFileResolver(Map<String, String> files) {
            this.files = files;
        }

        @Override
        public boolean exists(String path) {
            return files.containsKey(path);
        }

        @Override
        public boolean isRegularFile(String path) {
            return files.containsKey(path);
        }

        @Override
        public String readContents(String path) throws IOException {
            var text = files.get(path);
            if (text == null) {
                throw new NoSuchFileException(path);
            }
            return text;
        }
    }

    private static String dump(String text) {
        var chunk = Parser.parse(text);
        assertFalse(chunk.hasErrors(), () -> "unexpected errors: " + chunk.errors());
        return AstDump.dump(chunk.block());
    }

    private static List<String> messages(Chunk chunk) {
        return chunk.errors().stream().map(CodeProblem::message).toList();
    }

    @Test
    void testLocalAndAssignment() {
        assertEquals("(block (local (a b) (1 2)))", dump("local a, b = 1, 2"));
        assertEquals("(block (assign = ((. t x)) (3)))", dump("t.x = 3"));
        assertEquals("(block (assign += (a) (1)))", dump("a += 1"));
    }

    @Test
    void testPrecedence() {
        assertEquals("(block (local (x) ((+ 1 (* 2 3)))))", dump("local x = 1 + 2 * 3"));
        assertEquals("(block (local (x) ((^ 2 (^ 3 4)))))", dump("local x = 2 ^ 3 ^ 4"));
        assertEquals("(block (local (x) ((- (- a b) c))))", dump("local x = a - b - c"));
        assertEquals("(block (local (x) ((.. a b c))))", dump("local x = a .. b .. c"));
        assertEquals("(block (local (x) ((- (- a)))))", dump("local x = - -a"));
    }

    @Test
    void testControlFlow() {
        assertEquals(
                "(block (if (if a (block (call-stmt (call x)))) (elseif b (block)) (else (block (return 1)))))",
                dump("if a then x() elseif b then else return 1 end"));
        assertEquals("(block (while true (block (break))))", dump("while true do break end"));
        assertEquals("(block (fornum i 1 10 2 (block)))", dump("for i = 1, 10, 2 do end"));
        assertEquals("(block (forin (k v) ((call pairs t)) (block)))", dump("for k, v in pairs(t) do end"));
        assertEquals("(block (repeat (block (assign = (x) (1))) x))", dump("repeat x = 1 until x"));
        assertEquals("(block (do (block (label l) (goto l))))", dump("do ::l:: goto l end"));
    }

    @Test
    void testFunctions() {
        assertEquals("(block (function (. a b) (x ...) (block (return ...))))",
                dump("function a.b(x, ...) return ... end"));
        assertEquals("(block (local-function f () (block)))", dump("local function f() end"));
        assertEquals("(block (call-stmt (call (: obj m) \"s\")))", dump("obj:m \"s\""));
        assertEquals("(block (call-stmt (call f (table 1 (= x 2) ([] 3 4)))))", dump("f{1, x = 2, [3] = 4}"));
    }

    @Test
    void testOneLineIf() {
        var chunk = Parser.parse("if (x) y = 1 else y = 2\nz = 3");
        assertFalse(chunk.hasErrors(), chunk.errors()::toString);
        assertEquals(
                "(block (if (if x (block (assign = (y) (1)))) (else (block (assign = (y) (2))))) (assign = (z) (3)))",
                AstDump.dump(chunk.block()));
    }

    @Test
    void testPrintShorthand() {
        assertEquals("(block (call-stmt (call ? \"hi\" 1)) (assign = (x) (2)))", dump("? \"hi\", 1\nx = 2"));
    }

    @Test
    void testParenthesizedCallIsRecorded() {
        assertEquals("(block (local (x) ((paren (call f)))))", dump("local x = (f())"));
        assertEquals("(block (local (x) (y)))", dump("local x = (y)"));
    }

    @Test
    void testMalformedInputNeverThrows() {
        for (var text : List.of("a b c", "if", "function (", "x = = 1", "local", "for i = 1 do", "\"abc", "end end",
                "t = {1, 2", "?", "#include", "::", "x = 1 +")) {
            var chunk = assertDoesNotThrow(() -> Parser.parse(text), text);
            assertTrue(chunk.hasErrors(), text);
        }
    }

    @Test
    void testRecoveryContinuesOnNextLine() {
        var chunk = Parser.parse("x = = 1\ny = 2");
        assertEquals(1, chunk.errors().size());
        assertEquals(1, chunk.errors().get(0).bounds().start().line());
        assertTrue(AstDump.dump(chunk.block()).contains("(assign = (y) (2))"));
    }

    @Test
    void testLexerErrorIsReported() {
        var chunk = Parser.parse("x = \"abc");
        assertEquals(List.of("unfinished string near '\"abc'"), messages(chunk));
    }

    @Test
    void testBreakOutsideLoop() {
        var chunk = Parser.parse("break");
        assertEquals(List.of("no loop to break near '<eof>'"), messages(chunk));
    }

    @Test
    void testGotoWithoutLabel() {
        var chunk = Parser.parse("goto nowhere");
        assertEquals(List.of("no visible label 'nowhere' for <goto>"), messages(chunk));
    }

    @Test
    void testDuplicateLabel() {
        var chunk = Parser.parse("::a::\n::a::");
        assertEquals(List.of("label 'a' already defined on line 1"), messages(chunk));
    }

    @Test
    void testVarargOutsideVarargFunction() {
        var chunk = Parser.parse("function f() return ... end");
        assertEquals(List.of("cannot use '...' outside a vararg function near '...'"), messages(chunk));
    }

    @Test
    void testVarargAtTopLevelIsAllowed() {
        assertFalse(Parser.parse("local a = ...").hasErrors());
    }

    @Test
    void testDeepNestingIsAnErrorNotACrash() {
        var text = "x = " + "(".repeat(300) + "1" + ")".repeat(300);
        var chunk = assertDoesNotThrow(() -> Parser.parse(text));
        assertTrue(messages(chunk).contains("chunk has too many syntax levels"));
    }

    @Test
    void testCommentsAreCollected() {
        var chunk = Parser.parse("-- one\nx = 1 --[[ two ]]");
        assertEquals(2, chunk.comments().size());
        assertFalse(chunk.hasErrors());
    }

    @Test
    void testCartridgeFlag() {
        var chunk = Parser.parse("pico-8 cartridge\nversion 41\n__lua__\nx = 1\n__gfx__\n");
        assertTrue(chunk.cartridge());
        assertEquals("(block (assign = (x) (1)))", AstDump.dump(chunk.block()));
    }

    @Test
    void testIncludesResolveAgainstFile() {
        var file = ResolvedFile.fromPath("/proj/main.lua");
        var resolver = new MapFileResolver(Map.of("/proj/lib.lua", "x = 1"));
        var chunk = Parser.parse("#include lib.lua\n#include sub/missing.lua\ny = 2", file, resolver, false);

        assertFalse(chunk.hasErrors(), chunk.errors()::toString);
        assertEquals(
                List.of(ResolvedFile.fromPath("/proj/lib.lua"), ResolvedFile.fromPath("/proj/sub/missing.lua")),
                chunk.includedFiles());
        assertEquals(1, chunk.warnings().size());
        assertEquals("Can't #include sub/missing.lua: file does not exist", chunk.warnings().get(0).message());
        assertEquals(2, chunk.warnings().get(0).bounds().start().line());
        assertEquals("(block (include lib.lua) (include sub/missing.lua) (assign = (y) (2)))",
                AstDump.dump(chunk.block()));
    }

    @Test
    void testSelfIncludeWarns() {
        var file = ResolvedFile.fromPath("/proj/main.lua");
        var chunk = Parser.parse("#include main.lua", file, null, false);
        assertEquals(1, chunk.warnings().size());
        assertEquals("Circular #include of main.lua", chunk.warnings().get(0).message());
    }

    @Test
    void testIncludesIgnoredWithoutFile() {
        var chunk = Parser.parse("#include lib.lua");
        assertTrue(chunk.includes().isEmpty());
        assertTrue(chunk.warnings().isEmpty());
    }

    @Test
    void testSymbolsAreAttached() {
        var chunk = Parser.parse("function foo() end");
        assertEquals(1, chunk.symbols().size());
        assertEquals("foo", chunk.symbols().get(0).name());
    }
}
