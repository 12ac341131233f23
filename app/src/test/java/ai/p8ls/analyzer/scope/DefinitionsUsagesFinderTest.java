package ai.p8ls.analyzer.scope;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.p8ls.analyzer.Bounds;
import ai.p8ls.analyzer.diagnostics.CodeProblem;
import ai.p8ls.analyzer.parser.Parser;
import java.util.List;
import org.junit.jupiter.api.Test;

class DefinitionsUsagesFinderTest {

    private static DefinitionsUsagesResult resolve(String code) {
        return DefinitionsUsagesFinder.findDefinitionsUsages(Parser.parse(code));
    }

    private static List<String> positions(List<Bounds> bounds) {
        return bounds.stream().map(b -> b.start().line() + ":" + b.start().column()).toList();
    }

    private static DefinitionsUsages at(DefinitionsUsagesResult result, int line, int column) {
        var found = result.lookup().lookup(line, column);
        assertNotNull(found, "nothing bound at " + line + ":" + column);
        return found;
    }

    private static List<String> warnings(DefinitionsUsagesResult result) {
        return result.warnings().stream().map(CodeProblem::message).toList();
    }

    @Test
    void testLocalShadowing() {
        var code = """
                local a = 1
                do
                  local a = 2
                  print(a)
                end
                print(a)
                """;
        var result = resolve(code);

        var outer = at(result, 1, 6);
        assertEquals("a", outer.symbolName());
        assertEquals(List.of("1:6"), positions(outer.definitions()));
        assertEquals(List.of("1:6", "6:6"), positions(outer.usages()));

        var inner = at(result, 4, 8);
        assertEquals(List.of("3:8"), positions(inner.definitions()));
        assertEquals(List.of("3:8", "4:8"), positions(inner.usages()));
        assertTrue(result.warnings().isEmpty());
    }

    @Test
    void testRepeatBodyLocalsAreVisibleInCondition() {
        var result = resolve("repeat local done = true until done");
        assertTrue(result.warnings().isEmpty(), result.warnings()::toString);
        assertEquals(List.of("1:13"), positions(at(result, 1, 31).definitions()));
    }

    @Test
    void testRepeatConditionPrefersBodyLocalOverOuter() {
        var result = resolve("local d = false\nrepeat local d = true until d");
        var inner = at(result, 2, 28);
        assertEquals(List.of("2:13"), positions(inner.definitions()));
        assertEquals(List.of("2:13", "2:28"), positions(inner.usages()));

        var outer = at(result, 1, 6);
        assertEquals(List.of("1:6"), positions(outer.usages()));
    }

    @Test
    void testLocalInitializerSeesOuterBinding() {
        var result = resolve("a = 1\nlocal a = a");
        var global = at(result, 2, 10);
        assertEquals(List.of("1:0"), positions(global.definitions()));
        assertEquals(List.of("1:0", "2:10"), positions(global.usages()));

        var local = at(result, 2, 6);
        assertEquals(List.of("2:6"), positions(local.definitions()));
    }

    @Test
    void testUndefinedGlobalIsReportedAndDeclared() {
        var result = resolve("print(undeclared_name)");
        assertEquals(List.of("undefined variable: undeclared_name"), warnings(result));
        assertEquals(6, result.warnings().get(0).bounds().start().column());
        assertTrue(result.implicitGlobals().contains("undeclared_name"));
        assertTrue(result.globalScope().has("undeclared_name"));
    }

    @Test
    void testSuppressedBuiltinsAreUndefined() {
        var chunk = Parser.parse("print(undeclared_name)");
        var result = DefinitionsUsagesFinder.findDefinitionsUsages(chunk, true);
        assertEquals(
                List.of("undefined variable: print", "undefined variable: undeclared_name"), warnings(result));
    }

    @Test
    void testReferenceBeforeDefinitionResolvesLater() {
        var code = "function _init() foo() end\nfunction foo() end";
        var result = resolve(code);
        assertTrue(result.warnings().isEmpty(), () -> warnings(result).toString());

        var foo = at(result, 1, 17);
        assertEquals("foo", foo.symbolName());
        assertEquals(List.of("2:9"), positions(foo.definitions()));
        assertEquals(List.of("2:9", "1:17"), positions(foo.usages()));
    }

    @Test
    void testGlobalReassignmentIsAnotherDefinition() {
        var result = resolve("x = 1\nx = 2\nprint(x)");
        var x = at(result, 3, 6);
        assertEquals(List.of("1:0", "2:0"), positions(x.definitions()));
        assertEquals(List.of("1:0", "2:0", "3:6"), positions(x.usages()));
    }

    @Test
    void testLocalReassignmentIsAUsage() {
        var result = resolve("local x = 1\nx = 2");
        var x = at(result, 2, 0);
        assertEquals(List.of("1:6"), positions(x.definitions()));
        assertEquals(List.of("1:6", "2:0"), positions(x.usages()));
    }

    @Test
    void testDeprecatedBuiltin() {
        var result = resolve("x = band(1, 2)");
        assertEquals(List.of("deprecated function: band (use & operator instead)"), warnings(result));
    }

    @Test
    void testMemberDefinitionAndUsage() {
        var result = resolve("player = {}\nplayer.x = 1\nprint(player.x)");
        var member = at(result, 3, 13);
        assertEquals("player.x", member.symbolName());
        assertEquals(List.of("2:0"), positions(member.definitions()));

        var player = at(result, 3, 7);
        assertEquals("player", player.symbolName());
        assertEquals(List.of("1:0", "2:0", "3:6"), positions(player.usages()));
    }

    @Test
    void testSelfResolvesToMethodOwner() {
        var code = """
                obj = {}
                function obj:move()
                  self.x = 1
                end
                print(obj.x)
                """;
        var result = resolve(code);
        var member = at(result, 5, 10);
        assertEquals("obj.x", member.symbolName());
        assertEquals(List.of("3:2"), positions(member.definitions()));
        assertTrue(result.warnings().isEmpty(), () -> warnings(result).toString());
    }

    @Test
    void testParametersAndLoopVariables() {
        var code = """
                function f(p)
                  for i = 1, p do
                    print(i)
                  end
                end
                """;
        var result = resolve(code);
        assertEquals(List.of("1:11", "2:13"), positions(at(result, 2, 13).usages()));
        assertEquals(List.of("2:6", "3:10"), positions(at(result, 3, 10).usages()));
    }

    @Test
    void testGotoBindsToLabel() {
        var result = resolve("::top::\ngoto top");
        var label = at(result, 2, 5);
        assertEquals(List.of("1:2"), positions(label.definitions()));
        assertEquals(List.of("1:2", "2:5"), positions(label.usages()));
    }

    @Test
    void testLabelsAreNotVisibleAcrossFunctions() {
        var result = resolve("::a::\nfunction f() goto a end");
        assertNull(result.lookup().lookup(2, 18));
    }

    @Test
    void testProjectChunksShareGlobals() {
        var root = Parser.parse("util()\nunknown()");
        var lib = Parser.parse("function util() end");
        var results = DefinitionsUsagesFinder.findDefinitionsUsages(List.of(root, lib));

        assertEquals(2, results.size());
        assertEquals(List.of("undefined variable: unknown"), warnings(results.get(0)));
        assertTrue(results.get(1).warnings().isEmpty());
        assertTrue(results.get(0).globalScope() == results.get(1).globalScope());
    }

    @Test
    void testIdentifierAtPosition() {
        assertEquals("a.b", Identifiers.identifierAtPosition("x = a.b.c", 1, 6));
        assertEquals("a.b.c", Identifiers.identifierAtPosition("x = a.b.c", 1, 8));
        assertEquals("obj.m", Identifiers.identifierAtPosition("obj:m()", 1, 5));
        assertNull(Identifiers.identifierAtPosition("x = 1", 1, 4));
        assertNull(Identifiers.identifierAtPosition("x", 3, 0));
    }
}
