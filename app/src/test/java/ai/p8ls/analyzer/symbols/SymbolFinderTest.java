package ai.p8ls.analyzer.symbols;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ai.p8ls.analyzer.parser.Parser;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class SymbolFinderTest {

    /** Compact outline such as {@code f[FUNCTION](x[LOCAL_VARIABLE])}, siblings separated by commas. */
    private static String outline(List<CodeSymbol> symbols) {
        return symbols.stream()
                .map(s -> s.name() + "[" + s.kind() + "]"
                        + (s.children().isEmpty() ? "" : "(" + outline(s.children()) + ")"))
                .collect(Collectors.joining(","));
    }

    private static List<CodeSymbol> symbols(String code) {
        return Parser.parse(code).symbols();
    }

    @Test
    void testFunctionWithParameters() {
        var code = "function somefn(x, y, z)\n  return x + y + z\nend";
        var symbols = symbols(code);
        assertEquals("somefn[FUNCTION](x[LOCAL_VARIABLE],y[LOCAL_VARIABLE],z[LOCAL_VARIABLE])", outline(symbols));

        var fn = symbols.get(0);
        assertEquals("(x,y,z)", fn.detail());
        assertEquals(1, fn.bounds().start().line());
        assertEquals(0, fn.bounds().start().column());
        assertEquals(3, fn.bounds().end().line());
        assertEquals(3, fn.bounds().end().column());
        assertEquals(9, fn.selectionBounds().start().column());
        assertEquals(15, fn.selectionBounds().end().column());
    }

    @Test
    void testNestedFunctions() {
        var code = """
                function somefn(x)

                  function nested(y) print(y) end

                  return x
                end
                """;
        assertEquals(
                "somefn[FUNCTION](x[LOCAL_VARIABLE],nested[FUNCTION](y[LOCAL_VARIABLE]))", outline(symbols(code)));
    }

    @Test
    void testTopLevelGlobalIsRepeatedOnReassignment() {
        assertEquals("i[GLOBAL_VARIABLE]", outline(symbols("i = 1")));
        assertEquals("i[GLOBAL_VARIABLE],i[GLOBAL_VARIABLE]", outline(symbols("i = 1\ni = 2")));
    }

    @Test
    void testTopLevelLocal() {
        assertEquals("i[LOCAL_VARIABLE]", outline(symbols("local i = 1")));
    }

    @Test
    void testLocalReassignedInsideFunction() {
        var code = """
                function inside_a_block()
                  local i
                  i = 1
                end
                """;
        assertEquals("inside_a_block[FUNCTION](i[LOCAL_VARIABLE],i[LOCAL_VARIABLE])", outline(symbols(code)));
    }

    @Test
    void testGlobalsInsideFunctionGoToTopLevel() {
        var code = """
                function somefn()
                  some_global = 0
                  local i = 1
                  i = 47
                  some_global = 29
                end
                """;
        assertEquals(
                "somefn[FUNCTION](i[LOCAL_VARIABLE],i[LOCAL_VARIABLE]),"
                        + "some_global[GLOBAL_VARIABLE],some_global[GLOBAL_VARIABLE]",
                outline(symbols(code)));
    }

    @Test
    void testVariableAssignedAFunctionBecomesFunction() {
        var symbols = symbols("somefn = function(x)\n  return x\nend");
        assertEquals("somefn[FUNCTION](x[LOCAL_VARIABLE])", outline(symbols));
        assertEquals("(x)", symbols.get(0).detail());
    }

    @Test
    void testTableMembersNestUnderTable() {
        var code = """
                thing = {
                  asdf = {},
                  trav = function() end,
                }
                """;
        assertEquals("thing[GLOBAL_VARIABLE](asdf[LOCAL_VARIABLE],trav[FUNCTION])", outline(symbols(code)));
    }

    @Test
    void testIndexedAssignmentCreatesNoSymbol() {
        var code = """
                function particles:spawn(props)
                  self.ps[rnd()]=particle(props)
                end
                """;
        assertEquals("particles:spawn[FUNCTION](props[LOCAL_VARIABLE])", outline(symbols(code)));
    }

    @Test
    void testSelfIsReplacedByMethodOwner() {
        var code = """
                function obj:update()
                  self.x = 1
                end
                """;
        assertEquals("obj:update[FUNCTION],obj.x[GLOBAL_VARIABLE]", outline(symbols(code)));
    }

    @Test
    void testLoopVariables() {
        assertEquals("i[LOCAL_VARIABLE],y[LOCAL_VARIABLE]", outline(symbols("for i = 1, 3 do local y = i end")));
    }

    @Test
    void testRepeatConditionSeesBodyLocals() {
        assertEquals(
                "d[LOCAL_VARIABLE],<anonymous function>[FUNCTION](d[LOCAL_VARIABLE])",
                outline(symbols("repeat local d = 1 until (function() d = 2 end)()")));
    }

    @Test
    void testMalformedCodeStillYieldsOutline() {
        assertEquals("f[FUNCTION]", outline(symbols("function f() end\nx = = 1")));
    }
}
