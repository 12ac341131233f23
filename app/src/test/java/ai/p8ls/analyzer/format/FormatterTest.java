package ai.p8ls.analyzer.format;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.p8ls.analyzer.ast.AstDump;
import ai.p8ls.analyzer.ast.Expression;
import ai.p8ls.analyzer.ast.LocalStatement;
import ai.p8ls.analyzer.parser.Parser;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class FormatterTest {
    private static final String SAMPLE = """
            -- demo cart
            local t = {1,2,x=3}
            function f(a,b)
            -- sum
            return a+b
            end



            if a then b() end
            if (c) d() else e()
            while x<10 do x+=1 end
            repeat x=x-1 until x<=0
            for i=1,10,2 do print(i) end
            for k,v in pairs(t) do
            print(k,v) -- pair
            end
            ?"hi",1
            local s=('abc'):upper()
            y=a-(b-c)*-d
            ::top::
            goto top""";

    private static final String SAMPLE_FORMATTED = """
            -- demo cart
            local t = { 1, 2, x = 3 }
            function f(a, b)
              -- sum
              return a + b
            end

            if a then b() end
            if (c) d() else e()
            while x < 10 do
              x += 1
            end
            repeat
              x = x - 1
            until x <= 0
            for i = 1, 10, 2 do
              print(i)
            end
            for k, v in pairs(t) do
              print(k, v) -- pair
            end
            ?"hi", 1
            local s = ('abc'):upper()
            y = a - (b - c) * -d
            ::top::
            goto top""";

    private static Optional<FormatResult> tryFormat(String text, FormatterOptions options) {
        return new Formatter(options).format(Parser.parse(text), text, true);
    }

    private static String format(String text, FormatterOptions options) {
        return tryFormat(text, options).orElseThrow().formattedText();
    }

    private static String format(String text) {
        return format(text, FormatterOptions.DEFAULT);
    }

    @Test
    void testSample() {
        assertEquals(SAMPLE_FORMATTED, format(SAMPLE));
    }

    @Test
    @DisplayName("formatting canonical text is a fixed point")
    void testFormattingIsIdempotent() {
        var once = format(SAMPLE);
        assertEquals(once, format(once));
    }

    @Test
    @DisplayName("reparsed output has the same tree as the input")
    void testFormattingPreservesStructure() {
        var formatted = format(SAMPLE);
        var reparsed = Parser.parse(formatted);
        assertFalse(reparsed.hasErrors(), reparsed.errors()::toString);
        assertEquals(AstDump.dump(Parser.parse(SAMPLE).block()), AstDump.dump(reparsed.block()));
        assertEquals(3, reparsed.comments().size());
    }

    @ParameterizedTest
    @ValueSource(
            strings = {
                "x = t[ [[s]] ]",
                "t = {[ [[k]] ] = 1}",
                "t[ [=[s]=] ] = [==[\n  a ]] \n]==]",
                "x = [[\nfoo  \n]]",
                "print [[\nhi  \n]]",
                "--[[ note  \n  more  \n]]\nx = 1",
                "f(function() return g(function(a) return a end) end, 2)",
                "f(function()\nreturn g(function(a)\nreturn a\nend)\nend)",
                "x = a + -- c\n b",
                "x = 1 + --[[ c ]] 2",
                "y = (a or b) and --[[ why ]] c",
                "f(a, -- first\n b)",
                "if a then\n  x = {\n    -- k\n    [ [[k]] ] = [[\n  v  \n]]\n  }\nend"
            })
    @DisplayName("awkward inputs reparse to the same tree and format to a fixed point")
    void testFormattingInvariants(String text) {
        var formatted = format(text);
        var reparsed = Parser.parse(formatted);
        assertFalse(reparsed.hasErrors(), () -> formatted + " -> " + reparsed.errors());
        assertEquals(AstDump.dump(Parser.parse(text).block()), AstDump.dump(reparsed.block()));
        assertEquals(Parser.parse(text).comments().size(), reparsed.comments().size());
        assertEquals(formatted, format(formatted));
    }

    @Test
    void testLongStringIndexIsSpacedOut() {
        assertEquals("x = t[ [[s]] ]", format("x = t[ [[s]] ]"));
        assertEquals("x = t[ [=[s]=] ]", format("x = t[ [=[s]=] ]"));
        assertEquals("x = t[\"s\"]", format("x = t[ \"s\" ]"));
    }

    @Test
    void testMultilineLongStringsKeepTrailingWhitespace() {
        assertEquals("x = [[\nfoo  \n]]", format("x = [[\nfoo  \n]]"));
        assertEquals("x = [[foo  \nbar\t\n]]", format("x=[[foo  \nbar\t\n]]  "));
        assertEquals("--[[ a  \nb  ]]\nx = 1", format("--[[ a  \nb  ]]\nx = 1"));
        assertEquals("x = 1", format("x = 1   "));
    }

    @Test
    void testOperatorStaysOnTheLeftOperandLine() {
        var formatted = format("x = a + -- c\n b");
        assertEquals("x = a +", formatted.lines().findFirst().orElseThrow());
        assertTrue(formatted.lines().noneMatch(line -> line.trim().equals("+")), formatted);
        assertEquals("x = a and\n    b", format("x = a\nand b"));
    }

    @Test
    void testWholeDocumentRangeForPlainFiles() {
        var result = tryFormat("x=1", FormatterOptions.DEFAULT).orElseThrow();
        assertEquals(FormatRange.wholeDocument(), result.range());
        assertEquals("x = 1", result.formattedText());
    }

    @Test
    void testBlankLinesCollapseToOne() {
        assertEquals("a = 1\n\nb = 2", format("a = 1\n\n\n\nb = 2"));
        assertEquals("a = 1\nb = 2", format("a = 1\nb = 2"));
    }

    @Test
    void testParenthesesFollowPrecedence() {
        assertEquals("x = a - (b - c)", format("x = a - (b - c)"));
        assertEquals("x = a + b + c", format("x = a + (b + c)"));
        assertEquals("x = a - b - c", format("x = (a - b) - c"));
        assertEquals("x = (a + b) * c", format("x = (a + b) * c"));
        assertEquals("x = a * b + c", format("x = (a * b) + c"));
        assertEquals("x = (a ^ b) ^ c", format("x = (a ^ b) ^ c"));
        assertEquals("x = a ^ b ^ c", format("x = a ^ (b ^ c)"));
        assertEquals("x = (-a) ^ 2", format("x = (-a) ^ 2"));
        assertEquals("x = -a ^ 2", format("x = -a ^ 2"));
        assertEquals("x = #t + 1", format("x = (#t) + 1"));
        assertEquals("x = a", format("x = (a)"));
    }

    @Test
    void testMixedLogicalOperators() {
        assertEquals("x = a or b and c", format("x = a or (b and c)"));
        assertEquals("x = (a or b) and c", format("x = (a or b) and c"));
        assertEquals("x = a and b or c", format("x = (a and b) or c"));
        assertEquals("x = a or b or c", format("x = a or (b or c)"));
    }

    @Test
    void testTableConstructorAsBaseKeepsParentheses() {
        assertEquals("x = ({ 1, 2 })[k]", format("x = ({1, 2})[k]"));
        assertEquals("x = ('abc'):upper()", format("x = ('abc'):upper()"));
    }

    @Test
    void testTruncatingParenthesesAreKept() {
        assertEquals("x = (f())", format("x = (f())"));
        assertEquals("local a = (...)", format("local a = (...)"));
    }

    @Test
    void testUnaryOperators() {
        assertEquals("x = - -a", format("x = - -a"));
        assertEquals("x = -(a + b)", format("x = -(a + b)"));
        assertEquals("x = not (a == b)", format("x = not (a == b)"));
        assertEquals("x = not a", format("x = not a"));
    }

    @Test
    void testNeedsParentheses() {
        var sum = ((LocalStatement) Parser.parse("local v = a + b").block().statements().get(0)).values().get(0);
        assertTrue(Formatter.needsParentheses(sum, "*", false));
        assertFalse(Formatter.needsParentheses(sum, "+", true));
        assertFalse(Formatter.needsParentheses(sum, "..", false));

        Expression difference =
                ((LocalStatement) Parser.parse("local v = a - b").block().statements().get(0)).values().get(0);
        assertTrue(Formatter.needsParentheses(difference, "-", true));
        assertFalse(Formatter.needsParentheses(difference, "-", false));
    }

    @Test
    void testIndentationOptions() {
        var code = "function f()\nreturn 1\nend";
        assertEquals("function f()\n\treturn 1\nend", format(code, new FormatterOptions(2, false, false)));
        assertEquals("function f()\n    return 1\nend", format(code, new FormatterOptions(4, true, false)));
        assertThrows(IllegalArgumentException.class, () -> new FormatterOptions(-1, true, false));
    }

    @Test
    void testStatementsSharingALine() {
        assertEquals("a = 1 b = 2", format("a = 1 b = 2"));
        assertEquals("function f() return 1 end", format("function f() return 1 end"));

        var force = new FormatterOptions(2, true, true);
        assertEquals("a = 1\nb = 2", format("a = 1 b = 2", force));
        assertEquals("function f()\n  return 1\nend", format("function f() return 1 end", force));
    }

    @Test
    void testNestedBlocksIndent() {
        assertEquals(
                "if a then\n  if b then\n    c()\n  end\nend", format("if a then\nif b then\nc()\nend\nend"));
        assertEquals(
                "if a then\n  b()\nelseif c then\n  d()\nelse\n  e()\nend",
                format("if a then\nb()\nelseif c then\nd()\nelse\ne()\nend"));
        assertEquals("do\n  x = 1\nend", format("do x = 1 end"));
    }

    @Test
    void testMultilineCallsAndTables() {
        assertEquals("f(\n  a,\n  b\n)", format("f(a,\nb)"));
        assertEquals("t = {\n  1,\n  2\n}", format("t = {\n1,\n2\n}"));
        assertEquals("t = {}", format("t = { }"));
        assertEquals("t = { [ [[a]] ] = 1 }", format("t = {[ [[a]] ] = 1}"));
    }

    @Test
    void testCommentsArePreserved() {
        assertEquals("t = {\n  1, -- one\n  2\n}", format("t = {\n  1, -- one\n  2\n}"));
        assertEquals("--[[ note ]] x = 1", format("--[[ note ]] x = 1"));
        assertEquals(
                "function f()\n  return 1\n  -- trailing\nend", format("function f()\nreturn 1\n-- trailing\nend"));
        assertEquals("x = 1\n-- last", format("x = 1\n-- last"));
    }

    @Test
    void testDeclinesOnParseErrors() {
        assertTrue(tryFormat("x = = 1", FormatterOptions.DEFAULT).isEmpty());
        assertTrue(tryFormat("function f(", FormatterOptions.DEFAULT).isEmpty());
        assertTrue(Parser.parse("a b c").hasErrors());
        assertTrue(tryFormat("a b c", FormatterOptions.DEFAULT).isEmpty());
    }

    @Test
    void testCartridgeCodeSection() {
        var text = "pico-8 cartridge // http://www.pico-8.com\nversion 41\n__lua__\nx=1\n__gfx__\n0000\n";
        var result = new Formatter().format(Parser.parse(text), text, false).orElseThrow();
        assertEquals(new FormatRange(3, 0, 4, 0), result.range());
        assertEquals("x = 1\n\n", result.formattedText());
    }

    @Test
    void testCartridgeCodeSectionToEnd() {
        var text = "pico-8 cartridge\nversion 41\n__lua__\nx=1";
        var result = new Formatter().format(Parser.parse(text), text, false).orElseThrow();
        assertEquals(new FormatRange(3, 0, FormatRange.END_OF_DOCUMENT, 0), result.range());
        assertTrue(result.range().extendsToEnd());
        assertEquals("x = 1\n", result.formattedText());
    }

    @Test
    void testCartridgeWithoutCodeSection() {
        var text = "pico-8 cartridge\nversion 41\n__gfx__\n0000\n";
        assertTrue(new Formatter().format(Parser.parse(text), text, false).isEmpty());
    }
}
