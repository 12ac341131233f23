package ai.p8ls.analyzer.lexer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class LexerTest {

    private static List<Token> tokens(Lexer lexer) {
        var result = new ArrayList<Token>();
        lexer.next();
        while (!lexer.token().isEof()) {
            result.add(lexer.token());
            lexer.next();
        }
        return result;
    }

    private static List<Token> tokens(String text) {
        return tokens(new Lexer(text, null));
    }

    private static Token single(String text) {
        var all = tokens(text);
        assertEquals(1, all.size(), () -> "expected one token in " + all);
        return all.get(0);
    }

    @Test
    void testKeywordsIdentifiersAndLiterals() {
        var all = tokens("local x = nil and true or y");
        assertEquals(TokenType.KEYWORD, all.get(0).type());
        assertEquals("local", all.get(0).value());
        assertEquals(TokenType.IDENTIFIER, all.get(1).type());
        assertEquals("x", all.get(1).value());
        assertTrue(all.get(2).is("="));
        assertEquals(TokenType.NIL_LITERAL, all.get(3).type());
        assertTrue(all.get(4).is("and"));
        assertEquals(TokenType.BOOLEAN_LITERAL, all.get(5).type());
        assertEquals(Boolean.TRUE, all.get(5).value());
        assertTrue(all.get(6).is("or"));
        assertEquals(TokenType.IDENTIFIER, all.get(7).type());
    }

    @Test
    void testNumericForms() {
        assertEquals(16.0, single("0x10").value());
        assertEquals(5.0, single("0b101").value());
        assertEquals(150.0, single("1.5e2").value());
        assertEquals(0.5, single(".5").value());
        assertEquals(1.5, single("0x1.8").value());
        assertEquals(8.0, single("0x1p3").value());
        assertEquals("0x10", single("0x10").raw());
    }

    @Test
    void testMalformedNumberIsErrorToken() {
        var token = single("0x");
        assertEquals(TokenType.ERROR, token.type());
        assertEquals("malformed number near '0x'", token.value());
    }

    @Test
    void testPico8Punctuators() {
        var values = tokens("a ..= b >>> c ^^ d != e \\ f >>< g <<> h").stream()
                .filter(t -> t.type() == TokenType.PUNCTUATOR)
                .map(Token::stringValue)
                .toList();
        assertEquals(List.of("..=", ">>>", "^^", "!=", "\\", ">><", "<<>"), values);
    }

    @Test
    void testVarargIsItsOwnType() {
        var token = single("...");
        assertEquals(TokenType.VARARG_LITERAL, token.type());
        assertTrue(token.is("..."));
    }

    @Test
    void testStringEscapes() {
        assertEquals("a\nb", single("\"a\\nb\"").value());
        assertEquals("it's", single("'it\\'s'").value());
        assertEquals("A", single("\"\\65\"").value());
        assertEquals("A", single("\"\\x41\"").value());
        assertEquals("ab", single("\"a\\z   b\"").value());
    }

    @Test
    void testLongStrings() {
        assertEquals("long\nstring", single("[[\nlong\nstring]]").value());
        assertEquals("x]]y", single("[==[x]]y]==]").value());
    }

    @Test
    void testUnfinishedStringIsErrorToken() {
        var token = tokens("\"abc\nx").get(0);
        assertEquals(TokenType.ERROR, token.type());
        assertEquals("unfinished string near '\"abc'", token.value());
    }

    @Test
    void testInvalidEscapeIsErrorToken() {
        var token = single("\"\\q\"");
        assertEquals(TokenType.ERROR, token.type());
        assertEquals("invalid escape sequence '\\q'", token.value());
    }

    @Test
    void testUnexpectedCharacter() {
        var token = single("`");
        assertEquals(TokenType.ERROR, token.type());
        assertEquals("unexpected character '`'", token.value());
    }

    @Test
    void testCommentsAreCollectedOnTheSide() {
        var lexer = new Lexer("-- hi\nx // c\n--[[ long ]] y", null);
        var all = tokens(lexer);
        assertEquals(List.of("x", "y"), all.stream().map(Token::stringValue).toList());

        var comments = lexer.comments();
        assertEquals(3, comments.size());
        assertEquals(" hi", comments.get(0).value());
        assertEquals("-- hi", comments.get(0).raw());
        assertFalse(comments.get(0).isLong());
        assertEquals("// c", comments.get(1).raw());
        assertTrue(comments.get(2).isLong());
        assertEquals(" long ", comments.get(2).value());
        assertEquals("--[[ long ]]", comments.get(2).raw());
    }

    @Test
    void testUnfinishedLongComment() {
        var token = single("--[[ abc");
        assertEquals(TokenType.ERROR, token.type());
        assertEquals("unfinished long comment (starting at line 1) near '<eof>'", token.value());
    }

    @Test
    void testPositions() {
        var all = tokens("a\n  bb");
        var bb = all.get(1).bounds();
        assertEquals(2, bb.start().line());
        assertEquals(2, bb.start().column());
        assertEquals(4, bb.start().index());
        assertEquals(2, bb.end().line());
        assertEquals(4, bb.end().column());
        assertEquals(6, bb.end().index());
    }

    @Test
    void testCrLfCountsAsOneLineBreak() {
        var all = tokens("a\r\nb");
        assertEquals(2, all.get(1).bounds().start().line());
        assertEquals(0, all.get(1).bounds().start().column());
    }

    @Test
    void testCartridgeOnlyLexesCodeSection() {
        var text = "pico-8 cartridge // http://www.pico-8.com\nversion 41\n__lua__\nx = 1\n__gfx__\n0000\n";
        var lexer = new Lexer(text, null);
        var all = tokens(lexer);
        assertTrue(lexer.isCartridge());
        assertEquals(List.of("x", "=", "1"), all.stream().map(Token::raw).toList());
        assertEquals(4, all.get(0).bounds().start().line());
        assertEquals(0, all.get(0).bounds().start().column());
    }

    @Test
    void testPlainTextIsNotCartridge() {
        var lexer = new Lexer("__gfx__\nx", null);
        var all = tokens(lexer);
        assertFalse(lexer.isCartridge());
        assertEquals("x", all.get(all.size() - 1).stringValue());
    }

    @Test
    void testSectionMarkers() {
        assertTrue(Lexer.isBeginningOfCodeSection("__lua__"));
        assertTrue(Lexer.isEndOfCodeSection("__gfx__"));
        assertTrue(Lexer.isEndOfCodeSection("__meta:title__"));
        assertFalse(Lexer.isEndOfCodeSection("__lua__"));
    }

    @Test
    void testGlyphIdentifier() {
        var token = single("\u2B05\uFE0F");
        assertEquals(TokenType.IDENTIFIER, token.type());
    }

    @Test
    void testSignificantNewline() {
        var lexer = new Lexer("a\nb", null);
        lexer.next();
        lexer.setNewlineSignificant(true);
        assertEquals("a", lexer.token().stringValue());
        lexer.next();
        assertEquals(TokenType.NEWLINE, lexer.token().type());
        lexer.next();
        assertEquals("b", lexer.token().stringValue());
    }

    @Test
    void testConsumeRestOfLine() {
        var lexer = new Lexer("#include foo.lua -- not a comment\nx", null);
        lexer.next();
        assertTrue(lexer.token().is("#"));
        lexer.consumeRestOfLine();
        assertEquals(TokenType.RAW, lexer.token().type());
        assertEquals("#include foo.lua -- not a comment", lexer.token().value());
        assertTrue(lexer.comments().isEmpty());
        lexer.next();
        assertEquals("x", lexer.token().stringValue());
    }
}
