package ai.p8ls.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ai.p8ls.analyzer.format.FormatRange;
import ai.p8ls.analyzer.format.FormatResult;
import org.junit.jupiter.api.Test;

class FormatEditsTest {

    @Test
    void testWholeDocument() {
        assertEquals("x = 1", FormatEdits.apply("x=1", new FormatResult("x = 1", FormatRange.wholeDocument())));
    }

    @Test
    void testCodeSectionBetweenMarkers() {
        var original = "header\n__lua__\nx=1\ny=2\n__gfx__\n0000\n";
        var result = new FormatResult("x = 1\ny = 2\n\n", new FormatRange(2, 0, 4, 0));
        assertEquals("header\n__lua__\nx = 1\ny = 2\n\n__gfx__\n0000\n", FormatEdits.apply(original, result));
    }

    @Test
    void testCodeSectionToEnd() {
        var original = "header\n__lua__\nx=1";
        var result = new FormatResult("x = 1\n", new FormatRange(2, 0, FormatRange.END_OF_DOCUMENT, 0));
        assertEquals("header\n__lua__\nx = 1\n", FormatEdits.apply(original, result));
    }
}
