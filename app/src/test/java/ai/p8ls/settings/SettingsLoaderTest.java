package ai.p8ls.settings;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.p8ls.analyzer.format.FormatterOptions;
import com.fasterxml.jackson.core.JsonProcessingException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SettingsLoaderTest {
    @TempDir
    Path root;

    @Test
    void testEmptyObjectGivesDefaults() throws Exception {
        assertEquals(AnalyzerSettings.DEFAULT, SettingsLoader.parse("{}"));
    }

    @Test
    void testPartialSettings() throws Exception {
        var settings = SettingsLoader.parse("""
                {
                  "maxNumberOfProblems": 5,
                  "format": { "indentWidth": 4 },
                  "somethingElse": true
                }
                """);
        assertEquals(5, settings.maxNumberOfProblems());
        assertFalse(settings.suppressBuiltinGlobals());
        assertEquals(new FormatSettings(4, true, false), settings.format());
    }

    @Test
    void testFullSettings() throws Exception {
        var settings = SettingsLoader.parse("""
                {
                  "maxNumberOfProblems": 10,
                  "suppressBuiltinGlobals": true,
                  "format": { "indentWidth": 8, "useSpaces": false, "forceOneStatementPerLine": true }
                }
                """);
        assertEquals(new AnalyzerSettings(10, true, new FormatSettings(8, false, true)), settings);
        assertEquals(new FormatterOptions(8, false, true), settings.format().toFormatterOptions());
    }

    @Test
    void testNegativeProblemCapIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new AnalyzerSettings(-1, false, FormatSettings.DEFAULT));
        assertThrows(JsonProcessingException.class, () -> SettingsLoader.parse("{\"maxNumberOfProblems\": -1}"));
    }

    @Test
    void testDefaultFormatSettingsMatchFormatterDefaults() {
        assertEquals(FormatterOptions.DEFAULT, FormatSettings.DEFAULT.toFormatterOptions());
    }

    @Test
    void testLoadWithoutFile() {
        assertSame(AnalyzerSettings.DEFAULT, SettingsLoader.load(root));
    }

    @Test
    void testLoadFromFile() throws Exception {
        Files.writeString(root.resolve(AnalyzerSettings.FILE_NAME), "{\"suppressBuiltinGlobals\": true}");
        var settings = SettingsLoader.load(root);
        assertTrue(settings.suppressBuiltinGlobals());
        assertEquals(AnalyzerSettings.DEFAULT.maxNumberOfProblems(), settings.maxNumberOfProblems());
    }

    @Test
    void testMalformedFileFallsBackToDefaults() throws Exception {
        Files.writeString(root.resolve(AnalyzerSettings.FILE_NAME), "{ not json");
        assertSame(AnalyzerSettings.DEFAULT, SettingsLoader.load(root));
    }
}
