package ai.p8ls.settings;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Reads {@link AnalyzerSettings} for a workspace. */
public final class SettingsLoader {
    private static final Logger logger = LogManager.getLogger(SettingsLoader.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    private SettingsLoader() {}

    /**
     * Settings from {@code root/.p8ls.json}. A missing file gives the defaults; a file that is not valid JSON is
     * reported and also gives the defaults.
     *
     * @throws UncheckedIOException if the file exists but cannot be read
     */
    public static AnalyzerSettings load(Path root) {
        var file = root.resolve(AnalyzerSettings.FILE_NAME);
        if (!Files.isRegularFile(file)) {
            logger.debug("No {} in {}, using defaults", AnalyzerSettings.FILE_NAME, root);
            return AnalyzerSettings.DEFAULT;
        }
        try {
            return parse(Files.readString(file));
        } catch (JsonProcessingException e) {
            logger.warn("Ignoring malformed settings file {}: {}", file, e.getOriginalMessage());
            return AnalyzerSettings.DEFAULT;
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read " + file, e);
        }
    }

    public static AnalyzerSettings parse(String json) throws JsonProcessingException {
        var settings = objectMapper.readValue(json, AnalyzerSettings.class);
        return settings == null ? AnalyzerSettings.DEFAULT : settings;
    }
}
