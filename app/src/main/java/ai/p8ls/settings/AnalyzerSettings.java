package ai.p8ls.settings;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.Nullable;

/**
 * Workspace settings, read from {@code .p8ls.json} at the workspace root. Every property is optional.
 *
 * @param maxNumberOfProblems cap on diagnostics reported per file
 * @param suppressBuiltinGlobals do not predefine the PICO-8 API in the global scope
 * @param format formatter preferences
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AnalyzerSettings(int maxNumberOfProblems, boolean suppressBuiltinGlobals, FormatSettings format) {
    public static final String FILE_NAME = ".p8ls.json";
    public static final AnalyzerSettings DEFAULT = new AnalyzerSettings(1000, false, FormatSettings.DEFAULT);

    public AnalyzerSettings {
        if (maxNumberOfProblems < 0) {
            throw new IllegalArgumentException("maxNumberOfProblems must not be negative: " + maxNumberOfProblems);
        }
    }

    @JsonCreator
    public static AnalyzerSettings fromJson(
            @JsonProperty("maxNumberOfProblems") @Nullable Integer maxNumberOfProblems,
            @JsonProperty("suppressBuiltinGlobals") @Nullable Boolean suppressBuiltinGlobals,
            @JsonProperty("format") @Nullable FormatSettings format) {
        return new AnalyzerSettings(
                maxNumberOfProblems == null ? DEFAULT.maxNumberOfProblems() : maxNumberOfProblems,
                suppressBuiltinGlobals == null ? DEFAULT.suppressBuiltinGlobals() : suppressBuiltinGlobals,
                format == null ? FormatSettings.DEFAULT : format);
    }
}
