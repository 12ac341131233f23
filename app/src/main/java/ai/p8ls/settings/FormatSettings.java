package ai.p8ls.settings;

import ai.p8ls.analyzer.format.FormatterOptions;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.Nullable;

/** The {@code format} section of {@code .p8ls.json}. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FormatSettings(int indentWidth, boolean useSpaces, boolean forceOneStatementPerLine) {
    public static final FormatSettings DEFAULT = new FormatSettings(2, true, false);

    @JsonCreator
    public static FormatSettings fromJson(
            @JsonProperty("indentWidth") @Nullable Integer indentWidth,
            @JsonProperty("useSpaces") @Nullable Boolean useSpaces,
            @JsonProperty("forceOneStatementPerLine") @Nullable Boolean forceOneStatementPerLine) {
        return new FormatSettings(
                indentWidth == null ? DEFAULT.indentWidth() : indentWidth,
                useSpaces == null ? DEFAULT.useSpaces() : useSpaces,
                forceOneStatementPerLine == null ? DEFAULT.forceOneStatementPerLine() : forceOneStatementPerLine);
    }

    public FormatterOptions toFormatterOptions() {
        return new FormatterOptions(indentWidth, useSpaces, forceOneStatementPerLine);
    }
}
