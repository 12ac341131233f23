package ai.p8ls.analyzer.scope;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/**
 * Names the PICO-8 runtime defines before any cartridge code runs: API functions and glyph constants. Loaded once
 * from {@code builtin-globals.json} on the classpath.
 */
public final class BuiltinGlobals {
    private static final String RESOURCE = "ai/p8ls/analyzer/scope/builtin-globals.json";
    private static final ObjectMapper objectMapper = new ObjectMapper();

    private static volatile @Nullable BuiltinGlobals instance;

    /** Name to deprecation hint; the hint is null for current API. */
    private final Map<String, @Nullable String> entries;

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record FunctionEntry(
            @JsonProperty("name") String name, @JsonProperty("deprecated") @Nullable String deprecated) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record Catalog(
            @JsonProperty("functions") List<FunctionEntry> functions,
            @JsonProperty("constants") List<String> constants) {}

    private BuiltinGlobals(Map<String, @Nullable String> entries) {
        this.entries = Collections.unmodifiableMap(entries);
    }

    public static BuiltinGlobals instance() {
        var result = instance;
        if (result == null) {
            synchronized (BuiltinGlobals.class) {
                result = instance;
                if (result == null) {
                    result = load();
                    instance = result;
                }
            }
        }
        return result;
    }

    private static BuiltinGlobals load() {
        try (InputStream in = BuiltinGlobals.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) throw new IOException("Resource not found: " + RESOURCE);
            var catalog = objectMapper.readValue(in, Catalog.class);
            var entries = new LinkedHashMap<String, @Nullable String>();
            for (var function : catalog.functions()) {
                entries.put(function.name(), function.deprecated());
            }
            for (var constant : catalog.constants()) {
                entries.put(constant, null);
            }
            return new BuiltinGlobals(entries);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public Set<String> names() {
        return entries.keySet();
    }

    public boolean contains(String name) {
        return entries.containsKey(name);
    }

    /** Replacement hint for a deprecated builtin, or null when {@code name} is not deprecated. */
    public @Nullable String deprecation(String name) {
        return entries.get(name);
    }
}
