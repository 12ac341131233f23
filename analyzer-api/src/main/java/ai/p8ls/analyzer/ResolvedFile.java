package ai.p8ls.analyzer;

import static java.util.Objects.requireNonNull;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import java.net.URI;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonical identity of a source file: a normalized filesystem path plus its {@code file://} URL. Two references are
 * equal iff both fields match.
 *
 * <p>Paths are kept with forward slashes. A Windows style drive segment ({@code C:/...}) is rendered in the URL with
 * its colon percent-encoded ({@code file:///c%3A/...}), which is the form editors send.
 *
 * @param path normalized filesystem path
 * @param fileURL canonical URL for {@code path}
 */
public record ResolvedFile(String path, String fileURL) {
    private static final Pattern DRIVE_PATH = Pattern.compile("^/?([A-Za-z]):(/.*)?$");
    private static final Pattern DRIVE_URL_SEGMENT = Pattern.compile("^([A-Za-z])(:|%3A|%3a)$");

    @JsonCreator
    public ResolvedFile(@JsonProperty("path") String path, @JsonProperty("fileURL") String fileURL) {
        this.path = requireNonNull(path, "path");
        this.fileURL = requireNonNull(fileURL, "fileURL");
    }

    /** Builds a reference from a filesystem path, normalizing {@code .} and {@code ..} segments. */
    public static ResolvedFile fromPath(String path) {
        var normalized = normalizePath(path);
        return new ResolvedFile(normalized, pathToFileURL(normalized));
    }

    /** Builds a reference from a {@code file://} URL as sent by an editor. */
    public static ResolvedFile fromFileURL(String fileURL) {
        var path = fileURLToPath(fileURL);
        return new ResolvedFile(path, pathToFileURL(path));
    }

    /**
     * Resolves an {@code #include} filename relative to the directory of {@code currentFile}.
     */
    public static ResolvedFile resolveInclude(ResolvedFile currentFile, String includeFilename) {
        var filename = includeFilename.replace('\\', '/').trim();
        if (isAbsolute(filename)) {
            return fromPath(filename);
        }
        return fromPath(parentDirectory(currentFile.path()) + "/" + filename);
    }

    /** Final path segment, e.g. {@code lib.lua}. */
    public String fileName() {
        var idx = path.lastIndexOf('/');
        return idx < 0 ? path : path.substring(idx + 1);
    }

    /** True for PICO-8 cartridge files ({@code .p8}); false for plain Lua sources. */
    public boolean isCartridge() {
        return path.toLowerCase(Locale.ROOT).endsWith(".p8");
    }

    static String normalizePath(String path) {
        var unified = path.replace('\\', '/');
        var absolute = isAbsolute(unified);
        String prefix = "";
        var rest = unified;
        var drive = DRIVE_PATH.matcher(unified);
        if (drive.matches()) {
            prefix = Character.toLowerCase(drive.group(1).charAt(0)) + ":";
            rest = drive.group(2) == null ? "" : drive.group(2);
        }

        Deque<String> segments = new ArrayDeque<>();
        for (var segment : Splitter.on('/').omitEmptyStrings().split(rest)) {
            if (segment.equals(".")) {
                continue;
            }
            if (segment.equals("..")) {
                if (!segments.isEmpty() && !segments.peekLast().equals("..")) {
                    segments.removeLast();
                } else if (!absolute) {
                    segments.addLast(segment);
                }
                continue;
            }
            segments.addLast(segment);
        }

        var joined = Joiner.on('/').join(segments);
        if (!prefix.isEmpty()) {
            return prefix + "/" + joined;
        }
        if (absolute) {
            return "/" + joined;
        }
        return joined.isEmpty() ? "." : joined;
    }

    static String pathToFileURL(String normalizedPath) {
        List<String> encoded = new ArrayList<>();
        var segments = Splitter.on('/').splitToList(normalizedPath);
        for (int i = 0; i < segments.size(); i++) {
            var segment = segments.get(i);
            if (i == 0 && segment.length() == 2 && segment.charAt(1) == ':' && Character.isLetter(segment.charAt(0))) {
                encoded.add(Character.toLowerCase(segment.charAt(0)) + "%3A");
                continue;
            }
            encoded.add(encodeSegment(segment));
        }
        var joined = Joiner.on('/').join(encoded);
        return joined.startsWith("/") ? "file://" + joined : "file:///" + joined;
    }

    static String fileURLToPath(String fileURL) {
        var raw = fileURL.startsWith("file://") ? fileURL.substring("file://".length()) : fileURL;
        // authority is ignored; only local files are supported
        if (!raw.startsWith("/")) {
            var slash = raw.indexOf('/');
            raw = slash < 0 ? "/" : raw.substring(slash);
        }
        List<String> decoded = new ArrayList<>();
        var segments = Splitter.on('/').splitToList(raw.substring(1));
        for (int i = 0; i < segments.size(); i++) {
            var segment = segments.get(i);
            var drive = DRIVE_URL_SEGMENT.matcher(segment);
            if (i == 0 && drive.matches()) {
                decoded.add(Character.toLowerCase(drive.group(1).charAt(0)) + ":");
                continue;
            }
            decoded.add(URLDecoder.decode(segment.replace("+", "%2B"), StandardCharsets.UTF_8));
        }
        var path = Joiner.on('/').join(decoded);
        if (DRIVE_PATH.matcher(path).matches()) {
            return normalizePath(path);
        }
        return normalizePath("/" + path);
    }

    private static String encodeSegment(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20").replace("%7E", "~");
    }

    private static boolean isAbsolute(String path) {
        return path.startsWith("/") || DRIVE_PATH.matcher(path).matches();
    }

    private static String parentDirectory(String path) {
        var idx = path.lastIndexOf('/');
        if (idx < 0) {
            return ".";
        }
        if (idx == 0) {
            return "";
        }
        return path.substring(0, idx);
    }

    /** Convenience for callers that need a {@link URI}. */
    public URI toURI() {
        return URI.create(fileURL);
    }
}
