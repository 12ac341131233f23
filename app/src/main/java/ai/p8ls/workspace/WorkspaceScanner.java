package ai.p8ls.workspace;

import static java.util.Objects.requireNonNull;

import ai.p8ls.analyzer.FileResolver;
import ai.p8ls.analyzer.ResolvedFile;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Finds the PICO-8 sources of a workspace and reads them in parallel. A file that cannot be read is logged and left
 * out; it never fails the scan.
 */
public final class WorkspaceScanner {
    private static final Logger logger = LogManager.getLogger(WorkspaceScanner.class);

    private final FileResolver fileResolver;
    private final Executor executor;

    public WorkspaceScanner(FileResolver fileResolver, Executor executor) {
        this.fileResolver = requireNonNull(fileResolver, "fileResolver");
        this.executor = requireNonNull(executor, "executor");
    }

    public static boolean isSourceFile(Path path) {
        var name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".p8") || name.endsWith(".lua");
    }

    /**
     * Reads every {@code .p8} and {@code .lua} file under {@code root}, skipping hidden directories.
     *
     * @return file contents keyed by file, in path order
     * @throws IOException if {@code root} cannot be listed
     */
    public Map<ResolvedFile, String> scan(Path root) throws IOException {
        List<ResolvedFile> files;
        try (Stream<Path> paths = Files.walk(root)) {
            files = paths.filter(p -> !isHidden(root, p))
                    .filter(Files::isRegularFile)
                    .filter(WorkspaceScanner::isSourceFile)
                    .sorted()
                    .map(p -> ResolvedFile.fromPath(p.toAbsolutePath().toString()))
                    .collect(Collectors.toList());
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
        logger.debug("Found {} source files under {}", files.size(), root);

        var reads = files.stream()
                .map(file -> CompletableFuture.supplyAsync(() -> read(file), executor))
                .toList();

        var contents = new LinkedHashMap<ResolvedFile, String>();
        for (int i = 0; i < files.size(); i++) {
            var file = files.get(i);
            try {
                reads.get(i).join().ifPresent(text -> contents.put(file, text));
            } catch (CompletionException e) {
                logger.error("Failed to read {}", file.path(), e.getCause());
            }
        }
        return contents;
    }

    private Optional<String> read(ResolvedFile file) {
        try {
            return Optional.of(fileResolver.readContents(file.path()));
        } catch (IOException e) {
            logger.error("Skipping unreadable file {}: {}", file.path(), e.getMessage());
            return Optional.empty();
        }
    }

    private static boolean isHidden(Path root, Path path) {
        var relative = root.relativize(path);
        for (var segment : relative) {
            if (segment.toString().startsWith(".")) {
                return true;
            }
        }
        return false;
    }
}
