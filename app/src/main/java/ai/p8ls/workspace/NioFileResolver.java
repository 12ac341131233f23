package ai.p8ls.workspace;

import ai.p8ls.analyzer.FileResolver;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/** {@link FileResolver} backed by the local filesystem. */
public final class NioFileResolver implements FileResolver {

    @Override
    public boolean exists(String path) {
        return Files.exists(Path.of(path));
    }

    @Override
    public boolean isRegularFile(String path) {
        return Files.isRegularFile(Path.of(path));
    }

    @Override
    public String readContents(String path) throws IOException {
        return Files.readString(Path.of(path));
    }
}
