package ai.p8ls.analyzer;

import java.io.IOException;

/**
 * File access collaborator injected into the parser and the project layer. The analysis core never touches the
 * filesystem directly, which keeps it testable with in-memory implementations.
 */
public interface FileResolver {

    boolean exists(String path);

    boolean isRegularFile(String path);

    /**
     * Reads the full text of the given file.
     *
     * @throws IOException if the file is absent or cannot be read
     */
    String readContents(String path) throws IOException;
}
