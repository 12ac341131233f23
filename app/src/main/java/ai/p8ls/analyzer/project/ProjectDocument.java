package ai.p8ls.analyzer.project;

import static java.util.Objects.requireNonNull;

import ai.p8ls.analyzer.ResolvedFile;
import ai.p8ls.analyzer.diagnostics.ParseError;
import ai.p8ls.analyzer.parser.Chunk;
import java.util.List;

/** A parsed source file as the project layer sees it. */
public record ProjectDocument(ResolvedFile file, String text, Chunk chunk) {

    public ProjectDocument {
        requireNonNull(file, "file");
        requireNonNull(text, "text");
        requireNonNull(chunk, "chunk");
    }

    public String fileURL() {
        return file.fileURL();
    }

    public List<ParseError> errors() {
        return chunk.errors();
    }
}
