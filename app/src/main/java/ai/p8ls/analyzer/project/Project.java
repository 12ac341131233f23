package ai.p8ls.analyzer.project;

import static java.util.Objects.requireNonNull;

import ai.p8ls.analyzer.ResolvedFile;
import com.google.common.base.Joiner;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

/** A root document and everything reachable from it through includes. */
public record Project(ProjectDocumentNode root) {

    public Project {
        requireNonNull(root, "root");
    }

    /** Visits every node once, root first, then included documents depth first in include order. */
    public void forEachNode(Consumer<ProjectDocumentNode> action) {
        Set<ProjectDocumentNode> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        visit(root, action, seen);
    }

    private static void visit(
            ProjectDocumentNode node, Consumer<ProjectDocumentNode> action, Set<ProjectDocumentNode> seen) {
        if (!seen.add(node)) {
            return;
        }
        action.accept(node);
        for (var child : node.included()) {
            visit(child, action, seen);
        }
    }

    public List<ProjectDocument> documents() {
        var documents = new ArrayList<ProjectDocument>();
        forEachNode(node -> documents.add(node.document()));
        return documents;
    }

    /** Files of the project in pre-order, each once. */
    public List<ResolvedFile> files() {
        return documents().stream().map(ProjectDocument::file).toList();
    }

    public boolean contains(ResolvedFile file) {
        return files().contains(file);
    }

    @Override
    public String toString() {
        return Joiner.on(", ").join(files().stream().map(ResolvedFile::fileName).iterator());
    }
}
