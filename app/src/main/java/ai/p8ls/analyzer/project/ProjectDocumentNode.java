package ai.p8ls.analyzer.project;

import static java.util.Objects.requireNonNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** One document of a project tree and the documents it directly includes. */
public final class ProjectDocumentNode {
    private final ProjectDocument document;
    private final List<ProjectDocumentNode> included = new ArrayList<>();
    private boolean child;

    ProjectDocumentNode(ProjectDocument document) {
        this.document = requireNonNull(document, "document");
    }

    public ProjectDocument document() {
        return document;
    }

    public List<ProjectDocumentNode> included() {
        return Collections.unmodifiableList(included);
    }

    /** True when some other document includes this one, so it is not a project root. */
    public boolean isChild() {
        return child;
    }

    void addIncluded(ProjectDocumentNode node) {
        node.child = true;
        included.add(node);
    }

    @Override
    public String toString() {
        return "ProjectDocumentNode[" + document.file().fileName() + ", included=" + included.size() + "]";
    }
}
