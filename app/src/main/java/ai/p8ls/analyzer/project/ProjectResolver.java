package ai.p8ls.analyzer.project;

import static java.util.Objects.requireNonNull;

import ai.p8ls.analyzer.parser.Chunk;
import ai.p8ls.analyzer.scope.DefinitionsUsagesFinder;
import ai.p8ls.analyzer.scope.DefinitionsUsagesResult;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Groups parsed documents into projects along their {@code #include} edges and resolves each project's scopes.
 */
public final class ProjectResolver {
    private static final Logger logger = LogManager.getLogger(ProjectResolver.class);

    private ProjectResolver() {}

    /**
     * Builds the include forest over {@code documents}, keyed by file URL. Every document becomes exactly one node;
     * a document that another document includes is not a root. Include targets missing from the map are ignored,
     * and an include that closes a cycle is dropped so that the first document reached stays a root.
     *
     * @return one project per root, in map order
     */
    public static List<Project> findProjects(Map<String, ProjectDocument> documents) {
        requireNonNull(documents, "documents");
        var visited = new LinkedHashMap<String, ProjectDocumentNode>();
        for (var fileURL : documents.keySet()) {
            visit(fileURL, documents, visited, new HashSet<>());
        }
        var projects = visited.values().stream()
                .filter(node -> !node.isChild())
                .map(Project::new)
                .toList();
        logger.debug("Grouped {} documents into {} projects", documents.size(), projects.size());
        return projects;
    }

    private static @Nullable ProjectDocumentNode visit(
            String fileURL,
            Map<String, ProjectDocument> documents,
            Map<String, ProjectDocumentNode> visited,
            Set<String> path) {
        var existing = visited.get(fileURL);
        if (existing != null) {
            return existing;
        }
        var document = documents.get(fileURL);
        if (document == null) {
            return null;
        }

        var node = new ProjectDocumentNode(document);
        visited.put(fileURL, node);
        path.add(fileURL);
        for (var include : document.chunk().includes()) {
            var target = include.file().fileURL();
            if (path.contains(target)) {
                logger.debug("Ignoring circular include of {} from {}", target, fileURL);
                continue;
            }
            var child = visit(target, documents, visited, path);
            if (child != null && !node.included().contains(child)) {
                node.addIncluded(child);
            }
        }
        path.remove(fileURL);
        return node;
    }

    /**
     * Resolves definitions and usages for every file of {@code project} against one global scope owned by the
     * root, so globals defined in any file are visible in all of them.
     *
     * @return results keyed by file URL, root first
     */
    public static Map<String, DefinitionsUsagesResult> resolve(Project project) {
        var documents = project.documents();
        List<Chunk> chunks = documents.stream().map(ProjectDocument::chunk).toList();
        var results = DefinitionsUsagesFinder.findDefinitionsUsages(chunks);
        var byFile = new LinkedHashMap<String, DefinitionsUsagesResult>();
        for (int i = 0; i < documents.size(); i++) {
            byFile.put(documents.get(i).fileURL(), results.get(i));
        }
        return byFile;
    }
}
