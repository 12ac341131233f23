package ai.p8ls.workspace;

import static java.util.Objects.requireNonNull;

import ai.p8ls.analyzer.FileResolver;
import ai.p8ls.analyzer.ResolvedFile;
import ai.p8ls.analyzer.diagnostics.CodeProblem;
import ai.p8ls.analyzer.diagnostics.ErrorMessages;
import ai.p8ls.analyzer.diagnostics.Warning;
import ai.p8ls.analyzer.format.FormatResult;
import ai.p8ls.analyzer.format.Formatter;
import ai.p8ls.analyzer.parser.Parser;
import ai.p8ls.analyzer.project.Project;
import ai.p8ls.analyzer.project.ProjectDocument;
import ai.p8ls.analyzer.project.ProjectResolver;
import ai.p8ls.analyzer.scope.DefinitionsUsages;
import ai.p8ls.analyzer.scope.DefinitionsUsagesLookup;
import ai.p8ls.analyzer.scope.DefinitionsUsagesResult;
import ai.p8ls.analyzer.scope.ScopeTree;
import ai.p8ls.analyzer.symbols.CodeSymbol;
import ai.p8ls.settings.AnalyzerSettings;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Everything known about one workspace: parsed documents, the project forest and each file's scope resolution.
 *
 * <p>When a document's include list changes, the whole forest is rebuilt and every project re-resolved. Otherwise
 * only the project containing the document is resolved again. Included files that are not open are read through
 * the {@link FileResolver}. Methods are synchronized; callers that rebuild from several threads should still go
 * through a {@link RebuildScheduler} so that stale rebuilds are dropped.
 */
public final class WorkspaceState {
    private static final Logger logger = LogManager.getLogger(WorkspaceState.class);

    private final FileResolver fileResolver;
    private final AnalyzerSettings settings;
    private final Map<String, ProjectDocument> documents = new LinkedHashMap<>();
    private final Map<String, DefinitionsUsagesResult> resolutions = new HashMap<>();
    /** Include targets that exist but could not be read, by file URL, with the reason. */
    private final Map<String, String> unreadableIncludes = new HashMap<>();
    private List<Project> projects = List.of();

    public WorkspaceState(FileResolver fileResolver, AnalyzerSettings settings) {
        this.fileResolver = requireNonNull(fileResolver, "fileResolver");
        this.settings = requireNonNull(settings, "settings");
    }

    /** State for the files of a workspace scan, fully resolved. */
    public static WorkspaceState fromScan(
            Map<ResolvedFile, String> contents, FileResolver fileResolver, AnalyzerSettings settings) {
        var state = new WorkspaceState(fileResolver, settings);
        synchronized (state) {
            contents.forEach((file, text) -> state.documents.put(file.fileURL(), state.parse(file, text)));
            state.loadMissingIncludes();
            state.rebuildProjects();
        }
        return state;
    }

    public AnalyzerSettings settings() {
        return settings;
    }

    /** Replaces the text of {@code file}, which need not have been known before, and re-resolves what it affects. */
    public synchronized void update(ResolvedFile file, String text) {
        var document = parse(file, text);
        var previous = documents.put(file.fileURL(), document);
        boolean includesChanged = previous == null
                || !previous.chunk().includedFiles().equals(document.chunk().includedFiles());
        if (includesChanged) {
            logger.debug("Includes of {} changed, rebuilding all projects", file.fileName());
            loadMissingIncludes();
            rebuildProjects();
            return;
        }

        // same include graph: fresh project objects for the new chunk, but only one project to resolve
        projects = ProjectResolver.findProjects(documents);
        for (var project : projects) {
            if (project.contains(file)) {
                resolutions.putAll(ProjectResolver.resolve(project));
            }
        }
    }

    /** Forgets {@code file}. Projects are rebuilt so that files it included may become roots again. */
    public synchronized void close(ResolvedFile file) {
        if (documents.remove(file.fileURL()) != null) {
            resolutions.remove(file.fileURL());
            rebuildProjects();
        }
    }

    private ProjectDocument parse(ResolvedFile file, String text) {
        var chunk = Parser.parse(text, file, fileResolver, settings.suppressBuiltinGlobals());
        return new ProjectDocument(file, text, chunk);
    }

    /** Reads included files that are not loaded yet, following their own includes. */
    private void loadMissingIncludes() {
        unreadableIncludes.clear();
        var queue = new ArrayDeque<ResolvedFile>();
        documents.values().forEach(d -> queue.addAll(d.chunk().includedFiles()));
        while (!queue.isEmpty()) {
            var file = queue.poll();
            if (documents.containsKey(file.fileURL()) || !fileResolver.isRegularFile(file.path())) {
                continue;
            }
            try {
                var document = parse(file, fileResolver.readContents(file.path()));
                documents.put(file.fileURL(), document);
                queue.addAll(document.chunk().includedFiles());
                logger.debug("Loaded included file {}", file.path());
            } catch (IOException e) {
                logger.warn("Could not read included file {}: {}", file.path(), e.getMessage());
                unreadableIncludes.put(file.fileURL(), Objects.toString(e.getMessage(), e.getClass().getSimpleName()));
            }
        }
    }

    private void rebuildProjects() {
        projects = ProjectResolver.findProjects(documents);
        resolutions.clear();
        for (var project : projects) {
            resolutions.putAll(ProjectResolver.resolve(project));
        }
        logger.debug("Rebuilt {} projects over {} documents", projects.size(), documents.size());
    }

    // -- queries

    public synchronized List<Project> projects() {
        return projects;
    }

    public synchronized List<ProjectDocument> documents() {
        return List.copyOf(documents.values());
    }

    public synchronized Optional<ProjectDocument> document(ResolvedFile file) {
        return Optional.ofNullable(documents.get(file.fileURL()));
    }

    public synchronized List<CodeSymbol> symbols(ResolvedFile file) {
        return document(file).map(d -> d.chunk().symbols()).orElse(List.of());
    }

    public synchronized Optional<DefinitionsUsagesLookup> lookup(ResolvedFile file) {
        return Optional.ofNullable(resolutions.get(file.fileURL())).map(DefinitionsUsagesResult::lookup);
    }

    public synchronized Optional<ScopeTree> scopeTree(ResolvedFile file) {
        return Optional.ofNullable(resolutions.get(file.fileURL())).map(DefinitionsUsagesResult::scopeTree);
    }

    /** Definitions and usages of the identifier at a position (1-based line, 0-based column). */
    public synchronized Optional<DefinitionsUsages> definitionsUsagesAt(ResolvedFile file, int line, int column) {
        return lookup(file).map(lookup -> lookup.lookup(line, column));
    }

    /** Names visible at a position, innermost scope first. */
    public synchronized List<String> visibleNames(ResolvedFile file, int line, int column) {
        return scopeTree(file)
                .map(tree -> tree.allSymbols(tree.lookupScopeFor(line, column)))
                .orElse(List.of());
    }

    /**
     * Problems of {@code file} itself: parse errors, include warnings and resolution warnings, capped at
     * {@link AnalyzerSettings#maxNumberOfProblems()}.
     */
    public synchronized List<CodeProblem> diagnostics(ResolvedFile file) {
        var document = documents.get(file.fileURL());
        if (document == null) {
            return List.of();
        }
        var problems = new ArrayList<CodeProblem>(document.errors());
        problems.addAll(document.chunk().warnings());
        for (var include : document.chunk().includes()) {
            var reason = unreadableIncludes.get(include.file().fileURL());
            if (reason != null && !documents.containsKey(include.file().fileURL())) {
                var statement = include.statement();
                problems.add(new Warning(
                        ErrorMessages.INCLUDE_UNREADABLE.formatted(statement.filename(), reason), statement.bounds()));
            }
        }
        var resolution = resolutions.get(file.fileURL());
        if (resolution != null) {
            problems.addAll(resolution.warnings());
        }
        if (problems.size() > settings.maxNumberOfProblems()) {
            return List.copyOf(problems.subList(0, settings.maxNumberOfProblems()));
        }
        return List.copyOf(problems);
    }

    /** Diagnostics of every document, in load order. */
    public synchronized Map<ResolvedFile, List<CodeProblem>> diagnostics() {
        var all = new LinkedHashMap<ResolvedFile, List<CodeProblem>>();
        for (var document : documents.values()) {
            all.put(document.file(), diagnostics(document.file()));
        }
        return all;
    }

    public synchronized Optional<FormatResult> format(ResolvedFile file) {
        var formatter = new Formatter(settings.format().toFormatterOptions());
        return document(file).flatMap(d -> formatter.format(d.chunk(), d.text(), !file.isCartridge()));
    }
}
