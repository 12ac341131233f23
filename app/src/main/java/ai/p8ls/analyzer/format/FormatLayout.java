package ai.p8ls.analyzer.format;

import ai.p8ls.analyzer.Bounds;
import ai.p8ls.analyzer.ast.Block;
import ai.p8ls.analyzer.ast.CallExpression;
import ai.p8ls.analyzer.ast.Comment;
import ai.p8ls.analyzer.ast.Node;
import ai.p8ls.analyzer.ast.TableConstructorExpression;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * The formatter's working copy of a tree's surroundings. Syntax nodes are immutable, so comments and blank lines are
 * kept here, keyed by node identity: statement lists, table fields and call arguments become mixed entry lists, and
 * comments that cannot be spliced into a list are attached in front of a node.
 */
final class FormatLayout {
    private final Map<Object, List<Entry>> sequences = new IdentityHashMap<>();
    private final Map<Node, List<Comment>> leading = new IdentityHashMap<>();

    sealed interface Entry permits NodeEntry, CommentEntry, BlankLine {
        int startLine();

        int endLine();
    }

    record NodeEntry(Node node) implements Entry {
        @Override
        public int startLine() {
            return node.bounds().start().line();
        }

        @Override
        public int endLine() {
            return node.bounds().end().line();
        }
    }

    record CommentEntry(Comment comment) implements Entry {
        @Override
        public int startLine() {
            return comment.bounds().start().line();
        }

        @Override
        public int endLine() {
            return comment.bounds().end().line();
        }
    }

    /** Marks one or more blank source lines; always rendered as a single empty line. */
    record BlankLine(int line) implements Entry {
        @Override
        public int startLine() {
            return line;
        }

        @Override
        public int endLine() {
            return line;
        }
    }

    static Bounds boundsOf(Entry entry) {
        if (entry instanceof NodeEntry node) {
            return node.node().bounds();
        }
        if (entry instanceof CommentEntry comment) {
            return comment.comment().bounds();
        }
        throw new IllegalStateException("blank lines have no bounds");
    }

    List<Entry> entries(Block block) {
        return sequences.computeIfAbsent(block, k -> nodeEntries(block.statements()));
    }

    List<Entry> entries(TableConstructorExpression table) {
        return sequences.computeIfAbsent(table, k -> nodeEntries(table.fields()));
    }

    List<Entry> entries(CallExpression call) {
        return sequences.computeIfAbsent(call, k -> nodeEntries(call.arguments()));
    }

    private static List<Entry> nodeEntries(List<? extends Node> nodes) {
        var list = new ArrayList<Entry>(nodes.size());
        for (var node : nodes) {
            list.add(new NodeEntry(node));
        }
        return list;
    }

    void attach(Node node, Comment comment) {
        leading.computeIfAbsent(node, k -> new ArrayList<>()).add(comment);
    }

    List<Comment> leadingComments(Node node) {
        return leading.getOrDefault(node, List.of());
    }

    boolean hasComments(Block block) {
        return entries(block).stream().anyMatch(e -> e instanceof CommentEntry);
    }

    /**
     * Copy of a statement list with a {@link BlankLine} wherever the source left at least one empty line between two
     * entries.
     */
    static List<Entry> withBlankLines(List<Entry> entries) {
        var result = new ArrayList<Entry>(entries.size());
        Entry previous = null;
        for (var entry : entries) {
            if (previous != null && entry.startLine() - previous.endLine() > 1) {
                result.add(new BlankLine(entry.startLine() - 1));
            }
            result.add(entry);
            previous = entry;
        }
        return result;
    }
}
