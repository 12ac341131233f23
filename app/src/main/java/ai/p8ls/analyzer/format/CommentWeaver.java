package ai.p8ls.analyzer.format;

import ai.p8ls.analyzer.Bounds;
import ai.p8ls.analyzer.ast.AssignmentStatement;
import ai.p8ls.analyzer.ast.BinaryExpression;
import ai.p8ls.analyzer.ast.CallExpression;
import ai.p8ls.analyzer.ast.CallStatement;
import ai.p8ls.analyzer.ast.Comment;
import ai.p8ls.analyzer.ast.DoStatement;
import ai.p8ls.analyzer.ast.ForGenericStatement;
import ai.p8ls.analyzer.ast.ForNumericStatement;
import ai.p8ls.analyzer.ast.FunctionDeclaration;
import ai.p8ls.analyzer.ast.Identifier;
import ai.p8ls.analyzer.ast.IfClause;
import ai.p8ls.analyzer.ast.IfStatement;
import ai.p8ls.analyzer.ast.LocalStatement;
import ai.p8ls.analyzer.ast.LogicalExpression;
import ai.p8ls.analyzer.ast.Node;
import ai.p8ls.analyzer.ast.RepeatStatement;
import ai.p8ls.analyzer.ast.ReturnStatement;
import ai.p8ls.analyzer.ast.TableCallExpression;
import ai.p8ls.analyzer.ast.TableConstructorExpression;
import ai.p8ls.analyzer.ast.TableField;
import ai.p8ls.analyzer.ast.WhileStatement;
import ai.p8ls.analyzer.parser.Chunk;
import java.util.List;

/**
 * Places each comment of a chunk into a {@link FormatLayout}.
 *
 * <p>A comment is compared with the nodes of the list it falls in. If it lies inside a node it descends into that
 * node's parts; if it comes before a node it is spliced in front of it (statement lists, table fields, call
 * arguments) or attached to it (everything else). A comment after every node of a statement list is appended.
 */
final class CommentWeaver {
    private final FormatLayout layout;

    private CommentWeaver(FormatLayout layout) {
        this.layout = layout;
    }

    static FormatLayout weave(Chunk chunk) {
        var layout = new FormatLayout();
        var weaver = new CommentWeaver(layout);
        for (var comment : chunk.comments()) {
            weaver.splice(comment, layout.entries(chunk.block()));
        }
        return layout;
    }

    private void splice(Comment comment, List<FormatLayout.Entry> entries) {
        for (int i = 0; i < entries.size(); i++) {
            var entry = entries.get(i);
            var placement = Bounds.compare(comment.bounds(), FormatLayout.boundsOf(entry));
            if (placement == Bounds.Placement.CONTAINS && entry instanceof FormatLayout.NodeEntry node) {
                insertInto(comment, node.node());
                return;
            }
            if (placement == Bounds.Placement.BEFORE) {
                entries.add(i, new FormatLayout.CommentEntry(comment));
                return;
            }
        }
        entries.add(new FormatLayout.CommentEntry(comment));
    }

    /** Attaches the comment to the first node it precedes or descends into the node containing it. */
    private boolean attach(Comment comment, List<? extends Node> nodes) {
        for (var node : nodes) {
            if (attachTo(comment, node)) {
                return true;
            }
        }
        return false;
    }

    private boolean attachTo(Comment comment, Node node) {
        var placement = Bounds.compare(comment.bounds(), node.bounds());
        if (placement == Bounds.Placement.CONTAINS) {
            insertInto(comment, node);
            return true;
        }
        if (placement == Bounds.Placement.BEFORE) {
            layout.attach(node, comment);
            return true;
        }
        return false;
    }

    private void insertInto(Comment comment, Node node) {
        if (node instanceof IfStatement statement) {
            if (!attach(comment, statement.clauses())) {
                // between the last clause and 'end'
                var last = statement.clauses().get(statement.clauses().size() - 1);
                layout.entries(last.body()).add(new FormatLayout.CommentEntry(comment));
            }
        } else if (node instanceof IfClause clause) {
            if (clause.condition() == null || !attachTo(comment, clause.condition())) {
                splice(comment, layout.entries(clause.body()));
            }
        } else if (node instanceof WhileStatement statement) {
            if (!attachTo(comment, statement.condition())) {
                splice(comment, layout.entries(statement.body()));
            }
        } else if (node instanceof RepeatStatement statement) {
            if (Bounds.compare(comment.bounds(), statement.condition().bounds()) == Bounds.Placement.CONTAINS) {
                insertInto(comment, statement.condition());
            } else {
                splice(comment, layout.entries(statement.body()));
            }
        } else if (node instanceof DoStatement statement) {
            splice(comment, layout.entries(statement.body()));
        } else if (node instanceof ForNumericStatement statement) {
            splice(comment, layout.entries(statement.body()));
        } else if (node instanceof ForGenericStatement statement) {
            splice(comment, layout.entries(statement.body()));
        } else if (node instanceof FunctionDeclaration function) {
            splice(comment, layout.entries(function.body()));
        } else if (node instanceof TableField field) {
            insertInto(comment, field.value());
        } else if (node instanceof ReturnStatement statement) {
            if (!attach(comment, statement.arguments())) {
                layout.attach(node, comment);
            }
        } else if (node instanceof AssignmentStatement statement) {
            if (!attach(comment, statement.values()) && !attach(comment, statement.targets())) {
                layout.attach(node, comment);
            }
        } else if (node instanceof LocalStatement statement) {
            if (!attach(comment, statement.values()) && !attach(comment, statement.variables())) {
                layout.attach(node, comment);
            }
        } else if (node instanceof TableConstructorExpression table) {
            splice(comment, layout.entries(table));
        } else if (node instanceof CallStatement statement) {
            insertInto(comment, statement.expression());
        } else if (node instanceof CallExpression call) {
            if (call.base() instanceof Identifier id && id.name().equals("?")) {
                // the print shorthand has to stay on one line
                layout.attach(node, comment);
            } else {
                splice(comment, layout.entries(call));
            }
        } else if (node instanceof TableCallExpression call) {
            insertInto(comment, call.argument());
        } else if (node instanceof BinaryExpression binary) {
            if (!attachTo(comment, binary.left()) && !attachTo(comment, binary.right())) {
                layout.attach(node, comment);
            }
        } else if (node instanceof LogicalExpression logical) {
            if (!attachTo(comment, logical.left()) && !attachTo(comment, logical.right())) {
                layout.attach(node, comment);
            }
        } else {
            layout.attach(node, comment);
        }
    }
}
