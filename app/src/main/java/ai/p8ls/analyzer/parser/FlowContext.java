package ai.p8ls.analyzer.parser;

import ai.p8ls.analyzer.diagnostics.ErrorMessages;
import ai.p8ls.analyzer.diagnostics.ParseError;
import ai.p8ls.analyzer.lexer.Token;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Control-flow bookkeeping for one function body: loop nesting for {@code break}, labels and pending gotos, and
 * whether {@code ...} is legal. Violations go to the error sink; parsing carries on.
 */
final class FlowContext {
    private final Consumer<ParseError> errors;
    private final List<FlowScope> scopes = new ArrayList<>();
    private List<PendingGoto> pendingGotos = new ArrayList<>();
    private boolean allowVararg;

    private record Label(int localCount, int line) {}

    private static final class PendingGoto {
        final Token token;
        final String target;
        final int[] localCounts;
        int maxDepth;

        PendingGoto(Token token, String target, int[] localCounts, int maxDepth) {
            this.token = token;
            this.target = target;
            this.localCounts = localCounts;
            this.maxDepth = maxDepth;
        }
    }

    private static final class FlowScope {
        final Map<String, Label> labels = new HashMap<>();
        final List<String> locals = new ArrayList<>();
        final List<PendingGoto> deferredGotos = new ArrayList<>();
        final boolean loop;

        FlowScope(boolean loop) {
            this.loop = loop;
        }
    }

    FlowContext(Consumer<ParseError> errors) {
        this.errors = errors;
    }

    boolean allowVararg() {
        return allowVararg;
    }

    void setAllowVararg(boolean allowVararg) {
        this.allowVararg = allowVararg;
    }

    boolean isInLoop() {
        for (int i = scopes.size() - 1; i >= 0; i--) {
            if (scopes.get(i).loop) {
                return true;
            }
        }
        return false;
    }

    int depth() {
        return scopes.size();
    }

    /** Drops scopes left open by a statement that failed to parse. */
    void unwindTo(int depth) {
        while (scopes.size() > depth) {
            scopes.remove(scopes.size() - 1);
        }
    }

    void pushScope(boolean loop) {
        scopes.add(new FlowScope(loop));
    }

    void popScope() {
        var remaining = new ArrayList<PendingGoto>();
        for (var pending : pendingGotos) {
            if (pending.maxDepth >= scopes.size() && --pending.maxDepth <= 0) {
                report(pending.token, ErrorMessages.LABEL_NOT_VISIBLE.formatted(pending.target));
                continue;
            }
            remaining.add(pending);
        }
        pendingGotos = remaining;
        scopes.remove(scopes.size() - 1);
    }

    void addGoto(String target, Token token) {
        var localCounts = new int[scopes.size()];
        for (int i = 0; i < scopes.size(); i++) {
            var scope = scopes.get(i);
            localCounts[i] = scope.locals.size();
            if (scope.labels.containsKey(target)) {
                return;
            }
        }
        pendingGotos.add(new PendingGoto(token, target, localCounts, scopes.size()));
    }

    void addLabel(String name, Token token) {
        var scope = currentScope();
        var existing = scope.labels.get(name);
        if (existing != null) {
            report(token, ErrorMessages.LABEL_ALREADY_DEFINED.formatted(name, existing.line()));
        } else {
            var remaining = new ArrayList<PendingGoto>();
            for (var pending : pendingGotos) {
                if (pending.maxDepth >= scopes.size() && pending.target.equals(name)) {
                    if (pending.localCounts[scopes.size() - 1] < scope.locals.size()) {
                        scope.deferredGotos.add(pending);
                    }
                    continue;
                }
                remaining.add(pending);
            }
            pendingGotos = remaining;
        }
        scope.labels.put(name, new Label(scope.locals.size(), token.bounds().start().line()));
    }

    void addLocal(String name) {
        currentScope().locals.add(name);
    }

    /** Reports gotos that jump forward past a local declaration into its scope. */
    void raiseDeferredErrors() {
        var scope = currentScope();
        for (var pending : scope.deferredGotos) {
            var local = scope.locals.get(pending.localCounts[scopes.size() - 1]);
            report(pending.token, ErrorMessages.GOTO_JUMPS_INTO_LOCAL.formatted(pending.target, local));
        }
        scope.deferredGotos.clear();
    }

    void report(Token token, String message) {
        errors.accept(new ParseError(message, token.bounds()));
    }

    private FlowScope currentScope() {
        if (scopes.isEmpty()) {
            throw new IllegalStateException("no open flow scope");
        }
        return scopes.get(scopes.size() - 1);
    }
}
