package ai.p8ls.analyzer.scope;

public enum ScopeKind {
    /** Shared by every file of a project; holds globals and builtins. */
    GLOBAL,
    /** Top level of one file; holds its file-level locals. */
    FILE,
    FUNCTION,
    /** A table constructor; holds its named keys. */
    TABLE,
    /** Blocks: do, loops and if clauses. */
    OTHER
}
