package ai.p8ls.analyzer.symbols;

public enum CodeSymbolKind {
    FUNCTION,
    LOCAL_VARIABLE,
    GLOBAL_VARIABLE
}
