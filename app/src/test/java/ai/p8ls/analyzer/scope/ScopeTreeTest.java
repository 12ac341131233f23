package ai.p8ls.analyzer.scope;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.p8ls.analyzer.parser.Parser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ScopeTreeTest {
    private static final String CODE = """
            local a = 1
            function f(p)
              local b = 2
              if p then
                local c = 3
              end
            end
            ::done::
            """;

    private ScopeTree tree;

    @BeforeEach
    void setUp() {
        tree = DefinitionsUsagesFinder.findDefinitionsUsages(Parser.parse(CODE)).scopeTree();
    }

    @Test
    void testShape() {
        assertEquals(4, tree.size());
        var root = tree.root();
        assertEquals(ScopeKind.GLOBAL, root.kind());
        assertNull(tree.parent(root));

        var file = tree.children(root).get(0);
        assertEquals(ScopeKind.FILE, file.kind());
        var function = tree.children(file).get(0);
        assertEquals(ScopeKind.FUNCTION, function.kind());
        assertEquals("f", function.name());
        assertEquals(ScopeKind.OTHER, tree.children(function).get(0).kind());
        assertEquals(function, tree.parent(tree.children(function).get(0)));
    }

    @Test
    void testLookupFindsInnermostScope() {
        assertEquals(ScopeKind.OTHER, tree.lookupScopeFor(5, 4).kind());
        assertEquals(ScopeKind.FUNCTION, tree.lookupScopeFor(3, 2).kind());
        assertEquals(ScopeKind.FILE, tree.lookupScopeFor(1, 0).kind());
        assertEquals(ScopeKind.FILE, tree.lookupScopeFor(100, 0).kind());
    }

    @Test
    void testAllSymbolsInnermostFirst() {
        var names = tree.allSymbols(tree.lookupScopeFor(5, 4));
        assertEquals("c", names.get(0));
        assertEquals("p", names.get(1));
        assertEquals("b", names.get(2));
        assertEquals("a", names.get(3));
        assertTrue(names.contains("f"));
        assertTrue(names.contains("print"));
    }

    @Test
    void testAllSymbolsHidesInnerScopesAndLabels() {
        var names = tree.allSymbols(tree.lookupScopeFor(1, 0));
        assertEquals("a", names.get(0));
        assertFalse(names.contains("b"));
        assertFalse(names.contains("c"));
        assertFalse(names.stream().anyMatch(n -> n.startsWith("::")));
    }
}
