package ai.svcs.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public final class PythonAdapterTest {
    private final PythonAdapter adapter = new PythonAdapter(0.3);

    private static SemanticNode node(NodeTree tree, String id) {
        return tree.node(id).orElseThrow(() -> new AssertionError("Missing " + id + ". Found: " + tree.ids()));
    }

    @Test
    void testDeclarationsAndIds() {
        String py =
                """
                import os
                from collections import OrderedDict


                class Cache(Base, metaclass=Meta):
                    limit = 10

                    def __init__(self, size):
                        self.size = size

                    @staticmethod
                    def build():
                        return Cache(1)


                def load(path):
                    def inner():
                        return path
                    return inner()
                """;
        var tree = adapter.parse("cache.py", py);

        assertEquals(ParseStage.PRIMARY, tree.stage());
        assertEquals(
                Set.of(
                        "class:Cache",
                        "prop:Cache.limit",
                        "method:Cache.__init__",
                        "method:Cache.build",
                        "func:load",
                        "func:load.inner"),
                tree.ids());
        assertEquals(Set.of("collections", "os"), tree.dependencies());
        assertEquals(2, tree.importCount());
        assertEquals(1, tree.decoratorCount());

        var cache = node(tree, "class:Cache");
        assertEquals(5, cache.span().startLine());
        assertEquals(Set.of("__init__", "build"), cache.features().classMethods());
        assertEquals(Set.of("limit", "size"), cache.features().classAttributes());
        assertTrue(cache.features().baseTypes().contains("Base"));

        var build = node(tree, "method:Cache.build");
        assertEquals("class:Cache", build.parentId());
        assertEquals(List.of("staticmethod"), build.features().decorators());
        assertTrue(build.features().isStatic());

        assertEquals("func:load", node(tree, "func:load.inner").parentId());
    }

    @Test
    void testParametersAndSignatureFacts() {
        String py =
                """
                async def fetch(url: str, retries=3, *args, timeout: float = 1.5, **kwargs) -> bytes:
                    return await get(url)
                """;
        var fetch = node(adapter.parse("net.py", py), "func:fetch");
        var features = fetch.features();

        assertTrue(features.async());
        assertEquals("bytes", features.returnType());
        assertEquals(
                List.of(
                        new Parameter("url", null, "str", Parameter.Kind.POSITIONAL),
                        new Parameter("retries", "3", null, Parameter.Kind.POSITIONAL),
                        new Parameter("args", null, null, Parameter.Kind.VARIADIC),
                        new Parameter("timeout", "1.5", "float", Parameter.Kind.KEYWORD_ONLY),
                        new Parameter("kwargs", null, null, Parameter.Kind.VARIADIC_KEYWORD)),
                features.parameters());
        assertEquals(1, features.awaitCount());
        assertTrue(features.calls().contains("get"));
    }

    @Test
    void testBodyFeatures() {
        String py =
                """
                def process(items, limit):
                    global seen
                    total = 0
                    try:
                        for item in items:
                            if item.value > limit and item.ok:
                                total += item.value
                    except (ValueError, KeyError):
                        raise
                    values = list(map(lambda x: x * 2, items))
                    squares = [v * v for v in values]
                    return total
                """;
        var features = node(adapter.parse("work.py", py), "func:process").features();

        assertEquals(1, features.tryCount());
        assertEquals(Set.of("KeyError", "ValueError"), features.caughtTypes());
        assertEquals(1, features.raiseCount());
        assertEquals(Set.of("seen"), features.globals());
        assertTrue(features.calls().containsAll(Set.of("list", "map")));
        assertEquals(1, features.functionalCalls());
        assertEquals(1, features.lambdaCount());
        assertEquals(1, features.comprehensions().count("list"));
        assertEquals(1, features.maxLoopDepth());
        assertEquals(1, features.returnCount());
        assertEquals(1, features.usage(UsageKind.COMPARISON_OPERATOR).count(">"));
        assertEquals(1, features.usage(UsageKind.LOGICAL_OPERATOR).count("and"));
        assertEquals(1, features.usage(UsageKind.AUGMENTED_ASSIGNMENT).count("+="));
        assertEquals(1, features.usage(UsageKind.NUMERIC_LITERAL).count("0"));
        // loop, if, and, except
        assertEquals(4, features.decisionPoints());
        assertTrue(features.controlFlow().contains(ControlFlowKind.TRY));
    }

    @Test
    void testNestedDeclarationFactsStayWithTheirNode() {
        String py =
                """
                def outer():
                    def inner():
                        try:
                            pass
                        except Exception:
                            pass
                    return inner
                """;
        var tree = adapter.parse("nested.py", py);

        assertEquals(0, node(tree, "func:outer").features().tryCount());
        assertEquals(1, node(tree, "func:outer.inner").features().tryCount());
    }

    @Test
    void testLegacySyntaxFallsBackToRewrite() {
        String py =
                """
                def show(value):
                    try:
                        return `value`
                    except ValueError, e:
                        return None
                """;
        var tree = adapter.parse("old.py", py);

        assertEquals(ParseStage.LEGACY, tree.stage());
        assertEquals(ParseStage.PRIMARY, tree.failedAttempts().get(0).stage());
        assertTrue(node(tree, "func:show").features().calls().contains("repr"));
        assertEquals(Set.of("ValueError"), node(tree, "func:show").features().caughtTypes());
        // the tree keeps the text the caller gave
        assertEquals(py, tree.sourceText());
    }

    @ParameterizedTest
    @ValueSource(
            strings = {
                "def f(x):\n    return `x`\n",
                "if a <> 1:\n    pass\n",
                "try:\n    pass\nexcept ValueError, e:\n    pass\n",
                "print \"hi\"\n",
                "exec \"x = 1\"\n",
                "raise ValueError, 'bad'\n",
                "mode = 0777\n",
                "big = 10L\n"
            })
    void testPython2OnlyConstructsSkipThePrimaryStage(String py) {
        var tree = adapter.parse("old.py", py);

        assertEquals(ParseStage.LEGACY, tree.stage(), tree.failedAttempts().toString());
        var rejection = tree.failedAttempts().get(0);
        assertEquals(ParseStage.PRIMARY, rejection.stage());
        assertEquals(ParseError.Reason.SYNTAX_ERRORS, rejection.reason());
    }

    @Test
    void testModernEquivalentsStayPrimary() {
        String py =
                """
                try:
                    print("hi", repr(x))
                except (ValueError, KeyError) as e:
                    raise ValueError("bad") from e
                mode = 0o777 + 0 + 10
                if a != 1:
                    mode = 0
                """;
        var tree = adapter.parse("new.py", py);

        assertEquals(ParseStage.PRIMARY, tree.stage(), tree.failedAttempts().toString());
        assertTrue(tree.failedAttempts().isEmpty());
    }

    @Test
    void testLegacyRewrites() {
        var rewritten = adapter.rewriteLegacySyntax(
                """
                if a <> b:
                    x = 0777 + 10L
                    exec code
                    raise ValueError, "bad"
                s = ur"raw"
                """);

        assertEquals(
                """
                if a != b:
                    x = 0o777 + 10
                    exec(code)
                    raise ValueError("bad")
                s = r"raw"
                """,
                rewritten);
    }

    @Test
    void testUnparseableFileBecomesOpaque() {
        var tree = adapter.parse("junk.py", "?$?$?$?$?$?$\n");

        assertEquals(ParseStage.OPAQUE, tree.stage());
        assertEquals(Set.of("module:junk.py"), tree.ids());
        assertEquals(3, tree.failedAttempts().size());
    }

    @Test
    void testEquivalentFormattingHasEqualCanonicalText() {
        var a = adapter.parse("f.py", "def f(a, b):\n    return a+b  # sum\n");
        var b = adapter.parse("f.py", "def f(a,  b):\n    return a + b\n");

        assertEquals(
                node(a, "func:f").canonicalText(), node(b, "func:f").canonicalText());
        assertEquals(a.canonicalText(), b.canonicalText());
    }

    @Test
    void testLiteralOnlyEditKeepsShape() {
        var a = adapter.parse("f.py", "def f():\n    return 1\n");
        var b = adapter.parse("f.py", "def f():\n    return 2\n");

        assertNotEquals(a.canonicalText(), b.canonicalText());
        assertEquals(a.shapeText(), b.shapeText());
    }
}
