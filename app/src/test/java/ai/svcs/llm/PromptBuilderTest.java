package ai.svcs.llm;

import static ai.svcs.semantic.TestTrees.function;
import static ai.svcs.semantic.TestTrees.modified;
import static ai.svcs.semantic.TestTrees.tree;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.svcs.semantic.EventType;
import ai.svcs.semantic.SemanticEvent;
import java.util.List;
import org.junit.jupiter.api.Test;

class PromptBuilderTest {

    @Test
    void promptListsSourcesDetectedEventsAndAllowedTypes() {
        var diff = modified(tree(function("f", "def f(): return 1")), tree(function("f", "def f(): return 2")));
        var prior = List.of(SemanticEvent.rule(
                EventType.NUMERIC_LITERAL_USAGE_CHANGED, "func:f", "pkg/module.py:1", "added 1 new literals"));

        var prompt = new PromptBuilder(12_000).build(diff, prior);

        assertTrue(prompt.contains("pkg/module.py (language: python)"));
        assertTrue(prompt.contains("def f(): return 1"));
        assertTrue(prompt.contains("def f(): return 2"));
        assertTrue(prompt.contains("- numeric_literal_usage_changed func:f: added 1 new literals"));
        assertTrue(prompt.contains("business_logic_change"));
        assertFalse(prompt.contains("node_added,"), "only interpretable types are offered");
    }

    @Test
    void longSourcesAreTruncatedPerSide() {
        var body = "x = 1\n".repeat(100);
        var diff = modified(tree(function("f", body)), tree(function("f", body + "y = 2\n")));

        var prompt = new PromptBuilder(100).build(diff, List.of());

        assertTrue(prompt.contains(PromptBuilder.TRUNCATION_MARKER));
        assertTrue(prompt.contains("(none)"));
    }

    @Test
    void truncateKeepsShortText() {
        assertEquals("abc", PromptBuilder.truncate("abc", 3));
        assertEquals("ab" + PromptBuilder.TRUNCATION_MARKER, PromptBuilder.truncate("abc", 2));
    }
}
