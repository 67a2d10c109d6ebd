package ai.svcs.analyzer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;

import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import org.junit.jupiter.api.Test;

class FallbackChainTest {

    private static ParseStrategy rejecting(ParseStage stage) {
        return new ParseStrategy() {
            @Override
            public ParseStage stage() {
                return stage;
            }

            @Override
            public ParseOutcome attempt(String path, SourceContent source) {
                return ParseOutcome.rejected(stage, ParseError.Reason.SYNTAX_ERRORS, "rejected by " + stage);
            }
        };
    }

    private static ParseStrategy throwing(ParseStage stage) {
        return new ParseStrategy() {
            @Override
            public ParseStage stage() {
                return stage;
            }

            @Override
            public ParseOutcome attempt(String path, SourceContent source) {
                throw new IllegalStateException("grammar crashed");
            }
        };
    }

    private static ParseStrategy accepting(ParseStage stage) {
        return new ParseStrategy() {
            @Override
            public ParseStage stage() {
                return stage;
            }

            @Override
            public ParseOutcome attempt(String path, SourceContent source) {
                return ParseOutcome.parsed(new NodeTree(
                        path,
                        SourceLanguage.PYTHON,
                        stage,
                        Map.of(),
                        new TreeSet<>(),
                        0,
                        0,
                        source.lineCount(),
                        source.byteLength(),
                        source.text(),
                        source.text(),
                        source.text(),
                        List.of()));
            }
        };
    }

    @Test
    void firstAcceptedStageWinsAndKeepsEarlierRejections() {
        var chain = new FallbackChain(
                SourceLanguage.PYTHON,
                List.of(rejecting(ParseStage.PRIMARY), accepting(ParseStage.LEGACY), accepting(ParseStage.REGEX)));

        var tree = chain.parse("a.py", "x = 1\n");

        assertEquals(ParseStage.LEGACY, tree.stage());
        assertEquals(1, tree.failedAttempts().size());
        assertEquals(ParseStage.PRIMARY, tree.failedAttempts().get(0).stage());
    }

    @Test
    void crashingStrategyBecomesAnInternalFailure() {
        var chain = new FallbackChain(
                SourceLanguage.PYTHON, List.of(throwing(ParseStage.PRIMARY), accepting(ParseStage.LEGACY)));

        var tree = chain.parse("a.py", "x = 1\n");

        assertEquals(ParseStage.LEGACY, tree.stage());
        var failure = tree.failedAttempts().get(0);
        assertEquals(ParseError.Reason.INTERNAL_FAILURE, failure.reason());
        assertInstanceOf(IllegalStateException.class, failure.cause());
    }

    @Test
    void opaqueStageIsAlwaysLast() {
        var chain = new FallbackChain(
                SourceLanguage.PYTHON, List.of(rejecting(ParseStage.PRIMARY), rejecting(ParseStage.REGEX)));

        var tree = chain.parse("pkg/a.py", "??\n");

        assertEquals(ParseStage.OPAQUE, tree.stage());
        assertEquals(List.of("module:pkg/a.py"), List.copyOf(tree.ids()));
        assertEquals(2, tree.failedAttempts().size());
        assertEquals(ParseStage.OPAQUE, chain.strategies().get(2).stage());
    }

    @Test
    void explicitOpaqueStrategyIsNotDuplicated() {
        var opaque = new OpaqueStrategy(SourceLanguage.PYTHON);
        var chain = new FallbackChain(SourceLanguage.PYTHON, List.of(accepting(ParseStage.PRIMARY), opaque));

        assertEquals(2, chain.strategies().size());
        assertSame(ParseStage.PRIMARY, chain.parse("a.py", "x = 1\n").stage());
    }

    @Test
    void opaqueTreeCoversWholeFile() {
        var tree = new FallbackChain(SourceLanguage.PHP, List.of()).parse("x.php", "a\nb\nc\n");
        var module = tree.node("module:x.php").orElseThrow();

        assertEquals(1, module.span().startLine());
        assertEquals(3, module.span().endLine());
        assertEquals("a b c", module.canonicalText());
    }
}
