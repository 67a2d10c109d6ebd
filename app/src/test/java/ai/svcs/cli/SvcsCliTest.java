package ai.svcs.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.svcs.semantic.EventJson;
import ai.svcs.semantic.EventType;
import ai.svcs.semantic.SemanticEvent;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class SvcsCliTest {
    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(String... args) {
        var cmd = new CommandLine(new SvcsCli());
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
        return cmd.execute(args);
    }

    @Test
    void printsEventsAsJson(@TempDir Path dir) throws IOException {
        var before = Files.writeString(dir.resolve("old.py"), "def f(a):\n    return a\n");
        var after = Files.writeString(dir.resolve("new.py"), "def f(a):\n    return a\n\n\ndef g():\n    return 1\n");

        int code = run("--before", before.toString(), "--after", after.toString(), "--path", "pkg/mod.py", "--layers", "1");

        assertEquals(0, code, err.toString());
        var events = EventJson.fromJson(out.toString());
        assertEquals(1, events.size());
        SemanticEvent event = events.get(0);
        assertEquals(EventType.NODE_ADDED, event.eventType());
        assertEquals("func:g", event.nodeId());
        assertEquals("pkg/mod.py:5", event.location());
    }

    @Test
    void languageIsTakenFromTheExtension(@TempDir Path dir) throws IOException {
        var added = Files.writeString(dir.resolve("app.js"), "function main() { return 1; }\n");

        int code = run("--after", added.toString(), "--layers", "1");

        assertEquals(0, code, err.toString());
        assertTrue(out.toString().contains("\"file_added\""), out.toString());
    }

    @Test
    void unknownLanguageYieldsEmptyList(@TempDir Path dir) throws IOException {
        var after = Files.writeString(dir.resolve("notes.txt"), "hello\n");

        assertEquals(0, run("--after", after.toString()));
        assertEquals("[]", out.toString().strip());
    }

    @Test
    void missingInputsAreAUsageError() {
        assertEquals(1, run());
        assertTrue(err.toString().contains("--before"));
    }

    @Test
    void badLayerListIsAConfigurationError(@TempDir Path dir) throws IOException {
        var after = Files.writeString(dir.resolve("a.py"), "x = 1\n");

        assertEquals(1, run("--after", after.toString(), "--layers", "1,9"));
        assertTrue(err.toString().startsWith("Configuration error"), err.toString());
    }
}
