package ai.svcs.analyzer;

import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.UncheckedIOException;
import org.junit.jupiter.api.Test;

class TSQueryLoaderTest {

    @Test
    void loadsBundledQuery() {
        var query = TSQueryLoader.loadQuery("python-legacy");

        assertTrue(query.contains("(print_statement) @legacy.print"), query);
    }

    @Test
    void missingQueryFailsLoudly() {
        var e = assertThrows(UncheckedIOException.class, () -> TSQueryLoader.loadQuery("cobol"));
        assertTrue(e.getMessage().contains("treesitter/cobol.scm"), e.getMessage());
    }
}
