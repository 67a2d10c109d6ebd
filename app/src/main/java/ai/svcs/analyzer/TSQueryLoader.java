package ai.svcs.analyzer;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/** Loads tree-sitter query sources from {@code treesitter/<name>.scm} on the classpath. */
public class TSQueryLoader {

    private TSQueryLoader() {}

    private static final String resourcePrefix = "treesitter";

    public static String loadQuery(String name) {
        final String path = resourcePrefix + "/" + name + ".scm";
        try (InputStream in = TSQueryLoader.class.getClassLoader().getResourceAsStream(path)) {
            if (in == null) throw new IOException("Resource not found: " + path);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
