package ai.svcs.analyzer;

/**
 * Parses one snapshot of a file into a {@link NodeTree}. Adapters never throw for malformed input: each walks its
 * fallback chain down to an opaque whole-file node.
 */
public sealed interface LanguageAdapter permits TreeSitterAdapter {

    SourceLanguage language();

    NodeTree parse(String path, String sourceText);

    /** Creates the adapter for a language; JavaScript and TypeScript share one adapter class. */
    static LanguageAdapter forLanguage(SourceLanguage language, double maxErrorRatio) {
        return switch (language) {
            case PYTHON -> new PythonAdapter(maxErrorRatio);
            case PHP -> new PhpAdapter(maxErrorRatio);
            case JAVASCRIPT, TYPESCRIPT -> new JavascriptAdapter(language, maxErrorRatio);
        };
    }
}
