package ai.svcs.analyzer;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/** Languages the engine can analyze, resolved from the caller's language tag. */
public enum SourceLanguage {
    PYTHON("python", List.of("py", "pyw", "py2", "py3")),
    PHP("php", List.of("php", "phtml", "php5", "php7", "inc")),
    JAVASCRIPT("javascript", List.of("js", "mjs", "cjs", "jsx")),
    TYPESCRIPT("typescript", List.of("ts", "mts", "cts", "tsx"));

    private final String tag;
    private final List<String> extensions;

    SourceLanguage(String tag, List<String> extensions) {
        this.tag = tag;
        this.extensions = extensions;
    }

    public String tag() {
        return tag;
    }

    public List<String> extensions() {
        return extensions;
    }

    /**
     * Resolves a language name ("python", "js", ".tsx") to a language. Unknown and blank tags resolve to empty.
     */
    public static Optional<SourceLanguage> fromTag(@Nullable String languageTag) {
        if (languageTag == null || languageTag.isBlank()) {
            return Optional.empty();
        }
        var normalized = languageTag.trim().toLowerCase(Locale.ROOT);
        if (normalized.startsWith(".")) {
            normalized = normalized.substring(1);
        }
        for (var language : values()) {
            if (language.tag.equals(normalized) || language.extensions.contains(normalized)) {
                return Optional.of(language);
            }
        }
        return switch (normalized) {
            case "py2", "python2", "python3" -> Optional.of(PYTHON);
            case "node", "ecmascript" -> Optional.of(JAVASCRIPT);
            default -> Optional.empty();
        };
    }

    /** Resolves the language from a file path's extension. */
    public static Optional<SourceLanguage> fromPath(String path) {
        int dot = path.lastIndexOf('.');
        if (dot < 0 || dot == path.length() - 1) {
            return Optional.empty();
        }
        return fromTag(path.substring(dot + 1));
    }
}
