package ai.svcs.analyzer;

import org.jetbrains.annotations.Nullable;

/**
 * One declared parameter. Default value and annotation are kept as normalized source text so two versions can be
 * compared without evaluating anything.
 */
public record Parameter(String name, @Nullable String defaultValue, @Nullable String annotation, Kind kind) {

    public enum Kind {
        POSITIONAL,
        KEYWORD_ONLY,
        VARIADIC,
        VARIADIC_KEYWORD
    }

    public static Parameter positional(String name) {
        return new Parameter(name, null, null, Kind.POSITIONAL);
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }

    public boolean isAnnotated() {
        return annotation != null;
    }

    /** Compact rendering used in event details, e.g. {@code b: int=1} or {@code *args}. */
    public String render() {
        var sb = new StringBuilder();
        switch (kind) {
            case VARIADIC -> sb.append('*');
            case VARIADIC_KEYWORD -> sb.append("**");
            default -> {}
        }
        sb.append(name);
        if (annotation != null) {
            sb.append(": ").append(annotation);
        }
        if (defaultValue != null) {
            sb.append('=').append(defaultValue);
        }
        return sb.toString();
    }
}
