package ai.svcs.analyzer;

import java.util.List;
import java.util.regex.Pattern;
import org.jetbrains.annotations.Nullable;

/**
 * Patterns for the regex fallback stage. Function and method patterns expose the named groups {@code name} and
 * {@code params}, and optionally {@code async}, {@code visibility} and {@code static}; class patterns expose
 * {@code name} and optionally {@code bases}; import patterns expose {@code module}.
 */
public record RegexGrammar(
        BlockStyle blockStyle,
        ParameterStyle parameterStyle,
        List<Pattern> functionPatterns,
        List<Pattern> methodPatterns,
        Pattern classPattern,
        List<Pattern> importPatterns,
        @Nullable Pattern decoratorPattern,
        Pattern commentPattern) {

    public enum BlockStyle {
        INDENT,
        BRACES
    }

    public enum ParameterStyle {
        /** {@code name: annotation = default}, {@code *args}, {@code **kwargs} */
        PYTHON,
        /** {@code Type $name = default}, {@code ...$rest} */
        PHP,
        /** {@code name?: type = default}, {@code ...rest} */
        JAVASCRIPT
    }

    static final Pattern STRING_OR_NUMBER =
            Pattern.compile("\"(?:[^\"\\\\\\n]|\\\\.)*\"|'(?:[^'\\\\\\n]|\\\\.)*'|\\b\\d+(?:\\.\\d+)?\\b");
}
