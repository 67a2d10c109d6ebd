package ai.svcs.analyzer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jetbrains.annotations.Nullable;

/**
 * Third fallback stage: recovers function, class and method boundaries, parameters, bases, decorators and imports
 * with regular expressions. Bodies are not analyzed, so nodes from this stage carry declaration facts only.
 */
public final class RegexStructureExtractor implements ParseStrategy {
    private static final Set<String> KEYWORDS = Set.of(
            "if", "for", "while", "switch", "catch", "function", "return", "elseif", "foreach", "with", "new");

    private record Block(String name, int headerStart, int nameStart, int end) {
        boolean encloses(int position) {
            return position > nameStart && position < end;
        }
    }

    private final SourceLanguage language;
    private final RegexGrammar grammar;

    public RegexStructureExtractor(SourceLanguage language, RegexGrammar grammar) {
        this.language = language;
        this.grammar = grammar;
    }

    @Override
    public ParseStage stage() {
        return ParseStage.REGEX;
    }

    @Override
    public ParseOutcome attempt(String path, SourceContent source) {
        var text = source.text();
        var nodes = new LinkedHashMap<String, SemanticNode>();

        var classes = new ArrayList<Block>();
        var classMatcher = grammar.classPattern().matcher(text);
        while (classMatcher.find()) {
            var name = classMatcher.group("name");
            var headerStart = lineStart(text, classMatcher.start());
            classes.add(new Block(name, headerStart, classMatcher.start("name"), blockEnd(text, headerStart, classMatcher.end())));
        }

        var functions = new ArrayList<Block>();
        var seenHeaders = new TreeSet<Integer>();
        for (var pattern : grammar.functionPatterns()) {
            collectCallables(text, source, pattern, classes, functions, seenHeaders, nodes, false);
        }
        for (var pattern : grammar.methodPatterns()) {
            collectCallables(text, source, pattern, classes, functions, seenHeaders, nodes, true);
        }

        for (var block : classes) {
            var owner = innermost(classes, block.nameStart(), block);
            var qualified = qualifiedClassName(classes, block);
            var features = NodeFeatures.builder();
            var header = matchAt(grammar.classPattern(), text, block.headerStart());
            if (header != null && hasGroup(header, "bases") && header.group("bases") != null) {
                splitBases(header.group("bases")).forEach(features::baseType);
            }
            decoratorsAbove(text, block.headerStart()).forEach(features::decorator);
            for (var fn : functions) {
                if (innermost(classes, fn.nameStart(), null) == block) {
                    features.classMethod(fn.name());
                }
            }
            var id = NodeKind.CLASS.idFor(qualified);
            var parentId = owner == null ? null : NodeKind.CLASS.idFor(qualifiedClassName(classes, owner));
            nodes.put(id, node(id, NodeKind.CLASS, block.name(), text, source, block, parentId, features));
        }

        var dependencies = new TreeSet<String>();
        int importCount = 0;
        for (var pattern : grammar.importPatterns()) {
            var m = pattern.matcher(text);
            while (m.find()) {
                importCount++;
                for (var module : m.group("module").split(",")) {
                    var name = module.strip().split("\\s+")[0];
                    if (!name.isEmpty()) {
                        dependencies.add(name);
                    }
                }
            }
        }

        if (nodes.isEmpty() && dependencies.isEmpty()) {
            return ParseOutcome.rejected(
                    ParseStage.REGEX, ParseError.Reason.NOTHING_RECOGNIZED, "no declarations or imports recognized");
        }

        int decoratorCount = 0;
        if (grammar.decoratorPattern() != null) {
            var m = grammar.decoratorPattern().matcher(text);
            while (m.find()) {
                decoratorCount++;
            }
        }
        var canonical = canonical(text);
        return ParseOutcome.parsed(new NodeTree(
                path,
                language,
                ParseStage.REGEX,
                nodes,
                dependencies,
                importCount,
                decoratorCount,
                source.lineCount(),
                source.byteLength(),
                text,
                canonical,
                shape(canonical),
                List.of()));
    }

    private void collectCallables(
            String text,
            SourceContent source,
            Pattern pattern,
            List<Block> classes,
            List<Block> functions,
            Set<Integer> seenHeaders,
            LinkedHashMap<String, SemanticNode> nodes,
            boolean methodsOnly) {
        var m = pattern.matcher(text);
        while (m.find()) {
            var name = m.group("name");
            int headerStart = lineStart(text, m.start());
            if (KEYWORDS.contains(name) || seenHeaders.contains(headerStart)) {
                continue;
            }
            var owner = innermost(classes, m.start("name"), null);
            if (methodsOnly && owner == null) {
                continue;
            }
            boolean nested = functions.stream().anyMatch(f -> f.encloses(m.start("name")));
            if (nested) {
                continue;
            }
            seenHeaders.add(headerStart);
            var block = new Block(name, headerStart, m.start("name"), blockEnd(text, headerStart, m.end()));
            functions.add(block);

            var features = NodeFeatures.builder();
            features.async(hasGroup(m, "async") && m.group("async") != null);
            if (hasGroup(m, "visibility") && m.group("visibility") != null) {
                features.visibility(m.group("visibility").strip());
            }
            features.isStatic(hasGroup(m, "static") && m.group("static") != null);
            var params = m.group("params");
            if (params != null) {
                parseParameters(params).forEach(features::parameter);
            }
            decoratorsAbove(text, headerStart).forEach(features::decorator);

            var kind = owner == null ? NodeKind.FUNCTION : NodeKind.METHOD;
            var qualified = owner == null ? name : qualifiedClassName(classes, owner) + "." + name;
            var id = kind.idFor(qualified);
            var parentId = owner == null ? null : NodeKind.CLASS.idFor(qualifiedClassName(classes, owner));
            nodes.put(id, node(id, kind, name, text, source, block, parentId, features));
        }
    }

    private SemanticNode node(
            String id,
            NodeKind kind,
            String name,
            String text,
            SourceContent source,
            Block block,
            @Nullable String parentId,
            NodeFeatures.Builder features) {
        var body = text.substring(block.headerStart(), block.end());
        int startLine = lineOf(text, block.headerStart());
        int endLine = Math.max(startLine, lineOf(text, Math.max(block.headerStart(), block.end() - 1)));
        var span = new SourceSpan(
                startLine,
                endLine,
                source.charPositionToByteOffset(block.headerStart()),
                source.charPositionToByteOffset(block.end()));
        return new SemanticNode(id, kind, name, canonical(body), span, parentId, features.build());
    }

    private static String qualifiedClassName(List<Block> classes, Block block) {
        var outer = innermost(classes, block.nameStart(), block);
        return outer == null ? block.name() : outer.name() + "." + block.name();
    }

    private static @Nullable Block innermost(List<Block> classes, int position, @Nullable Block exclude) {
        return classes.stream()
                .filter(c -> c != exclude && c.encloses(position))
                .max(Comparator.comparingInt(Block::nameStart))
                .orElse(null);
    }

    private int blockEnd(String text, int headerStart, int headerEnd) {
        return switch (grammar.blockStyle()) {
            case INDENT -> indentBlockEnd(text, headerStart, headerEnd);
            case BRACES -> braceBlockEnd(text, headerEnd);
        };
    }

    private static int indentBlockEnd(String text, int headerStart, int headerEnd) {
        int headerIndent = indentOf(text, headerStart);
        int pos = text.indexOf('\n', headerEnd);
        if (pos < 0) {
            return text.length();
        }
        int lastContentEnd = pos;
        pos++;
        while (pos < text.length()) {
            int lineEnd = text.indexOf('\n', pos);
            if (lineEnd < 0) {
                lineEnd = text.length();
            }
            var line = text.substring(pos, lineEnd);
            if (!line.isBlank()) {
                if (indentOf(text, pos) <= headerIndent) {
                    break;
                }
                lastContentEnd = lineEnd;
            }
            pos = lineEnd + 1;
        }
        return lastContentEnd;
    }

    private static int braceBlockEnd(String text, int headerEnd) {
        int open = text.lastIndexOf('{', headerEnd);
        if (open < 0 || text.substring(open, headerEnd).contains("\n")) {
            open = text.indexOf('{', headerEnd);
        }
        int semicolon = text.indexOf(';', headerEnd);
        if (open < 0 || (semicolon >= 0 && semicolon < open)) {
            int lineEnd = text.indexOf('\n', headerEnd);
            return lineEnd < 0 ? text.length() : lineEnd;
        }
        int depth = 0;
        char quote = 0;
        for (int i = open; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            switch (c) {
                case '"', '\'', '`' -> quote = c;
                case '{' -> depth++;
                case '}' -> {
                    depth--;
                    if (depth == 0) {
                        return i + 1;
                    }
                }
                default -> {}
            }
        }
        return text.length();
    }

    private List<String> decoratorsAbove(String text, int headerStart) {
        var result = new ArrayList<String>();
        var pattern = grammar.decoratorPattern();
        if (pattern == null) {
            return result;
        }
        int lineEnd = headerStart - 1;
        while (lineEnd > 0) {
            int start = lineStart(text, lineEnd - 1);
            var line = text.substring(start, lineEnd);
            var m = pattern.matcher(line);
            if (!m.find()) {
                break;
            }
            result.add(0, m.group(1).strip());
            lineEnd = start - 1;
        }
        return result;
    }

    private List<Parameter> parseParameters(String params) {
        var result = new ArrayList<Parameter>();
        for (var raw : splitTopLevel(params)) {
            var part = raw.strip();
            if (part.isEmpty() || part.equals("*") || part.equals("/")) {
                continue;
            }
            String defaultValue = null;
            int eq = topLevelIndexOf(part, '=');
            if (eq >= 0) {
                defaultValue = TokenText.collapseWhitespace(part.substring(eq + 1));
                part = part.substring(0, eq).strip();
            }
            var kind = Parameter.Kind.POSITIONAL;
            String annotation = null;
            String name;
            switch (grammar.parameterStyle()) {
                case PHP -> {
                    int dollar = part.lastIndexOf('$');
                    if (dollar < 0) {
                        continue;
                    }
                    name = part.substring(dollar + 1);
                    var prefix = part.substring(0, dollar).strip();
                    if (prefix.endsWith("...")) {
                        kind = Parameter.Kind.VARIADIC;
                        prefix = prefix.substring(0, prefix.length() - 3).strip();
                    }
                    prefix = prefix.replaceAll("^(public|private|protected|readonly)\\s+", "").replace("&", "").strip();
                    annotation = prefix.isEmpty() ? null : prefix;
                }
                default -> {
                    int colon = topLevelIndexOf(part, ':');
                    if (colon >= 0) {
                        annotation = TokenText.collapseWhitespace(part.substring(colon + 1));
                        part = part.substring(0, colon).strip();
                    }
                    if (part.startsWith("**")) {
                        kind = Parameter.Kind.VARIADIC_KEYWORD;
                        part = part.substring(2);
                    } else if (part.startsWith("...")) {
                        kind = Parameter.Kind.VARIADIC;
                        part = part.substring(3);
                    } else if (part.startsWith("*")) {
                        kind = Parameter.Kind.VARIADIC;
                        part = part.substring(1);
                    }
                    name = part.endsWith("?") ? part.substring(0, part.length() - 1) : part;
                }
            }
            result.add(new Parameter(name.strip(), defaultValue, annotation, kind));
        }
        return result;
    }

    private static List<String> splitTopLevel(String text) {
        var parts = new ArrayList<String>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(' || c == '[' || c == '{' || c == '<') depth++;
            else if (c == ')' || c == ']' || c == '}' || c == '>') depth = Math.max(0, depth - 1);
            else if (c == ',' && depth == 0) {
                parts.add(text.substring(start, i));
                start = i + 1;
            }
        }
        parts.add(text.substring(start));
        return parts;
    }

    private static int topLevelIndexOf(String text, char target) {
        int depth = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(' || c == '[' || c == '{') depth++;
            else if (c == ')' || c == ']' || c == '}') depth = Math.max(0, depth - 1);
            else if (c == target && depth == 0) return i;
        }
        return -1;
    }

    private static List<String> splitBases(String bases) {
        var result = new ArrayList<String>();
        var cleaned = bases.replaceAll("\\b(extends|implements)\\b", ",").replaceAll("[(){}:]", " ");
        for (var part : cleaned.split(",")) {
            var base = part.strip();
            if (!base.isEmpty()) {
                result.add(TokenText.collapseWhitespace(base));
            }
        }
        return result;
    }

    private String canonical(String text) {
        return TokenText.collapseWhitespace(grammar.commentPattern().matcher(text).replaceAll(" "));
    }

    private static String shape(String canonical) {
        return RegexGrammar.STRING_OR_NUMBER.matcher(canonical).replaceAll(TokenText.LITERAL_PLACEHOLDER);
    }

    private static @Nullable Matcher matchAt(Pattern pattern, String text, int from) {
        var m = pattern.matcher(text);
        return m.find(from) ? m : null;
    }

    private static boolean hasGroup(Matcher m, String group) {
        return m.pattern().pattern().contains("(?<" + group + ">");
    }

    private static int lineStart(String text, int position) {
        int newline = text.lastIndexOf('\n', Math.max(0, position));
        return newline < 0 ? 0 : newline + 1;
    }

    private static int lineOf(String text, int position) {
        int line = 1;
        for (int i = 0; i < position && i < text.length(); i++) {
            if (text.charAt(i) == '\n') line++;
        }
        return line;
    }

    private static int indentOf(String text, int lineStart) {
        int i = lineStart;
        while (i < text.length() && (text.charAt(i) == ' ' || text.charAt(i) == '\t')) {
            i++;
        }
        return i - lineStart;
    }
}
