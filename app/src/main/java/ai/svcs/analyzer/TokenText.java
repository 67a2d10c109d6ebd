package ai.svcs.analyzer;

import static ai.svcs.analyzer.ASTTraversalUtils.children;

import org.treesitter.TSNode;

/**
 * Canonical and shape renderings of a syntax subtree. Canonical text is the leaf token stream with comments and
 * formatting dropped; shape text additionally replaces string and numeric literals with a placeholder, so two
 * versions with equal shape differ only in whitespace, comments or literal values.
 */
public record TokenText(String canonical, String shape) {
    static final String LITERAL_PLACEHOLDER = "<lit>";

    public static TokenText of(TSNode node, SourceContent content, LanguageSyntaxProfile profile) {
        var canonical = new StringBuilder();
        var shape = new StringBuilder();
        append(node, content, profile, canonical, shape);
        return new TokenText(canonical.toString(), shape.toString());
    }

    private static void append(
            TSNode node,
            SourceContent content,
            LanguageSyntaxProfile profile,
            StringBuilder canonical,
            StringBuilder shape) {
        var construct = profile.construct(node.getType());
        if (construct == BodyConstruct.COMMENT) {
            return;
        }
        if (construct != null && construct.isShapeLiteral()) {
            // literal text is kept verbatim so whitespace inside strings still counts
            token(canonical, ASTTraversalUtils.extractNodeText(node, content), false);
            token(shape, LITERAL_PLACEHOLDER, false);
            return;
        }
        if (node.getChildCount() == 0) {
            var text = ASTTraversalUtils.extractNodeText(node, content);
            token(canonical, text, true);
            token(shape, text, true);
            return;
        }
        for (var child : children(node)) {
            append(child, content, profile, canonical, shape);
        }
    }

    private static void token(StringBuilder sb, String text, boolean collapse) {
        if (text.isEmpty()) {
            return;
        }
        if (sb.length() > 0) {
            sb.append(' ');
        }
        sb.append(collapse ? collapseWhitespace(text) : text);
    }

    public static String collapseWhitespace(String text) {
        return text.strip().replaceAll("\\s+", " ");
    }
}
