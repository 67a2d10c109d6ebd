package ai.svcs.analyzer;

import org.jetbrains.annotations.Nullable;

/**
 * A function, class, method, property or whole-module blob extracted from one snapshot of a file.
 *
 * <p>The id is the kind prefix plus the qualified name, e.g. {@code func:load}, {@code method:Cache.get}. It is
 * stable across versions only while the name is unchanged: a rename is seen as a removal plus an addition.
 */
public record SemanticNode(
        String id,
        NodeKind kind,
        String name,
        String canonicalText,
        SourceSpan span,
        @Nullable String parentId,
        NodeFeatures features) {

    public SemanticNode {
        if (!id.startsWith(kind.prefix() + ":")) {
            throw new IllegalArgumentException("Node id " + id + " does not match kind " + kind);
        }
    }

    public String qualifiedName() {
        return id.substring(kind.prefix().length() + 1);
    }

    /** Public by naming convention: no leading underscore and no private/protected modifier. */
    public boolean isPublic() {
        var visibility = features.visibility();
        if (visibility != null && !"public".equals(visibility)) {
            return false;
        }
        return !name.startsWith("_") || (name.startsWith("__") && name.endsWith("__"));
    }
}
