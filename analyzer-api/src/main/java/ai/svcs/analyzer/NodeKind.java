package ai.svcs.analyzer;

/** Kind of a semantic node; the prefix is the leading segment of every node id. */
public enum NodeKind {
    MODULE("module"),
    FUNCTION("func"),
    CLASS("class"),
    METHOD("method"),
    PROPERTY("prop");

    private final String prefix;

    NodeKind(String prefix) {
        this.prefix = prefix;
    }

    public String prefix() {
        return prefix;
    }

    public String idFor(String qualifiedName) {
        return prefix + ":" + qualifiedName;
    }

    public boolean isCallable() {
        return this == FUNCTION || this == METHOD;
    }
}
