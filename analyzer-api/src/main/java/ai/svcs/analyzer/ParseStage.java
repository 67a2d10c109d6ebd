package ai.svcs.analyzer;

/** Fallback stages of a language adapter, in the order they are attempted. */
public enum ParseStage {
    PRIMARY,
    LEGACY,
    REGEX,
    OPAQUE;

    public boolean isOpaque() {
        return this == OPAQUE;
    }
}
