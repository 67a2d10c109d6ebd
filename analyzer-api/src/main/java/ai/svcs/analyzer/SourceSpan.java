package ai.svcs.analyzer;

/** 1-based inclusive line range plus the UTF-8 byte range [startByte, endByte). */
public record SourceSpan(int startLine, int endLine, int startByte, int endByte) {
    public SourceSpan {
        if (startLine < 1 || endLine < startLine) {
            throw new IllegalArgumentException("Invalid line range " + startLine + "-" + endLine);
        }
        if (startByte < 0 || endByte < startByte) {
            throw new IllegalArgumentException("Invalid byte range " + startByte + "-" + endByte);
        }
    }

    public int lineCount() {
        return endLine - startLine + 1;
    }

    /** Human-readable location used on events, e.g. {@code app.py:12}. */
    public String location(String path) {
        return path + ":" + startLine;
    }
}
