package ai.svcs.analyzer;

import java.nio.charset.StandardCharsets;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Wrapper for a source text and its UTF-8 bytes. Tree-sitter reports byte offsets, so every node text is cut from
 * the byte array rather than from the Java string.
 */
public final class SourceContent {
    private static final Logger logger = LogManager.getLogger(SourceContent.class);

    private final String text;
    private final byte[] utf8Bytes;

    private SourceContent(String text) {
        this.text = text;
        this.utf8Bytes = text.getBytes(StandardCharsets.UTF_8);
    }

    /** Wraps the source text, dropping a leading byte order mark. */
    public static SourceContent of(String src) {
        return new SourceContent(src.startsWith("\uFEFF") ? src.substring(1) : src);
    }

    /**
     * Extracts the text in the UTF-8 byte range [startByte, endByte). Invalid ranges yield the empty string; an end
     * past the last byte is truncated.
     */
    public String substringFromBytes(int startByte, int endByte) {
        if (startByte < 0 || endByte < startByte || startByte > utf8Bytes.length) {
            logger.warn(
                    "Requested bytes outside source range (length: {} bytes): startByte={}, endByte={}",
                    utf8Bytes.length,
                    startByte,
                    endByte);
            return "";
        }
        int end = Math.min(endByte, utf8Bytes.length);
        if (end == startByte) return "";
        return new String(utf8Bytes, startByte, end - startByte, StandardCharsets.UTF_8);
    }

    /** Converts a string index (UTF-16 code units) into a UTF-8 byte offset, clamped to the source. */
    public int charPositionToByteOffset(int charPosition) {
        if (charPosition <= 0) return 0;
        if (charPosition >= text.length()) return utf8Bytes.length;
        return text.substring(0, charPosition).getBytes(StandardCharsets.UTF_8).length;
    }

    public String text() {
        return text;
    }

    public int byteLength() {
        return utf8Bytes.length;
    }

    public int lineCount() {
        return NodeTree.countLines(text);
    }
}
