package ai.svcs.analyzer;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SourceContent Tests")
class SourceContentTest {

    @Test
    @DisplayName("BOM is stripped from text but byte mapping remains accurate")
    void testBomStripped() {
        SourceContent content = SourceContent.of("\uFEFFdef foo(): pass");

        assertEquals("def foo(): pass", content.text());
        assertEquals("def foo(): pass".getBytes(StandardCharsets.UTF_8).length, content.byteLength());
        assertEquals("def", content.substringFromBytes(0, 3));
        assertEquals("foo", content.substringFromBytes(4, 7));
    }

    @Test
    @DisplayName("Multi-byte characters are cut on byte offsets")
    void testMultiByteSubstring() {
        // "é" is two bytes, "€" three
        SourceContent content = SourceContent.of("s = 'é€'");

        assertEquals(11, content.byteLength());
        assertEquals("'é€'", content.substringFromBytes(4, 11));
        assertEquals(7, content.charPositionToByteOffset(6));
    }

    @Test
    @DisplayName("Invalid byte ranges yield empty strings")
    void testInvalidRanges() {
        SourceContent content = SourceContent.of("hello");

        assertEquals("", content.substringFromBytes(-1, 3));
        assertEquals("", content.substringFromBytes(3, 1));
        assertEquals("", content.substringFromBytes(6, 8));
        assertEquals("", content.substringFromBytes(2, 2));
    }

    @Test
    @DisplayName("End past the last byte is truncated")
    void testEndTruncated() {
        SourceContent content = SourceContent.of("hello");

        assertEquals("llo", content.substringFromBytes(2, 100));
    }

    @Test
    @DisplayName("charPositionToByteOffset clamps to the source")
    void testCharPositionClamped() {
        SourceContent content = SourceContent.of("héllo");

        assertEquals(0, content.charPositionToByteOffset(-4));
        assertEquals(content.byteLength(), content.charPositionToByteOffset(50));
    }

    @Test
    @DisplayName("Line count ignores a trailing newline")
    void testLineCount() {
        assertEquals(0, SourceContent.of("").lineCount());
        assertEquals(1, SourceContent.of("x = 1\n").lineCount());
        assertEquals(3, SourceContent.of("a\n\nb").lineCount());
    }
}
