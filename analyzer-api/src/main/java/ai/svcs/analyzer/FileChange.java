package ai.svcs.analyzer;

import org.jetbrains.annotations.Nullable;

/**
 * One file of a revision. A {@code null} side means the file does not exist in that version.
 */
public record FileChange(
        String filePath, String languageTag, @Nullable String sourceBefore, @Nullable String sourceAfter) {

    public FileChange {
        if (filePath.isBlank()) {
            throw new IllegalArgumentException("filePath must not be blank");
        }
    }

    public static FileChange added(String filePath, String languageTag, String source) {
        return new FileChange(filePath, languageTag, null, source);
    }

    public static FileChange removed(String filePath, String languageTag, String source) {
        return new FileChange(filePath, languageTag, source, null);
    }

    public static FileChange modified(String filePath, String languageTag, String before, String after) {
        return new FileChange(filePath, languageTag, before, after);
    }

    public boolean existsBefore() {
        return sourceBefore != null && !sourceBefore.isBlank();
    }

    public boolean existsAfter() {
        return sourceAfter != null && !sourceAfter.isBlank();
    }
}
