package ai.svcs.llm;

import org.jetbrains.annotations.Nullable;

/** Failure of an {@link AiProvider} call. {@code retryable} distinguishes transient faults from hard rejections. */
public class ProviderException extends Exception {
    private final boolean retryable;

    public ProviderException(String message) {
        this(message, null, true);
    }

    public ProviderException(String message, @Nullable Throwable cause) {
        this(message, cause, true);
    }

    public ProviderException(String message, @Nullable Throwable cause, boolean retryable) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
