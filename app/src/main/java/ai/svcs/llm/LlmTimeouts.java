package ai.svcs.llm;

import dev.langchain4j.exception.HttpException;
import java.util.concurrent.TimeoutException;
import org.jetbrains.annotations.Nullable;

/**
 * Timeout detection for provider failures. An HTTP 504 from the upstream model service counts as a timeout, as
 * does our own per-call deadline; message text is never inspected.
 */
public final class LlmTimeouts {

    private LlmTimeouts() {
        // utility
    }

    /** True when {@code t} or any of its causes is a 504 response or an expired call deadline. */
    public static boolean isTimeout(@Nullable Throwable t) {
        var current = t;
        int depth = 0;
        while (current != null && depth++ < 10) {
            if (current instanceof HttpException he && he.statusCode() == 504) {
                return true;
            }
            if (current instanceof TimeoutException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    /** Server-side faults and rate limiting are worth retrying; other HTTP errors are not. */
    public static boolean isRetryable(@Nullable Throwable t) {
        if (t instanceof HttpException he) {
            int status = he.statusCode();
            return status == 429 || status >= 500;
        }
        return true;
    }
}
