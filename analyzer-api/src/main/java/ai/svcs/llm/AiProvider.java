package ai.svcs.llm;

/**
 * A text-completion backend used by the interpretive layer. Implementations may block; callers enforce timeouts.
 */
public interface AiProvider {

    /** Short name used in logs and configuration, e.g. "openai" or "local". */
    String name();

    /**
     * Sends the prompt and returns the raw reply text.
     *
     * @throws ProviderException when the backend fails, rejects the request or returns nothing usable
     */
    String complete(String prompt) throws ProviderException;
}
