package ai.svcs.llm;

import dev.langchain4j.model.chat.ChatModel;

/** Adapts a langchain4j {@link ChatModel} to the {@link AiProvider} seam. */
public final class LangChainProvider implements AiProvider {
    private final String name;
    private final ChatModel model;

    public LangChainProvider(String name, ChatModel model) {
        this.name = name;
        this.model = model;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String complete(String prompt) throws ProviderException {
        String reply;
        try {
            reply = model.chat(prompt);
        } catch (RuntimeException e) {
            throw new ProviderException(
                    name + " request failed: " + e.getMessage(),
                    e,
                    LlmTimeouts.isTimeout(e) || LlmTimeouts.isRetryable(e));
        }
        if (reply == null || reply.isBlank()) {
            throw new ProviderException(name + " returned an empty reply");
        }
        return reply;
    }
}
