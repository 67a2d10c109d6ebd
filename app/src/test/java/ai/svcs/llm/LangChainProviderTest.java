package ai.svcs.llm;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.svcs.config.ConfigException;
import ai.svcs.config.ConfigLoader;
import dev.langchain4j.exception.HttpException;
import dev.langchain4j.model.chat.ChatModel;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import org.junit.jupiter.api.Test;

class LangChainProviderTest {

    private static ChatModel model(Function<String, String> behavior) {
        return new ChatModel() {
            @Override
            public String chat(String userMessage) {
                return behavior.apply(userMessage);
            }
        };
    }

    @Test
    void returnsModelReply() throws ProviderException {
        var provider = new LangChainProvider("local", model(prompt -> "[] for " + prompt));

        assertEquals("[] for hi", provider.complete("hi"));
        assertEquals("local", provider.name());
    }

    @Test
    void blankReplyIsAFailure() {
        var provider = new LangChainProvider("local", model(prompt -> "  "));

        assertThrows(ProviderException.class, () -> provider.complete("hi"));
    }

    @Test
    void clientErrorsAreNotRetryable() {
        var provider = new LangChainProvider("hosted", model(prompt -> {
            throw new HttpException(401, "bad key");
        }));

        var e = assertThrows(ProviderException.class, () -> provider.complete("hi"));
        assertFalse(e.isRetryable());
    }

    @Test
    void rateLimitAndGatewayTimeoutAreRetryable() {
        var limited = new LangChainProvider("hosted", model(prompt -> {
            throw new HttpException(429, "slow down");
        }));
        var gateway = new LangChainProvider("hosted", model(prompt -> {
            throw new HttpException(504, "upstream timeout");
        }));

        assertTrue(assertThrows(ProviderException.class, () -> limited.complete("hi")).isRetryable());
        var timeout = assertThrows(ProviderException.class, () -> gateway.complete("hi"));
        assertTrue(timeout.isRetryable());
        assertTrue(LlmTimeouts.isTimeout(timeout));
    }

    @Test
    void timeoutDetectionWalksTheCauseChain() {
        var wrapped = new RuntimeException("outer", new IllegalStateException("middle", new TimeoutException()));

        assertTrue(LlmTimeouts.isTimeout(wrapped));
        assertFalse(LlmTimeouts.isTimeout(new RuntimeException("plain")));
        assertFalse(LlmTimeouts.isTimeout(null));
    }

    @Test
    void factoryRequiresConfiguredKeyVariable() {
        var config = ConfigLoader.withOverrides(Map.of(
                "svcs.ai.providers", "hosted",
                "svcs.ai.provider.hosted.baseUrl", "https://models.example.com/v1",
                "svcs.ai.provider.hosted.model", "coder-large",
                "svcs.ai.provider.hosted.apiKeyEnv", "SVCS_TEST_KEY"));

        assertThrows(ConfigException.class, () -> new ProviderFactory(Map.of()).create(config));

        var providers = new ProviderFactory(Map.of("SVCS_TEST_KEY", "secret")).create(config);
        assertEquals(1, providers.size());
        assertEquals("hosted", providers.get(0).name());
    }

    @Test
    void localProviderNeedsNoKey() {
        var config = ConfigLoader.withOverrides(Map.of(
                "svcs.ai.providers", "local",
                "svcs.ai.provider.local.baseUrl", "http://localhost:11434/v1",
                "svcs.ai.provider.local.model", "qwen2.5-coder"));

        var providers = new ProviderFactory(Map.of()).create(config);

        assertEquals(1, providers.size());
    }
}
