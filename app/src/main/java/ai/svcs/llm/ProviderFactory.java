package ai.svcs.llm;

import ai.svcs.config.ConfigException;
import ai.svcs.config.EngineConfig;
import ai.svcs.config.ProviderSettings;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Builds providers for OpenAI-compatible endpoints, which covers hosted APIs and local model servers speaking the
 * same protocol. Retries are left to {@link ProviderChain}, so the models are built with none of their own.
 */
public final class ProviderFactory {
    private static final Logger logger = LogManager.getLogger(ProviderFactory.class);
    static final String NO_KEY = "not-needed";

    private final Function<String, String> environment;

    public ProviderFactory() {
        this(System::getenv);
    }

    ProviderFactory(Function<String, String> environment) {
        this.environment = environment;
    }

    public ProviderFactory(Map<String, String> environment) {
        this(environment::get);
    }

    public List<AiProvider> create(EngineConfig config) {
        return config.providers().stream()
                .map(settings -> (AiProvider) new LangChainProvider(settings.name(), chatModel(settings, config)))
                .toList();
    }

    ChatModel chatModel(ProviderSettings settings, EngineConfig config) {
        var apiKey = NO_KEY;
        if (settings.apiKeyEnv() != null) {
            apiKey = environment.apply(settings.apiKeyEnv());
            if (apiKey == null || apiKey.isBlank()) {
                throw new ConfigException("Provider " + settings.name() + " needs environment variable "
                        + settings.apiKeyEnv());
            }
        }
        logger.debug("Configuring provider {} -> {} ({})", settings.name(), settings.baseUrl(), settings.model());
        return OpenAiChatModel.builder()
                .baseUrl(settings.baseUrl())
                .apiKey(apiKey)
                .modelName(settings.model())
                .timeout(config.aiTimeout())
                .maxRetries(0)
                .temperature(0.0)
                .build();
    }
}
