package ai.svcs.config;

import org.jetbrains.annotations.Nullable;

/**
 * One OpenAI-compatible chat endpoint.
 *
 * @param apiKeyEnv name of the environment variable holding the key; {@code null} for local servers without auth
 */
public record ProviderSettings(String name, String baseUrl, String model, @Nullable String apiKeyEnv) {

    public ProviderSettings {
        if (name.isBlank()) {
            throw new ConfigException("Provider name must not be blank");
        }
        if (baseUrl.isBlank()) {
            throw new ConfigException("Provider " + name + " has no endpoint (svcs.ai.provider." + name + ".baseUrl)");
        }
        if (model.isBlank()) {
            throw new ConfigException("Provider " + name + " has no model (svcs.ai.provider." + name + ".model)");
        }
        if (apiKeyEnv != null && apiKeyEnv.isBlank()) {
            apiKeyEnv = null;
        }
    }
}
