package ai.svcs.config;

/** Invalid engine configuration. Raised while building the engine or its context, before any file is analyzed. */
public class ConfigException extends RuntimeException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
