package eu.virtualparadox.finrag.application.config;

/**
 * Invalid ingestion configuration. Raised before any document is processed.
 */
public class ConfigurationException extends IllegalArgumentException {

    public ConfigurationException(final String message) {
        super(message);
    }
}
