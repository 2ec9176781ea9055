package tech.noetzold.trust_engine_api.exception;

/**
 * Missing or invalid organization/catalog configuration: bad thresholds,
 * empty catalog, weights that sum to zero.
 */
public class ConfigurationException extends RuntimeException {
    public ConfigurationException(String message) {
        super(message);
    }
}
