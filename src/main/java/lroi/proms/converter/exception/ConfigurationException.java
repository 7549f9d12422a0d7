package lroi.proms.converter.exception;

/**
 * Fatal problem with the mapping configuration or the lookup-table file.
 * Raised before any input row is processed.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
