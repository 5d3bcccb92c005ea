package cz.vut.fit.zoneguard.errors;

/**
 * Invalid scan settings or an invalid domain list. Raised before any scanning starts.
 */
public class ConfigurationException extends Exception {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
