package taskclock.config;

/**
 * Startup configuration is unusable. Fatal: the process does not start.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
