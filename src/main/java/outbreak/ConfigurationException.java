package outbreak;

public class ConfigurationException extends OutbreakException {

    public ConfigurationException(String message) {
        super(FailureKind.CONFIGURATION, message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(FailureKind.CONFIGURATION, message, cause);
    }
}
