package tech.yump.vaultclient.secrets;

/**
 * Exception thrown for invalid secret request sets: duplicate names, missing
 * required fields or unsupported kinds.
 */
public class ConfigurationException extends SecretServiceException {
    public ConfigurationException(String message) {
        super(message);
    }
}
