package tech.yump.vaultclient.secrets;

/**
 * Base exception for errors raised while talking to the secret service or
 * while managing the secrets obtained from it.
 */
public class SecretServiceException extends RuntimeException {
    public SecretServiceException(String message) {
        super(message);
    }

    public SecretServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
