package tech.yump.vaultclient.secrets;

/**
 * Exception thrown on network failures, timeouts and 5xx responses.
 * Recoverable: the next unit of work may try again.
 */
public class ServiceUnavailableException extends SecretServiceException {
    public ServiceUnavailableException(String message) {
        super(message);
    }

    public ServiceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
