package tech.yump.vaultclient.secrets;

/**
 * Exception thrown when the platform identity token cannot be exchanged for a
 * service token (unreadable, expired or rejected).
 */
public class AuthenticationException extends SecretServiceException {
    public AuthenticationException(String message) {
        super(message);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
