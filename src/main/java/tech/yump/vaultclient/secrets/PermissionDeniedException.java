package tech.yump.vaultclient.secrets;

/**
 * Exception thrown when the service policy denies access to a requested secret.
 */
public class PermissionDeniedException extends SecretServiceException {
    public PermissionDeniedException(String description) {
        super("Permission denied for secret: " + description);
    }
}
