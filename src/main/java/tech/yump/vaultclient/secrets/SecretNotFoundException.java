package tech.yump.vaultclient.secrets;

/**
 * Exception thrown when a mount point, path or key does not resolve to a secret.
 */
public class SecretNotFoundException extends SecretServiceException {
    public SecretNotFoundException(String description) {
        super("Secret not found: " + description);
    }
}
