package tech.yump.vaultclient.secrets;

/**
 * Exception thrown when the service refuses to extend a lease.
 */
public class LeaseRenewalException extends SecretServiceException {
    public LeaseRenewalException(String leaseId, String reason) {
        super("Lease renewal refused for " + leaseId + ": " + reason);
    }
}
