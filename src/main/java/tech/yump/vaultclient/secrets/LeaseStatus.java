package tech.yump.vaultclient.secrets;

import java.time.Instant;

/**
 * Lease metadata of a managed secret, without its value.
 */
public record LeaseStatus(
        String name,
        SecretKind kind,
        String source,
        String leaseId,
        Instant issued,
        Instant expiresAt,
        boolean renewable,
        boolean fetched
) {
}
