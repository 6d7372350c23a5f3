package tech.yump.vaultclient.secrets;

import java.time.Duration;
import java.time.Instant;

/**
 * Lease granted by the secret service together with a secret or an auth token.
 *
 * @param leaseId   Identifier used to renew the lease. Empty for static secrets.
 * @param issued    When the lease was granted (or last extended).
 * @param duration  Validity window starting at {@code issued}. Zero marks a static secret.
 * @param renewable Whether the service allows the lease to be extended.
 */
public record Lease(
        String leaseId,
        Instant issued,
        Duration duration,
        boolean renewable
) {

    public Lease {
        if (leaseId == null) {
            leaseId = "";
        }
        if (duration == null || duration.isNegative()) {
            duration = Duration.ZERO;
        }
    }

    public static Lease fromSeconds(String leaseId, Instant issued, long durationSeconds, boolean renewable) {
        return new Lease(leaseId, issued, Duration.ofSeconds(Math.max(0, durationSeconds)), renewable);
    }

    /**
     * A lease without a duration never expires and is never renewed.
     */
    public boolean isStatic() {
        return duration.isZero();
    }

    public Instant expiresAt() {
        return issued.plus(duration);
    }

    public boolean isExpired(Instant asOf) {
        return !isStatic() && !asOf.isBefore(expiresAt());
    }

    public Duration remaining(Instant asOf) {
        if (isStatic()) {
            return Duration.ZERO;
        }
        Duration remaining = Duration.between(asOf, expiresAt());
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    public Duration age(Instant asOf) {
        return Duration.between(issued, asOf);
    }

    public boolean canBeRenewed() {
        return renewable && !isStatic() && !leaseId.isEmpty();
    }
}
