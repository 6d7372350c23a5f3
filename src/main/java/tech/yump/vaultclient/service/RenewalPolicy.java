package tech.yump.vaultclient.service;

import tech.yump.vaultclient.secrets.Lease;
import tech.yump.vaultclient.secrets.Secret;

import java.time.Duration;
import java.time.Instant;

/**
 * Decides when a lease must be renewed or its secret fetched again.
 * <p>
 * A leased secret is renewed once its remaining time drops below
 * {@code max(thresholdRatio * duration, minimumRemaining)}. It is fetched again when
 * it is missing or expired. Static secrets (zero duration) are never renewed; they are
 * re-read once older than {@code staticRefreshInterval}.
 */
public class RenewalPolicy {

    public enum RefreshAction {
        NONE,
        RENEW,
        FETCH
    }

    private final double thresholdRatio;
    private final Duration minimumRemaining;
    private final Duration staticRefreshInterval;

    public RenewalPolicy(double thresholdRatio, Duration minimumRemaining, Duration staticRefreshInterval) {
        if (thresholdRatio < 0.0 || thresholdRatio > 1.0) {
            throw new IllegalArgumentException("Renewal threshold ratio must be between 0 and 1, was " + thresholdRatio);
        }
        this.thresholdRatio = thresholdRatio;
        this.minimumRemaining = minimumRemaining == null ? Duration.ZERO : minimumRemaining;
        this.staticRefreshInterval = staticRefreshInterval == null ? Duration.ZERO : staticRefreshInterval;
    }

    public RefreshAction decide(Secret secret, Instant now) {
        if (secret == null) {
            return RefreshAction.FETCH;
        }
        Lease lease = secret.lease();
        if (lease.isStatic()) {
            return lease.age(now).compareTo(staticRefreshInterval) >= 0 ? RefreshAction.FETCH : RefreshAction.NONE;
        }
        if (lease.isExpired(now)) {
            return RefreshAction.FETCH;
        }
        if (lease.age(now).compareTo(secret.request().minimumTtl()) < 0) {
            return RefreshAction.NONE;
        }
        return isWithinThreshold(lease, now) ? RefreshAction.RENEW : RefreshAction.NONE;
    }

    /**
     * Whether a lease is expired or inside its renewal threshold, regardless of the request's
     * minimum TTL. A lease that is due right after renewal was capped by the service.
     */
    public boolean isDue(Lease lease, Instant now) {
        if (lease.isStatic()) {
            return false;
        }
        return lease.isExpired(now) || isWithinThreshold(lease, now);
    }

    /**
     * Auth sessions are not renewed in place; a session close to expiry is replaced by logging in again.
     */
    public boolean sessionNeedsReplacement(Lease sessionLease, Instant now) {
        if (sessionLease == null) {
            return true;
        }
        if (sessionLease.isStatic()) {
            return false;
        }
        return sessionLease.isExpired(now) || isWithinThreshold(sessionLease, now);
    }

    Duration threshold(Duration leaseDuration) {
        Duration proportional = Duration.ofMillis((long) (leaseDuration.toMillis() * thresholdRatio));
        return proportional.compareTo(minimumRemaining) >= 0 ? proportional : minimumRemaining;
    }

    private boolean isWithinThreshold(Lease lease, Instant now) {
        return lease.remaining(now).compareTo(threshold(lease.duration())) < 0;
    }
}
