package tech.yump.vaultclient.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.yump.vaultclient.secrets.GenericSecretRequest;
import tech.yump.vaultclient.secrets.Lease;
import tech.yump.vaultclient.secrets.Secret;
import tech.yump.vaultclient.service.RenewalPolicy.RefreshAction;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RenewalPolicyTest {

    private static final Instant ISSUED = Instant.parse("2024-05-01T10:00:00Z");
    private static final GenericSecretRequest REQUEST = new GenericSecretRequest("JWT_SECRET", "app/", "jwt", "secret");

    private final RenewalPolicy policy = new RenewalPolicy(0.2, Duration.ZERO, Duration.ofMinutes(5));

    private static Secret secretWithLease(long seconds, GenericSecretRequest request) {
        return new Secret(Map.of("secret", "s3cr3t"), Lease.fromSeconds("lease-1", ISSUED, seconds, true), request);
    }

    @Test
    @DisplayName("10s lease at 20%: renew after 9s, keep after 1s")
    void tenSecondLease() {
        Secret secret = secretWithLease(10, REQUEST);

        assertThat(policy.decide(secret, ISSUED.plusSeconds(1))).isEqualTo(RefreshAction.NONE);
        assertThat(policy.decide(secret, ISSUED.plusSeconds(9))).isEqualTo(RefreshAction.RENEW);
    }

    @Test
    @DisplayName("Missing and expired secrets are fetched")
    void fetchWhenMissingOrExpired() {
        assertThat(policy.decide(null, ISSUED)).isEqualTo(RefreshAction.FETCH);
        assertThat(policy.decide(secretWithLease(10, REQUEST), ISSUED.plusSeconds(10))).isEqualTo(RefreshAction.FETCH);
    }

    @Test
    @DisplayName("Absolute floor applies when the proportional threshold is smaller")
    void minimumRemainingFloor() {
        RenewalPolicy withFloor = new RenewalPolicy(0.2, Duration.ofSeconds(30), Duration.ofMinutes(5));
        Secret secret = secretWithLease(3600, REQUEST);

        assertThat(withFloor.threshold(Duration.ofSeconds(3600))).isEqualTo(Duration.ofSeconds(720));
        assertThat(withFloor.threshold(Duration.ofSeconds(60))).isEqualTo(Duration.ofSeconds(30));
        assertThat(withFloor.decide(secret, ISSUED.plusSeconds(2879))).isEqualTo(RefreshAction.NONE);
        assertThat(withFloor.decide(secret, ISSUED.plusSeconds(2881))).isEqualTo(RefreshAction.RENEW);
    }

    @Test
    @DisplayName("Renewal is throttled by the request's minimum TTL unless expired")
    void minimumTtlThrottle() {
        GenericSecretRequest throttled = new GenericSecretRequest("JWT_SECRET", "app/", "jwt", "secret", Duration.ofSeconds(9));
        Secret secret = secretWithLease(10, throttled);

        assertThat(policy.decide(secret, ISSUED.plusSeconds(8))).isEqualTo(RefreshAction.NONE);
        assertThat(policy.decide(secret, ISSUED.plusSeconds(9))).isEqualTo(RefreshAction.RENEW);
        assertThat(policy.decide(secret, ISSUED.plusSeconds(10))).isEqualTo(RefreshAction.FETCH);
    }

    @Test
    @DisplayName("Static secrets are never renewed and are re-read after the refresh interval")
    void staticSecrets() {
        Secret secret = secretWithLease(0, REQUEST);

        assertThat(policy.decide(secret, ISSUED.plus(Duration.ofMinutes(4)))).isEqualTo(RefreshAction.NONE);
        assertThat(policy.decide(secret, ISSUED.plus(Duration.ofMinutes(5)))).isEqualTo(RefreshAction.FETCH);
    }

    @Test
    @DisplayName("Sessions are replaced when missing, expired or close to expiry")
    void sessionReplacement() {
        Lease session = Lease.fromSeconds("accessor", ISSUED, 100, true);

        assertThat(policy.sessionNeedsReplacement(null, ISSUED)).isTrue();
        assertThat(policy.sessionNeedsReplacement(session, ISSUED.plusSeconds(50))).isFalse();
        assertThat(policy.sessionNeedsReplacement(session, ISSUED.plusSeconds(81))).isTrue();
        assertThat(policy.sessionNeedsReplacement(Lease.fromSeconds("root", ISSUED, 0, false), ISSUED.plusSeconds(1_000_000)))
                .isFalse();
    }

    @Test
    @DisplayName("Threshold ratio outside [0, 1] is rejected")
    void rejectsInvalidRatio() {
        assertThatThrownBy(() -> new RenewalPolicy(1.5, Duration.ZERO, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
