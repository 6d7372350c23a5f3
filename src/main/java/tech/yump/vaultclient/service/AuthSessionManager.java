package tech.yump.vaultclient.service;

import lombok.extern.slf4j.Slf4j;
import tech.yump.vaultclient.audit.AuditHelper;
import tech.yump.vaultclient.client.SecretServiceClient;
import tech.yump.vaultclient.secrets.AuthSession;
import tech.yump.vaultclient.secrets.SecretServiceException;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Holds the single auth session shared by all secret operations and replaces it
 * by logging in again once it expires or comes within the renewal threshold.
 * At most one login is in flight at any time.
 */
@Slf4j
public class AuthSessionManager {

    private final SecretServiceClient client;
    private final RenewalPolicy policy;
    private final Clock clock;
    private final AuditHelper auditHelper;
    private final String role;

    private final ReentrantLock lock = new ReentrantLock();
    private volatile AuthSession current;

    public AuthSessionManager(SecretServiceClient client, RenewalPolicy policy, Clock clock,
                              AuditHelper auditHelper, String role) {
        this.client = client;
        this.policy = policy;
        this.clock = clock;
        this.auditHelper = auditHelper;
        this.role = role;
    }

    /**
     * Returns a session usable for the next secret operation, logging in when needed.
     * If a replacement login fails while the held session is still unexpired, the held
     * session is returned and the failure is logged.
     *
     * @throws SecretServiceException when no usable session exists and login fails.
     */
    public AuthSession currentSession() {
        AuthSession session = current;
        if (session != null && !policy.sessionNeedsReplacement(session.lease(), clock.instant())) {
            return session;
        }

        lock.lock();
        try {
            session = current;
            Instant now = clock.instant();
            if (session != null && !policy.sessionNeedsReplacement(session.lease(), now)) {
                return session;
            }
            try {
                AuthSession replacement = client.authenticate();
                current = replacement;
                auditHelper.logAuthEvent(AuditHelper.OUTCOME_SUCCESS, role, null);
                return replacement;
            } catch (SecretServiceException e) {
                auditHelper.logAuthEvent(AuditHelper.OUTCOME_FAILURE, role, e.getMessage());
                if (session != null && !session.lease().isExpired(now)) {
                    log.warn("Login to secret service failed; keeping current session until it expires at {}: {}",
                            session.lease().expiresAt(), e.getMessage());
                    return session;
                }
                throw e;
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops the held session so the next operation logs in again.
     */
    public void invalidate() {
        lock.lock();
        try {
            current = null;
        } finally {
            lock.unlock();
        }
    }
}
