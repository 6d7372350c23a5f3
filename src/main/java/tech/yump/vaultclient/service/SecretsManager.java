package tech.yump.vaultclient.service;

import lombok.extern.slf4j.Slf4j;
import tech.yump.vaultclient.audit.AuditHelper;
import tech.yump.vaultclient.client.SecretServiceClient;
import tech.yump.vaultclient.secrets.AuthSession;
import tech.yump.vaultclient.secrets.AuthenticationException;
import tech.yump.vaultclient.secrets.AwsSecretRequest;
import tech.yump.vaultclient.secrets.ConfigurationException;
import tech.yump.vaultclient.secrets.DatabaseSecretRequest;
import tech.yump.vaultclient.secrets.GenericSecretRequest;
import tech.yump.vaultclient.secrets.Lease;
import tech.yump.vaultclient.secrets.LeaseStatus;
import tech.yump.vaultclient.secrets.Secret;
import tech.yump.vaultclient.secrets.SecretEntry;
import tech.yump.vaultclient.secrets.SecretRequest;
import tech.yump.vaultclient.secrets.SecretServiceException;
import tech.yump.vaultclient.service.RenewalPolicy.RefreshAction;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fetches, stores and renews the secrets of a configured set of requests.
 * <p>
 * Secrets are checked synchronously on every {@link #yieldSecrets()} call: missing or expired
 * secrets are fetched, secrets close to expiry are renewed, all others are reused as they are.
 * Refreshes are serialized per secret name. Reading a fresh secret takes no lock, and a caller
 * that finds a refresh in flight keeps using the current value while it is unexpired.
 */
@Slf4j
public class SecretsManager implements AutoCloseable {

    static final String AWS_ACCESS_KEY_ID = "AWS_ACCESS_KEY_ID";
    static final String AWS_SECRET_ACCESS_KEY = "AWS_SECRET_ACCESS_KEY";
    static final String AWS_SESSION_TOKEN = "AWS_SESSION_TOKEN";

    private final SecretServiceClient client;
    private final AuthSessionManager sessions;
    private final RenewalPolicy policy;
    private final Clock clock;
    private final AuditHelper auditHelper;

    private volatile List<SecretRequest> requests = List.of();
    private final ConcurrentMap<String, SecretSlot> slots = new ConcurrentHashMap<>();

    public SecretsManager(SecretServiceClient client, AuthSessionManager sessions, RenewalPolicy policy,
                          Clock clock, AuditHelper auditHelper) {
        this.client = client;
        this.sessions = sessions;
        this.policy = policy;
        this.clock = clock;
        this.auditHelper = auditHelper;
    }

    /**
     * Replaces the set of managed requests. Secrets of requests that are gone, or whose
     * parameters changed, are discarded.
     *
     * @throws ConfigurationException if two requests share a name.
     */
    public synchronized void configure(List<SecretRequest> newRequests) {
        Set<String> names = new HashSet<>();
        for (SecretRequest request : newRequests) {
            if (!names.add(request.name())) {
                throw new ConfigurationException("Duplicate secret request name: " + request.name());
            }
        }

        List<SecretRequest> ordered = List.copyOf(newRequests);
        slots.keySet().retainAll(names);
        for (SecretRequest request : ordered) {
            SecretSlot slot = slots.get(request.name());
            if (slot != null) {
                slot.dropIfRequestChanged(request);
            }
        }
        requests = ordered;
        log.info("Managing {} secret request(s): {}", ordered.size(),
                ordered.stream().map(SecretRequest::name).toList());
    }

    public List<SecretRequest> requests() {
        return requests;
    }

    /**
     * Ensures every configured request has a current secret and returns one entry per request,
     * in configuration order. The returned list is immutable and new on every call.
     *
     * @throws SecretServiceException when a secret cannot be refreshed and no unexpired value remains.
     */
    public List<SecretEntry> yieldSecrets() {
        List<SecretRequest> snapshot = requests;
        List<SecretEntry> entries = new ArrayList<>(snapshot.size());
        for (SecretRequest request : snapshot) {
            entries.add(resolve(request));
        }
        return List.copyOf(entries);
    }

    /**
     * Lease metadata of all managed secrets, without their values.
     */
    public List<LeaseStatus> describe() {
        return requests.stream()
                .map(request -> {
                    SecretSlot slot = slots.get(request.name());
                    Secret secret = slot == null ? null : slot.secret;
                    if (secret == null) {
                        return new LeaseStatus(request.name(), request.kind(), request.describe(),
                                null, null, null, false, false);
                    }
                    Lease lease = secret.lease();
                    return new LeaseStatus(request.name(), request.kind(), request.describe(),
                            lease.leaseId().isEmpty() ? null : lease.leaseId(),
                            lease.issued(),
                            lease.isStatic() ? null : lease.expiresAt(),
                            lease.canBeRenewed(),
                            true);
                })
                .toList();
    }

    /**
     * Discards all held secrets and the auth session. Leases are left to expire on the service side.
     */
    @Override
    public void close() {
        slots.clear();
        sessions.invalidate();
        log.info("Secrets manager closed; held secrets discarded.");
    }

    // --- Resolution ---

    private SecretEntry resolve(SecretRequest request) {
        SecretSlot slot = slots.computeIfAbsent(request.name(), name -> new SecretSlot());

        Secret secret = slot.secret;
        if (secret != null && policy.decide(secret, clock.instant()) == RefreshAction.NONE) {
            return toEntry(request, secret, null);
        }

        if (!slot.lock.tryLock()) {
            Secret inFlight = slot.secret;
            if (inFlight != null && !inFlight.lease().isExpired(clock.instant())) {
                log.debug("Refresh of '{}' in progress elsewhere; using current value.", request.name());
                return toEntry(request, inFlight, null);
            }
            slot.lock.lock();
        }
        try {
            Instant now = clock.instant();
            secret = slot.secret;
            RefreshAction action = policy.decide(secret, now);
            if (action == RefreshAction.NONE) {
                return toEntry(request, secret, null);
            }

            try {
                Secret refreshed = refresh(request, secret, action);
                slot.secret = refreshed;
                return toEntry(request, refreshed, null);
            } catch (SecretServiceException e) {
                String auditAction = action == RefreshAction.RENEW ? "renew" : "fetch";
                if (secret != null && !secret.lease().isExpired(now)) {
                    log.warn("Could not {} secret '{}', keeping current value until {}: {}",
                            auditAction, request.name(), secret.lease().expiresAt(), e.getMessage());
                    auditHelper.logSecretEvent(auditAction, AuditHelper.OUTCOME_STALE, request,
                            secret.lease().leaseId(), e.getMessage());
                    return toEntry(request, secret, e);
                }
                log.error("Could not {} secret '{}' and no valid value remains: {}",
                        auditAction, request.name(), e.getMessage());
                auditHelper.logSecretEvent(auditAction, AuditHelper.OUTCOME_FAILURE, request, null, e.getMessage());
                throw e;
            }
        } finally {
            slot.lock.unlock();
        }
    }

    private Secret refresh(SecretRequest request, Secret current, RefreshAction action) {
        AuthSession session = sessions.currentSession();
        try {
            return perform(request, current, action, session);
        } catch (AuthenticationException e) {
            log.warn("Session token rejected while refreshing '{}'; logging in again.", request.name());
            sessions.invalidate();
            return perform(request, current, action, sessions.currentSession());
        }
    }

    private Secret perform(SecretRequest request, Secret current, RefreshAction action, AuthSession session) {
        Secret result;
        String auditAction;
        if (action == RefreshAction.RENEW) {
            auditAction = "renew";
            result = client.renew(current, session);
        } else {
            auditAction = "fetch";
            result = client.fetch(request, session);
        }
        auditHelper.logSecretEvent(auditAction, AuditHelper.OUTCOME_SUCCESS, request, result.lease().leaseId(), null);
        return result;
    }

    // --- Rendering ---

    private SecretEntry toEntry(SecretRequest request, Secret secret, SecretServiceException refreshFailure) {
        return new SecretEntry(request.name(), render(request, secret), refreshFailure);
    }

    /**
     * Output value of a secret: a String, or an ordered map of output keys for secrets
     * that expand to several keys.
     */
    static Object render(SecretRequest request, Secret secret) {
        if (request instanceof GenericSecretRequest generic) {
            return secret.requireField(generic.key());
        }
        if (request instanceof AwsSecretRequest) {
            Map<String, String> values = new LinkedHashMap<>();
            values.put(AWS_ACCESS_KEY_ID, secret.requireField("access_key"));
            values.put(AWS_SECRET_ACCESS_KEY, secret.requireField("secret_key"));
            String sessionToken = secret.optionalField("security_token");
            if (sessionToken != null && !sessionToken.isEmpty()) {
                values.put(AWS_SESSION_TOKEN, sessionToken);
            }
            return Collections.unmodifiableMap(values);
        }
        DatabaseSecretRequest database = (DatabaseSecretRequest) request;
        String username = secret.requireField("username");
        String password = secret.requireField("password");
        if (database.format() == DatabaseSecretRequest.OutputFormat.CREDENTIALS) {
            String prefix = database.name().toUpperCase(Locale.ROOT);
            Map<String, String> values = new LinkedHashMap<>();
            values.put(prefix + "_USERNAME", username);
            values.put(prefix + "_PASSWORD", password);
            return Collections.unmodifiableMap(values);
        }
        return database.formatUri(username, password);
    }

    private static final class SecretSlot {
        private final ReentrantLock lock = new ReentrantLock();
        private volatile Secret secret;

        void dropIfRequestChanged(SecretRequest request) {
            lock.lock();
            try {
                if (secret != null && !secret.request().equals(request)) {
                    secret = null;
                }
            } finally {
                lock.unlock();
            }
        }
    }
}
