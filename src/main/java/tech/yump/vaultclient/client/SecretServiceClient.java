package tech.yump.vaultclient.client;

import tech.yump.vaultclient.secrets.AuthSession;
import tech.yump.vaultclient.secrets.Secret;
import tech.yump.vaultclient.secrets.SecretRequest;

/**
 * Thin wrapper over the secret service API. Implementations perform network I/O only
 * and hold no state beyond their configuration.
 */
public interface SecretServiceClient {

    /**
     * Exchanges the platform identity token for a service token.
     *
     * @throws tech.yump.vaultclient.secrets.AuthenticationException if the token is unusable or rejected.
     */
    AuthSession authenticate();

    /**
     * Issues a fresh secret for the request.
     *
     * @throws tech.yump.vaultclient.secrets.PermissionDeniedException  on 403.
     * @throws tech.yump.vaultclient.secrets.SecretNotFoundException    on 404 or when the requested key is absent.
     * @throws tech.yump.vaultclient.secrets.ServiceUnavailableException on network failure, timeout or 5xx.
     */
    Secret fetch(SecretRequest request, AuthSession session);

    /**
     * Extends the lease of a secret. When the lease cannot be extended (not renewable, denied,
     * capped at its maximum TTL, or the renewal call failed) a fresh secret is fetched instead,
     * exactly once, and that fetch decides the outcome.
     *
     * @throws tech.yump.vaultclient.secrets.AuthenticationException when the session token is rejected; nothing is fetched.
     */
    Secret renew(Secret secret, AuthSession session);
}
