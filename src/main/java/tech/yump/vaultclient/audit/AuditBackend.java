package tech.yump.vaultclient.audit;

/**
 * Receives audit events about logins and secret fetches or renewals.
 * Events never carry secret values or tokens.
 */
@FunctionalInterface
public interface AuditBackend {

    void publish(AuditEvent event);
}
