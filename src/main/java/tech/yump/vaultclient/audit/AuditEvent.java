package tech.yump.vaultclient.audit;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.time.Instant;
import java.util.Map;

/**
 * A single audit log entry for an interaction with the secret service.
 * Never carries secret values or tokens; logged as JSON.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuditEvent(
        Instant timestamp,
        String type,            // "auth" or "secret"
        String action,          // "login", "fetch", "renew"
        String outcome,         // "success", "failure", "stale"

        // Request id of the unit of work that triggered the call, when there is one
        String requestId,

        SecretInfo secretInfo,

        String errorMessage,

        Map<String, Object> data
) {

    /**
     * Identifies the secret an event is about.
     */
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record SecretInfo(
            String name,
            String kind,
            String source,      // e.g. generic:secret/:jwt:key
            String leaseId
    ) {}
}
