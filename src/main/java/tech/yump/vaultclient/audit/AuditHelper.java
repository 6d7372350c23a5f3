package tech.yump.vaultclient.audit;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.lang.Nullable;
import tech.yump.vaultclient.secrets.SecretRequest;
import tech.yump.vaultclient.web.SecretsRefreshFilter;

import java.time.Clock;
import java.util.Map;

@RequiredArgsConstructor
@Slf4j
public class AuditHelper {

    public static final String TYPE_AUTH = "auth";
    public static final String TYPE_SECRET = "secret";

    public static final String OUTCOME_SUCCESS = "success";
    public static final String OUTCOME_FAILURE = "failure";
    public static final String OUTCOME_STALE = "stale";

    private final AuditBackend auditBackend;
    private final Clock clock;

    /**
     * Logs the outcome of a login against the secret service.
     *
     * @param outcome      "success" or "failure".
     * @param role         Role the client logged in as.
     * @param errorMessage Optional error message (for failures).
     */
    public void logAuthEvent(String outcome, String role, @Nullable String errorMessage) {
        logEventInternal(TYPE_AUTH, "login", outcome, null, errorMessage, Map.of("role", role));
    }

    /**
     * Logs the outcome of a fetch or renewal of a managed secret.
     *
     * @param action       "fetch" or "renew".
     * @param outcome      "success", "failure", or "stale" when a previous value is kept.
     * @param request      Request the secret belongs to.
     * @param leaseId      Lease id of the resulting secret, if any.
     * @param errorMessage Optional error message (for failures).
     */
    public void logSecretEvent(String action, String outcome, SecretRequest request,
                               @Nullable String leaseId, @Nullable String errorMessage) {
        AuditEvent.SecretInfo secretInfo = AuditEvent.SecretInfo.builder()
                .name(request.name())
                .kind(request.kind().slug())
                .source(request.describe())
                .leaseId(leaseId == null || leaseId.isEmpty() ? null : leaseId)
                .build();
        logEventInternal(TYPE_SECRET, action, outcome, secretInfo, errorMessage, null);
    }

    private void logEventInternal(
            String type,
            String action,
            String outcome,
            @Nullable AuditEvent.SecretInfo secretInfo,
            @Nullable String errorMessage,
            @Nullable Map<String, Object> data) {
        try {
            AuditEvent auditEvent = AuditEvent.builder()
                    .timestamp(clock.instant())
                    .type(type)
                    .action(action)
                    .outcome(outcome)
                    .requestId(MDC.get(SecretsRefreshFilter.REQUEST_ID_MDC_KEY))
                    .secretInfo(secretInfo)
                    .errorMessage(errorMessage)
                    .data(data != null && !data.isEmpty() ? data : null)
                    .build();

            auditBackend.publish(auditEvent);

        } catch (Exception e) {
            log.error("Failed to log audit event in AuditHelper: Type={}, Action={}, Outcome={}, Error={}",
                    type, action, outcome, e.getMessage(), e);
        }
    }
}
