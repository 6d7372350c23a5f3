package tech.yump.vaultclient.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;
import org.slf4j.event.Level;

/**
 * Writes audit events as single-line JSON through a named SLF4J logger, tagged with the
 * {@link #AUDIT_MARKER}. The level follows the outcome: failures at ERROR, values kept
 * stale after a failed refresh at WARN, everything else at INFO.
 * <p>
 * {@link #application(ObjectMapper)} logs next to the application output with an
 * {@code AUDIT_EVENT:} prefix. {@link #dedicated(ObjectMapper)} logs bare JSON to
 * {@link #DEDICATED_LOGGER_NAME}, which logback-spring.xml routes to the audit file only.
 */
@Slf4j
public class LoggerAuditBackend implements AuditBackend {

    public static final String APPLICATION_LOGGER_NAME = "tech.yump.vaultclient.audit.AUDIT";
    public static final String DEDICATED_LOGGER_NAME = "tech.yump.vaultclient.audit.FILE_AUDIT";
    public static final Marker AUDIT_MARKER = MarkerFactory.getMarker("AUDIT");

    static final String APPLICATION_PREFIX = "AUDIT_EVENT: ";

    private final ObjectMapper objectMapper;
    private final Logger auditLogger;
    private final String prefix;

    LoggerAuditBackend(ObjectMapper objectMapper, String loggerName, String prefix) {
        this.objectMapper = objectMapper;
        this.auditLogger = LoggerFactory.getLogger(loggerName);
        this.prefix = prefix;
    }

    public static LoggerAuditBackend application(ObjectMapper objectMapper) {
        return new LoggerAuditBackend(objectMapper, APPLICATION_LOGGER_NAME, APPLICATION_PREFIX);
    }

    public static LoggerAuditBackend dedicated(ObjectMapper objectMapper) {
        return new LoggerAuditBackend(objectMapper, DEDICATED_LOGGER_NAME, "");
    }

    public String loggerName() {
        return auditLogger.getName();
    }

    @Override
    public void publish(AuditEvent event) {
        if (event == null) {
            log.warn("Attempted to publish a null audit event.");
            return;
        }

        String json;
        try {
            json = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            // Kept out of the audit logger so the dedicated file stays pure JSON.
            log.error("Failed to serialize audit event (type={}, action={}, outcome={}).",
                    event.type(), event.action(), event.outcome(), e);
            return;
        }
        auditLogger.atLevel(levelFor(event.outcome()))
                .addMarker(AUDIT_MARKER)
                .log(prefix + json);
    }

    static Level levelFor(String outcome) {
        if (outcome == null) {
            return Level.INFO;
        }
        return switch (outcome) {
            case AuditHelper.OUTCOME_FAILURE -> Level.ERROR;
            case AuditHelper.OUTCOME_STALE -> Level.WARN;
            default -> Level.INFO;
        };
    }
}
