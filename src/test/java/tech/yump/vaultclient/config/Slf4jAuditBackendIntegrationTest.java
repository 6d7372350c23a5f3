package tech.yump.vaultclient.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;
import org.springframework.test.context.ActiveProfiles;
import tech.yump.vaultclient.audit.AuditBackend;
import tech.yump.vaultclient.audit.AuditHelper;
import tech.yump.vaultclient.audit.LoggerAuditBackend;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration tests for AuditConfiguration focusing on the SLF4j backend.
 */
@SpringBootTest
@DisplayName("Integration Test: SLF4j Audit Backend (Default)")
@ActiveProfiles("test")
@ExtendWith(OutputCaptureExtension.class)
public class Slf4jAuditBackendIntegrationTest {

    @Autowired
    private AuditBackend auditBackend;
    @Autowired
    private AuditHelper auditHelper;

    @Test
    void shouldUseSlf4jAuditBackendAndLogToConsole(CapturedOutput output) {
        assertThat(auditBackend)
                .withFailMessage("Expected the application-log audit backend as the default")
                .isInstanceOfSatisfying(LoggerAuditBackend.class, backend ->
                        assertThat(backend.loggerName()).isEqualTo(LoggerAuditBackend.APPLICATION_LOGGER_NAME));

        String role = "role-" + UUID.randomUUID();
        auditHelper.logAuthEvent(AuditHelper.OUTCOME_SUCCESS, role, null);

        assertThat(output.getOut())
                .withFailMessage("Audit event should appear in console output with the default backend")
                .contains("AUDIT_EVENT:")
                .contains("\"type\":\"auth\"")
                .contains("\"action\":\"login\"")
                .contains(role);
    }
}
