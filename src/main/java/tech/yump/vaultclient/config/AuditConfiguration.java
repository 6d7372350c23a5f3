package tech.yump.vaultclient.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tech.yump.vaultclient.audit.AuditBackend;
import tech.yump.vaultclient.audit.LoggerAuditBackend;

/**
 * Selects where audit events go from {@code vault.audit.backend}.
 */
@Configuration
@Slf4j
public class AuditConfiguration {

    static final String FILE_BACKEND = "file";

    @Bean
    public AuditBackend auditBackend(VaultClientProperties properties, ObjectMapper objectMapper) {
        if (FILE_BACKEND.equals(properties.audit().backend())) {
            log.info("Audit events go to logger '{}'; its file is set by '{}'.",
                    LoggerAuditBackend.DEDICATED_LOGGER_NAME,
                    VaultClientProperties.AuditProperties.FileAuditProperties.PATH_PROPERTY);
            return LoggerAuditBackend.dedicated(objectMapper);
        }
        log.info("Audit events go to the application log via logger '{}'.", LoggerAuditBackend.APPLICATION_LOGGER_NAME);
        return LoggerAuditBackend.application(objectMapper);
    }
}
