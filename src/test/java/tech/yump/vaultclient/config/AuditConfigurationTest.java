package tech.yump.vaultclient.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import tech.yump.vaultclient.audit.AuditBackend;
import tech.yump.vaultclient.audit.LoggerAuditBackend;

import static org.assertj.core.api.Assertions.assertThat;

class AuditConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(TestConfig.class, AuditConfiguration.class)
            .withBean(ObjectMapper.class, ObjectMapper::new);

    @EnableConfigurationProperties(VaultClientProperties.class)
    static class TestConfig {}

    @Test
    @DisplayName("Audit backend: Should log to the application log by default")
    void defaultBackend() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(AuditBackend.class);
            assertThat(context.getBean(AuditBackend.class))
                    .isInstanceOfSatisfying(LoggerAuditBackend.class, backend ->
                            assertThat(backend.loggerName()).isEqualTo(LoggerAuditBackend.APPLICATION_LOGGER_NAME));
        });
    }

    @Test
    @DisplayName("Audit backend: Should log to the dedicated logger when vault.audit.backend=file")
    void fileBackend() {
        contextRunner
                .withPropertyValues(
                        "vault.audit.backend=file",
                        "vault.audit.file.path=target/test-audit/audit.log")
                .run(context -> assertThat(context.getBean(AuditBackend.class))
                        .isInstanceOfSatisfying(LoggerAuditBackend.class, backend ->
                                assertThat(backend.loggerName()).isEqualTo(LoggerAuditBackend.DEDICATED_LOGGER_NAME)));
    }
}
