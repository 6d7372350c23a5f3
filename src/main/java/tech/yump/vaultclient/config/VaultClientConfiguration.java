package tech.yump.vaultclient.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.ssl.SslBundle;
import org.springframework.boot.ssl.pem.PemSslStoreBundle;
import org.springframework.boot.ssl.pem.PemSslStoreDetails;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.MapPropertySource;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestTemplate;
import tech.yump.vaultclient.audit.AuditBackend;
import tech.yump.vaultclient.audit.AuditHelper;
import tech.yump.vaultclient.client.FileIdentityTokenSource;
import tech.yump.vaultclient.client.IdentityTokenSource;
import tech.yump.vaultclient.client.SecretServiceClient;
import tech.yump.vaultclient.client.VaultServiceClient;
import tech.yump.vaultclient.secrets.ServiceUnavailableException;
import tech.yump.vaultclient.service.AuthSessionManager;
import tech.yump.vaultclient.service.ConfigManager;
import tech.yump.vaultclient.service.RenewalPolicy;
import tech.yump.vaultclient.service.SecretsManager;
import tech.yump.vaultclient.web.SecretsRefreshFilter;
import tech.yump.vaultclient.web.SecretsRefreshTaskDecorator;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Configuration
@Slf4j
public class VaultClientConfiguration {

  public static final String PROPERTY_SOURCE_NAME = "vaultSecrets";

  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public AuditHelper auditHelper(AuditBackend auditBackend, Clock clock) {
    return new AuditHelper(auditBackend, clock);
  }

  /**
   * Beans talking to the secret service. Only created when vault.enabled=true.
   */
  @Configuration(proxyBeanMethods = false)
  @ConditionalOnProperty(name = "vault.enabled", havingValue = "true")
  static class EnabledConfiguration {

    @Bean
    public RestTemplate vaultRestTemplate(RestTemplateBuilder builder, VaultClientProperties properties) {
      RestTemplateBuilder configured = builder
          .rootUri(properties.baseUrl())
          .setConnectTimeout(properties.http().connectTimeout())
          .setReadTimeout(properties.http().readTimeout());
      if (StringUtils.hasText(properties.caCertPath())) {
        log.info("Trusting CA bundle at {} for the secret service.", properties.caCertPath());
        PemSslStoreDetails trustStore = PemSslStoreDetails.forCertificate(properties.caCertPath());
        configured = configured.setSslBundle(SslBundle.of(new PemSslStoreBundle(null, trustStore)));
      }
      return configured.build();
    }

    @Bean
    public RetryTemplate vaultRetryTemplate(VaultClientProperties properties) {
      return RetryTemplate.builder()
          .maxAttempts(properties.http().maxAttempts())
          .fixedBackoff(Math.max(1L, properties.http().backoff().toMillis()))
          .retryOn(ServiceUnavailableException.class)
          .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public IdentityTokenSource identityTokenSource(VaultClientProperties properties, Clock clock) {
      return new FileIdentityTokenSource(Path.of(properties.auth().identityTokenPath()), clock);
    }

    @Bean
    public SecretServiceClient secretServiceClient(RestTemplate vaultRestTemplate,
                                                   IdentityTokenSource identityTokenSource,
                                                   VaultClientProperties properties,
                                                   RetryTemplate vaultRetryTemplate,
                                                   RenewalPolicy renewalPolicy,
                                                   Clock clock) {
      log.info("Configuring secret service client for {}", properties.baseUrl());
      return new VaultServiceClient(vaultRestTemplate, identityTokenSource, properties, vaultRetryTemplate,
          renewalPolicy, clock);
    }

    @Bean
    public RenewalPolicy renewalPolicy(VaultClientProperties properties) {
      VaultClientProperties.RenewalProperties renewal = properties.renewal();
      return new RenewalPolicy(renewal.thresholdRatio(), renewal.minimumRemaining(), renewal.staticRefreshInterval());
    }

    @Bean
    public AuthSessionManager authSessionManager(SecretServiceClient secretServiceClient, RenewalPolicy renewalPolicy,
                                                 Clock clock, AuditHelper auditHelper,
                                                 VaultClientProperties properties) {
      return new AuthSessionManager(secretServiceClient, renewalPolicy, clock, auditHelper, properties.auth().role());
    }

    @Bean
    public SecretsManager secretsManager(SecretServiceClient secretServiceClient, AuthSessionManager authSessionManager,
                                         RenewalPolicy renewalPolicy, Clock clock, AuditHelper auditHelper,
                                         VaultClientProperties properties) {
      SecretsManager manager = new SecretsManager(secretServiceClient, authSessionManager, renewalPolicy, clock, auditHelper);
      manager.configure(properties.secretRequests());
      return manager;
    }

    @Bean
    public ConfigManager configManager(SecretsManager secretsManager, ConfigurableEnvironment environment) {
      Map<String, Object> secrets = new ConcurrentHashMap<>();
      environment.getPropertySources().addFirst(new MapPropertySource(PROPERTY_SOURCE_NAME, secrets));
      log.debug("Registered '{}' property source ahead of all others.", PROPERTY_SOURCE_NAME);
      return new ConfigManager(secretsManager, secrets);
    }

    @Bean
    public SecretsRefreshFilter secretsRefreshFilter(ConfigManager configManager, ObjectMapper objectMapper) {
      return new SecretsRefreshFilter(true, configManager, objectMapper);
    }

    @Bean
    public SecretsRefreshTaskDecorator secretsRefreshTaskDecorator(ConfigManager configManager) {
      return new SecretsRefreshTaskDecorator(true, configManager);
    }
  }

  /**
   * No-op hooks, so the application runs unchanged without a secret service.
   */
  @Configuration(proxyBeanMethods = false)
  @ConditionalOnProperty(name = "vault.enabled", havingValue = "false", matchIfMissing = true)
  static class DisabledConfiguration {

    @Bean
    public SecretsRefreshFilter secretsRefreshFilter(ObjectMapper objectMapper) {
      log.warn("Secret service integration is disabled (vault.enabled=false). Secrets will not be fetched.");
      return SecretsRefreshFilter.disabled(objectMapper);
    }

    @Bean
    public SecretsRefreshTaskDecorator secretsRefreshTaskDecorator() {
      return SecretsRefreshTaskDecorator.disabled();
    }
  }
}
