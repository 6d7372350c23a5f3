package tech.yump.vaultclient.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;
import tech.yump.vaultclient.config.validation.ValidSecretRequest;
import tech.yump.vaultclient.secrets.AwsSecretRequest;
import tech.yump.vaultclient.secrets.DatabaseSecretRequest;
import tech.yump.vaultclient.secrets.GenericSecretRequest;
import tech.yump.vaultclient.secrets.SecretKind;
import tech.yump.vaultclient.secrets.SecretRequest;

import java.time.Duration;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Configuration properties for the secret service client under the 'vault' prefix.
 */
@ConfigurationProperties(prefix = "vault")
@Validated
public record VaultClientProperties(

        boolean enabled,

        String host,

        @Min(value = 1, message = "Service port (vault.port) must be between 1 and 65535.")
        @Max(value = 65535, message = "Service port (vault.port) must be between 1 and 65535.")
        Integer port,

        @Pattern(regexp = "https?", message = "Service scheme (vault.scheme) must be 'http' or 'https'.")
        String scheme,

        String caCertPath,

        String namespace,

        @Valid
        AuthProperties auth,

        @Valid
        RenewalProperties renewal,

        @Valid
        HttpProperties http,

        @Valid
        List<SecretRequestProperties> requests,

        @Valid
        AuditProperties audit
) {
    public static final int DEFAULT_PORT = 8200;
    public static final String DEFAULT_SCHEME = "https";

    public VaultClientProperties {
        port = port == null ? DEFAULT_PORT : port;
        scheme = StringUtils.hasText(scheme) ? scheme : DEFAULT_SCHEME;
        auth = auth == null ? new AuthProperties(null, null, null) : auth;
        renewal = renewal == null ? new RenewalProperties(null, null, null, null) : renewal;
        http = http == null ? new HttpProperties(null, null, null, null) : http;
        requests = requests == null ? Collections.emptyList() : requests;
        audit = audit == null ? new AuditProperties(null, null) : audit;
    }

    @AssertTrue(message = "Service host (vault.host) must be provided when vault.enabled=true.")
    public boolean isHostValid() {
        return !enabled || StringUtils.hasText(host);
    }

    @AssertTrue(message = "Service role (vault.auth.role) must be provided when vault.enabled=true.")
    public boolean isRoleValid() {
        return !enabled || StringUtils.hasText(auth.role());
    }

    @AssertTrue(message = "Secret request names (vault.requests[*].name) must be unique.")
    public boolean isRequestNamesUnique() {
        Set<String> names = new HashSet<>();
        return requests.stream()
                .map(SecretRequestProperties::name)
                .filter(Objects::nonNull)
                .allMatch(names::add);
    }

    public String baseUrl() {
        return scheme + "://" + host + ":" + port;
    }

    /**
     * Converts the configured descriptors into typed requests, in configuration order.
     *
     * @throws tech.yump.vaultclient.secrets.ConfigurationException if a descriptor is invalid.
     */
    public List<SecretRequest> secretRequests() {
        return requests.stream()
                .map(SecretRequestProperties::toSecretRequest)
                .toList();
    }

    // --- AuthProperties ---
    @Validated
    public record AuthProperties(
            String role,
            String identityTokenPath,
            String mountPoint
    ) {
        public static final String DEFAULT_TOKEN_PATH = "/var/run/secrets/kubernetes.io/serviceaccount/token";
        public static final String DEFAULT_MOUNT_POINT = "kubernetes";

        public AuthProperties {
            identityTokenPath = StringUtils.hasText(identityTokenPath) ? identityTokenPath : DEFAULT_TOKEN_PATH;
            mountPoint = StringUtils.hasText(mountPoint) ? mountPoint : DEFAULT_MOUNT_POINT;
        }
    }

    // --- RenewalProperties ---
    @Validated
    public record RenewalProperties(
            @DecimalMin(value = "0.0", message = "Renewal threshold ratio (vault.renewal.threshold-ratio) must be between 0 and 1.")
            @DecimalMax(value = "1.0", message = "Renewal threshold ratio (vault.renewal.threshold-ratio) must be between 0 and 1.")
            Double thresholdRatio,

            Duration minimumRemaining,

            Duration increment,

            Duration staticRefreshInterval
    ) {
        public RenewalProperties {
            thresholdRatio = thresholdRatio == null ? 0.2 : thresholdRatio;
            minimumRemaining = minimumRemaining == null ? Duration.ofSeconds(30) : minimumRemaining;
            increment = increment == null ? Duration.ofHours(1) : increment;
            staticRefreshInterval = staticRefreshInterval == null ? Duration.ofMinutes(5) : staticRefreshInterval;
        }
    }

    // --- HttpProperties ---
    @Validated
    public record HttpProperties(
            Duration connectTimeout,

            Duration readTimeout,

            @Min(value = 1, message = "HTTP attempts (vault.http.max-attempts) must be at least 1.")
            Integer maxAttempts,

            Duration backoff
    ) {
        public HttpProperties {
            connectTimeout = connectTimeout == null ? Duration.ofSeconds(3) : connectTimeout;
            readTimeout = readTimeout == null ? Duration.ofSeconds(5) : readTimeout;
            maxAttempts = maxAttempts == null ? 3 : maxAttempts;
            backoff = backoff == null ? Duration.ofMillis(500) : backoff;
        }
    }

    // --- SecretRequestProperties ---
    /**
     * Loosely typed secret request descriptor as it appears in configuration.
     * Kind-specific fields are checked by {@link ValidSecretRequest} at bind time.
     */
    @ValidSecretRequest
    public record SecretRequestProperties(
            String kind,
            String name,
            String mountPoint,
            String path,
            String key,
            String role,
            String engine,
            String host,
            String port,
            String database,
            String params,
            DatabaseSecretRequest.OutputFormat format,
            Duration minimumTtl
    ) {
        public SecretRequest toSecretRequest() {
            SecretKind secretKind = SecretKind.fromSlug(kind);
            return switch (secretKind) {
                case GENERIC -> new GenericSecretRequest(name, mountPoint, path, key, minimumTtl);
                case AWS -> new AwsSecretRequest(name, mountPoint, role, minimumTtl);
                case DATABASE -> new DatabaseSecretRequest(
                        name, mountPoint, role, engine, host, port, database, params, format, minimumTtl);
            };
        }
    }

    // --- AuditProperties ---
    @Validated
    public record AuditProperties(
            @Pattern(regexp = "slf4j|file", message = "Audit backend (vault.audit.backend) must be 'slf4j' or 'file'.")
            String backend,

            @Valid
            FileAuditProperties file
    ) {
        public AuditProperties {
            backend = StringUtils.hasText(backend) ? backend : "slf4j";
        }

        public record FileAuditProperties(String path) {
            public static final String PATH_PROPERTY = "vault.audit.file.path";
        }
    }
}
