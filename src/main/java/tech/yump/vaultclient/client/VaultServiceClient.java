package tech.yump.vaultclient.client;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.lang.Nullable;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.util.StringUtils;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import tech.yump.vaultclient.config.VaultClientProperties;
import tech.yump.vaultclient.secrets.AuthSession;
import tech.yump.vaultclient.secrets.AuthenticationException;
import tech.yump.vaultclient.secrets.AwsSecretRequest;
import tech.yump.vaultclient.secrets.DatabaseSecretRequest;
import tech.yump.vaultclient.secrets.GenericSecretRequest;
import tech.yump.vaultclient.secrets.Lease;
import tech.yump.vaultclient.secrets.LeaseRenewalException;
import tech.yump.vaultclient.secrets.PermissionDeniedException;
import tech.yump.vaultclient.secrets.Secret;
import tech.yump.vaultclient.secrets.SecretNotFoundException;
import tech.yump.vaultclient.secrets.SecretRequest;
import tech.yump.vaultclient.secrets.SecretServiceException;
import tech.yump.vaultclient.secrets.ServiceUnavailableException;
import tech.yump.vaultclient.service.RenewalPolicy;

import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * {@link SecretServiceClient} speaking the HashiCorp Vault HTTP API.
 * <p>
 * The {@link RestTemplate} is expected to carry the service base URL as its root URI;
 * paths used here are relative ({@code /v1/...}). Transient failures
 * ({@link ServiceUnavailableException}) are retried by the supplied {@link RetryTemplate}.
 */
@Slf4j
public class VaultServiceClient implements SecretServiceClient {

    static final String TOKEN_HEADER = "X-Vault-Token";
    static final String NAMESPACE_HEADER = "X-Vault-Namespace";

    static final List<String> AWS_REQUIRED_FIELDS = List.of("access_key", "secret_key");
    static final List<String> DATABASE_REQUIRED_FIELDS = List.of("username", "password");

    private final RestTemplate restTemplate;
    private final IdentityTokenSource identityTokenSource;
    private final VaultClientProperties properties;
    private final RetryTemplate retryTemplate;
    private final RenewalPolicy renewalPolicy;
    private final Clock clock;

    public VaultServiceClient(RestTemplate restTemplate,
                              IdentityTokenSource identityTokenSource,
                              VaultClientProperties properties,
                              RetryTemplate retryTemplate,
                              RenewalPolicy renewalPolicy,
                              Clock clock) {
        this.restTemplate = restTemplate;
        this.identityTokenSource = identityTokenSource;
        this.properties = properties;
        this.retryTemplate = retryTemplate;
        this.renewalPolicy = renewalPolicy;
        this.clock = clock;
    }

    // --- Authentication ---

    @Override
    public AuthSession authenticate() {
        String jwt = identityTokenSource.readToken();
        String role = properties.auth().role();
        String path = apiPath("auth", properties.auth().mountPoint(), "login");
        Map<String, String> body = Map.of("role", role, "jwt", jwt);

        log.debug("Logging in to secret service at {} with role '{}'", path, role);
        Instant issued = clock.instant();
        JsonNode response;
        try {
            response = withRetry(() -> exchange(HttpMethod.POST, path, body, null, "login as role " + role));
        } catch (ServiceUnavailableException | AuthenticationException e) {
            throw e;
        } catch (SecretServiceException e) {
            throw new AuthenticationException("Login rejected for role '" + role + "': " + e.getMessage(), e);
        }

        JsonNode auth = response.path("auth");
        String clientToken = requireText(auth, "client_token", path);
        Lease lease = Lease.fromSeconds(
                auth.path("accessor").asText(""),
                issued,
                auth.path("lease_duration").asLong(0),
                auth.path("renewable").asBoolean(false));
        log.info("Authenticated with secret service as role '{}'; token valid for {}s", role, lease.duration().toSeconds());
        return new AuthSession(clientToken, lease);
    }

    // --- Fetch ---

    @Override
    public Secret fetch(SecretRequest request, AuthSession session) {
        Instant issued = clock.instant();
        // Exhaustive over the sealed request hierarchy.
        Secret secret;
        if (request instanceof GenericSecretRequest generic) {
            secret = fetchGeneric(generic, session, issued);
        } else if (request instanceof AwsSecretRequest aws) {
            secret = fetchCredentials(aws, aws.role(), AWS_REQUIRED_FIELDS, session, issued);
        } else if (request instanceof DatabaseSecretRequest database) {
            secret = fetchCredentials(database, database.role(), DATABASE_REQUIRED_FIELDS, session, issued);
        } else {
            throw new SecretServiceException("Unsupported secret request type: " + request.getClass().getName());
        }
        log.debug("Fetched secret {} (lease '{}', {}s)", request.describe(),
                secret.lease().leaseId(), secret.lease().duration().toSeconds());
        return secret;
    }

    private Secret fetchGeneric(GenericSecretRequest request, AuthSession session, Instant issued) {
        String path = apiPath(request.mountPoint(), "data", request.path());
        JsonNode response = withRetry(() -> exchange(HttpMethod.GET, path, null, session, request.describe()));

        JsonNode value = response.path("data").path("data").path(request.key());
        if (value.isMissingNode() || value.isNull()) {
            throw new SecretNotFoundException(request.describe());
        }
        String text = value.isValueNode() ? value.asText() : value.toString();
        return new Secret(Map.of(request.key(), text), leaseOf(response, issued), request);
    }

    private Secret fetchCredentials(SecretRequest request, String role, List<String> requiredFields,
                                    AuthSession session, Instant issued) {
        String path = apiPath(request.mountPoint(), "creds", role);
        JsonNode response = withRetry(() -> exchange(HttpMethod.GET, path, null, session, request.describe()));

        JsonNode data = response.path("data");
        for (String field : requiredFields) {
            requireText(data, field, path);
        }
        return new Secret(textFields(data), leaseOf(response, issued), request);
    }

    // --- Renewal ---

    @Override
    public Secret renew(Secret secret, AuthSession session) {
        Lease lease = secret.lease();
        SecretRequest request = secret.request();
        if (!lease.canBeRenewed()) {
            log.debug("Lease of {} cannot be renewed; fetching a new secret.", request.describe());
            return fetch(request, session);
        }

        Lease renewed;
        try {
            renewed = renewLease(lease, session);
        } catch (AuthenticationException e) {
            throw e;
        } catch (LeaseRenewalException e) {
            log.info("{}; fetching a new secret for {}.", e.getMessage(), request.describe());
            return fetch(request, session);
        } catch (SecretServiceException e) {
            log.warn("Renewal of lease {} failed ({}); fetching a new secret for {}.",
                    lease.leaseId(), e.getMessage(), request.describe());
            return fetch(request, session);
        }

        // At its maximum TTL the service still answers 200, with the lease cut to what is left.
        if (renewed.isStatic() || renewalPolicy.isDue(renewed, clock.instant())) {
            log.info("Lease {} reached its maximum TTL ({}s granted); fetching a new secret for {}.",
                    lease.leaseId(), renewed.duration().toSeconds(), request.describe());
            return fetch(request, session);
        }
        log.debug("Renewed lease {} for {}s", renewed.leaseId(), renewed.duration().toSeconds());
        return secret.withLease(renewed);
    }

    private Lease renewLease(Lease lease, AuthSession session) {
        String path = apiPath("sys", "leases", "renew");
        Map<String, Object> body = Map.of(
                "lease_id", lease.leaseId(),
                "increment", properties.renewal().increment().toSeconds());

        Instant issued = clock.instant();
        JsonNode response;
        try {
            response = withRetry(() -> exchange(HttpMethod.PUT, path, body, session, "renew lease " + lease.leaseId()));
        } catch (PermissionDeniedException e) {
            throw new LeaseRenewalException(lease.leaseId(), "permission denied");
        } catch (SecretServiceException e) {
            if (e.getCause() instanceof HttpClientErrorException.BadRequest badRequest) {
                throw new LeaseRenewalException(lease.leaseId(), badRequest.getResponseBodyAsString().trim());
            }
            throw e;
        }

        String leaseId = response.path("lease_id").asText(lease.leaseId());
        return Lease.fromSeconds(
                leaseId.isEmpty() ? lease.leaseId() : leaseId,
                issued,
                response.path("lease_duration").asLong(0),
                response.path("renewable").asBoolean(false));
    }

    // --- HTTP plumbing ---

    private JsonNode withRetry(Supplier<JsonNode> call) {
        return retryTemplate.execute(context -> {
            if (context.getRetryCount() > 0) {
                log.warn("Retrying secret service call (attempt {}) after: {}",
                        context.getRetryCount() + 1, context.getLastThrowable().getMessage());
            }
            return call.get();
        });
    }

    private JsonNode exchange(HttpMethod method, String path, @Nullable Object body,
                              @Nullable AuthSession session, String description) {
        HttpEntity<Object> entity = new HttpEntity<>(body, createHeaders(session));
        try {
            ResponseEntity<JsonNode> response = restTemplate.exchange(path, method, entity, JsonNode.class);
            if (response.getBody() == null) {
                throw new SecretServiceException("Could not use response for " + description + ": empty body");
            }
            return response.getBody();
        } catch (HttpClientErrorException e) {
            throw translateClientError(e, description);
        } catch (HttpServerErrorException e) {
            throw new ServiceUnavailableException(
                    "Secret service failed to " + description + ": " + e.getStatusCode(), e);
        } catch (ResourceAccessException e) {
            throw new ServiceUnavailableException(
                    "Secret service unreachable while trying to " + description + ": " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new SecretServiceException("Could not use response for " + description + ": " + e.getMessage(), e);
        }
    }

    private SecretServiceException translateClientError(HttpClientErrorException e, String description) {
        if (e instanceof HttpClientErrorException.Forbidden) {
            return new PermissionDeniedException(description);
        }
        if (e instanceof HttpClientErrorException.NotFound) {
            return new SecretNotFoundException(description);
        }
        if (e instanceof HttpClientErrorException.Unauthorized) {
            return new AuthenticationException("Secret service rejected the session token while trying to " + description, e);
        }
        if (e instanceof HttpClientErrorException.TooManyRequests) {
            return new ServiceUnavailableException("Secret service rate limited " + description, e);
        }
        return new SecretServiceException("Secret service refused to " + description + ": " + e.getStatusCode(), e);
    }

    private HttpHeaders createHeaders(@Nullable AuthSession session) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (session != null) {
            headers.set(TOKEN_HEADER, session.clientToken());
        }
        if (StringUtils.hasText(properties.namespace())) {
            headers.set(NAMESPACE_HEADER, properties.namespace());
        }
        return headers;
    }

    /**
     * Joins path segments under {@code /v1}, tolerating leading and trailing slashes in mount points.
     */
    static String apiPath(String... segments) {
        return "/v1/" + Arrays.stream(segments)
                .map(segment -> StringUtils.trimTrailingCharacter(StringUtils.trimLeadingCharacter(segment, '/'), '/'))
                .filter(StringUtils::hasText)
                .collect(Collectors.joining("/"));
    }

    private Lease leaseOf(JsonNode response, Instant issued) {
        return Lease.fromSeconds(
                response.path("lease_id").asText(""),
                issued,
                response.path("lease_duration").asLong(0),
                response.path("renewable").asBoolean(false));
    }

    private static String requireText(JsonNode node, String field, String path) {
        JsonNode value = node.path(field);
        if (!value.isValueNode() || value.isNull() || value.asText().isEmpty()) {
            throw new SecretServiceException("Could not use response from " + path + ": missing field '" + field + "'");
        }
        return value.asText();
    }

    private static Map<String, Object> textFields(JsonNode data) {
        Map<String, Object> fields = new LinkedHashMap<>();
        data.fields().forEachRemaining(field -> {
            JsonNode value = field.getValue();
            if (!value.isNull()) {
                fields.put(field.getKey(), value.isValueNode() ? value.asText() : value.toString());
            }
        });
        return fields;
    }
}
