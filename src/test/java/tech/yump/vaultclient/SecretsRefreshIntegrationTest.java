package tech.yump.vaultclient;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.client.RestTemplate;
import tech.yump.vaultclient.config.VaultClientConfiguration;
import tech.yump.vaultclient.service.SecretsManager;
import tech.yump.vaultclient.web.SecretsRefreshTaskDecorator;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServiceUnavailable;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Runs the application with the integration enabled against a mocked secret service and checks
 * that secrets reach the environment through the request filter and the task decorator.
 */
@SpringBootTest(properties = {
        "vault.enabled=true",
        "vault.host=vault.test",
        "vault.scheme=http",
        "vault.auth.role=app-role",
        "vault.http.max-attempts=1",
        "vault.requests[0].kind=generic",
        "vault.requests[0].name=JWT_SECRET",
        "vault.requests[0].path=app/jwt",
        "vault.requests[0].key=secret"
})
@AutoConfigureMockMvc
@ActiveProfiles("test")
class SecretsRefreshIntegrationTest {

    private static final String BASE = "http://vault.test:8200";

    @TempDir
    static Path tokenDir;

    @DynamicPropertySource
    static void overrideProperties(DynamicPropertyRegistry registry) {
        registry.add("vault.auth.identity-token-path", () -> tokenDir.resolve("token").toString());
    }

    @BeforeAll
    static void writeIdentityToken() throws IOException {
        Files.writeString(tokenDir.resolve("token"), "k8s-jwt\n");
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    @Qualifier("vaultRestTemplate")
    private RestTemplate vaultRestTemplate;

    @Autowired
    private SecretsManager secretsManager;

    @Autowired
    private SecretsRefreshTaskDecorator taskDecorator;

    @Autowired
    private ConfigurableEnvironment environment;

    private MockRestServiceServer server;

    @BeforeEach
    void setUp() {
        // Start every test without a session or cached secrets.
        secretsManager.close();
        server = MockRestServiceServer.bindTo(vaultRestTemplate).build();
    }

    private void expectLoginAndRead(String value) {
        server.expect(requestTo(BASE + "/v1/auth/kubernetes/login"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().json("{\"role\": \"app-role\", \"jwt\": \"k8s-jwt\"}"))
                .andRespond(withSuccess("""
                        {"auth": {"client_token": "s.it-token", "accessor": "acc-it",
                                  "lease_duration": 3600, "renewable": true}}
                        """, MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/v1/secret/data/app/jwt"))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header("X-Vault-Token", "s.it-token"))
                .andRespond(withSuccess("""
                        {"lease_id": "", "lease_duration": 0, "renewable": false,
                         "data": {"data": {"secret": "%s"}, "metadata": {"version": 1}}}
                        """.formatted(value), MediaType.APPLICATION_JSON));
    }

    @Test
    @DisplayName("HTTP request: Should publish fetched secrets to the environment before the handler runs")
    void request_publishesSecretToEnvironment() throws Exception {
        expectLoginAndRead("s3cr3t");

        mockMvc.perform(get("/v3/api-docs"))
                .andExpect(status().isOk());

        server.verify();
        assertThat(environment.getPropertySources().contains(VaultClientConfiguration.PROPERTY_SOURCE_NAME)).isTrue();
        assertThat(environment.getProperty("JWT_SECRET")).isEqualTo("s3cr3t");

        // Static secret is still fresh; the second request must not call the service again.
        mockMvc.perform(get("/v3/api-docs"))
                .andExpect(status().isOk());
        server.verify();
    }

    @Test
    @DisplayName("HTTP request: Should answer 503 problem when the service is unavailable and nothing is cached")
    void request_serviceUnavailable_returnsProblem() throws Exception {
        server.expect(requestTo(BASE + "/v1/auth/kubernetes/login"))
                .andRespond(withServiceUnavailable());

        mockMvc.perform(get("/v3/api-docs"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.title", is("Secrets Unavailable")))
                .andExpect(jsonPath("$.status", is(503)))
                .andExpect(jsonPath("$.requestId").isNotEmpty());

        server.verify();
    }

    @Test
    @DisplayName("Task decorator: Should publish secrets before the task body runs")
    void taskDecorator_publishesSecretBeforeTask() {
        expectLoginAndRead("task-value");
        AtomicReference<String> seen = new AtomicReference<>();

        taskDecorator.decorate(() -> seen.set(environment.getProperty("JWT_SECRET"))).run();

        server.verify();
        assertThat(seen.get()).isEqualTo("task-value");
    }

    @Test
    @DisplayName("GET /sys/secrets: Should list lease status without fetching or exposing values")
    void status_listsLeasesWithoutFetching() throws Exception {
        mockMvc.perform(get("/sys/secrets"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.enabled", is(true)))
                .andExpect(jsonPath("$.secrets[0].name", is("JWT_SECRET")))
                .andExpect(jsonPath("$.secrets[0].fetched", is(false)))
                .andExpect(jsonPath("$.secrets[0].leaseId", nullValue()));

        server.verify();
    }
}
