package tech.yump.vaultclient.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.UrlPathHelper;
import tech.yump.vaultclient.secrets.SecretServiceException;
import tech.yump.vaultclient.service.ConfigManager;

import java.io.IOException;
import java.net.URI;
import java.util.List;
import java.util.UUID;

/**
 * Refreshes managed secrets into the application configuration before each HTTP request.
 * When secrets cannot be made available the request is answered with 503 and not processed.
 */
@Slf4j
public class SecretsRefreshFilter extends OncePerRequestFilter {

  public static final String REQUEST_ID_ATTR = "secretsRequestId";
  public static final String REQUEST_ID_MDC_KEY = "requestId";

  private final List<String> skippedPaths = List.of("/sys/secrets");
  private final UrlPathHelper urlPathHelper = new UrlPathHelper();

  private final boolean enabled;
  @Nullable
  private final ConfigManager configManager;
  private final ObjectMapper objectMapper;

  public SecretsRefreshFilter(boolean enabled, @Nullable ConfigManager configManager, ObjectMapper objectMapper) {
    this.enabled = enabled && configManager != null;
    this.configManager = configManager;
    this.objectMapper = objectMapper;
    log.debug("SecretsRefreshFilter initialized. Enabled: {}", this.enabled);
  }

  public static SecretsRefreshFilter disabled(ObjectMapper objectMapper) {
    return new SecretsRefreshFilter(false, null, objectMapper);
  }

  public boolean isEnabled() {
    return enabled;
  }

  @Override
  protected void doFilterInternal(
      @NonNull HttpServletRequest request,
      @NonNull HttpServletResponse response,
      @NonNull FilterChain filterChain) throws ServletException, IOException {

    String requestId = UUID.randomUUID().toString();
    request.setAttribute(REQUEST_ID_ATTR, requestId);
    MDC.put(REQUEST_ID_MDC_KEY, requestId);

    try {
      try {
        configManager.update();
      } catch (SecretServiceException e) {
        log.error("Secrets unavailable for {} {}: {}", request.getMethod(), request.getRequestURI(), e.getMessage());
        sendUnavailableResponse(request, response, requestId);
        return;
      }
      filterChain.doFilter(request, response);
    } finally {
      MDC.remove(REQUEST_ID_MDC_KEY);
    }
  }

  @Override
  protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
    if (!enabled) {
      log.trace("Skipping filter as secret refresh is disabled.");
      return true;
    }
    // Path below the servlet context path.
    String path = urlPathHelper.getPathWithinApplication(request);
    if (skippedPaths.contains(path)) {
      log.trace("Path {} does not need secrets, skipping SecretsRefreshFilter.", path);
      return true;
    }
    return false;
  }

  private void sendUnavailableResponse(HttpServletRequest request, HttpServletResponse response, String requestId)
      throws IOException {
    ProblemDetail problem = ProblemDetail.forStatusAndDetail(
        HttpStatus.SERVICE_UNAVAILABLE, "Secrets required to serve this request are currently unavailable.");
    problem.setTitle("Secrets Unavailable");
    problem.setInstance(URI.create(request.getRequestURI()));
    problem.setProperty("requestId", requestId);

    response.setStatus(HttpStatus.SERVICE_UNAVAILABLE.value());
    response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
    objectMapper.writeValue(response.getWriter(), problem);
  }
}
