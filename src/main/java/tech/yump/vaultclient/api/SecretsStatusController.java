package tech.yump.vaultclient.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import tech.yump.vaultclient.api.dto.SecretsStatusResponse;
import tech.yump.vaultclient.service.SecretsManager;

import java.util.List;

@RestController
@RequiredArgsConstructor
@Slf4j
@Tag(name = "System", description = "Secret lease status endpoints")
public class SecretsStatusController {

  private final ObjectProvider<SecretsManager> secretsManager;

  @GetMapping("/sys/secrets")
  @Operation(
          summary = "Get Secret Lease Status",
          description = "Lists the managed secrets with their lease id, issue and expiry times. Does not fetch or renew anything and never returns secret values."
  )
  @ApiResponse(responseCode = "200", description = "Lease status retrieved.",
          content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE,
                  schema = @Schema(implementation = SecretsStatusResponse.class)))
  public SecretsStatusResponse getSecretsStatus() {
    SecretsManager manager = secretsManager.getIfAvailable();
    if (manager == null) {
      log.debug("Secret status requested while the integration is disabled.");
      return new SecretsStatusResponse(false, List.of());
    }
    return new SecretsStatusResponse(true, manager.describe());
  }
}
