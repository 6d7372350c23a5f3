package tech.yump.vaultclient.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import tech.yump.vaultclient.secrets.LeaseStatus;

import java.util.List;

@Schema(description = "Lease metadata of the secrets managed by this application. Never contains secret values.")
public record SecretsStatusResponse(
        @Schema(description = "Whether the secret service integration is enabled.", example = "true", requiredMode = Schema.RequiredMode.REQUIRED)
        boolean enabled,

        @Schema(description = "One entry per configured secret request, in configuration order.", requiredMode = Schema.RequiredMode.REQUIRED)
        List<LeaseStatus> secrets
) {
}
