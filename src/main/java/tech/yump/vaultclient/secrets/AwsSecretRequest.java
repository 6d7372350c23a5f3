package tech.yump.vaultclient.secrets;

import java.time.Duration;

/**
 * Request for dynamically issued AWS credentials.
 *
 * @param role AWS role pre-configured with IAM policies in the service.
 */
public record AwsSecretRequest(
        String name,
        String mountPoint,
        String role,
        Duration minimumTtl
) implements SecretRequest {

    public static final String DEFAULT_MOUNT_POINT = "aws/";

    public AwsSecretRequest {
        name = SecretRequest.requireText(name, "name", name);
        mountPoint = SecretRequest.mountOrDefault(mountPoint, DEFAULT_MOUNT_POINT);
        role = SecretRequest.requireText(role, "role", name);
        minimumTtl = SecretRequest.ttlOrZero(minimumTtl);
    }

    public AwsSecretRequest(String name, String mountPoint, String role) {
        this(name, mountPoint, role, Duration.ZERO);
    }

    @Override
    public SecretKind kind() {
        return SecretKind.AWS;
    }

    @Override
    public String describe() {
        return kind().slug() + ":" + mountPoint + ":" + role;
    }
}
