package tech.yump.vaultclient.secrets;

import java.time.Duration;

/**
 * Request for a single key of a key/value (KV version 2) secret.
 */
public record GenericSecretRequest(
        String name,
        String mountPoint,
        String path,
        String key,
        Duration minimumTtl
) implements SecretRequest {

    public static final String DEFAULT_MOUNT_POINT = "secret/";

    public GenericSecretRequest {
        name = SecretRequest.requireText(name, "name", name);
        mountPoint = SecretRequest.mountOrDefault(mountPoint, DEFAULT_MOUNT_POINT);
        path = SecretRequest.requireText(path, "path", name);
        key = SecretRequest.requireText(key, "key", name);
        minimumTtl = SecretRequest.ttlOrZero(minimumTtl);
    }

    public GenericSecretRequest(String name, String mountPoint, String path, String key) {
        this(name, mountPoint, path, key, Duration.ZERO);
    }

    @Override
    public SecretKind kind() {
        return SecretKind.GENERIC;
    }

    @Override
    public String describe() {
        return kind().slug() + ":" + mountPoint + ":" + path + ":" + key;
    }
}
