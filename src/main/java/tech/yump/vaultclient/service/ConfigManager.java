package tech.yump.vaultclient.service;

import lombok.extern.slf4j.Slf4j;
import tech.yump.vaultclient.secrets.SecretEntry;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Copies the current secrets into a mutable configuration mapping, typically the source map
 * of the {@code vaultSecrets} property source. Multi-key secrets are flattened into their keys.
 */
@Slf4j
public class ConfigManager {

    private final SecretsManager secretsManager;
    private final Map<String, Object> target;
    // Output keys last written per secret name.
    private final Map<String, Set<String>> writtenKeys = new HashMap<>();

    public ConfigManager(SecretsManager secretsManager, Map<String, Object> target) {
        this.secretsManager = secretsManager;
        this.target = target;
    }

    /**
     * Refreshes the secrets and overwrites their keys in the target mapping. Keys a multi-key
     * secret wrote before but no longer has are removed.
     * Nothing is written when any secret cannot be resolved.
     *
     * @throws tech.yump.vaultclient.secrets.SecretServiceException propagated from the secrets manager.
     */
    public void update() {
        List<SecretEntry> entries = secretsManager.yieldSecrets();
        synchronized (writtenKeys) {
            for (SecretEntry entry : entries) {
                if (entry.isStale()) {
                    log.warn("Secret '{}' could not be refreshed; serving previous value. Cause: {}",
                            entry.name(), entry.refreshFailure().getMessage());
                }
                Map<String, Object> values = flatten(entry);
                Set<String> previous = writtenKeys.put(entry.name(), Set.copyOf(values.keySet()));
                if (previous != null) {
                    previous.stream()
                            .filter(key -> !values.containsKey(key))
                            .forEach(key -> {
                                log.debug("Removing '{}' no longer provided by secret '{}'.", key, entry.name());
                                target.remove(key);
                            });
                }
                target.putAll(values);
            }
        }
    }

    private static Map<String, Object> flatten(SecretEntry entry) {
        Map<String, Object> values = new HashMap<>();
        if (entry.value() instanceof Map<?, ?> multiKey) {
            multiKey.forEach((key, value) -> values.put(key.toString(), value));
        } else {
            values.put(entry.name(), entry.value());
        }
        return values;
    }

    public Map<String, Object> target() {
        return target;
    }
}
