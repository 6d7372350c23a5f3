package tech.yump.vaultclient.secrets;

import java.time.Duration;

/**
 * Immutable description of a secret an application wants from the service.
 * Each variant carries the parameters its secrets engine needs; all of them are
 * checked when the request is built, not when it is used.
 */
public sealed interface SecretRequest permits GenericSecretRequest, AwsSecretRequest, DatabaseSecretRequest {

    /**
     * Output key under which the secret is exposed. Unique within a manager.
     */
    String name();

    SecretKind kind();

    /**
     * Path where the secrets engine is mounted.
     */
    String mountPoint();

    /**
     * Renewal is attempted no more frequently than this.
     */
    Duration minimumTtl();

    /**
     * Short form used in logs, e.g. {@code generic:secret/:jwt:key}. Never contains secret material.
     */
    String describe();

    static String requireText(String value, String field, String requestName) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("Secret request '" + requestName + "' is missing required field '" + field + "'.");
        }
        return value.trim();
    }

    static String mountOrDefault(String mountPoint, String defaultMount) {
        return (mountPoint == null || mountPoint.isBlank()) ? defaultMount : mountPoint.trim();
    }

    static Duration ttlOrZero(Duration minimumTtl) {
        return (minimumTtl == null || minimumTtl.isNegative()) ? Duration.ZERO : minimumTtl;
    }
}
