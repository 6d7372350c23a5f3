package tech.yump.vaultclient.secrets;

import java.util.Arrays;
import java.util.Locale;

/**
 * Kinds of secret the client knows how to request.
 */
public enum SecretKind {
    GENERIC("generic"),
    AWS("aws"),
    DATABASE("database");

    private final String slug;

    SecretKind(String slug) {
        this.slug = slug;
    }

    public String slug() {
        return slug;
    }

    public static SecretKind fromSlug(String slug) {
        if (slug == null) {
            throw new ConfigurationException("Secret request kind must be provided.");
        }
        String normalized = slug.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(kind -> kind.slug.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new ConfigurationException("Unsupported secret request kind: " + slug));
    }
}
