package tech.yump.vaultclient.secrets;

/**
 * One resolved (name, value) pair handed out by the secrets manager.
 *
 * @param name           Output key of the request.
 * @param value          A {@code String}, or a {@code Map<String, String>} of output keys to values
 *                       for secrets that expand to several keys.
 * @param refreshFailure Failure of the refresh attempted for this call, when the previous,
 *                       still unexpired value is handed out instead. {@code null} otherwise.
 */
public record SecretEntry(
        String name,
        Object value,
        SecretServiceException refreshFailure
) {

    public SecretEntry(String name, Object value) {
        this(name, value, null);
    }

    public boolean isStale() {
        return refreshFailure != null;
    }

    @Override
    public String toString() {
        return "SecretEntry[name=" + name + ", stale=" + isStale() + "]";
    }
}
