package tech.yump.vaultclient.secrets;

/**
 * Service token obtained by exchanging the platform identity token.
 *
 * @param clientToken Token sent with every secret operation.
 * @param lease       Lease of the token itself.
 */
public record AuthSession(
        String clientToken,
        Lease lease
) {

    @Override
    public String toString() {
        return "AuthSession[clientToken=******, lease=" + lease + "]";
    }
}
