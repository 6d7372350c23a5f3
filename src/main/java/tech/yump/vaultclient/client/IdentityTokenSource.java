package tech.yump.vaultclient.client;

/**
 * Source of the short-lived platform identity token exchanged at login.
 */
public interface IdentityTokenSource {

    /**
     * Reads the current identity token.
     *
     * @return The raw token, never blank.
     * @throws tech.yump.vaultclient.secrets.AuthenticationException if the token is unreadable, blank or expired.
     */
    String readToken();
}
