package tech.yump.vaultclient.client;

import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.JWTParser;
import lombok.extern.slf4j.Slf4j;
import tech.yump.vaultclient.secrets.AuthenticationException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.text.ParseException;
import java.time.Clock;
import java.util.Date;

/**
 * Reads the identity token from a file such as the projected Kubernetes service account token.
 * The file is read on every call since the platform rotates it in place.
 */
@Slf4j
public class FileIdentityTokenSource implements IdentityTokenSource {

    private final Path tokenPath;
    private final Clock clock;

    public FileIdentityTokenSource(Path tokenPath, Clock clock) {
        this.tokenPath = tokenPath;
        this.clock = clock;
    }

    @Override
    public String readToken() {
        String token;
        try {
            token = Files.readString(tokenPath).trim();
        } catch (IOException e) {
            throw new AuthenticationException("Failed to read identity token from " + tokenPath, e);
        }
        if (token.isEmpty()) {
            throw new AuthenticationException("Identity token at " + tokenPath + " is empty.");
        }
        checkNotExpired(token);
        return token;
    }

    private void checkNotExpired(String token) {
        Date expiration;
        try {
            JWTClaimsSet claims = JWTParser.parse(token).getJWTClaimsSet();
            expiration = claims.getExpirationTime();
        } catch (ParseException e) {
            log.debug("Identity token at {} is not a JWT; skipping expiry check.", tokenPath);
            return;
        }
        if (expiration != null && !expiration.toInstant().isAfter(clock.instant())) {
            throw new AuthenticationException("Identity token at " + tokenPath + " expired at " + expiration.toInstant());
        }
    }
}
