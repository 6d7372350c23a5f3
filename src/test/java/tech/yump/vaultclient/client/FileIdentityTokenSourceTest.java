package tech.yump.vaultclient.client;

import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.PlainJWT;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import tech.yump.vaultclient.secrets.AuthenticationException;
import tech.yump.vaultclient.support.MutableClock;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Date;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileIdentityTokenSourceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @TempDir
    Path tempDir;

    private final MutableClock clock = new MutableClock(NOW);

    private static String jwtExpiringAt(Instant expiry) {
        JWTClaimsSet claims = new JWTClaimsSet.Builder()
                .subject("system:serviceaccount:default:app")
                .expirationTime(Date.from(expiry))
                .build();
        return new PlainJWT(claims).serialize();
    }

    @Test
    @DisplayName("readToken: Should return trimmed token when JWT is still valid")
    void readToken_validJwt() throws IOException {
        // Arrange
        String jwt = jwtExpiringAt(NOW.plusSeconds(600));
        Path tokenFile = Files.writeString(tempDir.resolve("token"), jwt + "\n");
        FileIdentityTokenSource source = new FileIdentityTokenSource(tokenFile, clock);

        // Act & Assert
        assertThat(source.readToken()).isEqualTo(jwt);
    }

    @Test
    @DisplayName("readToken: Should re-read the file on every call")
    void readToken_rereadsRotatedToken() throws IOException {
        Path tokenFile = Files.writeString(tempDir.resolve("token"), jwtExpiringAt(NOW.plusSeconds(60)));
        FileIdentityTokenSource source = new FileIdentityTokenSource(tokenFile, clock);
        source.readToken();

        String rotated = jwtExpiringAt(NOW.plusSeconds(3600));
        Files.writeString(tokenFile, rotated);

        assertThat(source.readToken()).isEqualTo(rotated);
    }

    @Test
    @DisplayName("readToken: Should fail when the JWT has expired")
    void readToken_expiredJwt() throws IOException {
        Path tokenFile = Files.writeString(tempDir.resolve("token"), jwtExpiringAt(NOW.minusSeconds(1)));
        FileIdentityTokenSource source = new FileIdentityTokenSource(tokenFile, clock);

        assertThatThrownBy(source::readToken)
                .isInstanceOf(AuthenticationException.class)
                .hasMessageContaining("expired");
    }

    @Test
    @DisplayName("readToken: Should accept opaque tokens without an expiry check")
    void readToken_opaqueToken() throws IOException {
        Path tokenFile = Files.writeString(tempDir.resolve("token"), "opaque-token-value");
        FileIdentityTokenSource source = new FileIdentityTokenSource(tokenFile, clock);

        assertThat(source.readToken()).isEqualTo("opaque-token-value");
    }

    @Test
    @DisplayName("readToken: Should fail on a missing or blank file")
    void readToken_missingOrBlank() throws IOException {
        FileIdentityTokenSource missing = new FileIdentityTokenSource(tempDir.resolve("absent"), clock);
        Path blankFile = Files.writeString(tempDir.resolve("blank"), "  \n");
        FileIdentityTokenSource blank = new FileIdentityTokenSource(blankFile, clock);

        assertThatThrownBy(missing::readToken)
                .isInstanceOf(AuthenticationException.class)
                .hasMessageContaining("Failed to read identity token")
                .hasCauseInstanceOf(IOException.class);
        assertThatThrownBy(blank::readToken)
                .isInstanceOf(AuthenticationException.class)
                .hasMessageContaining("is empty");
    }
}
