package warden.adapter.out.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import io.smallrye.mutiny.Uni;
import org.jose4j.jwt.NumericDate;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import warden.config.TestWardenConfig;
import warden.core.exception.InvalidAudienceException;
import warden.core.exception.InvalidIssuerException;
import warden.core.exception.InvalidSignatureException;
import warden.core.exception.KeyNotFoundException;
import warden.core.exception.TokenExpiredException;
import warden.core.exception.TokenValidationException;
import warden.core.model.auth.TokenClaims;
import warden.core.port.out.JwksCache;
import warden.testing.RsaTokenFixture;

@DisplayName("JwtTokenValidator")
@ExtendWith(MockitoExtension.class)
class JwtTokenValidatorTest {

    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");
    private static final String KEY_ID = "key-1";

    private static RsaTokenFixture signer;
    private static RsaTokenFixture otherSigner;

    @Mock
    private JwksCache jwksCache;

    private TestWardenConfig config;
    private JwtTokenValidator validator;

    @BeforeAll
    static void generateKeys() {
        signer = new RsaTokenFixture(KEY_ID);
        otherSigner = new RsaTokenFixture("key-2");
    }

    @BeforeEach
    void setUp() {
        config = new TestWardenConfig();
        validator = new JwtTokenValidator(jwksCache, config, Clock.fixed(NOW, ZoneOffset.UTC));
        lenient().when(jwksCache.getKey(KEY_ID)).thenReturn(Uni.createFrom().item(signer.signingKey()));
    }

    private String issuer() {
        return config.issuer();
    }

    private TokenClaims validate(String token) {
        return validator.validate(token).await().indefinitely();
    }

    @Nested
    @DisplayName("Valid tokens")
    class ValidTokens {

        @Test
        @DisplayName("should accept access token and derive email from federated username")
        void shouldAcceptAccessToken() {
            final var token = signer.sign(RsaTokenFixture.accessClaims(
                    issuer(), TestWardenConfig.APP_CLIENT_ID, "google_alice@example.com", NOW));

            final var claims = validate(token);

            assertEquals("sub-google_alice@example.com", claims.subject());
            assertEquals(issuer(), claims.issuer());
            assertTrue(claims.isAccessToken());
            assertEquals(TestWardenConfig.APP_CLIENT_ID, claims.clientId());
            assertEquals("alice@example.com", claims.resolvedEmail());
            assertEquals(NOW.plusSeconds(3600), claims.expiresAt());
            assertEquals(NOW, claims.issuedAt());
        }

        @Test
        @DisplayName("should accept id token and use email claim")
        void shouldAcceptIdToken() {
            final var token = signer.sign(RsaTokenFixture.idClaims(issuer(), "bob@example.com", "Bob Builder", NOW));

            final var claims = validate(token);

            assertEquals("id", claims.tokenUse());
            assertEquals("bob@example.com", claims.resolvedEmail());
            assertEquals("Bob Builder", claims.displayName());
        }

        @Test
        @DisplayName("should fall back to provider username claim")
        void shouldFallBackToProviderUsername() {
            final var jwtClaims =
                    RsaTokenFixture.accessClaims(issuer(), TestWardenConfig.APP_CLIENT_ID, "ignored", NOW);
            jwtClaims.unsetClaim("username");
            jwtClaims.setClaim("cognito:username", "carol");

            final var claims = validate(signer.sign(jwtClaims));

            assertEquals("carol", claims.username());
            assertEquals("carol", claims.resolvedEmail());
        }

        @Test
        @DisplayName("should accept token expired within clock skew")
        void shouldAcceptExpiredWithinSkew() {
            final var jwtClaims =
                    RsaTokenFixture.accessClaims(issuer(), TestWardenConfig.APP_CLIENT_ID, "dave", NOW.minusSeconds(7200));
            jwtClaims.setExpirationTime(NumericDate.fromSeconds(NOW.minusSeconds(60).getEpochSecond()));

            final var claims = validate(signer.sign(jwtClaims));

            assertEquals("dave", claims.username());
        }

        @Test
        @DisplayName("should honour issuer override with trailing slash")
        void shouldHonourIssuerOverride() {
            config.withIssuer("http://localhost:9999/pool/");
            final var token = signer.sign(RsaTokenFixture.accessClaims(
                    "http://localhost:9999/pool", TestWardenConfig.APP_CLIENT_ID, "erin", NOW));

            assertEquals("erin", validate(token).username());
        }
    }

    @Nested
    @DisplayName("Rejected tokens")
    class RejectedTokens {

        @Test
        @DisplayName("should reject token expired beyond clock skew")
        void shouldRejectExpired() {
            final var jwtClaims =
                    RsaTokenFixture.accessClaims(issuer(), TestWardenConfig.APP_CLIENT_ID, "dave", NOW.minusSeconds(7200));
            jwtClaims.setExpirationTime(NumericDate.fromSeconds(
                    NOW.minus(Duration.ofSeconds(301)).getEpochSecond()));

            final var error = assertThrows(TokenExpiredException.class, () -> validate(signer.sign(jwtClaims)));
            assertEquals("TOKEN_EXPIRED", error.getCode());
        }

        @Test
        @DisplayName("should reject wrong issuer")
        void shouldRejectWrongIssuer() {
            final var token = signer.sign(RsaTokenFixture.accessClaims(
                    "https://evil.example.com", TestWardenConfig.APP_CLIENT_ID, "mallory", NOW));

            final var error = assertThrows(InvalidIssuerException.class, () -> validate(token));
            assertEquals("INVALID_ISSUER", error.getCode());
        }

        @Test
        @DisplayName("should reject token signed by a different key")
        void shouldRejectBadSignature() {
            final var token = otherSigner.sign(
                    RsaTokenFixture.accessClaims(issuer(), TestWardenConfig.APP_CLIENT_ID, "mallory", NOW), KEY_ID);

            final var error = assertThrows(InvalidSignatureException.class, () -> validate(token));
            assertEquals("INVALID_SIGNATURE", error.getCode());
        }

        @Test
        @DisplayName("should reject access token for another client")
        void shouldRejectWrongClient() {
            final var token = signer.sign(
                    RsaTokenFixture.accessClaims(issuer(), "other-client", "mallory", NOW));

            final var error = assertThrows(InvalidAudienceException.class, () -> validate(token));
            assertEquals("Invalid client_id: other-client", error.getMessage());
        }

        @Test
        @DisplayName("should reject token without token_use")
        void shouldRejectMissingTokenUse() {
            final var jwtClaims =
                    RsaTokenFixture.accessClaims(issuer(), TestWardenConfig.APP_CLIENT_ID, "mallory", NOW);
            jwtClaims.unsetClaim("token_use");

            final var error = assertThrows(TokenValidationException.class, () -> validate(signer.sign(jwtClaims)));
            assertEquals("INVALID_TOKEN", error.getCode());
        }

        @Test
        @DisplayName("should reject malformed token without consulting key set")
        void shouldRejectMalformed() {
            final var error = assertThrows(TokenValidationException.class, () -> validate("not-a-jwt"));

            assertEquals("INVALID_TOKEN", error.getCode());
            verify(jwksCache, never()).getKey(anyString());
        }

        @Test
        @DisplayName("should reject empty token")
        void shouldRejectEmpty() {
            assertThrows(TokenValidationException.class, () -> validate(" "));
        }

        @Test
        @DisplayName("should propagate unknown key id")
        void shouldPropagateUnknownKey() {
            when(jwksCache.getKey("rotated")).thenReturn(Uni.createFrom().failure(new KeyNotFoundException("rotated")));
            final var token = signer.sign(
                    RsaTokenFixture.accessClaims(issuer(), TestWardenConfig.APP_CLIENT_ID, "frank", NOW), "rotated");

            final var error = assertThrows(KeyNotFoundException.class, () -> validate(token));
            assertEquals("KEY_NOT_FOUND", error.getCode());
        }
    }
}
