package warden.adapter.out.auth;

import java.time.Clock;
import java.time.Instant;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;
import org.jose4j.jwa.AlgorithmConstraints;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.MalformedClaimException;
import org.jose4j.jwt.NumericDate;
import org.jose4j.jwt.consumer.ErrorCodes;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.jwt.consumer.JwtConsumer;
import org.jose4j.jwt.consumer.JwtConsumerBuilder;
import org.jose4j.lang.JoseException;

import warden.config.WardenConfig;
import warden.core.exception.InvalidAudienceException;
import warden.core.exception.InvalidIssuerException;
import warden.core.exception.InvalidSignatureException;
import warden.core.exception.TokenExpiredException;
import warden.core.exception.TokenValidationException;
import warden.core.model.auth.SigningKey;
import warden.core.model.auth.TokenClaims;
import warden.core.port.out.JwksCache;
import warden.core.port.out.TokenValidator;

/**
 * Validates provider-issued JWTs against the cached key set.
 *
 * <p>
 * Checks, in order:
 * <ul>
 * <li>Signature (RS256 only) using the key named by the {@code kid} header</li>
 * <li>Issuer ({@code iss}) against the configured provider issuer</li>
 * <li>Expiry ({@code exp}) and issue time ({@code iat}) with the configured clock skew</li>
 * <li>{@code token_use} is present; access tokens must carry the configured {@code client_id}</li>
 * </ul>
 *
 * <p>
 * Audience is not checked: access tokens from this provider carry no {@code aud}.
 */
public class JwtTokenValidator implements TokenValidator {

    private static final Logger LOG = Logger.getLogger(JwtTokenValidator.class);

    static final String TOKEN_USE_CLAIM = "token_use";
    static final String CLIENT_ID_CLAIM = "client_id";
    static final String USERNAME_CLAIM = "username";
    static final String PROVIDER_USERNAME_CLAIM = "cognito:username";
    static final String EMAIL_CLAIM = "email";
    static final String NAME_CLAIM = "name";

    private final JwksCache jwksCache;
    private final WardenConfig config;
    private final Clock clock;

    public JwtTokenValidator(JwksCache jwksCache, WardenConfig config, Clock clock) {
        this.jwksCache = jwksCache;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public Uni<TokenClaims> validate(String token) {
        if (token == null || token.isBlank()) {
            return Uni.createFrom().failure(new TokenValidationException("Token is empty"));
        }

        return extractKeyId(token)
                .flatMap(jwksCache::getKey)
                .map(key -> validateWithKey(token, key))
                .onFailure(TokenValidationException.class)
                .invoke(error -> LOG.debugv("Token validation failed: {0}", error.getMessage()));
    }

    private Uni<String> extractKeyId(String token) {
        return Uni.createFrom().item(() -> {
            try {
                JsonWebSignature jws = new JsonWebSignature();
                jws.setCompactSerialization(token);
                String keyId = jws.getKeyIdHeaderValue();
                if (keyId == null || keyId.isBlank()) {
                    throw new TokenValidationException("Token missing 'kid' header");
                }
                return keyId;
            } catch (JoseException e) {
                throw new TokenValidationException("Failed to parse token: " + e.getMessage(), e);
            }
        });
    }

    private TokenClaims validateWithKey(String token, SigningKey key) {
        try {
            JwtConsumer consumer = new JwtConsumerBuilder()
                    .setRequireSubject()
                    .setRequireExpirationTime()
                    .setRequireIssuedAt()
                    .setAllowedClockSkewInSeconds((int) config.clockSkewTolerance().toSeconds())
                    .setEvaluationTime(NumericDate.fromMilliseconds(clock.millis()))
                    .setExpectedIssuer(config.issuer())
                    .setSkipDefaultAudienceValidation()
                    .setJwsAlgorithmConstraints(
                            AlgorithmConstraints.ConstraintType.PERMIT, AlgorithmIdentifiers.RSA_USING_SHA256)
                    .setVerificationKey(key.key())
                    .build();

            JwtClaims claims = consumer.processToClaims(token);
            return buildClaims(claims);
        } catch (InvalidJwtException e) {
            LOG.debugv("JWT validation failed: {0}", e.getMessage());
            throw classify(e);
        }
    }

    private TokenClaims buildClaims(JwtClaims claims) {
        try {
            String tokenUse = claims.getStringClaimValue(TOKEN_USE_CLAIM);
            if (tokenUse == null || tokenUse.isBlank()) {
                throw new TokenValidationException("Token missing 'token_use' claim");
            }

            String clientId = claims.getStringClaimValue(CLIENT_ID_CLAIM);
            if (TokenClaims.ACCESS_TOKEN.equals(tokenUse) && !config.providerAppClientId().equals(clientId)) {
                throw new InvalidAudienceException("Invalid client_id: " + clientId);
            }

            String username = claims.getStringClaimValue(USERNAME_CLAIM);
            if (username == null) {
                username = claims.getStringClaimValue(PROVIDER_USERNAME_CLAIM);
            }

            return new TokenClaims(
                    claims.getSubject(),
                    claims.getIssuer(),
                    tokenUse,
                    Instant.ofEpochSecond(claims.getExpirationTime().getValue()),
                    Instant.ofEpochSecond(claims.getIssuedAt().getValue()),
                    clientId,
                    username,
                    claims.getStringClaimValue(EMAIL_CLAIM),
                    claims.getStringClaimValue(NAME_CLAIM));
        } catch (MalformedClaimException e) {
            throw new TokenValidationException("Malformed claims: " + e.getMessage(), e);
        }
    }

    private TokenValidationException classify(InvalidJwtException e) {
        if (e.hasExpired()) {
            return new TokenExpiredException("Token has expired", e);
        }
        if (e.hasErrorCode(ErrorCodes.ISSUER_INVALID) || e.hasErrorCode(ErrorCodes.ISSUER_MISSING)) {
            return new InvalidIssuerException("Invalid token issuer", e);
        }
        if (e.hasErrorCode(ErrorCodes.SIGNATURE_INVALID)
                || e.hasErrorCode(ErrorCodes.SIGNATURE_MISSING)
                || String.valueOf(e.getMessage()).contains("signature")) {
            return new InvalidSignatureException("Invalid token signature", e);
        }
        return new TokenValidationException("Token validation failed: " + summarize(e), e);
    }

    private static String summarize(InvalidJwtException e) {
        if (e.getErrorDetails() == null || e.getErrorDetails().isEmpty()) {
            return e.getMessage();
        }
        return e.getErrorDetails().get(0).getErrorMessage();
    }
}
