package warden.core.port.out;

import io.smallrye.mutiny.Uni;

import warden.core.model.auth.TokenClaims;

/**
 * Port for verifying provider-issued bearer tokens.
 */
public interface TokenValidator {

    /**
     * Verify a token and extract its claims.
     *
     * @param token the raw token (without the "Bearer " prefix)
     * @return verified claims; fails with a {@code TokenValidationException} subtype,
     *         {@code KeyNotFoundException} or {@code KeySetFetchException}
     */
    Uni<TokenClaims> validate(String token);
}
