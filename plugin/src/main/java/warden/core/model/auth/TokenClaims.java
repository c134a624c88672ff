package warden.core.model.auth;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Verified claims of a provider-issued token.
 *
 * @param subject     provider subject id ({@code sub})
 * @param issuer      issuer URL ({@code iss})
 * @param tokenUse    {@code access} or {@code id}
 * @param expiresAt   expiry ({@code exp})
 * @param issuedAt    issue time ({@code iat})
 * @param clientId    application client id, present on access tokens
 * @param username    provider username, may be in {@code provider_localpart} form
 * @param email       email, present on id tokens
 * @param displayName full name ({@code name})
 */
public record TokenClaims(
        @JsonProperty("sub") String subject,
        @JsonProperty("iss") String issuer,
        @JsonProperty("token_use") String tokenUse,
        @JsonProperty("exp") Instant expiresAt,
        @JsonProperty("iat") Instant issuedAt,
        @JsonProperty("client_id") String clientId,
        @JsonProperty("username") String username,
        @JsonProperty("email") String email,
        @JsonProperty("name") String displayName) {

    public static final String ACCESS_TOKEN = "access";
    public static final String ID_TOKEN = "id";

    private static final String USERNAME_SEPARATOR = "_";

    public TokenClaims {
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("Subject cannot be null or blank");
        }
        if (issuer == null || issuer.isBlank()) {
            throw new IllegalArgumentException("Issuer cannot be null or blank");
        }
    }

    @JsonIgnore
    public boolean isAccessToken() {
        return ACCESS_TOKEN.equals(tokenUse);
    }

    /**
     * Email used as the identity key for permission lookups.
     *
     * <p>Federated users carry a username such as {@code google_user@example.com}; the part
     * after the first separator is the email.
     *
     * @return email claim, else the username suffix, else the username, else the subject
     */
    @JsonIgnore
    public String resolvedEmail() {
        if (email != null && !email.isBlank()) {
            return email;
        }
        if (username != null && username.contains(USERNAME_SEPARATOR)) {
            return username.substring(username.indexOf(USERNAME_SEPARATOR) + 1);
        }
        if (username != null && !username.isBlank()) {
            return username;
        }
        return subject;
    }
}
