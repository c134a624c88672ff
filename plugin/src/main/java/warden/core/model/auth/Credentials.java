package warden.core.model.auth;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Authorization credentials extracted by the host from the request.
 *
 * @param scheme      authorization scheme (e.g., "Bearer"), may be null
 * @param credentials the credential string following the scheme, may be null
 */
public record Credentials(String scheme, String credentials) {

    public static final String BEARER = "bearer";

    private static final String PAYLOAD_KEY = "credentials";
    private static final String SCHEME_KEY = "scheme";

    /**
     * Normalize a host payload into credentials.
     *
     * <p>Hosts pass {@code payload.credentials} either as a {@link Credentials} instance or as
     * a map with {@code scheme} and {@code credentials} entries. Anything else yields empty
     * credentials.
     *
     * @param payload the hook payload, may be null
     * @return normalized credentials, never null
     */
    public static Credentials fromPayload(Map<String, ?> payload) {
        if (payload == null) {
            return new Credentials(null, null);
        }
        final var raw = payload.get(PAYLOAD_KEY);
        if (raw instanceof Credentials credentials) {
            return credentials;
        }
        if (raw instanceof Map<?, ?> map) {
            return new Credentials(asString(map.get(SCHEME_KEY)), asString(map.get(PAYLOAD_KEY)));
        }
        return new Credentials(null, null);
    }

    /**
     * Parse an {@code Authorization} header value of the form {@code <scheme> <credentials>}.
     */
    public static Credentials fromAuthorizationHeader(String header) {
        if (header == null || header.isBlank()) {
            return new Credentials(null, null);
        }
        final var parts = header.strip().split("\\s+");
        if (parts.length != 2) {
            return new Credentials(parts[0], null);
        }
        return new Credentials(parts[0], parts[1]);
    }

    public boolean isBearer() {
        return scheme != null && BEARER.equals(scheme.strip().toLowerCase(Locale.ROOT));
    }

    /**
     * The bearer token, when these credentials carry one.
     */
    public Optional<String> bearerToken() {
        if (!isBearer() || credentials == null || credentials.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(credentials.strip());
    }

    private static String asString(Object value) {
        return value != null ? value.toString() : null;
    }
}
