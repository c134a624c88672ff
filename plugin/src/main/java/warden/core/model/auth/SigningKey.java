package warden.core.model.auth;

import java.security.Key;

/**
 * One public verification key published by the identity provider.
 *
 * @param keyId     the key id ({@code kid})
 * @param algorithm the signing algorithm the key is published for (e.g., RS256), may be null
 * @param key       the public key material
 */
public record SigningKey(String keyId, String algorithm, Key key) {

    public SigningKey {
        if (keyId == null || keyId.isBlank()) {
            throw new IllegalArgumentException("Key id cannot be null or blank");
        }
        if (key == null) {
            throw new IllegalArgumentException("Key material cannot be null");
        }
    }
}
