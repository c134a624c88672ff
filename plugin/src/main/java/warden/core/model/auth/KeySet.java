package warden.core.model.auth;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Immutable snapshot of the provider's published keys.
 *
 * <p>Replaced wholesale on refresh; never modified in place.
 *
 * @param keys      the keys in document order
 * @param fetchedAt when the document was fetched
 */
public record KeySet(List<SigningKey> keys, Instant fetchedAt) {

    public KeySet {
        keys = keys != null ? List.copyOf(keys) : List.of();
        if (fetchedAt == null) {
            throw new IllegalArgumentException("Fetch time cannot be null");
        }
    }

    /**
     * Find a key by id.
     *
     * @param keyId the key id from the token header
     * @return the key if present
     */
    public Optional<SigningKey> find(String keyId) {
        if (keyId == null) {
            return Optional.empty();
        }
        return keys.stream().filter(key -> keyId.equals(key.keyId())).findFirst();
    }

    /**
     * Check whether this set is older than the given TTL.
     */
    public boolean isOlderThan(Duration ttl, Instant now) {
        return !fetchedAt.plus(ttl).isAfter(now);
    }

    public int size() {
        return keys.size();
    }
}
