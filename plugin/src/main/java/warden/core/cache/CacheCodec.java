package warden.core.cache;

/**
 * Converts cached values to and from their stored string form.
 *
 * @param <T> the cached type
 */
public interface CacheCodec<T> {

    /**
     * @throws warden.core.exception.CacheException if the value cannot be encoded
     */
    String encode(T value);

    /**
     * Decode a stored payload.
     *
     * @return the value, or null when the payload holds no value (a JSON {@code null})
     * @throws warden.core.exception.CacheException if the payload is not a valid encoding
     */
    T decode(String payload);
}
