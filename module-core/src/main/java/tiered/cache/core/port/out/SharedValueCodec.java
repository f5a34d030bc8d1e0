package tiered.cache.core.port.out;

/**
 * Port for serializing values stored in the Shared tier.
 *
 * <p>Implementations raise {@link tiered.cache.error.exception.CacheSerializationException} on
 * failure.
 *
 * @param <V> value type
 */
public interface SharedValueCodec<V> {

  String encode(V value);

  V decode(String payload);
}
