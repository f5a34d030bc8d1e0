package tiered.cache.core.port.out;

/**
 * Caller-supplied loader that produces the authoritative value for a key.
 *
 * <p>Invoked at most once per key per stampede window, always while the key's lock is held. A
 * {@code null} result means the key does not exist at the origin (NotFound); it is never cached
 * as a regular value.
 *
 * @param <V> value type
 */
@FunctionalInterface
public interface OriginLoader<V> {

  /**
   * @param key exact cache key
   * @return the value, or {@code null} when the origin has no such key
   * @throws Exception any origin failure, surfaced to callers as an origin load error
   */
  V load(String key) throws Exception;
}
