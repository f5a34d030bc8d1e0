package tiered.cache.core.port.out;

import java.util.Optional;
import tiered.cache.core.domain.model.CacheEntry;

/**
 * Port for one cache tier (Local in-process or Shared remote).
 *
 * <p>Implemented by module-infra adapters. A tier enforces the expiration spec attached to each
 * entry: an entry past its deadline is never reported as present.
 *
 * <h3>Failure contract</h3>
 *
 * <p>Implementations raise {@link tiered.cache.error.exception.TierUnavailableException} when the
 * backing store cannot be reached. The orchestrator treats such a read failure as a miss.
 *
 * @param <V> cached value type
 */
public interface TierStore<V> {

  /**
   * Look up a live entry. A SLIDING entry's deadline is refreshed by this call.
   *
   * <p>When the tier can tell how long the entry has left, the returned entry carries it as {@link
   * CacheEntry#remainingTtl()}.
   *
   * @param key exact cache key
   * @return the entry, or empty when absent or expired
   */
  Optional<CacheEntry<V>> get(String key);

  /**
   * Renew the deadline of a live SLIDING entry without reading it back.
   *
   * <p>Used when the entry was served from another tier. Absent keys and ABSOLUTE entries are left
   * untouched.
   *
   * @param key exact cache key
   * @param entry the entry as served, whose expiration spec gives the window
   */
  void touch(String key, CacheEntry<V> entry);

  /**
   * Store or replace an entry. The new entry fully replaces the previous one, including its tags.
   *
   * @param key exact cache key
   * @param entry entry with its expiration spec
   */
  void set(String key, CacheEntry<V> entry);

  /**
   * Remove an entry. Removing an absent key is a no-op.
   *
   * @param key exact cache key
   */
  void remove(String key);

  /**
   * Remove every entry carrying the tag.
   *
   * @param tag tag label
   * @return number of keys removed (best effort for remote tiers)
   */
  int removeByTag(String tag);

  /** Tier name used in logs and metrics tags. */
  String name();
}
