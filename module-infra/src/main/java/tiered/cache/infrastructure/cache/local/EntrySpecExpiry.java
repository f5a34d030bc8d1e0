package tiered.cache.infrastructure.cache.local;

import com.github.benmanes.caffeine.cache.Expiry;
import tiered.cache.core.domain.model.CacheEntry;

/**
 * 엔트리별 만료 스펙을 Caffeine에 그대로 적용하는 Expiry
 *
 * <ul>
 *   <li>생성/교체: 새 엔트리의 duration으로 재설정
 *   <li>조회: SLIDING이면 duration으로 재설정, ABSOLUTE면 남은 시간 유지
 * </ul>
 */
final class EntrySpecExpiry<V> implements Expiry<String, CacheEntry<V>> {

  @Override
  public long expireAfterCreate(String key, CacheEntry<V> entry, long currentTime) {
    return durationNanos(entry);
  }

  @Override
  public long expireAfterUpdate(
      String key, CacheEntry<V> entry, long currentTime, long currentDuration) {
    return durationNanos(entry);
  }

  @Override
  public long expireAfterRead(
      String key, CacheEntry<V> entry, long currentTime, long currentDuration) {
    return entry.expiration().isSliding() ? durationNanos(entry) : currentDuration;
  }

  private static long durationNanos(CacheEntry<?> entry) {
    return entry.expiration().duration().toNanos();
  }
}
