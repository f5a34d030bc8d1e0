package tiered.cache.infrastructure.cache.shared;

import java.util.Optional;
import tiered.cache.core.domain.model.CacheEntry;
import tiered.cache.core.port.out.TierStore;

/**
 * Redis 미구성 시 사용하는 Shared 자리 표시자
 *
 * <p>항상 미스이며 쓰기는 성공으로 간주됩니다. 이 경우 캐시는 L1 단독으로 동작합니다.
 */
public class NoOpTierStore<V> implements TierStore<V> {

  @Override
  public Optional<CacheEntry<V>> get(String key) {
    return Optional.empty();
  }

  @Override
  public void touch(String key, CacheEntry<V> entry) {}

  @Override
  public void set(String key, CacheEntry<V> entry) {}

  @Override
  public void remove(String key) {}

  @Override
  public int removeByTag(String tag) {
    return 0;
  }

  @Override
  public String name() {
    return "shared-noop";
  }
}
