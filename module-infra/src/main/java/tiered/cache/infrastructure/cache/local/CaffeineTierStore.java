package tiered.cache.infrastructure.cache.local;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.github.benmanes.caffeine.cache.Ticker;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.cache.CaffeineCacheMetrics;
import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import tiered.cache.core.domain.model.CacheEntry;
import tiered.cache.core.port.out.TierStore;

/**
 * L1 (Caffeine) 계층 저장소
 *
 * <h3>만료</h3>
 *
 * <p>{@link EntrySpecExpiry}로 엔트리마다 ABSOLUTE/SLIDING 만료를 적용합니다. 만료된 엔트리는 Caffeine이 조회 시점에
 * 숨기므로 hit로 관측되지 않습니다. 조회 결과에는 남은 수명이 함께 실립니다.
 *
 * <h3>태그 인덱스</h3>
 *
 * <p>tag → keys 역인덱스를 유지합니다. 엔트리가 교체/만료/제거되면 removal listener가 호출 스레드에서 동기적으로 인덱스를
 * 정리합니다.
 */
@Slf4j
public class CaffeineTierStore<V> implements TierStore<V> {

  private static final String TIER_NAME = "local";

  private final String cacheName;
  private final Cache<String, CacheEntry<V>> cache;
  private final ConcurrentHashMap<String, Set<String>> tagIndex = new ConcurrentHashMap<>();

  public CaffeineTierStore(String cacheName, long maximumSize) {
    this(cacheName, maximumSize, Ticker.systemTicker(), null);
  }

  /**
   * @param ticker 시간 소스 (테스트에서 수동 시계 주입)
   * @param meterRegistry null이면 Caffeine 통계를 등록하지 않음
   */
  public CaffeineTierStore(
      String cacheName, long maximumSize, Ticker ticker, MeterRegistry meterRegistry) {
    this.cacheName = cacheName;
    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maximumSize)
            .expireAfter(new EntrySpecExpiry<V>())
            .ticker(ticker)
            .executor(Runnable::run)
            .removalListener(this::onRemoval)
            .recordStats()
            .build();
    if (meterRegistry != null) {
      CaffeineCacheMetrics.monitor(meterRegistry, cache, cacheName + "." + TIER_NAME);
    }
  }

  @Override
  public Optional<CacheEntry<V>> get(String key) {
    CacheEntry<V> entry = cache.getIfPresent(key);
    if (entry == null) {
      return Optional.empty();
    }
    return Optional.of(entry.withRemainingTtl(remaining(key).orElse(null)));
  }

  @Override
  public void touch(String key, CacheEntry<V> entry) {
    if (!entry.expiration().isSliding()) {
      return;
    }
    cache
        .policy()
        .expireVariably()
        .ifPresent(
            expiry -> {
              if (expiry.getExpiresAfter(key).isPresent()) {
                expiry.setExpiresAfter(key, entry.expiration().duration());
              }
            });
  }

  @Override
  public void set(String key, CacheEntry<V> entry) {
    entry.tags().forEach(tag -> tagIndex.computeIfAbsent(tag, t -> newKeySet()).add(key));
    cache.put(key, entry);
  }

  @Override
  public void remove(String key) {
    cache.invalidate(key);
  }

  @Override
  public int removeByTag(String tag) {
    Set<String> keys = tagIndex.remove(tag);
    if (keys == null) {
      return 0;
    }
    int removed = 0;
    for (String key : keys) {
      CacheEntry<V> current = cache.policy().getIfPresentQuietly(key);
      if (current != null && current.hasTag(tag)) {
        cache.invalidate(key);
        removed++;
      }
    }
    log.debug("[LocalTier] Tag evicted: cache={}, tag={}, removed={}", cacheName, tag, removed);
    return removed;
  }

  @Override
  public String name() {
    return TIER_NAME;
  }

  /** 현재 엔트리 수 (만료 정리 전 추정치) */
  public long estimatedSize() {
    return cache.estimatedSize();
  }

  /** 만료된 엔트리 즉시 정리 (테스트/진단용) */
  public void cleanUp() {
    cache.cleanUp();
  }

  /** 만료까지 남은 시간 (조회 직후이므로 SLIDING은 전체 창) */
  private Optional<Duration> remaining(String key) {
    return cache.policy().expireVariably().flatMap(expiry -> expiry.getExpiresAfter(key));
  }

  private void onRemoval(String key, CacheEntry<V> entry, RemovalCause cause) {
    if (key == null || entry == null) {
      return;
    }
    for (String tag : entry.tags()) {
      if (cause == RemovalCause.REPLACED && stillTagged(key, tag)) {
        continue;
      }
      tagIndex.computeIfPresent(
          tag,
          (t, keys) -> {
            keys.remove(key);
            return keys.isEmpty() ? null : keys;
          });
    }
  }

  private boolean stillTagged(String key, String tag) {
    CacheEntry<V> current = cache.policy().getIfPresentQuietly(key);
    return current != null && current.hasTag(tag);
  }

  private static Set<String> newKeySet() {
    return ConcurrentHashMap.newKeySet();
  }
}
