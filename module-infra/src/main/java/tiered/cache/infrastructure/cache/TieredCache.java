package tiered.cache.infrastructure.cache;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import tiered.cache.core.domain.model.CacheEntry;
import tiered.cache.core.domain.model.CacheKeys;
import tiered.cache.core.domain.model.ExpirationSpec;
import tiered.cache.core.expiration.ExpirationPolicy;
import tiered.cache.core.port.out.OriginLoader;
import tiered.cache.core.port.out.TierStore;
import tiered.cache.infrastructure.cache.invalidation.CacheInvalidationEvent;
import tiered.cache.infrastructure.cache.invalidation.CacheInvalidationPublisher;
import tiered.cache.infrastructure.executor.LogicExecutor;
import tiered.cache.infrastructure.executor.TaskContext;
import tiered.cache.infrastructure.executor.strategy.ExceptionTranslator;
import tiered.cache.infrastructure.lock.KeyLockRegistry;
import tiered.cache.infrastructure.lock.LockHandle;

/**
 * 2층 구조 Cache-aside 오케스트레이터 (L1: Local, L2: Shared)
 *
 * <h4>Cache Stampede 방지</h4>
 *
 * <ul>
 *   <li>키 단위 락({@link KeyLockRegistry})으로 같은 키의 동시 미스를 직렬화
 *   <li>락 획득 후 L1 → L2 Double-check, 그래도 미스면 로더 1회 실행
 *   <li>대기자는 락 해제 후 Double-check에서 방금 채워진 값을 읽음
 * </ul>
 *
 * <h4>Layer Consistency</h4>
 *
 * <ul>
 *   <li>쓰기 순서 L2 → L1. L2 저장 실패 시 L1 저장 생략
 *   <li>무효화 순서 L2 → L1 → Pub/Sub (stale backfill 방지)
 *   <li>ABSOLUTE L1 TTL은 {@link ExpirationPolicy#localSpecFor}로 L2보다 짧게 산정하고, L2 hit
 *       backfill 시 L2 남은 수명을 넘지 않음
 *   <li>SLIDING L1 hit는 L2 TTL도 연장 (L1이 읽기를 흡수해도 L2가 먼저 만료되지 않음)
 * </ul>
 *
 * <h4>Graceful Degradation</h4>
 *
 * <p>계층 읽기 장애는 미스로 취급합니다. 로더 실패는 {@code OriginLoadException}으로 전파되며 어떤 계층에도 캐시되지
 * 않습니다.
 *
 * @param <V> 캐시 값 타입
 */
@Slf4j
public class TieredCache<V> {

  private final String name;
  private final TierStore<V> local;
  private final TierStore<V> shared;
  private final KeyLockRegistry lockRegistry;
  private final ExpirationPolicy expirationPolicy;
  private final LogicExecutor executor;
  private final TieredCacheSettings settings;
  private final ExecutorService loaderExecutor;
  private final CacheInvalidationPublisher invalidationPublisher;
  private final String instanceId;

  private final Counter l1HitCounter;
  private final Counter l2HitCounter;
  private final Counter missCounter;
  private final Counter loadFailureCounter;
  private final Counter l2FailureCounter;

  /**
   * @param loaderExecutor 로더 타임아웃 적용 시 로더를 실행할 풀 (타임아웃 미설정이면 null 허용)
   */
  public TieredCache(
      String name,
      TierStore<V> local,
      TierStore<V> shared,
      KeyLockRegistry lockRegistry,
      ExpirationPolicy expirationPolicy,
      LogicExecutor executor,
      TieredCacheSettings settings,
      ExecutorService loaderExecutor,
      CacheInvalidationPublisher invalidationPublisher,
      String instanceId,
      MeterRegistry meterRegistry) {
    this.name = Objects.requireNonNull(name, "name");
    this.local = Objects.requireNonNull(local, "local");
    this.shared = Objects.requireNonNull(shared, "shared");
    this.lockRegistry = Objects.requireNonNull(lockRegistry, "lockRegistry");
    this.expirationPolicy = Objects.requireNonNull(expirationPolicy, "expirationPolicy");
    this.executor = Objects.requireNonNull(executor, "executor");
    this.settings = Objects.requireNonNull(settings, "settings");
    if (settings.hasLoaderTimeout()) {
      Objects.requireNonNull(loaderExecutor, "loaderExecutor is required with loaderTimeout");
    }
    this.loaderExecutor = loaderExecutor;
    this.invalidationPublisher = Objects.requireNonNull(invalidationPublisher, "publisher");
    this.instanceId = instanceId;

    this.l1HitCounter =
        Counter.builder("cache.hit").tag("layer", "L1").tag("cache", name).register(meterRegistry);
    this.l2HitCounter =
        Counter.builder("cache.hit").tag("layer", "L2").tag("cache", name).register(meterRegistry);
    this.missCounter = Counter.builder("cache.miss").tag("cache", name).register(meterRegistry);
    this.loadFailureCounter =
        Counter.builder("cache.load.failure").tag("cache", name).register(meterRegistry);
    this.l2FailureCounter =
        Counter.builder("cache.l2.failure").tag("cache", name).register(meterRegistry);
  }

  public String getName() {
    return name;
  }

  /** 원격 무효화 구독자가 L1만 직접 무효화할 때 사용 */
  public TierStore<V> getLocalStore() {
    return local;
  }

  public KeyLockRegistry getLockRegistry() {
    return lockRegistry;
  }

  public V get(String key, OriginLoader<V> loader, ExpirationSpec spec) {
    return get(key, loader, spec, Set.of());
  }

  /**
   * 캐시 조회 with loader (Single-flight)
   *
   * <ol>
   *   <li>L1 hit → 즉시 반환 (락 없음)
   *   <li>L2 hit → L1 backfill 후 반환
   *   <li>키 락 획득 (최대 lockWait) → L1/L2 Double-check
   *   <li>미스 → 로더 실행 → L2 저장 → L1 저장 → 락 해제 → 반환
   * </ol>
   *
   * @return 값, 원본에 키가 없으면 null
   * @throws tiered.cache.error.exception.LockTimeoutException lockWait 내 락 획득 실패
   * @throws tiered.cache.error.exception.OriginLoadException 로더 실패 (캐시되지 않음)
   */
  public V get(String key, OriginLoader<V> loader, ExpirationSpec spec, Set<String> tags) {
    CacheKeys.requireValid(key);
    Objects.requireNonNull(loader, "loader");
    Objects.requireNonNull(spec, "spec");
    Set<String> entryTags = validateTags(tags);

    Optional<CacheEntry<V>> cached = lookup(key);
    if (cached.isPresent()) {
      return valueOf(cached.get());
    }
    return loadUnderLock(key, loader, spec, entryTags);
  }

  /**
   * 캐시 직접 저장 (L2 → L1 순서)
   *
   * <p>저장 성공 시 다른 인스턴스의 L1에서 같은 키를 제거하도록 이벤트를 발행합니다.
   */
  public void put(String key, V value, ExpirationSpec spec, Set<String> tags) {
    CacheKeys.requireValid(key);
    Objects.requireNonNull(value, "value");
    Objects.requireNonNull(spec, "spec");

    if (store(key, CacheEntry.of(value, spec, validateTags(tags)))) {
      invalidationPublisher.publish(CacheInvalidationEvent.evict(name, key, instanceId));
    }
  }

  /**
   * 키 무효화 (L2 → L1 → Pub/Sub)
   *
   * <p>L2 장애 시에도 L1 무효화는 항상 수행합니다.
   */
  public void invalidate(String key) {
    CacheKeys.requireValid(key);
    TaskContext context = TaskContext.of("Cache", "Invalidate", key);

    boolean sharedRemoved =
        executor.executeOrDefault(
            () -> {
              shared.remove(key);
              return true;
            },
            false,
            context);
    if (!sharedRemoved) {
      log.warn("[TieredCache] L2 evict failed, proceeding with L1: cache={}, key={}", name, key);
      l2FailureCounter.increment();
    }

    executor.executeVoid(() -> local.remove(key), context);
    invalidationPublisher.publish(CacheInvalidationEvent.evict(name, key, instanceId));
  }

  /**
   * 태그 일괄 무효화 (L2 → L1 → Pub/Sub)
   *
   * <p>키 락을 잡지 않습니다. 진행 중인 로드가 무효화 직후 새 값을 쓸 수 있습니다.
   */
  public void invalidateTag(String tag) {
    CacheKeys.requireValidTag(tag);
    TaskContext context = TaskContext.of("Cache", "InvalidateTag", tag);

    int sharedRemoved = executor.executeOrDefault(() -> shared.removeByTag(tag), -1, context);
    if (sharedRemoved < 0) {
      log.warn(
          "[TieredCache] L2 tag evict failed, proceeding with L1: cache={}, tag={}", name, tag);
      l2FailureCounter.increment();
    }

    int localRemoved = executor.execute(() -> local.removeByTag(tag), context);
    log.debug(
        "[TieredCache] Tag invalidated: cache={}, tag={}, l2Removed={}, l1Removed={}",
        name,
        tag,
        sharedRemoved,
        localRemoved);
    invalidationPublisher.publish(CacheInvalidationEvent.evictTag(name, tag, instanceId));
  }

  // ==================== Read Path ====================

  /** L1 → L2 순차 조회 (L2 hit 시 L1 backfill) */
  private Optional<CacheEntry<V>> lookup(String key) {
    Optional<CacheEntry<V>> l1 = readTier(local, key);
    if (l1.isPresent()) {
      l1HitCounter.increment();
      touchShared(key, l1.get());
      return l1;
    }

    Optional<CacheEntry<V>> l2 = readTier(shared, key);
    if (l2.isPresent()) {
      backfillLocal(key, l2.get());
      l2HitCounter.increment();
    }
    return l2;
  }

  /** SLIDING L1 hit → L2 TTL 연장 (실패는 무시, L2 만료 시 재로드로 수렴) */
  private void touchShared(String key, CacheEntry<V> localEntry) {
    if (!localEntry.expiration().isSliding()) {
      return;
    }
    boolean touched =
        executor.executeOrDefault(
            () -> {
              shared.touch(key, localEntry);
              return true;
            },
            false,
            TaskContext.of("Cache", "TouchL2", key));
    if (!touched) {
      l2FailureCounter.increment();
    }
  }

  /** L2 hit → L1 backfill (ABSOLUTE는 L2 남은 수명 이내, 남은 수명이 없으면 생략) */
  private void backfillLocal(String key, CacheEntry<V> sharedEntry) {
    expirationPolicy
        .backfillSpecFor(sharedEntry.expiration(), sharedEntry.remainingTtl())
        .ifPresent(localSpec -> putLocal(key, sharedEntry.withExpiration(localSpec)));
  }

  /** 계층 읽기 (장애 시 미스로 취급) */
  private Optional<CacheEntry<V>> readTier(TierStore<V> tier, String key) {
    return executor.executeOrDefault(
        () -> tier.get(key), Optional.empty(), TaskContext.of("Cache", "Get-" + tier.name(), key));
  }

  /**
   * 키 락 획득 후 Double-check + 로드
   *
   * <p>락 획득 실패(LockTimeoutException)는 그대로 전파합니다. 획득 성공 시에만 executeWithFinally로 해제를 보장합니다.
   */
  private V loadUnderLock(
      String key, OriginLoader<V> loader, ExpirationSpec spec, Set<String> tags) {
    LockHandle handle = lockRegistry.acquire(key, settings.lockWait());
    return executor.executeWithFinally(
        () -> doubleCheckAndLoad(key, loader, spec, tags),
        handle::close,
        TaskContext.of("Cache", "DoubleCheckLoad", key));
  }

  private V doubleCheckAndLoad(
      String key, OriginLoader<V> loader, ExpirationSpec spec, Set<String> tags) {
    Optional<CacheEntry<V>> cached = lookup(key);
    if (cached.isPresent()) {
      return valueOf(cached.get());
    }

    missCounter.increment();
    V value = invokeLoader(key, loader);
    if (value == null) {
      cacheNotFound(key, tags);
      return null;
    }
    store(key, CacheEntry.of(value, spec, tags));
    return value;
  }

  /** 로더 실행 (모든 예외 → OriginLoadException) */
  private V invokeLoader(String key, OriginLoader<V> loader) {
    TaskContext context = TaskContext.of("Cache", "Load", key);
    try {
      return executor.executeWithTranslation(
          () -> settings.hasLoaderTimeout() ? loadWithTimeout(key, loader) : loader.load(key),
          ExceptionTranslator.forOriginLoad(key),
          context);
    } catch (RuntimeException e) {
      loadFailureCounter.increment();
      throw e;
    }
  }

  /** 타임아웃 초과 시 TimeoutException (future는 취소) */
  private V loadWithTimeout(String key, OriginLoader<V> loader) throws Exception {
    Future<V> future = loaderExecutor.submit(() -> loader.load(key));
    try {
      return future.get(settings.loaderTimeout().toNanos(), TimeUnit.NANOSECONDS);
    } finally {
      future.cancel(true);
    }
  }

  private void cacheNotFound(String key, Set<String> tags) {
    if (!settings.negativeCaching()) {
      log.debug("[TieredCache] Origin has no value, not cached: cache={}, key={}", name, key);
      return;
    }
    store(key, CacheEntry.negative(expirationPolicy.negativeSpec(), tags));
  }

  // ==================== Write Path ====================

  /**
   * L2 → L1 순서 저장
   *
   * @return L2 저장 성공 여부 (실패 시 L1도 저장하지 않음)
   */
  private boolean store(String key, CacheEntry<V> entry) {
    boolean sharedWritten =
        executor.executeOrDefault(
            () -> {
              shared.set(key, entry);
              return true;
            },
            false,
            TaskContext.of("Cache", "PutL2", key));
    if (!sharedWritten) {
      log.warn("[TieredCache] L2 put failed, skipping L1: cache={}, key={}", name, key);
      l2FailureCounter.increment();
      return false;
    }
    writeLocal(key, entry);
    return true;
  }

  /** L1 저장 (TTL은 L2 스펙에서 산정) */
  private void writeLocal(String key, CacheEntry<V> sharedEntry) {
    ExpirationSpec localSpec = expirationPolicy.localSpecFor(sharedEntry.expiration());
    putLocal(key, sharedEntry.withExpiration(localSpec));
  }

  private void putLocal(String key, CacheEntry<V> localEntry) {
    executor.executeOrDefault(
        () -> {
          local.set(key, localEntry);
          return true;
        },
        false,
        TaskContext.of("Cache", "PutL1", key));
  }

  // ==================== Helper Methods ====================

  private V valueOf(CacheEntry<V> entry) {
    return entry.negative() ? null : entry.value();
  }

  private static Set<String> validateTags(Set<String> tags) {
    if (tags == null || tags.isEmpty()) {
      return Set.of();
    }
    tags.forEach(CacheKeys::requireValidTag);
    return Set.copyOf(tags);
  }
}
