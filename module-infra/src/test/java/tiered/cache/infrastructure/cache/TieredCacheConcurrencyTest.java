package tiered.cache.infrastructure.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import tiered.cache.core.domain.model.CacheEntry;
import tiered.cache.core.domain.model.ExpirationSpec;
import tiered.cache.core.expiration.ExpirationPolicy;
import tiered.cache.error.exception.LockTimeoutException;
import tiered.cache.error.exception.OriginLoadException;
import tiered.cache.infrastructure.cache.invalidation.CacheInvalidationPublisher;
import tiered.cache.infrastructure.executor.DefaultLogicExecutor;
import tiered.cache.infrastructure.executor.LogicExecutor;
import tiered.cache.infrastructure.executor.strategy.ExceptionTranslator;
import tiered.cache.infrastructure.lock.KeyLockRegistry;
import tiered.cache.infrastructure.lock.LockHandle;
import tiered.cache.support.InMemoryTierStore;

/**
 * TieredCache 동시성 테스트
 *
 * <p>실제 DefaultLogicExecutor와 KeyLockRegistry, 메모리 기반 TierStore로 Single-flight 동작을 검증합니다.
 */
@Tag("concurrency")
class TieredCacheConcurrencyTest {

  private static final String KEY = "product:42";
  private static final ExpirationSpec SPEC = ExpirationSpec.absolute(Duration.ofMinutes(5));

  private InMemoryTierStore<String> local;
  private InMemoryTierStore<String> shared;
  private MeterRegistry meterRegistry;
  private KeyLockRegistry lockRegistry;
  private LogicExecutor executor;
  private ExecutorService callers;
  private ExecutorService loaderPool;

  @BeforeEach
  void setUp() {
    local = new InMemoryTierStore<>("local");
    shared = new InMemoryTierStore<>("shared");
    meterRegistry = new SimpleMeterRegistry();
    lockRegistry = new KeyLockRegistry(meterRegistry, "products");
    executor = new DefaultLogicExecutor(ExceptionTranslator.defaultTranslator(), meterRegistry);
    callers = Executors.newFixedThreadPool(32);
    loaderPool = Executors.newCachedThreadPool();
  }

  @AfterEach
  void tearDown() {
    callers.shutdownNow();
    loaderPool.shutdownNow();
  }

  @Test
  @DisplayName("100개 동시 미스에도 로더는 1회만 실행")
  void concurrent_misses_load_once() throws Exception {
    TieredCache<String> cache = newCache(TieredCacheSettings.defaults());
    AtomicInteger loads = new AtomicInteger();
    CountDownLatch start = new CountDownLatch(1);
    List<Future<String>> results = new ArrayList<>();

    for (int i = 0; i < 100; i++) {
      results.add(
          callers.submit(
              () -> {
                start.await();
                return cache.get(
                    KEY,
                    key -> {
                      loads.incrementAndGet();
                      Thread.sleep(100);
                      return "value-of-" + key;
                    },
                    SPEC);
              }));
    }
    start.countDown();

    for (Future<String> result : results) {
      assertThat(result.get(10, TimeUnit.SECONDS)).isEqualTo("value-of-" + KEY);
    }
    assertThat(loads).hasValue(1);
    assertThat(shared.writes()).isEqualTo(1);
    assertThat(lockRegistry.size()).isZero();
  }

  @Test
  @DisplayName("서로 다른 키의 로드는 서로를 막지 않음")
  void distinct_keys_load_independently() throws Exception {
    TieredCache<String> cache = newCache(TieredCacheSettings.defaults());
    CountDownLatch secondLoaded = new CountDownLatch(1);

    Future<String> first =
        callers.submit(
            () ->
                cache.get(
                    "a",
                    key -> {
                      if (!secondLoaded.await(5, TimeUnit.SECONDS)) {
                        throw new IllegalStateException("key b never loaded");
                      }
                      return "A";
                    },
                    SPEC));
    await().atMost(Duration.ofSeconds(5)).until(() -> lockRegistry.size() == 1);

    String second =
        cache.get(
            "b",
            key -> {
              secondLoaded.countDown();
              return "B";
            },
            SPEC);

    assertThat(second).isEqualTo("B");
    assertThat(first.get(5, TimeUnit.SECONDS)).isEqualTo("A");
  }

  @Test
  @DisplayName("락 대기 중 다른 인스턴스가 L2를 채우면 Double-check로 로더 생략")
  void waiter_reads_value_filled_while_waiting() throws Exception {
    TieredCache<String> cache = newCache(TieredCacheSettings.defaults());
    AtomicInteger loads = new AtomicInteger();
    LockHandle held = lockRegistry.acquire(KEY, Duration.ofSeconds(1));

    Future<String> waiter =
        callers.submit(
            () ->
                cache.get(
                    KEY,
                    key -> {
                      loads.incrementAndGet();
                      return "from-origin";
                    },
                    SPEC));
    await().atMost(Duration.ofSeconds(5)).until(() -> lockRegistry.queuedWaiters(KEY) == 1);

    shared.seed(KEY, CacheEntry.of("from-peer", SPEC));
    held.close();

    assertThat(waiter.get(5, TimeUnit.SECONDS)).isEqualTo("from-peer");
    assertThat(loads).hasValue(0);
    assertThat(local.peek(KEY)).isPresent();
  }

  @Test
  @DisplayName("로더 실패는 캐시되지 않고 다음 호출이 다시 로드")
  void load_error_is_retried_on_next_call() {
    TieredCache<String> cache = newCache(TieredCacheSettings.defaults());
    AtomicInteger loads = new AtomicInteger();

    assertThatThrownBy(
            () ->
                cache.get(
                    KEY,
                    key -> {
                      loads.incrementAndGet();
                      throw new IOException("origin unavailable");
                    },
                    SPEC))
        .isInstanceOf(OriginLoadException.class);
    assertThat(local.peek(KEY)).isEmpty();
    assertThat(shared.peek(KEY)).isEmpty();

    String value =
        cache.get(
            KEY,
            key -> {
              loads.incrementAndGet();
              return "recovered";
            },
            SPEC);

    assertThat(value).isEqualTo("recovered");
    assertThat(loads).hasValue(2);
    assertThat(lockRegistry.size()).isZero();
    assertThat(meterRegistry.get("cache.load.failure").counter().count()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("Negative caching 활성화 시 NotFound를 짧은 TTL로 저장")
  void negative_caching_stores_not_found() {
    TieredCache<String> cache =
        newCache(new TieredCacheSettings(Duration.ofSeconds(5), null, true));
    AtomicInteger loads = new AtomicInteger();

    for (int i = 0; i < 3; i++) {
      assertThat(
              cache.get(
                  KEY,
                  key -> {
                    loads.incrementAndGet();
                    return null;
                  },
                  SPEC))
          .isNull();
    }

    assertThat(loads).hasValue(1);
    assertThat(shared.peek(KEY))
        .hasValueSatisfying(
            entry -> {
              assertThat(entry.negative()).isTrue();
              assertThat(entry.expiration())
                  .isEqualTo(ExpirationPolicy.defaults().negativeSpec());
            });
  }

  @Test
  @DisplayName("Negative caching 비활성화 시 NotFound는 매번 로드")
  void not_found_without_negative_caching_reloads() {
    TieredCache<String> cache = newCache(TieredCacheSettings.defaults());
    AtomicInteger loads = new AtomicInteger();

    cache.get(KEY, key -> nullAfterCount(loads), SPEC);
    cache.get(KEY, key -> nullAfterCount(loads), SPEC);

    assertThat(loads).hasValue(2);
    assertThat(shared.peek(KEY)).isEmpty();
  }

  @Test
  @DisplayName("태그 무효화는 태그된 엔트리만 양쪽 계층에서 제거")
  void tag_invalidation_leaves_untagged_entries() {
    TieredCache<String> cache = newCache(TieredCacheSettings.defaults());
    cache.put("tagged", "T", SPEC, Set.of("team:7"));
    cache.put("untagged", "U", SPEC, Set.of());

    cache.invalidateTag("team:7");

    assertThat(local.peek("tagged")).isEmpty();
    assertThat(shared.peek("tagged")).isEmpty();
    assertThat(local.peek("untagged")).isPresent();
    assertThat(shared.peek("untagged")).isPresent();
  }

  @Test
  @DisplayName("L2 읽기 장애는 미스로 취급되어 로더 결과를 반환")
  void shared_read_failure_degrades_to_miss() {
    TieredCache<String> cache = newCache(TieredCacheSettings.defaults());
    shared.failReads(true);

    assertThat(cache.get(KEY, key -> "fresh", SPEC)).isEqualTo("fresh");
    assertThat(shared.peek(KEY)).isPresent();
    assertThat(local.peek(KEY)).isPresent();
  }

  @Test
  @DisplayName("L2 쓰기 장애 시 값은 반환하되 L1에도 저장하지 않음")
  void shared_write_failure_keeps_local_empty() {
    TieredCache<String> cache = newCache(TieredCacheSettings.defaults());
    shared.failWrites(true);

    assertThat(cache.get(KEY, key -> "fresh", SPEC)).isEqualTo("fresh");
    assertThat(local.peek(KEY)).isEmpty();
  }

  @Test
  @DisplayName("lockWait 초과 시 LockTimeoutException, 로더는 실행되지 않음")
  void lock_wait_timeout() {
    TieredCache<String> cache =
        newCache(new TieredCacheSettings(Duration.ofMillis(100), null, false));
    AtomicInteger loads = new AtomicInteger();

    try (LockHandle ignored = lockRegistry.acquire(KEY, Duration.ofSeconds(1))) {
      Future<String> waiter =
          callers.submit(
              () ->
                  cache.get(
                      KEY,
                      key -> {
                        loads.incrementAndGet();
                        return "never";
                      },
                      SPEC));

      assertThatThrownBy(() -> waiter.get(5, TimeUnit.SECONDS))
          .hasCauseInstanceOf(LockTimeoutException.class);
    }
    assertThat(loads).hasValue(0);
    assertThat(lockRegistry.size()).isZero();
  }

  @Test
  @DisplayName("loaderTimeout 초과 시 OriginLoadException(TimeoutException), 락은 해제")
  void loader_timeout_releases_lock() {
    TieredCache<String> cache =
        newCache(new TieredCacheSettings(Duration.ofSeconds(5), Duration.ofMillis(100), false));

    assertThatThrownBy(
            () ->
                cache.get(
                    KEY,
                    key -> {
                      Thread.sleep(5_000);
                      return "too-late";
                    },
                    SPEC))
        .isInstanceOf(OriginLoadException.class)
        .hasCauseInstanceOf(TimeoutException.class);

    assertThat(lockRegistry.size()).isZero();
    assertThat(shared.peek(KEY)).isEmpty();
    assertThat(cache.get(KEY, key -> "fast", SPEC)).isEqualTo("fast");
  }

  private TieredCache<String> newCache(TieredCacheSettings settings) {
    return new TieredCache<>(
        "products",
        local,
        shared,
        lockRegistry,
        ExpirationPolicy.defaults(),
        executor,
        settings,
        loaderPool,
        CacheInvalidationPublisher.noOp(),
        "instance-test",
        meterRegistry);
  }

  private static String nullAfterCount(AtomicInteger loads) {
    loads.incrementAndGet();
    return null;
  }
}
