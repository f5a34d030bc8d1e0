package tiered.cache.infrastructure.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.github.benmanes.caffeine.cache.Ticker;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RedissonClient;
import tiered.cache.core.expiration.ExpirationPolicy;
import tiered.cache.core.port.out.TierStore;
import tiered.cache.error.exception.InvalidCacheKeyException;
import tiered.cache.infrastructure.cache.invalidation.CacheInvalidationPublisher;
import tiered.cache.infrastructure.cache.local.CaffeineTierStore;
import tiered.cache.infrastructure.cache.shared.JacksonValueCodec;
import tiered.cache.infrastructure.cache.shared.NoOpTierStore;
import tiered.cache.infrastructure.cache.shared.RedisTierStore;
import tiered.cache.infrastructure.executor.LogicExecutor;
import tiered.cache.infrastructure.lock.KeyLockRegistry;

/**
 * 캐시 이름별 {@link TieredCache} 생성/보관
 *
 * <ul>
 *   <li>캐시 이름마다 독립된 L1(Caffeine), L2(Redis), {@code KeyLockRegistry}
 *   <li>RedissonClient가 없으면 L2는 {@link NoOpTierStore} (L1 단독 동작)
 *   <li>같은 이름을 다른 값 타입으로 요청하면 거부
 * </ul>
 */
@Slf4j
public class TieredCacheManager implements AutoCloseable {

  private static final long DEFAULT_LOCAL_MAX_SIZE = 10_000L;
  private static final String DEFAULT_KEY_PREFIX = "cache";

  private final ConcurrentHashMap<String, Registration> caches = new ConcurrentHashMap<>();

  private final RedissonClient redissonClient;
  private final ObjectMapper objectMapper;
  private final ExpirationPolicy expirationPolicy;
  private final LogicExecutor executor;
  private final MeterRegistry meterRegistry;
  private final TieredCacheSettings settings;
  private final long localMaxSize;
  private final String keyPrefix;
  private final CacheInvalidationPublisher invalidationPublisher;
  private final String instanceId;
  private final ExecutorService loaderExecutor;
  private final boolean ownsLoaderExecutor;

  /**
   * @param redissonClient null이면 L1 단독
   * @param loaderExecutor null이고 loaderTimeout이 설정되면 내부 풀 생성 (close 시 종료)
   */
  @Builder
  public TieredCacheManager(
      RedissonClient redissonClient,
      ObjectMapper objectMapper,
      ExpirationPolicy expirationPolicy,
      LogicExecutor executor,
      MeterRegistry meterRegistry,
      TieredCacheSettings settings,
      long localMaxSize,
      String keyPrefix,
      CacheInvalidationPublisher invalidationPublisher,
      String instanceId,
      ExecutorService loaderExecutor) {
    this.redissonClient = redissonClient;
    this.objectMapper =
        objectMapper != null
            ? objectMapper
            : new ObjectMapper().registerModule(new JavaTimeModule());
    this.expirationPolicy =
        expirationPolicy != null ? expirationPolicy : ExpirationPolicy.defaults();
    this.executor = executor;
    this.meterRegistry = meterRegistry;
    this.settings = settings != null ? settings : TieredCacheSettings.defaults();
    this.localMaxSize = localMaxSize > 0 ? localMaxSize : DEFAULT_LOCAL_MAX_SIZE;
    this.keyPrefix = keyPrefix != null && !keyPrefix.isBlank() ? keyPrefix : DEFAULT_KEY_PREFIX;
    this.invalidationPublisher =
        invalidationPublisher != null ? invalidationPublisher : CacheInvalidationPublisher.noOp();
    this.instanceId =
        instanceId != null && !instanceId.isBlank() ? instanceId : UUID.randomUUID().toString();
    this.ownsLoaderExecutor = loaderExecutor == null && this.settings.hasLoaderTimeout();
    this.loaderExecutor = ownsLoaderExecutor ? newLoaderExecutor() : loaderExecutor;
  }

  /** 단순 타입 값 캐시 */
  public <V> TieredCache<V> getCache(String name, Class<V> type) {
    return getCache(name, objectMapper.constructType(type));
  }

  /** 제네릭 타입 값 캐시 (List&lt;Dto&gt; 등) */
  public <V> TieredCache<V> getCache(String name, TypeReference<V> type) {
    return getCache(name, objectMapper.getTypeFactory().constructType(type));
  }

  public Collection<String> getCacheNames() {
    return List.copyOf(caches.keySet());
  }

  /**
   * L1 직접 접근 (원격 무효화 이벤트 처리용)
   *
   * @return 해당 이름의 캐시가 아직 없으면 null
   */
  public TierStore<?> getLocalStore(String name) {
    Registration registration = caches.get(name);
    return registration == null ? null : registration.cache().getLocalStore();
  }

  public String getInstanceId() {
    return instanceId;
  }

  @Override
  public void close() {
    if (ownsLoaderExecutor) {
      loaderExecutor.shutdownNow();
    }
  }

  @SuppressWarnings("unchecked")
  private <V> TieredCache<V> getCache(String name, JavaType type) {
    if (name == null || name.isBlank()) {
      throw new InvalidCacheKeyException("cache name must not be blank");
    }
    Registration registration =
        caches.computeIfAbsent(name, n -> new Registration(type, createCache(n, type)));
    if (!registration.valueType().equals(type)) {
      throw new InvalidCacheKeyException(
          "cache '" + name + "' already registered with " + registration.valueType());
    }
    return (TieredCache<V>) registration.cache();
  }

  private <V> TieredCache<V> createCache(String name, JavaType type) {
    TierStore<V> local =
        new CaffeineTierStore<>(name, localMaxSize, Ticker.systemTicker(), meterRegistry);
    TierStore<V> shared = createSharedStore(name, type);
    log.info(
        "[TieredCacheManager] Cache created: name={}, type={}, shared={}",
        name,
        type,
        shared.name());
    return new TieredCache<>(
        name,
        local,
        shared,
        new KeyLockRegistry(meterRegistry, name),
        expirationPolicy,
        executor,
        settings,
        loaderExecutor,
        invalidationPublisher,
        instanceId,
        meterRegistry);
  }

  private <V> TierStore<V> createSharedStore(String name, JavaType type) {
    if (redissonClient == null) {
      return new NoOpTierStore<>();
    }
    return new RedisTierStore<>(
        redissonClient,
        new JacksonValueCodec<V>(objectMapper, type),
        objectMapper,
        executor,
        keyPrefix,
        name);
  }

  private static ExecutorService newLoaderExecutor() {
    AtomicInteger sequence = new AtomicInteger();
    ThreadFactory factory =
        runnable -> {
          Thread thread = new Thread(runnable, "tiered-cache-loader-" + sequence.incrementAndGet());
          thread.setDaemon(true);
          return thread;
        };
    return Executors.newCachedThreadPool(factory);
  }

  private record Registration(JavaType valueType, TieredCache<?> cache) {}
}
