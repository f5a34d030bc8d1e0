package tiered.cache.infrastructure.cache.shared;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RBucket;
import org.redisson.api.RSet;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.StringCodec;
import tiered.cache.core.domain.model.CacheEntry;
import tiered.cache.core.port.out.SharedValueCodec;
import tiered.cache.core.port.out.TierStore;
import tiered.cache.error.exception.CacheSerializationException;
import tiered.cache.infrastructure.executor.LogicExecutor;
import tiered.cache.infrastructure.executor.TaskContext;
import tiered.cache.infrastructure.executor.strategy.ExceptionTranslator;

/**
 * L2 (Redis) 계층 저장소
 *
 * <h3>저장 형식</h3>
 *
 * <pre>
 * {prefix}:{cacheName}:{key}        → RBucket&lt;String&gt; (Envelope JSON, PX = duration)
 * {prefix}:{cacheName}:tag:{tag}    → RSet&lt;String&gt; (태그가 붙은 키 목록)
 * </pre>
 *
 * <h3>만료</h3>
 *
 * <ul>
 *   <li>ABSOLUTE: 쓰기 시 TTL 설정, 조회는 TTL을 건드리지 않고 남은 PTTL을 엔트리에 실어 반환
 *   <li>SLIDING: hit와 {@code touch}마다 {@code expire(duration)}로 TTL 재설정 (태그 집합 TTL도 함께 연장)
 * </ul>
 *
 * <h3>장애 처리</h3>
 *
 * <p>Redis 예외는 {@link ExceptionTranslator#forTier}로 {@code TierUnavailableException}으로
 * 변환됩니다. 직렬화 예외는 {@link CacheSerializationException} 그대로 전파됩니다.
 */
@Slf4j
public class RedisTierStore<V> implements TierStore<V> {

  private static final String TIER_NAME = "shared";

  private final RedissonClient redissonClient;
  private final SharedValueCodec<V> codec;
  private final ObjectMapper envelopeMapper;
  private final LogicExecutor executor;
  private final String namespace;

  public RedisTierStore(
      RedissonClient redissonClient,
      SharedValueCodec<V> codec,
      ObjectMapper envelopeMapper,
      LogicExecutor executor,
      String keyPrefix,
      String cacheName) {
    this.redissonClient = redissonClient;
    this.codec = codec;
    this.envelopeMapper = envelopeMapper;
    this.executor = executor;
    this.namespace = keyPrefix + ":" + cacheName;
  }

  @Override
  public Optional<CacheEntry<V>> get(String key) {
    return executor.executeWithTranslation(
        () -> doGet(key), ExceptionTranslator.forTier(TIER_NAME), context("Get", key));
  }

  @Override
  public void touch(String key, CacheEntry<V> entry) {
    if (!entry.expiration().isSliding()) {
      return;
    }
    executor.executeWithTranslation(
        () -> {
          doTouch(key, entry);
          return null;
        },
        ExceptionTranslator.forTier(TIER_NAME),
        context("Touch", key));
  }

  @Override
  public void set(String key, CacheEntry<V> entry) {
    executor.executeWithTranslation(
        () -> {
          doSet(key, entry);
          return null;
        },
        ExceptionTranslator.forTier(TIER_NAME),
        context("Set", key));
  }

  @Override
  public void remove(String key) {
    executor.executeWithTranslation(
        () -> bucket(key).delete(),
        ExceptionTranslator.forTier(TIER_NAME),
        context("Remove", key));
  }

  @Override
  public int removeByTag(String tag) {
    return executor.executeWithTranslation(
        () -> doRemoveByTag(tag),
        ExceptionTranslator.forTier(TIER_NAME),
        context("RemoveTag", tag));
  }

  @Override
  public String name() {
    return TIER_NAME;
  }

  private Optional<CacheEntry<V>> doGet(String key) {
    RBucket<String> bucket = bucket(key);
    String json = bucket.get();
    if (json == null) {
      return Optional.empty();
    }
    SharedEntryEnvelope envelope = readEnvelope(json);
    if (envelope.sliding()) {
      Duration ttl = Duration.ofMillis(envelope.ttlMillis());
      bucket.expire(ttl);
      extendTagSets(envelope.tags(), ttl);
      return Optional.of(toEntry(envelope).withRemainingTtl(ttl));
    }
    // -2: 조회 직후 만료됨, -1: TTL 없음
    long remaining = bucket.remainTimeToLive();
    if (remaining == -2) {
      return Optional.empty();
    }
    Duration remainingTtl = remaining < 0 ? null : Duration.ofMillis(remaining);
    return Optional.of(toEntry(envelope).withRemainingTtl(remainingTtl));
  }

  private void doTouch(String key, CacheEntry<V> entry) {
    Duration ttl = entry.expiration().duration();
    if (bucket(key).expire(ttl)) {
      extendTagSets(entry.tags(), ttl);
    }
  }

  private void doSet(String key, CacheEntry<V> entry) {
    String payload = entry.negative() ? null : codec.encode(entry.value());
    String json = writeEnvelope(SharedEntryEnvelope.wrap(entry, payload));
    Duration ttl = entry.expiration().duration();

    bucket(key).set(json, ttl);
    for (String tag : entry.tags()) {
      tagSet(tag).add(key);
    }
    extendTagSets(entry.tags(), ttl);
  }

  /**
   * 태그 집합의 키 중 현재도 해당 태그를 가진 엔트리만 삭제
   *
   * <p>교체되면서 태그가 빠진 엔트리는 집합에 남아 있을 수 있으므로 봉투를 재확인합니다.
   */
  private int doRemoveByTag(String tag) {
    RSet<String> keys = tagSet(tag);
    int removed = 0;
    for (String key : keys.readAll()) {
      if (stillTagged(key, tag) && bucket(key).delete()) {
        removed++;
      }
    }
    keys.delete();
    log.debug(
        "[SharedTier] Tag evicted: namespace={}, tag={}, removed={}", namespace, tag, removed);
    return removed;
  }

  private boolean stillTagged(String key, String tag) {
    String json = bucket(key).get();
    return json != null && readEnvelope(json).hasTag(tag);
  }

  private void extendTagSets(Set<String> tags, Duration ttl) {
    long ttlMillis = ttl.toMillis();
    for (String tag : tags) {
      RSet<String> set = tagSet(tag);
      // -1: TTL 없음, -2: 키 없음
      long remaining = set.remainTimeToLive();
      if (remaining != -2 && remaining < ttlMillis) {
        set.expire(ttl);
      }
    }
  }

  private CacheEntry<V> toEntry(SharedEntryEnvelope envelope) {
    if (envelope.negative()) {
      return CacheEntry.negative(envelope.expiration(), envelope.tags());
    }
    return CacheEntry.of(codec.decode(envelope.payload()), envelope.expiration(), envelope.tags());
  }

  private SharedEntryEnvelope readEnvelope(String json) {
    try {
      return envelopeMapper.readValue(json, SharedEntryEnvelope.class);
    } catch (JsonProcessingException e) {
      throw new CacheSerializationException("envelope decode", e);
    }
  }

  private String writeEnvelope(SharedEntryEnvelope envelope) {
    try {
      return envelopeMapper.writeValueAsString(envelope);
    } catch (JsonProcessingException e) {
      throw new CacheSerializationException("envelope encode", e);
    }
  }

  private RBucket<String> bucket(String key) {
    return redissonClient.getBucket(namespace + ":" + key, StringCodec.INSTANCE);
  }

  private RSet<String> tagSet(String tag) {
    return redissonClient.getSet(namespace + ":tag:" + tag, StringCodec.INSTANCE);
  }

  private static TaskContext context(String operation, String key) {
    return TaskContext.of("Shared", operation, key);
  }
}
