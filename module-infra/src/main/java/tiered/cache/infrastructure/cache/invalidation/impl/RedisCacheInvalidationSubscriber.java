package tiered.cache.infrastructure.cache.invalidation.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RTopic;
import org.redisson.api.RedissonClient;
import org.redisson.api.listener.MessageListener;
import org.redisson.client.codec.StringCodec;
import tiered.cache.core.port.out.TierStore;
import tiered.cache.infrastructure.cache.TieredCacheManager;
import tiered.cache.infrastructure.cache.invalidation.CacheInvalidationEvent;
import tiered.cache.infrastructure.cache.invalidation.CacheInvalidationSubscriber;
import tiered.cache.infrastructure.executor.LogicExecutor;
import tiered.cache.infrastructure.executor.TaskContext;

/**
 * Redis RTopic 기반 캐시 무효화 이벤트 구독자
 *
 * <p>다른 인스턴스에서 발행한 이벤트를 수신하여 L1(Caffeine)만 무효화합니다. L2는 공유 저장소이므로 이미 발행 측에서 제거되었습니다.
 *
 * <ul>
 *   <li>EVICT: 특정 키의 L1 무효화
 *   <li>EVICT_TAG: 태그가 붙은 L1 엔트리 일괄 무효화
 *   <li>Self-skip: 자기 자신이 발행한 이벤트는 무시
 * </ul>
 *
 * <p>구독/해제는 자동 구성에서 initMethod/destroyMethod로 호출됩니다.
 */
@Slf4j
public class RedisCacheInvalidationSubscriber implements CacheInvalidationSubscriber {

  private final RedissonClient redissonClient;
  private final String topicName;
  private final ObjectMapper objectMapper;
  private final TieredCacheManager tieredCacheManager;
  private final LogicExecutor executor;
  private final MeterRegistry meterRegistry;
  private final String instanceId;

  private volatile Integer listenerId;
  private volatile RTopic topic;

  public RedisCacheInvalidationSubscriber(
      RedissonClient redissonClient,
      String topicName,
      ObjectMapper objectMapper,
      TieredCacheManager tieredCacheManager,
      LogicExecutor executor,
      MeterRegistry meterRegistry) {
    this.redissonClient = redissonClient;
    this.topicName = topicName;
    this.objectMapper = objectMapper;
    this.tieredCacheManager = tieredCacheManager;
    this.executor = executor;
    this.meterRegistry = meterRegistry;
    this.instanceId = tieredCacheManager.getInstanceId();
  }

  @Override
  public void subscribe() {
    TaskContext context = TaskContext.of("CacheInvalidation", "Subscribe", instanceId);
    executor.executeVoid(
        () -> {
          topic = redissonClient.getTopic(topicName, StringCodec.INSTANCE);
          listenerId = topic.addListener(String.class, createMessageListener());
          log.info(
              "[CacheInvalidation] Subscribed to topic: {}, instanceId={}", topicName, instanceId);
        },
        context);
  }

  private MessageListener<String> createMessageListener() {
    return (channel, message) -> onMessage(message);
  }

  private void onMessage(String message) {
    TaskContext context = TaskContext.of("CacheInvalidation", "Decode");
    CacheInvalidationEvent event =
        executor.executeOrDefault(
            () -> objectMapper.readValue(message, CacheInvalidationEvent.class), null, context);
    if (event != null) {
      onEvent(event);
    }
  }

  @Override
  public void onEvent(CacheInvalidationEvent event) {
    if (instanceId.equals(event.sourceInstanceId())) {
      log.trace(
          "[CacheInvalidation] Self-skip: cache={}, type={}", event.cacheName(), event.type());
      return;
    }

    TaskContext context = TaskContext.of("CacheInvalidation", "OnEvent", event.cacheName());
    executor.executeVoid(
        () -> {
          invalidateLocal(event);
          meterRegistry
              .counter("cache.invalidation.received", "type", event.type().name())
              .increment();
        },
        context);
  }

  private void invalidateLocal(CacheInvalidationEvent event) {
    TierStore<?> local = tieredCacheManager.getLocalStore(event.cacheName());
    if (local == null) {
      log.debug("[CacheInvalidation] L1 cache not found: {}", event.cacheName());
      return;
    }
    switch (event.type()) {
      case EVICT -> local.remove(event.target());
      case EVICT_TAG -> local.removeByTag(event.target());
    }
    log.debug(
        "[CacheInvalidation] L1 invalidated: cache={}, type={}, target={}, source={}",
        event.cacheName(),
        event.type(),
        event.target(),
        event.sourceInstanceId());
  }

  @Override
  public void unsubscribe() {
    TaskContext context = TaskContext.of("CacheInvalidation", "Unsubscribe", instanceId);
    executor.executeVoid(
        () -> {
          if (topic != null && listenerId != null) {
            topic.removeListener(listenerId);
            log.info("[CacheInvalidation] Unsubscribed from topic: instanceId={}", instanceId);
          }
        },
        context);
  }
}
