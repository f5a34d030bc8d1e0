package tiered.cache.infrastructure.cache.invalidation.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RTopic;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.StringCodec;
import tiered.cache.infrastructure.cache.invalidation.CacheInvalidationEvent;
import tiered.cache.infrastructure.cache.invalidation.CacheInvalidationPublisher;
import tiered.cache.infrastructure.executor.LogicExecutor;
import tiered.cache.infrastructure.executor.TaskContext;

/**
 * Redis RTopic 기반 캐시 무효화 이벤트 발행자
 *
 * <p>이벤트는 JSON 문자열로 발행됩니다 (StringCodec). RTopic은 생성자에서 1회 캐싱합니다.
 *
 * <p>Redis Pub/Sub 장애 시에도 캐시 기능은 정상 동작합니다 (executeOrDefault, L1 TTL Fallback).
 */
@Slf4j
public class RedisCacheInvalidationPublisher implements CacheInvalidationPublisher {

  private final LogicExecutor executor;
  private final MeterRegistry meterRegistry;
  private final ObjectMapper objectMapper;
  private final RTopic topic;

  public RedisCacheInvalidationPublisher(
      RedissonClient redissonClient,
      String topicName,
      ObjectMapper objectMapper,
      LogicExecutor executor,
      MeterRegistry meterRegistry) {
    this.executor = executor;
    this.meterRegistry = meterRegistry;
    this.objectMapper = objectMapper;
    this.topic = redissonClient.getTopic(topicName, StringCodec.INSTANCE);
  }

  @Override
  public void publish(CacheInvalidationEvent event) {
    TaskContext context = TaskContext.of("CacheInvalidation", "Publish", event.cacheName());
    long clientsReceived =
        executor.executeOrDefault(
            () -> topic.publish(objectMapper.writeValueAsString(event)), -1L, context);
    recordPublishResult(clientsReceived, event);
  }

  private void recordPublishResult(long clientsReceived, CacheInvalidationEvent event) {
    if (clientsReceived < 0) {
      meterRegistry.counter("cache.invalidation.publish", "status", "failure").increment();
      log.warn(
          "[CacheInvalidation] Publish failed: cache={}, type={}", event.cacheName(), event.type());
      return;
    }
    meterRegistry.counter("cache.invalidation.publish", "status", "success").increment();
    log.debug(
        "[CacheInvalidation] Published: cache={}, type={}, target={}, clients={}",
        event.cacheName(),
        event.type(),
        event.target(),
        clientsReceived);
  }
}
