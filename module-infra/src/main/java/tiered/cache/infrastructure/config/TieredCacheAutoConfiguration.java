package tiered.cache.infrastructure.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.redisson.api.RedissonClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tiered.cache.core.expiration.ExpirationPolicy;
import tiered.cache.core.expiration.ExpirationPolicyConfig;
import tiered.cache.infrastructure.cache.TieredCacheManager;
import tiered.cache.infrastructure.cache.TieredCacheSettings;
import tiered.cache.infrastructure.cache.invalidation.CacheInvalidationPublisher;
import tiered.cache.infrastructure.cache.invalidation.CacheInvalidationSubscriber;
import tiered.cache.infrastructure.cache.invalidation.impl.RedisCacheInvalidationPublisher;
import tiered.cache.infrastructure.cache.invalidation.impl.RedisCacheInvalidationSubscriber;
import tiered.cache.infrastructure.executor.DefaultLogicExecutor;
import tiered.cache.infrastructure.executor.LogicExecutor;
import tiered.cache.infrastructure.executor.strategy.ExceptionTranslator;

/**
 * TieredCache 자동 구성
 *
 * <ul>
 *   <li>{@code tiered-cache.enabled=false}면 전체 비활성
 *   <li>RedissonClient 빈이 있으면 L2(Redis) + 원격 L1 무효화 활성
 *   <li>없으면 L1 단독 동작
 *   <li>MeterRegistry/ObjectMapper가 없으면 기본 인스턴스 사용
 * </ul>
 */
@AutoConfiguration(
    afterName = {
      "org.redisson.spring.starter.RedissonAutoConfigurationV2",
      "org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration",
      "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration",
      "org.springframework.boot.actuate.autoconfigure.metrics.export.simple.SimpleMetricsExportAutoConfiguration"
    })
@ConditionalOnProperty(
    prefix = "tiered-cache",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true)
@EnableConfigurationProperties(TieredCacheProperties.class)
public class TieredCacheAutoConfiguration {

  /** actuator가 없는 환경용 기본 레지스트리 */
  @Bean
  @ConditionalOnMissingBean(MeterRegistry.class)
  public SimpleMeterRegistry tieredCacheMeterRegistry() {
    return new SimpleMeterRegistry();
  }

  @Bean
  @ConditionalOnMissingBean
  public LogicExecutor tieredCacheLogicExecutor(MeterRegistry meterRegistry) {
    return new DefaultLogicExecutor(ExceptionTranslator.defaultTranslator(), meterRegistry);
  }

  @Bean
  @ConditionalOnMissingBean
  public ExpirationPolicy expirationPolicy(TieredCacheProperties properties) {
    TieredCacheProperties.Local local = properties.getLocal();
    return new ExpirationPolicy(
        new ExpirationPolicyConfig(
            local.getTtlRatio(),
            local.getMinTtl(),
            local.getMaxTtl(),
            properties.getNegativeCaching().getTtl()));
  }

  @Bean
  @ConditionalOnMissingBean
  public TieredCacheManager tieredCacheManager(
      TieredCacheProperties properties,
      ExpirationPolicy expirationPolicy,
      LogicExecutor tieredCacheLogicExecutor,
      ObjectProvider<RedissonClient> redissonClient,
      ObjectProvider<ObjectMapper> objectMapper,
      MeterRegistry meterRegistry,
      ObjectProvider<CacheInvalidationPublisher> invalidationPublisher) {
    return TieredCacheManager.builder()
        .redissonClient(redissonClient.getIfAvailable())
        .objectMapper(objectMapper.getIfAvailable(TieredCacheAutoConfiguration::defaultMapper))
        .expirationPolicy(expirationPolicy)
        .executor(tieredCacheLogicExecutor)
        .meterRegistry(meterRegistry)
        .settings(
            new TieredCacheSettings(
                properties.getLockWait(),
                properties.getLoaderTimeout(),
                properties.getNegativeCaching().isEnabled()))
        .localMaxSize(properties.getLocal().getMaxSize())
        .keyPrefix(properties.getShared().getKeyPrefix())
        .invalidationPublisher(invalidationPublisher.getIfAvailable())
        .instanceId(properties.getInstanceId())
        .build();
  }

  private static ObjectMapper defaultMapper() {
    return new ObjectMapper().registerModule(new JavaTimeModule());
  }

  /** Redis Pub/Sub 기반 인스턴스 간 L1 무효화 */
  @Configuration(proxyBeanMethods = false)
  @ConditionalOnClass(RedissonClient.class)
  @ConditionalOnBean(RedissonClient.class)
  @ConditionalOnProperty(
      prefix = "tiered-cache.invalidation",
      name = "enabled",
      havingValue = "true",
      matchIfMissing = true)
  static class RedisInvalidationConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public CacheInvalidationPublisher cacheInvalidationPublisher(
        RedissonClient redissonClient,
        TieredCacheProperties properties,
        LogicExecutor tieredCacheLogicExecutor,
        ObjectProvider<ObjectMapper> objectMapper,
        MeterRegistry meterRegistry) {
      return new RedisCacheInvalidationPublisher(
          redissonClient,
          properties.getInvalidation().getTopic(),
          objectMapper.getIfAvailable(TieredCacheAutoConfiguration::defaultMapper),
          tieredCacheLogicExecutor,
          meterRegistry);
    }

    @Bean(initMethod = "subscribe", destroyMethod = "unsubscribe")
    @ConditionalOnMissingBean
    public CacheInvalidationSubscriber cacheInvalidationSubscriber(
        RedissonClient redissonClient,
        TieredCacheProperties properties,
        TieredCacheManager tieredCacheManager,
        LogicExecutor tieredCacheLogicExecutor,
        ObjectProvider<ObjectMapper> objectMapper,
        MeterRegistry meterRegistry) {
      return new RedisCacheInvalidationSubscriber(
          redissonClient,
          properties.getInvalidation().getTopic(),
          objectMapper.getIfAvailable(TieredCacheAutoConfiguration::defaultMapper),
          tieredCacheManager,
          tieredCacheLogicExecutor,
          meterRegistry);
    }
  }
}
