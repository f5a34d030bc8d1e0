package tiered.cache.infrastructure.cache.invalidation;

/**
 * 캐시 무효화 이벤트 DTO
 *
 * <p>Scale-out 환경에서 다른 인스턴스의 L1(Caffeine)을 무효화하기 위한 메시지입니다. L2는 모든 인스턴스가 공유하므로 이벤트 대상이
 * 아닙니다.
 *
 * @param cacheName 캐시 이름
 * @param target EVICT면 캐시 키, EVICT_TAG면 태그
 * @param sourceInstanceId 발행 인스턴스 ID (Self-skip용)
 * @param type 무효화 유형
 * @param timestamp 발행 시각 (디버깅용)
 */
public record CacheInvalidationEvent(
    String cacheName,
    String target,
    String sourceInstanceId,
    InvalidationType type,
    long timestamp) {

  public static CacheInvalidationEvent evict(String cacheName, String key, String instanceId) {
    return new CacheInvalidationEvent(
        cacheName, key, instanceId, InvalidationType.EVICT, System.currentTimeMillis());
  }

  public static CacheInvalidationEvent evictTag(String cacheName, String tag, String instanceId) {
    return new CacheInvalidationEvent(
        cacheName, tag, instanceId, InvalidationType.EVICT_TAG, System.currentTimeMillis());
  }
}
