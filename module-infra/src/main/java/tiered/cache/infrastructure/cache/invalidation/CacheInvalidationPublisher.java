package tiered.cache.infrastructure.cache.invalidation;

/**
 * 캐시 무효화 이벤트 발행 인터페이스 (Strategy Pattern)
 *
 * <p>TieredCache의 put/invalidate/invalidateTag 호출 시 다른 인스턴스의 L1 무효화 이벤트를 발행합니다. 발행 실패는 캐시
 * 동작을 깨뜨리지 않습니다 (L1 TTL이 최종 Fallback).
 *
 * @see CacheInvalidationEvent
 */
public interface CacheInvalidationPublisher {

  /**
   * 캐시 무효화 이벤트 발행
   *
   * @param event 발행할 무효화 이벤트
   */
  void publish(CacheInvalidationEvent event);

  /** 단일 인스턴스용 (발행하지 않음) */
  static CacheInvalidationPublisher noOp() {
    return event -> {};
  }
}
