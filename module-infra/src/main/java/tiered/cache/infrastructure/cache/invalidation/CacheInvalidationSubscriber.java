package tiered.cache.infrastructure.cache.invalidation;

/**
 * 캐시 무효화 이벤트 구독 인터페이스 (Strategy Pattern)
 *
 * <p>다른 인스턴스에서 발행한 캐시 무효화 이벤트를 수신하여 L1 캐시를 무효화합니다.
 *
 * @see CacheInvalidationEvent
 */
public interface CacheInvalidationSubscriber {

  /** 이벤트 구독 시작 */
  void subscribe();

  /**
   * 이벤트 처리 (내부 콜백)
   *
   * @param event 수신된 무효화 이벤트
   */
  void onEvent(CacheInvalidationEvent event);

  /** 구독 해제 */
  void unsubscribe();
}
