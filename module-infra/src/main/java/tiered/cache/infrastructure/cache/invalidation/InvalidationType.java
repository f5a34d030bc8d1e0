package tiered.cache.infrastructure.cache.invalidation;

/** 캐시 무효화 이벤트 유형 */
public enum InvalidationType {

  /** 특정 키의 L1 무효화 */
  EVICT,

  /** 태그가 붙은 L1 엔트리 일괄 무효화 */
  EVICT_TAG
}
