package tiered.cache.core.domain.model;

/**
 * 캐시 엔트리 만료 방식
 *
 * <ul>
 *   <li>{@link #ABSOLUTE}: 쓰기 시각 + duration에 만료 (조회와 무관)
 *   <li>{@link #SLIDING}: 마지막 조회 시각 + duration에 만료 (조회마다 갱신)
 * </ul>
 *
 * <p>한 엔트리에는 하나의 방식만 적용됩니다.
 */
public enum ExpirationKind {

  /** 고정 만료 */
  ABSOLUTE,

  /** 접근 시 갱신되는 만료 */
  SLIDING
}
