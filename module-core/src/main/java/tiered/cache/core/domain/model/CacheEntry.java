package tiered.cache.core.domain.model;

import java.time.Duration;
import java.util.Objects;
import java.util.Set;

/**
 * 계층 저장소에 기록되는 불변 캐시 엔트리
 *
 * <p>값 + 만료 스펙 + 태그 집합으로 구성됩니다. 저장된 엔트리는 수정되지 않으며, 쓰기는 항상 교체입니다.
 *
 * <h3>Negative 엔트리</h3>
 *
 * <p>원본에 존재하지 않는 키(로더가 null 반환)를 짧게 기억하기 위한 엔트리입니다. {@code negative == true}이면 value는 항상
 * null입니다.
 *
 * @param value 캐시 값 (negative 엔트리면 null)
 * @param expiration 만료 스펙
 * @param tags 일괄 무효화용 태그 (불변 복사본)
 * @param negative "원본에 없음" 표식 여부
 * @param remainingTtl 계층 저장소가 조회 시점에 보고한 남은 수명 (쓰기용 엔트리나 알 수 없으면 null)
 * @param <V> 값 타입
 */
public record CacheEntry<V>(
    V value,
    ExpirationSpec expiration,
    Set<String> tags,
    boolean negative,
    Duration remainingTtl) {

  public CacheEntry {
    Objects.requireNonNull(expiration, "expiration");
    tags = tags == null ? Set.of() : Set.copyOf(tags);
    if (negative && value != null) {
      throw new IllegalArgumentException("negative entry must not carry a value");
    }
    if (!negative && value == null) {
      throw new IllegalArgumentException("positive entry requires a value");
    }
  }

  public CacheEntry(V value, ExpirationSpec expiration, Set<String> tags, boolean negative) {
    this(value, expiration, tags, negative, null);
  }

  public static <V> CacheEntry<V> of(V value, ExpirationSpec expiration) {
    return new CacheEntry<>(value, expiration, Set.of(), false);
  }

  public static <V> CacheEntry<V> of(V value, ExpirationSpec expiration, Set<String> tags) {
    return new CacheEntry<>(value, expiration, tags, false);
  }

  public static <V> CacheEntry<V> negative(ExpirationSpec expiration, Set<String> tags) {
    return new CacheEntry<>(null, expiration, tags, true);
  }

  /** 같은 값/태그로 만료 스펙만 바꾼 엔트리 (Local backfill용) */
  public CacheEntry<V> withExpiration(ExpirationSpec newExpiration) {
    return new CacheEntry<>(value, newExpiration, tags, negative);
  }

  /** 조회한 계층이 알려준 남은 수명을 붙인 엔트리 */
  public CacheEntry<V> withRemainingTtl(Duration remaining) {
    return new CacheEntry<>(value, expiration, tags, negative, remaining);
  }

  public boolean hasTag(String tag) {
    return tags.contains(tag);
  }
}
