package tiered.cache.infrastructure.cache;

import java.time.Duration;
import java.util.Objects;

/**
 * 캐시 인스턴스별 동작 설정
 *
 * @param lockWait 키 락 최대 대기 시간
 * @param loaderTimeout 원본 로더 최대 실행 시간 (null이면 무제한)
 * @param negativeCaching 로더 NotFound(null) 결과를 negative 엔트리로 캐시할지 여부
 */
public record TieredCacheSettings(
    Duration lockWait, Duration loaderTimeout, boolean negativeCaching) {

  public static final Duration DEFAULT_LOCK_WAIT = Duration.ofSeconds(5);

  public TieredCacheSettings {
    Objects.requireNonNull(lockWait, "lockWait");
    if (lockWait.isNegative()) {
      throw new IllegalArgumentException("lockWait must not be negative: " + lockWait);
    }
    if (loaderTimeout != null && (loaderTimeout.isZero() || loaderTimeout.isNegative())) {
      throw new IllegalArgumentException("loaderTimeout must be positive: " + loaderTimeout);
    }
  }

  public static TieredCacheSettings defaults() {
    return new TieredCacheSettings(DEFAULT_LOCK_WAIT, null, false);
  }

  public boolean hasLoaderTimeout() {
    return loaderTimeout != null;
  }
}
