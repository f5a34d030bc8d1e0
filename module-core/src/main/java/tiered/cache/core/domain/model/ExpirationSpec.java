package tiered.cache.core.domain.model;

import java.time.Duration;
import java.util.Objects;
import tiered.cache.error.exception.InvalidCacheKeyException;

/**
 * 캐시 쓰기 시 첨부되는 만료 스펙
 *
 * <p>만료 집행은 계층 저장소가 담당하며, 오케스트레이터는 쓰기 시점에 스펙만 첨부합니다.
 *
 * @param kind 만료 방식 (ABSOLUTE | SLIDING)
 * @param duration 만료 기간 (양수)
 */
public record ExpirationSpec(ExpirationKind kind, Duration duration) {

  public ExpirationSpec {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(duration, "duration");
    if (duration.isZero() || duration.isNegative()) {
      throw new InvalidCacheKeyException("expiration duration must be positive: " + duration);
    }
  }

  public static ExpirationSpec absolute(Duration duration) {
    return new ExpirationSpec(ExpirationKind.ABSOLUTE, duration);
  }

  public static ExpirationSpec sliding(Duration duration) {
    return new ExpirationSpec(ExpirationKind.SLIDING, duration);
  }

  public boolean isSliding() {
    return kind == ExpirationKind.SLIDING;
  }

  /** 같은 방식으로 기간만 바꾼 스펙 */
  public ExpirationSpec withDuration(Duration newDuration) {
    return new ExpirationSpec(kind, newDuration);
  }
}
