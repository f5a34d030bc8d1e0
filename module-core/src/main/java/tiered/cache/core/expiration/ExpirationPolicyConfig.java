package tiered.cache.core.expiration;

import java.time.Duration;
import java.util.Objects;

/**
 * {@link ExpirationPolicy} 설정값
 *
 * @param localTtlRatio Local TTL = Shared TTL × ratio (0 초과 1 이하)
 * @param localMinTtl Local TTL 하한
 * @param localMaxTtl Local TTL 상한
 * @param negativeTtl Negative 엔트리 TTL
 */
public record ExpirationPolicyConfig(
    double localTtlRatio, Duration localMinTtl, Duration localMaxTtl, Duration negativeTtl) {

  public static final double DEFAULT_LOCAL_TTL_RATIO = 0.5;
  public static final Duration DEFAULT_LOCAL_MIN_TTL = Duration.ofSeconds(1);
  public static final Duration DEFAULT_LOCAL_MAX_TTL = Duration.ofMinutes(10);
  public static final Duration DEFAULT_NEGATIVE_TTL = Duration.ofSeconds(30);

  public ExpirationPolicyConfig {
    if (!(localTtlRatio > 0.0 && localTtlRatio <= 1.0)) {
      throw new IllegalArgumentException("localTtlRatio must be in (0, 1]: " + localTtlRatio);
    }
    Objects.requireNonNull(localMinTtl, "localMinTtl");
    Objects.requireNonNull(localMaxTtl, "localMaxTtl");
    Objects.requireNonNull(negativeTtl, "negativeTtl");
    if (localMinTtl.isNegative() || localMinTtl.compareTo(localMaxTtl) > 0) {
      throw new IllegalArgumentException(
          "localMinTtl must be within [0, localMaxTtl]: " + localMinTtl + " / " + localMaxTtl);
    }
    if (negativeTtl.isZero() || negativeTtl.isNegative()) {
      throw new IllegalArgumentException("negativeTtl must be positive: " + negativeTtl);
    }
  }

  public static ExpirationPolicyConfig defaults() {
    return new ExpirationPolicyConfig(
        DEFAULT_LOCAL_TTL_RATIO,
        DEFAULT_LOCAL_MIN_TTL,
        DEFAULT_LOCAL_MAX_TTL,
        DEFAULT_NEGATIVE_TTL);
  }
}
