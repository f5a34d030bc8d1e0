package tiered.cache.core.expiration;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import tiered.cache.core.domain.model.ExpirationSpec;

/**
 * 만료 규칙 (Pure Business Logic)
 *
 * <h3>만료 시각</h3>
 *
 * <ul>
 *   <li>ABSOLUTE: writeTime + duration
 *   <li>SLIDING: lastAccess + duration (조회마다 lastAccess 갱신)
 * </ul>
 *
 * <p>만료 시각에 도달한 엔트리는 더 이상 hit로 관측되지 않습니다 (deadline 포함 만료).
 *
 * <h3>Local TTL 산정</h3>
 *
 * <ul>
 *   <li>ABSOLUTE: L1이 L2보다 먼저 만료되도록 기간을 {@code ratio}로 축소한 뒤 [min, max]로 clamp 합니다. Shared에서
 *       backfill할 때는 Shared에 남은 수명을 넘지 않습니다.
 *   <li>SLIDING: Shared와 같은 창을 그대로 씁니다. L1 hit마다 Shared 창도 함께 갱신되므로 L2가 먼저 만료되지 않습니다.
 * </ul>
 *
 * <p>결과는 항상 Shared 기간 이하이며 방식은 바뀌지 않습니다.
 */
public class ExpirationPolicy {

  private final ExpirationPolicyConfig config;

  public ExpirationPolicy(ExpirationPolicyConfig config) {
    this.config = Objects.requireNonNull(config, "config");
  }

  public static ExpirationPolicy defaults() {
    return new ExpirationPolicy(ExpirationPolicyConfig.defaults());
  }

  /** 엔트리 만료 시각 */
  public Instant deadline(ExpirationSpec spec, Instant writeTime, Instant lastAccess) {
    Instant base = spec.isSliding() ? lastAccess : writeTime;
    return base.plus(spec.duration());
  }

  public boolean isExpired(
      ExpirationSpec spec, Instant writeTime, Instant lastAccess, Instant now) {
    return !now.isBefore(deadline(spec, writeTime, lastAccess));
  }

  /** 남은 수명 (만료되었으면 ZERO) */
  public Duration remaining(
      ExpirationSpec spec, Instant writeTime, Instant lastAccess, Instant now) {
    Duration left = Duration.between(now, deadline(spec, writeTime, lastAccess));
    return left.isNegative() ? Duration.ZERO : left;
  }

  /** Shared 스펙으로부터 Local 스펙 산정 (새로 쓰는 엔트리용) */
  public ExpirationSpec localSpecFor(ExpirationSpec sharedSpec) {
    if (sharedSpec.isSliding()) {
      return sharedSpec;
    }
    Duration shared = sharedSpec.duration();
    Duration scaled = scale(shared, config.localTtlRatio());
    Duration clamped = max(config.localMinTtl(), min(config.localMaxTtl(), scaled));
    Duration bounded = min(clamped, shared);
    if (bounded.isZero()) {
      bounded = shared;
    }
    return sharedSpec.withDuration(bounded);
  }

  /**
   * Shared hit을 Local로 backfill할 때의 스펙
   *
   * <p>ABSOLUTE 엔트리는 Shared의 deadline을 넘겨 Local에 남으면 안 되므로 남은 수명으로 한 번 더 자릅니다.
   *
   * @param sharedRemaining Shared가 보고한 남은 수명 (null이면 모름)
   * @return 남은 수명이 없으면 empty (backfill 생략)
   */
  public Optional<ExpirationSpec> backfillSpecFor(
      ExpirationSpec sharedSpec, Duration sharedRemaining) {
    ExpirationSpec local = localSpecFor(sharedSpec);
    if (sharedSpec.isSliding() || sharedRemaining == null) {
      return Optional.of(local);
    }
    if (sharedRemaining.isZero() || sharedRemaining.isNegative()) {
      return Optional.empty();
    }
    return Optional.of(local.withDuration(min(local.duration(), sharedRemaining)));
  }

  /** Negative 엔트리용 스펙 (ABSOLUTE) */
  public ExpirationSpec negativeSpec() {
    return ExpirationSpec.absolute(config.negativeTtl());
  }

  public ExpirationPolicyConfig config() {
    return config;
  }

  private static Duration scale(Duration duration, double ratio) {
    long nanos;
    try {
      nanos = duration.toNanos();
    } catch (ArithmeticException overflow) {
      return Duration.ofMillis((long) (duration.toMillis() * ratio));
    }
    return Duration.ofNanos((long) (nanos * ratio));
  }

  private static Duration min(Duration a, Duration b) {
    return a.compareTo(b) <= 0 ? a : b;
  }

  private static Duration max(Duration a, Duration b) {
    return a.compareTo(b) >= 0 ? a : b;
  }
}
