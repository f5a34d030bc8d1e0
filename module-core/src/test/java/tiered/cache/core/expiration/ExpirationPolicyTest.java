package tiered.cache.core.expiration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import tiered.cache.core.domain.model.ExpirationKind;
import tiered.cache.core.domain.model.ExpirationSpec;

/**
 * ExpirationPolicy 순수 유닛 테스트
 *
 * <p>Spring/Redis 없이 순수 JUnit5 + AssertJ
 */
@DisplayName("ExpirationPolicy 순수 유닛 테스트")
class ExpirationPolicyTest {

  private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

  private final ExpirationPolicy policy = ExpirationPolicy.defaults();

  @Nested
  @DisplayName("만료 시각")
  class Deadline {

    @Test
    @DisplayName("ABSOLUTE: 조회와 무관하게 writeTime + duration")
    void absolute_ignores_access() {
      ExpirationSpec spec = ExpirationSpec.absolute(Duration.ofMillis(100));

      Instant lastAccess = T0.plusMillis(90);

      assertThat(policy.deadline(spec, T0, lastAccess)).isEqualTo(T0.plusMillis(100));
      assertThat(policy.isExpired(spec, T0, lastAccess, T0.plusMillis(99))).isFalse();
      assertThat(policy.isExpired(spec, T0, lastAccess, T0.plusMillis(150))).isTrue();
    }

    @Test
    @DisplayName("SLIDING: 마지막 조회 + duration (조회마다 연장)")
    void sliding_extends_on_access() {
      ExpirationSpec spec = ExpirationSpec.sliding(Duration.ofMillis(100));

      // 50ms 간격 조회 → 120ms 시점에도 살아 있음
      Instant lastAccess = T0.plusMillis(50);
      assertThat(policy.isExpired(spec, T0, lastAccess, T0.plusMillis(120))).isFalse();

      // 조회 없이 150ms 경과 → 만료
      assertThat(policy.isExpired(spec, T0, T0, T0.plusMillis(150))).isTrue();
    }

    @Test
    @DisplayName("deadline 시각 자체는 만료로 간주")
    void deadline_is_inclusive() {
      ExpirationSpec spec = ExpirationSpec.absolute(Duration.ofMillis(100));

      assertThat(policy.isExpired(spec, T0, T0, T0.plusMillis(100))).isTrue();
    }

    @Test
    @DisplayName("remaining: 만료 후에는 ZERO")
    void remaining_never_negative() {
      ExpirationSpec spec = ExpirationSpec.absolute(Duration.ofSeconds(1));

      assertThat(policy.remaining(spec, T0, T0, T0.plusMillis(400)))
          .isEqualTo(Duration.ofMillis(600));
      assertThat(policy.remaining(spec, T0, T0, T0.plusSeconds(5))).isEqualTo(Duration.ZERO);
    }
  }

  @Nested
  @DisplayName("Local TTL 산정")
  class LocalSpec {

    @Test
    @DisplayName("ABSOLUTE는 기본 ratio 0.5 적용, 방식 유지")
    void scales_absolute_by_ratio() {
      ExpirationSpec local = policy.localSpecFor(ExpirationSpec.absolute(Duration.ofMinutes(4)));

      assertThat(local.kind()).isEqualTo(ExpirationKind.ABSOLUTE);
      assertThat(local.duration()).isEqualTo(Duration.ofMinutes(2));
    }

    @Test
    @DisplayName("SLIDING은 Shared와 같은 창을 유지")
    void sliding_keeps_shared_window() {
      ExpirationSpec shared = ExpirationSpec.sliding(Duration.ofHours(1));

      assertThat(policy.localSpecFor(shared)).isEqualTo(shared);
    }

    @Test
    @DisplayName("상한 clamp: 1시간 → 10분")
    void clamps_to_max() {
      ExpirationSpec local = policy.localSpecFor(ExpirationSpec.absolute(Duration.ofHours(1)));

      assertThat(local.duration()).isEqualTo(Duration.ofMinutes(10));
    }

    @Test
    @DisplayName("하한 clamp는 Shared 기간을 넘지 않음")
    void min_never_exceeds_shared() {
      ExpirationSpec local = policy.localSpecFor(ExpirationSpec.absolute(Duration.ofMillis(500)));

      assertThat(local.duration()).isEqualTo(Duration.ofMillis(500));
    }

    @Test
    @DisplayName("하한 clamp: 1.5초 → 1초")
    void clamps_to_min() {
      ExpirationSpec local =
          policy.localSpecFor(ExpirationSpec.absolute(Duration.ofMillis(1500)));

      assertThat(local.duration()).isEqualTo(Duration.ofSeconds(1));
    }
  }

  @Nested
  @DisplayName("Shared hit backfill 스펙")
  class BackfillSpec {

    @Test
    @DisplayName("ABSOLUTE는 Shared 남은 수명으로 잘림")
    void absolute_capped_by_shared_remaining() {
      ExpirationSpec shared = ExpirationSpec.absolute(Duration.ofSeconds(10));

      assertThat(policy.backfillSpecFor(shared, Duration.ofSeconds(4)))
          .contains(ExpirationSpec.absolute(Duration.ofSeconds(4)));
    }

    @Test
    @DisplayName("ABSOLUTE 남은 수명이 축소 TTL보다 길면 축소 TTL 사용")
    void absolute_uses_local_ttl_when_shorter() {
      ExpirationSpec shared = ExpirationSpec.absolute(Duration.ofSeconds(10));

      assertThat(policy.backfillSpecFor(shared, Duration.ofSeconds(9)))
          .contains(ExpirationSpec.absolute(Duration.ofSeconds(5)));
    }

    @Test
    @DisplayName("남은 수명이 없으면 backfill 생략")
    void nothing_left_skips_backfill() {
      ExpirationSpec shared = ExpirationSpec.absolute(Duration.ofSeconds(10));

      assertThat(policy.backfillSpecFor(shared, Duration.ZERO)).isEmpty();
    }

    @Test
    @DisplayName("남은 수명을 모르면 Local 스펙 그대로")
    void unknown_remaining_falls_back_to_local_spec() {
      ExpirationSpec shared = ExpirationSpec.absolute(Duration.ofSeconds(10));

      assertThat(policy.backfillSpecFor(shared, null)).contains(policy.localSpecFor(shared));
    }

    @Test
    @DisplayName("SLIDING은 남은 수명과 무관하게 전체 창")
    void sliding_ignores_remaining() {
      ExpirationSpec shared = ExpirationSpec.sliding(Duration.ofSeconds(10));

      assertThat(policy.backfillSpecFor(shared, Duration.ofSeconds(1))).contains(shared);
    }
  }

  @Test
  @DisplayName("Negative 스펙은 설정된 TTL의 ABSOLUTE")
  void negative_spec_is_absolute() {
    ExpirationSpec negative = policy.negativeSpec();

    assertThat(negative.kind()).isEqualTo(ExpirationKind.ABSOLUTE);
    assertThat(negative.duration()).isEqualTo(ExpirationPolicyConfig.DEFAULT_NEGATIVE_TTL);
  }

  @Test
  @DisplayName("잘못된 설정은 생성 시 거부")
  void rejects_invalid_config() {
    assertThatThrownBy(
            () ->
                new ExpirationPolicyConfig(
                    0.0, Duration.ofSeconds(1), Duration.ofMinutes(1), Duration.ofSeconds(1)))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(
            () ->
                new ExpirationPolicyConfig(
                    0.5, Duration.ofMinutes(2), Duration.ofMinutes(1), Duration.ofSeconds(1)))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
