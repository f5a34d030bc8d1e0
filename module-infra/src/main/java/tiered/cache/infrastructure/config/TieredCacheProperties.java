package tiered.cache.infrastructure.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * TieredCache 외부 설정 프로퍼티
 *
 * <h4>application.yml 설정 예시</h4>
 *
 * <pre>
 * tiered-cache:
 *   lock-wait: 5s            # 키 락 최대 대기
 *   loader-timeout: 3s       # 원본 로더 최대 실행 (미설정 시 무제한)
 *   local:
 *     ttl-ratio: 0.5         # L1 TTL = L2 TTL × ratio
 *     min-ttl: 1s
 *     max-ttl: 10m
 *     max-size: 10000
 *   shared:
 *     key-prefix: cache
 *   negative-caching:
 *     enabled: false
 *     ttl: 30s
 *   invalidation:
 *     enabled: true
 *     topic: cache:invalidation
 * </pre>
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "tiered-cache")
public class TieredCacheProperties {

  /** 자동 구성 활성화 여부 */
  private boolean enabled = true;

  /** 키 락 최대 대기 시간 (cold burst 시 스레드 고갈 방지) */
  @NotNull private Duration lockWait = Duration.ofSeconds(5);

  /** 원본 로더 최대 실행 시간 (null이면 무제한) */
  private Duration loaderTimeout;

  /** 인스턴스 ID (원격 무효화 Self-skip용, 비어 있으면 UUID) */
  private String instanceId;

  @NotNull @Valid private Local local = new Local();

  @NotNull @Valid private Shared shared = new Shared();

  @NotNull @Valid private NegativeCaching negativeCaching = new NegativeCaching();

  @NotNull @Valid private Invalidation invalidation = new Invalidation();

  /** L1(Caffeine) 설정 */
  @Getter
  @Setter
  public static class Local {

    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax("1.0")
    private double ttlRatio = 0.5;

    @NotNull private Duration minTtl = Duration.ofSeconds(1);

    @NotNull private Duration maxTtl = Duration.ofMinutes(10);

    @Min(1)
    private long maxSize = 10_000L;
  }

  /** L2(Redis) 설정 */
  @Getter
  @Setter
  public static class Shared {

    @NotBlank private String keyPrefix = "cache";
  }

  /** NotFound 결과 캐시 설정 */
  @Getter
  @Setter
  public static class NegativeCaching {

    private boolean enabled = false;

    @NotNull private Duration ttl = Duration.ofSeconds(30);
  }

  /** 인스턴스 간 L1 무효화 (Redis Pub/Sub) */
  @Getter
  @Setter
  public static class Invalidation {

    private boolean enabled = true;

    @NotBlank private String topic = "cache:invalidation";
  }
}
