package tiered.cache.error.exception;

import lombok.Getter;
import tiered.cache.error.CommonErrorCode;
import tiered.cache.error.exception.base.ServerBaseException;

/**
 * 캐시 계층(Local/Shared) 장애 예외
 *
 * <p>오케스트레이터는 이 예외를 해당 계층의 미스로 취급하고 다음 단계(Shared → Origin)로 진행합니다. Shared 계층 장애가 전체 조회를
 * 실패시키지 않도록 하는 Graceful Degradation의 기준 예외입니다.
 */
@Getter
public class TierUnavailableException extends ServerBaseException {

  private final String tierName;

  public TierUnavailableException(String tierName, Throwable cause) {
    super(CommonErrorCode.TIER_UNAVAILABLE, cause, tierName);
    this.tierName = tierName;
  }
}
