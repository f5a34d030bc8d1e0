package tiered.cache.error.exception;

import java.time.Duration;
import lombok.Getter;
import tiered.cache.error.CommonErrorCode;
import tiered.cache.error.exception.base.ServerBaseException;

/**
 * 키 락 대기 시간 초과 예외 (TimeoutError)
 *
 * <p>타임아웃된 호출자는 락을 한 번도 보유하지 않았으므로 레지스트리 상태는 일관되게 유지됩니다.
 */
@Getter
public class LockTimeoutException extends ServerBaseException {

  private final String key;
  private final Duration waitTime;

  public LockTimeoutException(String key, Duration waitTime) {
    super(CommonErrorCode.LOCK_TIMEOUT, key, waitTime);
    this.key = key;
    this.waitTime = waitTime;
  }
}
